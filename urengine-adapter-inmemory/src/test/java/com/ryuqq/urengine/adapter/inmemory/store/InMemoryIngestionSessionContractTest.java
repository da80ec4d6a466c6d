package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.testkit.contract.EngineFixture;
import com.ryuqq.urengine.testkit.contract.IngestionSessionContract;

import java.time.Clock;

/**
 * In-memory 저장소에 대한 수집 세션 계약 (규칙, 중복 판정, 세션 생명주기) 검증.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryIngestionSessionContractTest extends IngestionSessionContract {

    @Override
    protected EngineFixture createFixture(Clock clock) {
        return InMemoryFixtures.create(clock);
    }
}
