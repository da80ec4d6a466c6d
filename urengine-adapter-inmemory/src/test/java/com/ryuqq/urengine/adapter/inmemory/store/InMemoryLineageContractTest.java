package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.testkit.contract.EngineFixture;
import com.ryuqq.urengine.testkit.contract.LineageContract;

import java.time.Clock;

/**
 * In-memory 저장소에 대한 LineageStore 계약 (graph 등록, edge 멱등성, 삭제 리소스 제외) 검증.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryLineageContractTest extends LineageContract {

    @Override
    protected EngineFixture createFixture(Clock clock) {
        return InMemoryFixtures.create(clock);
    }
}
