package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.testkit.contract.EngineFixture;
import com.ryuqq.urengine.testkit.contract.ResourceStoreContract;

import java.time.Clock;

/**
 * In-memory 저장소에 대한 ResourceStore 계약 (admission 멱등성, 동시 admission, listener) 검증.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryResourceStoreContractTest extends ResourceStoreContract {

    @Override
    protected EngineFixture createFixture(Clock clock) {
        return InMemoryFixtures.create(clock);
    }
}
