package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.testkit.contract.EngineFixture;

import java.time.Clock;

/**
 * 계약 테스트용 in-memory fixture 생성.
 */
final class InMemoryFixtures {

    private InMemoryFixtures() {
    }

    static EngineFixture create(Clock clock) {
        InMemoryStores stores = InMemoryStores.create(clock);
        return new EngineFixture(stores.devices(), stores.ingestSessions(), stores.resources(),
            stores.lineage(), stores.orchestration());
    }
}
