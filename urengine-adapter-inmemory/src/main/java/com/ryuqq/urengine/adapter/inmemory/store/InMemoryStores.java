package com.ryuqq.urengine.adapter.inmemory.store;

import java.time.Clock;

/**
 * 하나의 논리 저장소를 구성하는 in-memory SPI 구현 묶음.
 *
 * <p>Resource Store는 Device Registry와 Ingest Session Store를 참조 검증에 사용하므로
 * 반드시 같은 묶음 안에서 생성되어야 합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class InMemoryStores {

    private final InMemoryDeviceRegistry devices;
    private final InMemoryIngestSessionStore ingestSessions;
    private final InMemoryResourceStore resources;
    private final InMemoryLineageStore lineage;
    private final InMemoryOrchestrationStore orchestration;

    private InMemoryStores(Clock clock) {
        this.devices = new InMemoryDeviceRegistry(clock);
        this.ingestSessions = new InMemoryIngestSessionStore(clock);
        this.resources = new InMemoryResourceStore(devices, ingestSessions, clock);
        this.lineage = new InMemoryLineageStore();
        this.orchestration = new InMemoryOrchestrationStore();
    }

    /**
     * 저장소 묶음 생성.
     *
     * @param clock 시간 공급원
     * @return 새 저장소 묶음
     */
    public static InMemoryStores create(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new InMemoryStores(clock);
    }

    public InMemoryDeviceRegistry devices() {
        return devices;
    }

    public InMemoryIngestSessionStore ingestSessions() {
        return ingestSessions;
    }

    public InMemoryResourceStore resources() {
        return resources;
    }

    public InMemoryLineageStore lineage() {
        return lineage;
    }

    public InMemoryOrchestrationStore orchestration() {
        return orchestration;
    }
}
