package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.LineageStore;
import com.ryuqq.urengine.core.spi.OrchestrationStore;
import com.ryuqq.urengine.core.spi.ResourceStore;

/**
 * The storage SPI implementations under test, wired as one logical store.
 *
 * @param devices device registry
 * @param ingestSessions ingest session store
 * @param resources resource store
 * @param lineage lineage store
 * @param orchestration orchestration store
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record EngineFixture(
    DeviceRegistry devices,
    IngestSessionStore ingestSessions,
    ResourceStore resources,
    LineageStore lineage,
    OrchestrationStore orchestration
) {

    public EngineFixture {
        if (devices == null || ingestSessions == null || resources == null || lineage == null
                || orchestration == null) {
            throw new IllegalArgumentException("all stores are required");
        }
    }
}
