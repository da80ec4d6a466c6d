package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.application.ingest.IngestionSessionManager;
import com.ryuqq.urengine.application.ingest.SourceAdapterRegistry;
import com.ryuqq.urengine.application.lineage.LineageGraph;
import com.ryuqq.urengine.application.orchestration.OrchestrationExecutor;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.rule.PathRuleCatalog;
import org.junit.jupiter.api.BeforeEach;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Abstract base class for engine contract tests.
 *
 * <p>Subclasses supply the storage SPI implementations through {@link #createFixture(Clock)};
 * this class wires the application services on top of them so every contract runs against the
 * same service layer.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryResourceStoreContractTest extends ResourceStoreContract {
 *     {@literal @}Override
 *     protected EngineFixture createFixture(Clock clock) {
 *         InMemoryStores stores = InMemoryStores.create(clock);
 *         return new EngineFixture(stores.devices(), ...);
 *     }
 * }
 * </pre>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class AbstractEngineContractTest {

    protected static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    protected MutableClock clock;
    protected EngineFixture fixture;
    protected FixtureSourceAdapter adapter;
    protected PathRuleCatalog rules;
    protected IngestionSessionManager manager;
    protected OrchestrationExecutor executor;
    protected LineageGraph lineage;

    /**
     * Creates the storage implementations under test.
     *
     * @param clock clock every store must use for housekeeping
     * @return fresh, empty stores
     */
    protected abstract EngineFixture createFixture(Clock clock);

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    protected void setUpEngine() {
        clock = new MutableClock(START);
        fixture = createFixture(clock);
        adapter = new FixtureSourceAdapter();
        rules = new PathRuleCatalog();
        manager = new IngestionSessionManager(fixture.devices(), fixture.ingestSessions(), fixture.resources(),
            rules, new SourceAdapterRegistry().register(adapter), clock);
        executor = new OrchestrationExecutor(fixture.devices(), fixture.orchestration(), fixture.ingestSessions(),
            clock);
        lineage = new LineageGraph(fixture.lineage(), fixture.resources(), clock);
    }

    /**
     * Registers a device with a fixed state and boundary.
     *
     * @param name device name
     * @return device id
     */
    protected DeviceId registerDevice(String name) {
        return fixture.devices()
            .register(DeviceRegistration.of(name, "{\"os\":\"linux\"}", "local"), "tester")
            .id();
    }

    /**
     * Opens an ingest session with the default behavior.
     *
     * @param deviceId device
     * @return session id
     */
    protected IngestSessionId openSession(DeviceId deviceId) {
        return manager.open(deviceId, "{\"agent\":\"contract\"}", new BehaviorConfig());
    }

    protected ResourceCandidate textCandidate(DeviceId deviceId, String uri, String text) {
        return ResourceCandidate.of(deviceId, uri, text.getBytes(StandardCharsets.UTF_8), "txt");
    }

    protected static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
