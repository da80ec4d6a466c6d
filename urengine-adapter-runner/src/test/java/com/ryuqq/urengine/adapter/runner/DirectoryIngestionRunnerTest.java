package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.adapter.inmemory.store.InMemoryStores;
import com.ryuqq.urengine.application.ingest.IngestionSessionManager;
import com.ryuqq.urengine.application.ingest.SourceAdapterRegistry;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.ingest.PathEntryStatus;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.rule.PathMatchRule;
import com.ryuqq.urengine.core.rule.PathRuleCatalog;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.testkit.contract.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DirectoryIngestionRunner 테스트 (실제 파일 시스템 + 인메모리 저장소).
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class DirectoryIngestionRunnerTest {

    @TempDir
    Path root;

    private InMemoryStores stores;
    private PathRuleCatalog rules;
    private DirectoryIngestionRunner runner;
    private DeviceId deviceId;

    @BeforeEach
    void setUp() throws IOException {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        stores = InMemoryStores.create(clock);
        rules = new PathRuleCatalog();
        IngestionSessionManager manager = new IngestionSessionManager(stores.devices(), stores.ingestSessions(),
            stores.resources(), rules, new SourceAdapterRegistry().register(new FileSystemSourceAdapter()), clock);
        runner = new DirectoryIngestionRunner(manager, new IngestionRunnerConfig().withConcurrency(4));
        deviceId = stores.devices().register(DeviceRegistration.of("D1", "{}", "local"), "test").id();

        Files.writeString(root.resolve("a.md"), "# A");
        Files.writeString(root.resolve("b.md"), "# B");
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("sub/c.txt"), "C");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
    }

    @Test
    void run_모든_파일을_수집하고_두번째_실행은_DUPLICATE() {
        // when
        IngestionRun first = runner.run(deviceId, root, null, new BehaviorConfig());
        IngestionRun second = runner.run(deviceId, root, null, new BehaviorConfig());

        // then
        assertThat(first.summary().admitted()).isEqualTo(3);
        assertThat(second.summary().admitted()).isZero();
        assertThat(second.summary().duplicate()).isEqualTo(3);
        assertThat(stores.resources().countForDevice(deviceId)).isEqualTo(3);
        assertThat(stores.ingestSessions().findSession(first.sessionId()).orElseThrow().ingestFinishedAt())
            .isNotNull();
    }

    @Test
    void run_상대_경로와_규칙_nature가_엔트리에_기록됨() {
        // given
        rules.register(PathMatchRule.of("docs", "\\.md$", "markdown", 1));
        rules.register(PathMatchRule.of("docs", "\\.txt$", "text", 1));

        // when
        IngestionRun run = runner.run(deviceId, root, null, new BehaviorConfig().withRuleNamespace("docs"));

        // then
        List<PathEntry> entries = stores.ingestSessions().entriesOf(run.sessionId());
        assertThat(entries).extracting(PathEntry::relPath)
            .containsExactlyInAnyOrder("a.md", "b.md", "sub/c.txt");
        PathEntry nested = entries.stream().filter(e -> e.relPath().equals("sub/c.txt")).findFirst().orElseThrow();
        assertThat(nested.relParent()).isEqualTo("sub");
        assertThat(nested.transformations()).contains("\"nature\":\"text\"");
        assertThat(stores.resources().find(nested.resourceId()).orElseThrow().nature()).isEqualTo("text");
    }

    @Test
    void run_exclude_glob에_걸린_파일은_rejected로_집계() {
        // when
        IngestionRun run = runner.run(deviceId, root, null, new BehaviorConfig(), null, List.of("*.txt"),
            IngestionObserver.NOOP);

        // then
        assertThat(run.summary().admitted()).isEqualTo(2);
        assertThat(run.summary().rejected()).isEqualTo(1);
        assertThat(stores.ingestSessions().entriesOf(run.sessionId()))
            .filteredOn(e -> e.status() == PathEntryStatus.EXCLUDED)
            .extracting(PathEntry::basename)
            .containsExactly("c.txt");
    }

    @Test
    void run_저장소_접근_불가면_세션을_중단하고_예외_전파() {
        // given
        stores.resources().setAvailable(false);

        // when & then
        assertThatThrownBy(() -> runner.run(deviceId, root, null, new BehaviorConfig()))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void run_디렉토리가_아니면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> runner.run(deviceId, root.resolve("a.md"), null, new BehaviorConfig()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
