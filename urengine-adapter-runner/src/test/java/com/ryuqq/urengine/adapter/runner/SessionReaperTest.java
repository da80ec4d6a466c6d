package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.adapter.inmemory.store.InMemoryOrchestrationStore;
import com.ryuqq.urengine.adapter.inmemory.store.InMemoryStores;
import com.ryuqq.urengine.application.orchestration.ExecHandle;
import com.ryuqq.urengine.application.orchestration.OrchestrationExecutor;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.OrchestrationReport;
import com.ryuqq.urengine.core.orchestration.SessionIssue;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import com.ryuqq.urengine.core.statemachine.OrchestrationState;
import com.ryuqq.urengine.testkit.contract.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SessionReaper 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class SessionReaperTest {

    private MutableClock clock;
    private InMemoryStores stores;
    private OrchestrationExecutor executor;
    private SessionReaper reaper;
    private DeviceId deviceId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        stores = InMemoryStores.create(clock);
        executor = new OrchestrationExecutor(stores.devices(), stores.orchestration(), stores.ingestSessions(), clock);
        reaper = new SessionReaper(executor, stores.orchestration(),
            new ReaperConfig().withTimeoutThresholdMs(Duration.ofHours(1).toMillis()), clock);
        deviceId = stores.devices().register(DeviceRegistration.of("D1", "{}", "local"), "test").id();
    }

    @Test
    void scan_임계값을_넘긴_세션은_실행_중_Exec과_함께_실패로_종료() {
        // given
        OrchestrationSessionId sessionId = executor.beginSession(deviceId, "nightly", "1.0", null);
        executor.recordTransition(sessionId, OrchestrationState.OPEN, OrchestrationState.RUNNING, null, "started");
        ExecHandle running = executor.exec(sessionId, null, null, "stage", "extract", null);
        clock.advance(Duration.ofHours(2));

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(1);
        OrchestrationReport report = executor.report(sessionId);
        assertThat(report.session().isFinished()).isTrue();
        assertThat(report.session().diagnosticsJson()).contains("\"reaped\":true").contains("\"abandonedExecs\":1");
        ExecNode exec = executor.findExec(running.getExecId()).orElseThrow();
        assertThat(exec.status()).isEqualTo(ExecStatus.ENGINE_FAILURE);
        assertThat(exec.error()).startsWith("abandoned");
        assertThat(report.issues()).extracting(SessionIssue::type).containsExactly(SessionReaper.ISSUE_SESSION_REAPED);
        assertThat(executor.transitionHistory(sessionId))
            .extracting(SessionTransition::toState)
            .containsExactly("RUNNING", "FAILED");
    }

    @Test
    void scan_임계값_이내의_세션은_그대로_둠() {
        // given
        OrchestrationSessionId sessionId = executor.beginSession(deviceId, "nightly", "1.0", null);
        clock.advance(Duration.ofMinutes(30));

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isZero();
        assertThat(executor.report(sessionId).session().isFinished()).isFalse();
    }

    @Test
    void scan_이미_종료된_세션은_다시_정리하지_않음() {
        // given
        OrchestrationSessionId sessionId = executor.beginSession(deviceId, "nightly", "1.0", null);
        clock.advance(Duration.ofHours(2));
        reaper.scan();

        // when
        int second = reaper.scan();

        // then
        assertThat(second).isZero();
        assertThat(executor.report(sessionId).issues()).hasSize(1);
    }

    @Test
    void scan_batchSize만큼만_정리() {
        // given
        for (int i = 0; i < 3; i++) {
            executor.beginSession(deviceId, "nightly", "1.0", null);
        }
        clock.advance(Duration.ofHours(2));
        SessionReaper small = new SessionReaper(executor, stores.orchestration(),
            new ReaperConfig(Duration.ofHours(1).toMillis(), 2), clock);

        // when & then
        assertThat(small.scan()).isEqualTo(2);
        assertThat(small.scan()).isEqualTo(1);
        assertThat(stores.orchestration().listOpenSessions()).isEmpty();
    }

    @Test
    void scan_조회_이후_이미_종료된_Exec은_건드리지_않고_세션은_한번만_정리됨() {
        // given
        AtomicReference<List<ExecNode>> staleSnapshot = new AtomicReference<>();
        InMemoryOrchestrationStore racing = new InMemoryOrchestrationStore() {
            @Override
            public List<ExecNode> execsOf(OrchestrationSessionId sessionId) {
                List<ExecNode> snapshot = staleSnapshot.getAndSet(null);
                return snapshot != null ? snapshot : super.execsOf(sessionId);
            }
        };
        OrchestrationExecutor racingExecutor = new OrchestrationExecutor(stores.devices(), racing,
            stores.ingestSessions(), clock);
        SessionReaper racingReaper = new SessionReaper(racingExecutor, racing,
            new ReaperConfig().withTimeoutThresholdMs(Duration.ofHours(1).toMillis()), clock);

        OrchestrationSessionId sessionId = racingExecutor.beginSession(deviceId, "nightly", "1.0", null);
        ExecHandle exec = racingExecutor.exec(sessionId, null, null, "stage", "extract", null);
        List<ExecNode> seenRunning = racing.execsOf(sessionId);
        exec.finish(ExecStatus.SUCCESS, "done", null);
        staleSnapshot.set(seenRunning);
        clock.advance(Duration.ofHours(2));

        // when
        int reaped = racingReaper.scan();

        // then
        assertThat(reaped).isEqualTo(1);
        ExecNode node = racingExecutor.findExec(exec.getExecId()).orElseThrow();
        assertThat(node.status()).isEqualTo(ExecStatus.SUCCESS);
        assertThat(node.output()).isEqualTo("done");
        OrchestrationReport report = racingExecutor.report(sessionId);
        assertThat(report.session().diagnosticsJson()).contains("\"abandonedExecs\":0");
        assertThat(report.issues()).hasSize(1);
        assertThat(racingReaper.scan()).isZero();
        assertThat(racingExecutor.report(sessionId).issues()).hasSize(1);
    }
}
