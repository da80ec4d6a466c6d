package com.ryuqq.urengine.application.orchestration;

import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.OrchestrationSession;
import com.ryuqq.urengine.core.orchestration.SessionEntry;
import com.ryuqq.urengine.core.orchestration.SessionIssue;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.core.spi.OrchestrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * OrchestrationExecutor 유닛 테스트.
 *
 * <p>저장소를 mock으로 두고 참조 검증과 오류 분류를 확인합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OrchestrationExecutorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private DeviceRegistry devices;

    @Mock
    private OrchestrationStore store;

    @Mock
    private IngestSessionStore ingestSessions;

    private OrchestrationExecutor executor;
    private OrchestrationSessionId sessionId;

    @BeforeEach
    void setUp() {
        executor = new OrchestrationExecutor(devices, store, ingestSessions, Clock.fixed(NOW, ZoneOffset.UTC));
        sessionId = OrchestrationSessionId.generate();
    }

    private void sessionExists() {
        when(store.findSession(sessionId)).thenReturn(Optional.of(new OrchestrationSession(
            sessionId, DeviceId.of("d1"), "nightly", "1.0", NOW, null, null, null, null, null,
            Housekeeping.created(NOW, null))));
    }

    // ============================================================
    // 1. 세션
    // ============================================================

    @Test
    void beginSession_Device가_없으면_세션을_기록하지_않음() {
        // given
        DeviceId unknown = DeviceId.of("ghost");
        when(devices.findLive(unknown)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> executor.beginSession(unknown, "nightly", "1.0", null))
            .isInstanceOf(DeviceUnknownException.class);
        verify(store, never()).insertSession(any());
        verify(store, never()).ensureNature(anyString(), anyString(), any());
    }

    // ============================================================
    // 2. 전이
    // ============================================================

    @Test
    void recordTransition_지원하지_않는_소유자_타입이면_ReferentialException() {
        // when & then
        assertThatThrownBy(() -> executor.recordTransition(DeviceId.of("d1"), "OPEN", "CLOSED", null, null))
            .isInstanceOf(ReferentialException.class)
            .hasMessageContaining("DeviceId");
        verify(store, never()).upsertTransition(any(), anyString(), anyString(), any(), any(), any());
    }

    @Test
    void recordTransition_없는_Ingest_세션이면_ReferentialException() {
        // given
        IngestSessionId ingestSessionId = IngestSessionId.generate();
        when(ingestSessions.findSession(ingestSessionId)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> executor.recordTransition(ingestSessionId, "OPEN", "CLOSED", null, null))
            .isInstanceOf(ReferentialException.class);
    }

    // ============================================================
    // 3. observer 연결
    // ============================================================

    @Test
    void observerFor_수집_Issue를_단위_위치와_함께_기록() {
        // given
        sessionExists();
        when(store.appendIssue(any())).then(invocation -> invocation.getArgument(0));
        IngestionObserver observer = executor.observerFor(sessionId, null);

        // when
        observer.onIssue(IngestSessionId.generate(), "adapter-failure", "permission denied", "/d1/a.md");

        // then
        ArgumentCaptor<SessionIssue> captor = ArgumentCaptor.forClass(SessionIssue.class);
        verify(store).appendIssue(captor.capture());
        SessionIssue issue = captor.getValue();
        assertThat(issue.sessionId()).isEqualTo(sessionId);
        assertThat(issue.type()).isEqualTo("adapter-failure");
        assertThat(issue.message()).isEqualTo("permission denied");
        assertThat(issue.location().invalidValue()).isEqualTo("/d1/a.md");
        assertThat(issue.location().row()).isNull();
    }

    // ============================================================
    // 4. run
    // ============================================================

    @Test
    void run_저장소_접근_불가는_Fail로_바꾸지_않고_자식을_ENGINE_FAILURE로_종료한_뒤_그대로_던짐() {
        // given
        sessionExists();
        ExecId parentId = ExecId.generate();
        ExecNode parentNode = ExecNode.started(parentId, sessionId, null, null, "root", "root", null,
            Housekeeping.created(NOW, null));
        when(store.findExec(parentId)).thenReturn(Optional.of(parentNode));
        AtomicReference<ExecNode> child = new AtomicReference<>();
        when(store.insertExec(any())).then(invocation -> {
            ExecNode stored = ((ExecNode) invocation.getArgument(0)).withSiblingOrder(0);
            child.set(stored);
            return stored;
        });
        when(store.updateExec(any(), any())).then(invocation -> {
            UnaryOperator<ExecNode> update = invocation.getArgument(1);
            child.set(update.apply(child.get()));
            return child.get();
        });
        ExecHandle parent = new ExecHandle(executor, parentNode);

        // when & then
        assertThatThrownBy(() -> executor.run(parent, "fetch", "fetch", null, handle -> {
            throw new StoreUnavailableException("store down");
        })).isInstanceOf(StoreUnavailableException.class);
        assertThat(child.get().isRunning()).isFalse();
        assertThat(child.get().status()).isEqualTo(ExecStatus.ENGINE_FAILURE);
        assertThat(child.get().error()).contains("store down");
    }

    @Test
    void run_중단_기록마저_실패하면_원래_예외에_suppressed로_붙여_던짐() {
        // given
        sessionExists();
        ExecId parentId = ExecId.generate();
        ExecNode parentNode = ExecNode.started(parentId, sessionId, null, null, "root", "root", null,
            Housekeeping.created(NOW, null));
        when(store.findExec(parentId)).thenReturn(Optional.of(parentNode));
        when(store.insertExec(any())).then(invocation -> ((ExecNode) invocation.getArgument(0)).withSiblingOrder(0));
        when(store.updateExec(any(), any())).thenThrow(new StoreUnavailableException("still down"));
        ExecHandle parent = new ExecHandle(executor, parentNode);

        // when
        Throwable thrown = catchThrowable(() -> executor.run(parent, "fetch", "fetch", null, handle -> {
            throw new StoreUnavailableException("store down");
        }));

        // then
        assertThat(thrown).isInstanceOf(StoreUnavailableException.class).hasMessageContaining("store down");
        assertThat(thrown.getSuppressed()).hasSize(1);
    }

    // ============================================================
    // 5. 참조 검증
    // ============================================================

    @Test
    void recordIssue_다른_세션의_엔트리면_Issue를_기록하지_않음() {
        // given
        sessionExists();
        SessionEntryId entryId = SessionEntryId.generate();
        SessionEntry foreign = new SessionEntry(entryId, OrchestrationSessionId.generate(), "stage", "parse",
            null, Housekeeping.created(NOW, null));
        when(store.findEntry(entryId)).thenReturn(Optional.of(foreign));

        // when & then
        assertThatThrownBy(() -> executor.recordIssue(sessionId, entryId, "late", "msg", null, null))
            .isInstanceOf(ReferentialException.class)
            .hasMessageContaining("another session");
        verify(store, never()).appendIssue(any());
    }

    @Test
    void log_없는_Exec이면_로그를_기록하지_않음() {
        // given
        sessionExists();
        ExecId unknown = ExecId.generate();
        when(store.findExec(unknown)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> executor.log(sessionId, null, unknown, "info", "orphan", null))
            .isInstanceOf(ReferentialException.class);
        verify(store, never()).appendLog(any());
    }
}
