package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.application.orchestration.ExecHandle;
import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.IssueId;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ArenaTree;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.OrchestrationReport;
import com.ryuqq.urengine.core.orchestration.SessionIssue;
import com.ryuqq.urengine.core.orchestration.SessionLogEntry;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import com.ryuqq.urengine.core.outcome.Fail;
import com.ryuqq.urengine.core.outcome.Ok;
import com.ryuqq.urengine.core.outcome.Outcome;
import com.ryuqq.urengine.core.statemachine.OrchestrationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract for {@link com.ryuqq.urengine.core.spi.OrchestrationStore} implementations driven
 * through {@link com.ryuqq.urengine.application.orchestration.OrchestrationExecutor}.
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>Exec trees stay inside one session and number siblings densely</li>
 *   <li>Failures are recorded on the failing node and surface on the parent</li>
 *   <li>Transitions overwrite per (owner, from, to) while history keeps every write</li>
 *   <li>Ingestion signals reach the orchestration audit trail through the observer bridge</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class OrchestrationContract extends AbstractEngineContractTest {

    protected DeviceId d1;
    protected OrchestrationSessionId session;

    @BeforeEach
    protected void setUpSession() {
        d1 = registerDevice("D1");
        session = executor.beginSession(d1, "nightly-build", "1.0", "{\"dryRun\":false}");
    }

    // ============================================================
    // 1. 세션
    // ============================================================

    @Test
    void beginSession_nature는_처음_쓰일_때_등록됨() {
        assertThat(fixture.orchestration().findNature("nightly-build")).isPresent();
        assertThat(fixture.orchestration().findSession(session).orElseThrow().natureId())
            .isEqualTo("nightly-build");
    }

    @Test
    void beginSession_Device를_모르면_DeviceUnknownException() {
        assertThatThrownBy(() -> executor.beginSession(DeviceId.generate(), "n", "1", null))
            .isInstanceOf(DeviceUnknownException.class);
    }

    @Test
    void beginSession_args가_JSON이_아니면_ValidationException() {
        assertThatThrownBy(() -> executor.beginSession(d1, "n", "1", "{broken"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void finishSession_종료된_세션은_열린_목록에서_빠지고_다시_종료할_수_없음() {
        // when
        executor.finishSession(session, "{\"ok\":true}", "# done");

        // then
        assertThat(fixture.orchestration().listOpenSessions()).extracting(s -> s.id()).doesNotContain(session);
        assertThat(fixture.orchestration().findSession(session).orElseThrow().diagnosticsMd()).isEqualTo("# done");
        assertThatThrownBy(() -> executor.finishSession(session, null, null))
            .isInstanceOf(AlreadyClosedException.class);
    }

    @Test
    void beginEntry_종료된_세션이면_AlreadyClosedException() {
        executor.finishSession(session, null, null);

        assertThatThrownBy(() -> executor.beginEntry(session, "src", null))
            .isInstanceOf(AlreadyClosedException.class);
    }

    @Test
    void exec_종료된_세션에도_늦은_Exec과_Issue는_기록됨() {
        // given
        SessionEntryId entry = executor.beginEntry(session, "src", null);
        executor.finishSession(session, null, null);

        // when
        ExecHandle late = executor.exec(session, entry, null, "cleanup", "rm tmp", null);
        late.finish(ExecStatus.SUCCESS, "ok", null);
        executor.recordIssue(session, entry, "late", "arrived after finish", null, null);

        // then
        assertThat(fixture.orchestration().execsOf(session)).hasSize(1);
        assertThat(fixture.orchestration().issuesOf(session)).hasSize(1);
    }

    // ============================================================
    // 2. Exec 트리
    // ============================================================

    @Test
    void exec_부모가_다른_세션에_있으면_ReferentialException() {
        // given
        OrchestrationSessionId other = executor.beginSession(d1, "other", "1", null);
        ExecHandle foreign = executor.exec(other, null, null, "root", "r", null);

        // when & then
        assertThatThrownBy(() -> executor.exec(session, null, foreign.getExecId(), "child", "c", null))
            .isInstanceOf(ReferentialException.class);
        assertThat(fixture.orchestration().execsOf(session)).isEmpty();
    }

    @Test
    void exec_형제_순서는_0부터_연속으로_부여됨() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);

        // when
        ExecHandle first = root.child("step", "a", null);
        ExecHandle second = root.child("step", "b", null);
        ExecHandle third = root.child("step", "c", null);

        // then
        assertThat(root.getSiblingOrder()).isZero();
        assertThat(List.of(first.getSiblingOrder(), second.getSiblingOrder(), third.getSiblingOrder()))
            .containsExactly(0, 1, 2);
    }

    @Test
    void exec_동시에_자식을_만들어도_형제_순서는_중복되지_않음() throws Exception {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<Integer>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threads; i++) {
                String code = "c" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return root.child("step", code, null).getSiblingOrder();
                }));
            }
            start.countDown();
            List<Integer> orders = new ArrayList<>();
            for (Future<Integer> future : futures) {
                orders.add(future.get(10, TimeUnit.SECONDS));
            }

            // then
            assertThat(orders).containsExactlyInAnyOrderElementsOf(
                IntStream.range(0, threads).boxed().toList());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void finish_자식이_실패하면_부모의_성공_종료는_첫_실패_status로_기록됨() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        root.run("step", "ok", null, exec -> Ok.of("fine"));
        root.run("step", "bad", null, exec -> Fail.of(3, "E_BAD", "bad input"));
        root.run("step", "worse", null, exec -> Fail.of(7, "E_WORSE", "worse input"));

        // when
        ExecNode finished = root.finish(ExecStatus.SUCCESS, null, null);

        // then
        assertThat(finished.status()).isEqualTo(3);
        assertThat(executor.report(session).isSuccessful()).isFalse();
    }

    @Test
    void finishOverriding_자식_실패를_무시하고_주어진_status로_기록() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        root.run("step", "bad", null, exec -> Fail.of(3, "E_BAD", "bad input"));

        // when
        ExecNode finished = root.finishOverriding(ExecStatus.SUCCESS, "recovered", null);

        // then
        assertThat(finished.status()).isEqualTo(ExecStatus.SUCCESS);
        assertThat(finished.output()).isEqualTo("recovered");
    }

    @Test
    void finish_두번_종료하면_IllegalStateException() {
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        root.finish(ExecStatus.SUCCESS, null, null);

        assertThatThrownBy(() -> root.finish(ExecStatus.SUCCESS, null, null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void run_예외_종류에_따라_실패_status가_분류됨() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);

        // when
        Outcome engine = root.run("step", "engine", null, exec -> {
            throw new ValidationException("frontmatter", "not json");
        });
        Outcome adapter = root.run("step", "adapter", null, exec -> {
            throw new AdapterException("/x", "unreadable");
        });
        Outcome unhandled = root.run("step", "unhandled", null, exec -> {
            throw new IllegalStateException("boom");
        });

        // then
        assertThat(engine.status()).isEqualTo(ExecStatus.ENGINE_FAILURE);
        assertThat(adapter.status()).isEqualTo(ExecStatus.ADAPTER_FAILURE);
        assertThat(unhandled.status()).isEqualTo(ExecStatus.UNHANDLED_FAILURE);
        assertThat(executor.report(session).failedExecs()).hasSize(3);
    }

    @Test
    void close_try_with_resources를_벗어나면_실행_중인_Exec은_종료됨() {
        // given
        ExecId execId;
        try (ExecHandle root = executor.exec(session, null, null, "root", "r", null)) {
            execId = root.getExecId();
            root.log("info", "working");
        }

        // then
        ExecNode node = executor.findExec(execId).orElseThrow();
        assertThat(node.isRunning()).isFalse();
        assertThat(node.status()).isEqualTo(ExecStatus.SUCCESS);
    }

    @Test
    void close_실행_중인_자식이_남아_있으면_부모는_UNHANDLED_FAILURE로_기록됨() {
        // given
        ExecId rootId;
        ExecId orphanId;
        try (ExecHandle root = executor.exec(session, null, null, "root", "r", null)) {
            rootId = root.getExecId();
            root.run("step", "ok", null, exec -> Ok.of("fine"));
            orphanId = root.child("step", "left-open", null).getExecId();
        }

        // then
        ExecNode root = executor.findExec(rootId).orElseThrow();
        assertThat(root.isRunning()).isFalse();
        assertThat(root.status()).isEqualTo(ExecStatus.UNHANDLED_FAILURE);
        assertThat(executor.findExec(orphanId).orElseThrow().isRunning()).isTrue();
    }

    @Test
    void run_저장소_접근_불가면_자식을_ENGINE_FAILURE로_종료하고_예외를_다시_던짐() {
        // given
        AtomicReference<ExecId> rootId = new AtomicReference<>();
        AtomicReference<ExecId> attemptId = new AtomicReference<>();

        // when
        assertThatThrownBy(() -> {
            try (ExecHandle root = executor.exec(session, null, null, "root", "r", null)) {
                rootId.set(root.getExecId());
                root.run("attempt", "fetch#1", null, exec -> {
                    attemptId.set(exec.getExecId());
                    throw new StoreUnavailableException("connection refused");
                });
            }
        }).isInstanceOf(StoreUnavailableException.class);

        // then
        ExecNode attempt = executor.findExec(attemptId.get()).orElseThrow();
        assertThat(attempt.isRunning()).isFalse();
        assertThat(attempt.status()).isEqualTo(ExecStatus.ENGINE_FAILURE);
        assertThat(attempt.error()).contains("connection refused");
        ExecNode root = executor.findExec(rootId.get()).orElseThrow();
        assertThat(root.isRunning()).isFalse();
        assertThat(root.status()).isEqualTo(ExecStatus.ENGINE_FAILURE);
        assertThat(executor.report(session).isSuccessful()).isFalse();
    }

    @Test
    void finishIfRunning_이미_종료된_Exec은_건드리지_않음() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        root.finish(ExecStatus.SUCCESS, "done", null);

        // when
        boolean changed = executor.finishIfRunning(root.getExecId(), ExecStatus.ENGINE_FAILURE, "late").isPresent();

        // then
        assertThat(changed).isFalse();
        ExecNode node = executor.findExec(root.getExecId()).orElseThrow();
        assertThat(node.status()).isEqualTo(ExecStatus.SUCCESS);
        assertThat(node.output()).isEqualTo("done");
    }

    @Test
    void execTree_깊이_우선으로_형제_순서를_따라_순회() {
        // given
        ExecHandle root = executor.exec(session, null, null, "root", "r", null);
        ExecHandle a = root.child("step", "a", null);
        a.child("leaf", "a1", null);
        root.child("step", "b", null);

        // when
        ArenaTree<ExecId, ExecNode> tree = executor.execTree(session);

        // then
        assertThat(tree.depthFirst())
            .extracting(visit -> visit.node().code() + "@" + visit.depth())
            .containsExactly("r@0", "a@1", "a1@2", "b@1");
    }

    // ============================================================
    // 3. 로그
    // ============================================================

    @Test
    void log_명시_순서가_형제와_겹치면_ValidationException() {
        // given
        executor.log(session, null, null, "info", "first", 5);

        // when & then
        assertThatThrownBy(() -> executor.log(session, null, null, "info", "second", 5))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void log_순서를_생략하면_형제_다음_순서가_부여됨() {
        // given
        LogId parent = executor.log(session, null, null, "step", "parent", null);
        executor.log(session, parent, null, "info", "a", null);
        executor.log(session, parent, null, "info", "b", null);

        // when
        ArenaTree<LogId, SessionLogEntry> tree = executor.logTree(session);

        // then
        assertThat(tree.children(parent)).extracting(SessionLogEntry::content).containsExactly("a", "b");
        assertThat(tree.children(parent)).extracting(SessionLogEntry::siblingOrder).containsExactly(0, 1);
    }

    @Test
    void log_다른_세션의_Exec을_가리키면_ReferentialException() {
        // given
        OrchestrationSessionId other = executor.beginSession(d1, "other", "1", null);
        ExecHandle foreign = executor.exec(other, null, null, "root", "r", null);

        // when & then
        assertThatThrownBy(() -> executor.log(session, null, foreign.getExecId(), "info", "misplaced", null))
            .isInstanceOf(ReferentialException.class);
        assertThat(fixture.orchestration().logsOf(session)).isEmpty();
    }

    @Test
    void log_없는_Exec을_가리키면_ReferentialException() {
        assertThatThrownBy(() -> executor.log(session, null, ExecId.generate(), "info", "orphan", null))
            .isInstanceOf(ReferentialException.class);
    }

    @Test
    void recordIssue_다른_세션의_엔트리를_가리키면_ReferentialException() {
        // given
        OrchestrationSessionId other = executor.beginSession(d1, "other", "1", null);
        SessionEntryId foreign = executor.beginEntry(other, "src", null);

        // when & then
        assertThatThrownBy(() -> executor.recordIssue(session, foreign, "misplaced", "wrong session", null, null))
            .isInstanceOf(ReferentialException.class);
        assertThatThrownBy(() -> executor.recordIssue(session, SessionEntryId.generate(), "ghost", "unknown", null, null))
            .isInstanceOf(ReferentialException.class);
        assertThat(fixture.orchestration().issuesOf(session)).isEmpty();
    }

    @Test
    void appendIssue_저장소도_다른_세션의_엔트리를_거부함() {
        // given
        OrchestrationSessionId other = executor.beginSession(d1, "other", "1", null);
        SessionEntryId foreign = executor.beginEntry(other, "src", null);
        SessionIssue issue = new SessionIssue(IssueId.generate(), session, foreign, "misplaced", "wrong session",
            null, null, null, Housekeeping.created(Instant.now(), null));

        // when & then
        assertThatThrownBy(() -> fixture.orchestration().appendIssue(issue))
            .isInstanceOf(ReferentialException.class);
        assertThat(fixture.orchestration().issuesOf(session)).isEmpty();
    }

    // ============================================================
    // 4. 전이
    // ============================================================

    @Test
    void recordTransition_같은_키로_다시_쓰면_한_행을_덮어쓰고_이력은_남음() {
        // when
        executor.recordTransition(session, OrchestrationState.OPEN, OrchestrationState.RUNNING, null, "r1");
        executor.recordTransition(session, OrchestrationState.OPEN, OrchestrationState.RUNNING, null, "r2");

        // then
        List<SessionTransition> rows = executor.transitionsOf(session);
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).reason()).isEqualTo("r2");
        assertThat(executor.transitionHistory(session)).extracting(SessionTransition::reason)
            .containsExactly("r1", "r2");
    }

    @Test
    void recordTransition_동시에_같은_키로_써도_한_행만_남음() throws Exception {
        // given
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threads; i++) {
                String reason = "r" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return executor.recordTransition(session, "OPEN", "RUNNING", null, reason);
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        assertThat(executor.transitionsOf(session)).hasSize(1);
        assertThat(executor.transitionHistory(session)).hasSize(threads);
    }

    @Test
    void recordTransition_허용되지_않은_전이는_IllegalStateException() {
        assertThatThrownBy(() -> executor.recordTransition(session, OrchestrationState.OPEN,
            OrchestrationState.COMPLETED, null, null))
            .isInstanceOf(IllegalStateException.class);
        assertThat(executor.transitionsOf(session)).isEmpty();
    }

    @Test
    void recordTransition_소유자를_모르면_ReferentialException() {
        assertThatThrownBy(() -> executor.recordTransition(OrchestrationSessionId.generate(), "OPEN", "RUNNING",
            null, null))
            .isInstanceOf(ReferentialException.class);
    }

    // ============================================================
    // 5. 수집 연결
    // ============================================================

    @Test
    void observerFor_수집_전이와_어댑터_실패가_감사_기록으로_남음() {
        // given
        SessionEntryId entry = executor.beginEntry(session, "/d1", null);
        adapter.put("/d1/a.md", "# A").failOn("/d1/b.md", "unreadable");
        IngestSessionId ingest = manager.open(d1, null, new BehaviorConfig(), executor.observerFor(session, entry));
        IngestPathId pathId = manager.registerPath(ingest, "/d1", null, null);

        // when
        manager.recordEntry(pathId, "/d1/a.md", "a.md");
        manager.recordEntry(pathId, "/d1/b.md", "b.md");
        manager.close(ingest);

        // then
        assertThat(executor.transitionsOf(ingest))
            .extracting(t -> t.fromState() + "->" + t.toState())
            .containsExactly("OPEN->CLOSED");
        OrchestrationReport report = executor.report(session);
        assertThat(report.issues()).hasSize(1);
        assertThat(report.issues().get(0).entryId()).isEqualTo(entry);
        assertThat(report.issues().get(0).location().invalidValue()).isEqualTo("/d1/b.md");
    }
}
