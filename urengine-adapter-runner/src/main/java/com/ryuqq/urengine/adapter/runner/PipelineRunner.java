package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.application.orchestration.ExecHandle;
import com.ryuqq.urengine.application.orchestration.OrchestrationExecutor;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.OrchestrationReport;
import com.ryuqq.urengine.core.outcome.Fail;
import com.ryuqq.urengine.core.outcome.Ok;
import com.ryuqq.urengine.core.outcome.Outcome;
import com.ryuqq.urengine.core.outcome.Retry;
import com.ryuqq.urengine.core.statemachine.OrchestrationState;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestration Pipeline Runner.
 *
 * <p>단계 목록을 하나의 Orchestration Session으로 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(deviceId, nature, version, args, stages)
 *   1. beginSession → 세션 OPEN → RUNNING
 *   2. For each stage:
 *      a. beginEntry(stage.name) → 엔트리 OPEN → RUNNING
 *      b. 단계 루트 Exec 생성
 *      c. 시도마다 루트 아래 자식 Exec로 실행:
 *         - Ok → 루트 status 0, 엔트리 COMPLETED
 *         - Retry → 엔트리 RUNNING → RETRYING, backoff 후 RETRYING → RUNNING, 다음 시도
 *         - Fail 또는 시도 소진 → 루트에 마지막 status 기록, issue 추가, 엔트리 FAILED
 *      d. 실패 시 continueOnFailure가 아니면 남은 단계 생략
 *   3. 세션 RUNNING → COMPLETED/FAILED, finishSession(진단 JSON/Markdown)
 *   4. report 반환
 * </pre>
 *
 * <p>저장소 장애 같은 치명적 예외가 빠져나오면 단계 루트 Exec을 ENGINE_FAILURE로 종료하고
 * 엔트리와 세션을 FAILED로 기록해 세션을 닫은 뒤 예외를 다시 던집니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final String ISSUE_STAGE_FAILED = "stage-failed";
    static final String ISSUE_STAGE_SKIPPED = "stage-skipped";

    private final OrchestrationExecutor executor;
    private final PipelineRunnerConfig config;
    private final BackoffCalculator backoffCalculator;

    /**
     * 생성자 (설정의 백오프 사용).
     *
     * @param executor Orchestration Executor
     * @param config 설정
     */
    public PipelineRunner(OrchestrationExecutor executor, PipelineRunnerConfig config) {
        this(executor, config, config == null ? null : config.backoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param executor Orchestration Executor
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineRunner(OrchestrationExecutor executor, PipelineRunnerConfig config,
                          BackoffCalculator backoffCalculator) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.executor = executor;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 파이프라인 실행.
     *
     * @param deviceId 대상 Device
     * @param nature 세션 종류
     * @param version 파이프라인 버전
     * @param argsJson 실행 인자 (JSON, null 가능)
     * @param stages 단계 목록 (순서대로 실행)
     * @return 세션 리포트
     * @throws StoreUnavailableException 저장소 접근 불가 시 (세션은 가능한 한 FAILED로 닫힘)
     */
    public OrchestrationReport run(DeviceId deviceId, String nature, String version, String argsJson,
                                   List<PipelineStage> stages) {
        if (stages == null) {
            throw new IllegalArgumentException("stages cannot be null");
        }

        // 1. 세션 시작
        OrchestrationSessionId sessionId = executor.beginSession(deviceId, nature, version, argsJson);
        OrchestrationState sessionState = OrchestrationState.OPEN;
        Map<String, Object> stageResults = new LinkedHashMap<>();
        try {
            executor.recordTransition(sessionId, OrchestrationState.OPEN, OrchestrationState.RUNNING,
                null, "pipeline started");
            sessionState = OrchestrationState.RUNNING;
            log.info("Pipeline started: session={}, nature={}, stages={}", sessionId, nature, stages.size());

            // 2. 단계 실행
            StringBuilder markdown = new StringBuilder("# Pipeline ").append(nature).append(' ').append(version)
                .append("\n\n");
            int failed = 0;
            for (PipelineStage stage : stages) {
                if (failed > 0 && !config.continueOnFailure()) {
                    log.info("Stage skipped after failure: session={}, stage={}", sessionId, stage.name());
                    executor.recordIssue(sessionId, null, ISSUE_STAGE_SKIPPED,
                        "Stage " + stage.name() + " skipped after an earlier failure", null, null);
                    stageResults.put(stage.name(), "SKIPPED");
                    markdown.append("- ").append(stage.name()).append(": SKIPPED\n");
                    continue;
                }
                int status = runStage(sessionId, stage);
                boolean ok = ExecStatus.isSuccess(status);
                if (!ok) {
                    failed++;
                }
                stageResults.put(stage.name(), ok ? "COMPLETED" : "FAILED(" + status + ")");
                markdown.append("- ").append(stage.name()).append(": ")
                    .append(ok ? "COMPLETED" : "FAILED (status " + status + ")").append('\n');
            }

            // 3. 세션 종료
            OrchestrationState terminal = failed == 0 ? OrchestrationState.COMPLETED : OrchestrationState.FAILED;
            Map<String, Object> diagnostics = new LinkedHashMap<>(stageResults);
            diagnostics.put("failedStages", failed);
            String diagnosticsJson = StructuredPayloadValidator.toJson(diagnostics);
            executor.recordTransition(sessionId, OrchestrationState.RUNNING, terminal, diagnosticsJson,
                failed == 0 ? "pipeline completed" : failed + " stage(s) failed");
            sessionState = terminal;
            executor.finishSession(sessionId, diagnosticsJson, markdown.toString());
            log.info("Pipeline finished: session={}, state={}", sessionId, terminal);
        } catch (RuntimeException e) {
            log.error("Pipeline aborted: session={}, state={}", sessionId, sessionState, e);
            abortSession(sessionId, sessionState, stageResults, e);
            throw e;
        }

        // 4. 리포트
        return executor.report(sessionId);
    }

    /**
     * 단계 하나 실행.
     *
     * @return 단계 루트 Exec에 기록된 status
     */
    private int runStage(OrchestrationSessionId sessionId, PipelineStage stage) {
        SessionEntryId entryId = executor.beginEntry(sessionId, stage.name(), null);
        AtomicReference<OrchestrationState> entryState = new AtomicReference<>(OrchestrationState.OPEN);
        try {
            executor.recordTransition(entryId, OrchestrationState.OPEN, OrchestrationState.RUNNING,
                null, "stage started");
            entryState.set(OrchestrationState.RUNNING);
            try (ExecHandle root = executor.exec(sessionId, entryId, null, "stage", stage.name(), null)) {
                try {
                    return runAttempts(sessionId, entryId, entryState, stage, root);
                } catch (RuntimeException e) {
                    finishAborted(root, e);
                    throw e;
                }
            }
        } catch (RuntimeException e) {
            failAborted(entryId, entryState.get(), e);
            throw e;
        }
    }

    private int runAttempts(OrchestrationSessionId sessionId, SessionEntryId entryId,
                            AtomicReference<OrchestrationState> entryState, PipelineStage stage, ExecHandle root) {
        Outcome outcome = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            if (attempt > 1) {
                waitBeforeRetry(entryId, entryState, stage, attempt, (Retry) outcome);
            }
            final int current = attempt;
            outcome = root.run("attempt", stage.name() + "#" + attempt, null,
                exec -> stage.execute(new StageContext(executor, exec, current)));

            if (outcome instanceof Ok ok) {
                root.finishOverriding(ExecStatus.SUCCESS, ok.output(), null);
                executor.recordTransition(entryId, OrchestrationState.RUNNING, OrchestrationState.COMPLETED,
                    null, "completed on attempt " + attempt);
                entryState.set(OrchestrationState.COMPLETED);
                log.debug("Stage completed: session={}, stage={}, attempt={}", sessionId, stage.name(), attempt);
                return ExecStatus.SUCCESS;
            }
            if (outcome instanceof Fail) {
                break;
            }
        }

        // 실패 기록
        String error = describe(outcome);
        root.finishOverriding(outcome.status(), null, error);
        executor.recordIssue(sessionId, entryId, ISSUE_STAGE_FAILED,
            "Stage " + stage.name() + " failed: " + error, null, null);
        executor.recordTransition(entryId, OrchestrationState.RUNNING, OrchestrationState.FAILED,
            null, error);
        entryState.set(OrchestrationState.FAILED);
        log.warn("Stage failed: session={}, stage={}, status={}, error={}",
            sessionId, stage.name(), outcome.status(), error);
        return outcome.status();
    }

    private void waitBeforeRetry(SessionEntryId entryId, AtomicReference<OrchestrationState> entryState,
                                 PipelineStage stage, int attempt, Retry previous) {
        long delay = backoffCalculator.calculate(attempt - 1);
        executor.recordTransition(entryId, OrchestrationState.RUNNING, OrchestrationState.RETRYING,
            null, previous.reason());
        entryState.set(OrchestrationState.RETRYING);
        log.info("Stage retry scheduled: stage={}, attempt={}, delay={}ms", stage.name(), attempt, delay);
        sleep(delay);
        executor.recordTransition(entryId, OrchestrationState.RETRYING, OrchestrationState.RUNNING,
            null, "attempt " + attempt);
        entryState.set(OrchestrationState.RUNNING);
    }

    // ========================================
    // 중단 처리 (저장소가 불가할 수 있으므로 가능한 만큼만 기록)
    // ========================================

    private void finishAborted(ExecHandle root, RuntimeException cause) {
        try {
            executor.finishIfRunning(root.getExecId(), ExecStatus.ENGINE_FAILURE, abortReason(cause));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not finish aborted stage exec {}: {}", root.getExecId(), e.getMessage());
        }
    }

    private void failAborted(SessionEntryId entryId, OrchestrationState state, RuntimeException cause) {
        if (state.isTerminal()) {
            return;
        }
        try {
            executor.recordTransition(entryId, state, OrchestrationState.FAILED, null, abortReason(cause));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not mark aborted stage entry {} failed: {}", entryId, e.getMessage());
        }
    }

    private void abortSession(OrchestrationSessionId sessionId, OrchestrationState state,
                              Map<String, Object> stageResults, RuntimeException cause) {
        String reason = abortReason(cause);
        Map<String, Object> diagnostics = new LinkedHashMap<>(stageResults);
        diagnostics.put("aborted", true);
        diagnostics.put("error", reason);
        String diagnosticsJson = StructuredPayloadValidator.toJson(diagnostics);
        try {
            if (!state.isTerminal()) {
                executor.recordTransition(sessionId, state, OrchestrationState.FAILED, diagnosticsJson, reason);
            }
            executor.finishSession(sessionId, diagnosticsJson, "# Pipeline aborted\n\n" + reason + "\n");
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not close aborted session {}: {}", sessionId, e.getMessage());
        }
    }

    private static String abortReason(RuntimeException cause) {
        return "aborted: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private String describe(Outcome outcome) {
        if (outcome instanceof Fail fail) {
            return fail.errorCode() + ": " + fail.message();
        }
        if (outcome instanceof Retry retry) {
            return "retries exhausted after " + config.maxAttempts() + " attempt(s): " + retry.reason();
        }
        return String.valueOf(outcome);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry backoff interrupted", e);
        }
    }
}
