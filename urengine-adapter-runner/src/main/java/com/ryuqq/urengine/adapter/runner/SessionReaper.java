package com.ryuqq.urengine.adapter.runner;

import com.ryuqq.urengine.application.orchestration.OrchestrationExecutor;
import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.OrchestrationSession;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import com.ryuqq.urengine.core.spi.OrchestrationStore;
import com.ryuqq.urengine.core.statemachine.OrchestrationState;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 방치된 Orchestration Session 정리 컴포넌트.
 *
 * <p>timeoutThreshold보다 오래 열려 있는 세션을 찾아 다음을 수행합니다:</p>
 * <ol>
 *   <li>실행 중인 Exec를 {@link ExecStatus#ENGINE_FAILURE}로 종료</li>
 *   <li>{@value #ISSUE_SESSION_REAPED} issue 기록</li>
 *   <li>세션 상태를 마지막 상태에서 FAILED로 전이</li>
 *   <li>reaper 진단과 함께 세션 종료</li>
 * </ol>
 *
 * <p>한 세션의 정리가 실패해도 나머지 세션은 계속 처리합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    static final String ISSUE_SESSION_REAPED = "session-reaped";

    private final OrchestrationExecutor executor;
    private final OrchestrationStore store;
    private final ReaperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param executor Orchestration Executor
     * @param store 열린 세션 조회용 저장소
     * @param config 설정
     * @param clock 시간 공급원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionReaper(OrchestrationExecutor executor, OrchestrationStore store, ReaperConfig config, Clock clock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executor = executor;
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 방치된 세션 스캔 및 정리.
     *
     * @return 이번 스캔에서 종료한 세션 수
     */
    public int scan() {
        log.info("Session reaper scan started");
        Instant now = clock.instant();
        Instant cutoff = now.minusMillis(config.timeoutThresholdMs());

        // 1. 임계값을 넘긴 열린 세션 (오래된 순)
        List<OrchestrationSession> stale = store.listOpenSessions().stream()
            .filter(session -> session.startedAt().isBefore(cutoff))
            .limit(config.batchSize())
            .toList();

        // 2. 각 세션 정리 시도
        int reaped = 0;
        for (OrchestrationSession session : stale) {
            if (tryReap(session, now)) {
                reaped++;
            }
        }

        log.info("Session reaper scan completed: {} reaped out of {} stale", reaped, stale.size());
        return reaped;
    }

    private boolean tryReap(OrchestrationSession session, Instant now) {
        OrchestrationSessionId sessionId = session.id();
        try {
            long openForMs = Duration.between(session.startedAt(), now).toMillis();

            // 1. 실행 중인 Exec 종료
            int abandoned = 0;
            for (ExecNode exec : store.execsOf(sessionId)) {
                // 조회 이후 다른 스레드가 먼저 종료했을 수 있으므로 실행 중일 때만 종료
                if (exec.isRunning() && executor.finishIfRunning(exec.id(), ExecStatus.ENGINE_FAILURE,
                        "abandoned: session reaped after " + openForMs + "ms").isPresent()) {
                    abandoned++;
                }
            }

            // 2. issue
            String message = "Session open for " + openForMs + "ms exceeded threshold "
                + config.timeoutThresholdMs() + "ms";
            executor.recordIssue(sessionId, null, ISSUE_SESSION_REAPED, message, null, null);

            // 3. 상태 전이
            Map<String, Object> diagnostics = new LinkedHashMap<>();
            diagnostics.put("reaped", true);
            diagnostics.put("openForMs", openForMs);
            diagnostics.put("abandonedExecs", abandoned);
            String diagnosticsJson = StructuredPayloadValidator.toJson(diagnostics);

            String from = lastState(sessionId);
            if (!OrchestrationState.FAILED.name().equals(from) && !OrchestrationState.COMPLETED.name().equals(from)) {
                executor.recordTransition(sessionId, from, OrchestrationState.FAILED.name(), diagnosticsJson,
                    "reaped");
            }

            // 4. 종료
            executor.finishSession(sessionId, diagnosticsJson, "Reaped: " + message);
            log.info("Session reaped: {} (openFor={}ms, abandonedExecs={})", sessionId, openForMs, abandoned);
            return true;

        } catch (AlreadyClosedException e) {
            log.info("Session {} finished concurrently, skipping", sessionId);
            return false;
        } catch (Exception e) {
            log.error("Failed to reap session {}", sessionId, e);
            return false;
        }
    }

    private String lastState(OrchestrationSessionId sessionId) {
        List<SessionTransition> transitions = executor.transitionHistory(sessionId);
        return transitions.isEmpty()
            ? OrchestrationState.OPEN.name()
            : transitions.get(transitions.size() - 1).toState();
    }
}
