package com.ryuqq.urengine.application.orchestration;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.Identifier;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.IssueId;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ArenaTree;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.ExecStatus;
import com.ryuqq.urengine.core.orchestration.IssueLocation;
import com.ryuqq.urengine.core.orchestration.OrchestrationReport;
import com.ryuqq.urengine.core.orchestration.OrchestrationSession;
import com.ryuqq.urengine.core.orchestration.SessionEntry;
import com.ryuqq.urengine.core.orchestration.SessionIssue;
import com.ryuqq.urengine.core.orchestration.SessionLogEntry;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import com.ryuqq.urengine.core.outcome.Fail;
import com.ryuqq.urengine.core.outcome.Ok;
import com.ryuqq.urengine.core.outcome.Outcome;
import com.ryuqq.urengine.core.outcome.Retry;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.core.spi.OrchestrationStore;
import com.ryuqq.urengine.core.statemachine.OrchestrationState;
import com.ryuqq.urengine.core.statemachine.StateTransition;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 파이프라인 실행을 감사 가능한 호출 트리로 기록하는 실행기.
 *
 * <p><strong>기록 대상:</strong></p>
 * <ul>
 *   <li>Orchestration Session / Session Entry</li>
 *   <li>Exec 트리 (부모는 같은 세션, 형제 순서는 저장소가 원자적으로 부여)</li>
 *   <li>Issue (append-only, Exec status에 영향 없음)</li>
 *   <li>상태 전이 (소유자+from+to 당 마지막 기록 유지, 이력은 누적)</li>
 *   <li>구조화 로그 트리</li>
 * </ul>
 *
 * <p><strong>실패 전파:</strong> 부모가 status 0으로 종료될 때 실패한 자식이 있으면
 * 첫 번째 실패 자식(형제 순서 기준)의 status가 기록됩니다. {@link #finishOverriding}은 이 규칙을 건너뜁니다.</p>
 *
 * <p><strong>종료 후 기록:</strong> 종료된 세션에도 Exec, Issue, 로그는 계속 기록할 수 있습니다.
 * 새 Session Entry만 거부됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class OrchestrationExecutor {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationExecutor.class);

    private final DeviceRegistry devices;
    private final OrchestrationStore store;
    private final IngestSessionStore ingestSessions;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param devices Device 저장소
     * @param store Orchestration 저장소
     * @param ingestSessions Ingest Session 저장소 (전이 소유자 확인용)
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OrchestrationExecutor(DeviceRegistry devices, OrchestrationStore store,
                                 IngestSessionStore ingestSessions, Clock clock) {
        if (devices == null) {
            throw new IllegalArgumentException("devices cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (ingestSessions == null) {
            throw new IllegalArgumentException("ingestSessions cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.devices = devices;
        this.store = store;
        this.ingestSessions = ingestSessions;
        this.clock = clock;
    }

    // ========================================
    // Session / Entry
    // ========================================

    /**
     * 세션 시작. nature는 처음 보면 등록됩니다.
     *
     * @param deviceId 대상 Device
     * @param nature 파이프라인 종류
     * @param version 파이프라인 버전
     * @param argsJson 실행 인자 (JSON, null 가능)
     * @return 세션 ID
     * @throws DeviceUnknownException Device가 없거나 삭제된 경우
     * @throws ValidationException argsJson이 JSON이 아닌 경우
     */
    public OrchestrationSessionId beginSession(DeviceId deviceId, String nature, String version, String argsJson) {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId cannot be null");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (devices.findLive(deviceId).isEmpty()) {
            throw new DeviceUnknownException(deviceId);
        }
        StructuredPayloadValidator.requireValid("argsJson", argsJson);

        Instant now = clock.instant();
        store.ensureNature(nature, nature, now);
        OrchestrationSession session = new OrchestrationSession(
            OrchestrationSessionId.generate(), deviceId, nature, version, now, null, argsJson,
            null, null, null, Housekeeping.created(now, null)
        );
        store.insertSession(session);
        log.info("Orchestration session started: {} (device={}, nature={}, version={})",
            session.id(), deviceId, nature, version);
        return session.id();
    }

    /**
     * 세션 종료.
     *
     * @param sessionId 세션
     * @param diagnosticsJson 진단 JSON (null 가능)
     * @param diagnosticsMd 진단 Markdown (null 가능)
     * @return 종료된 세션
     * @throws AlreadyClosedException 이미 종료된 경우
     */
    public OrchestrationSession finishSession(OrchestrationSessionId sessionId, String diagnosticsJson,
                                              String diagnosticsMd) {
        requireSession(sessionId);
        OrchestrationSession finished = store.markSessionFinished(sessionId, clock.instant(),
            diagnosticsJson, diagnosticsMd);
        log.info("Orchestration session finished: {}", sessionId);
        return finished;
    }

    /**
     * 단계(Session Entry) 시작.
     *
     * @param sessionId 세션
     * @param ingestSrc 입력 소스
     * @param ingestTableName 적재 테이블 (null 가능)
     * @return 엔트리 ID
     * @throws AlreadyClosedException 세션이 종료된 경우
     */
    public SessionEntryId beginEntry(OrchestrationSessionId sessionId, String ingestSrc, String ingestTableName) {
        OrchestrationSession session = requireSession(sessionId);
        if (session.isFinished()) {
            throw new AlreadyClosedException("OrchestrationSession", sessionId.getValue());
        }
        SessionEntry entry = new SessionEntry(SessionEntryId.generate(), sessionId, ingestSrc, ingestTableName,
            null, Housekeeping.created(clock.instant(), null));
        store.insertEntry(entry);
        log.debug("Session entry started: {} ({})", entry.id(), ingestSrc);
        return entry.id();
    }

    // ========================================
    // Exec tree
    // ========================================

    /**
     * Exec 시작.
     *
     * @param sessionId 세션
     * @param entryId 엔트리 (null 가능)
     * @param parentExecId 부모 Exec (null이면 루트)
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @return handle
     * @throws ReferentialException 세션/엔트리/부모가 없거나 부모가 다른 세션에 속한 경우
     */
    public ExecHandle exec(OrchestrationSessionId sessionId, SessionEntryId entryId, ExecId parentExecId,
                           String nature, String code, String input) {
        requireSession(sessionId);
        requireEntryOf(sessionId, entryId);
        requireExecOf(sessionId, parentExecId);
        ExecNode stored = store.insertExec(ExecNode.started(ExecId.generate(), sessionId, entryId, parentExecId,
            nature, code, input, Housekeeping.created(clock.instant(), null)));
        log.debug("Exec started: {} (parent={}, order={})", stored.id(), parentExecId, stored.siblingOrder());
        return new ExecHandle(this, stored);
    }

    /**
     * Exec 종료. status 0이어도 실패한 자식이 있으면 첫 번째 실패 자식의 status로 기록됩니다.
     * 아직 실행 중인 자식은 {@link ExecStatus#UNHANDLED_FAILURE}로 간주합니다.
     *
     * @param execId Exec
     * @param status status
     * @param output 출력 (null 가능)
     * @param error 오류 (null 가능)
     * @return 기록된 노드
     * @throws IllegalStateException 이미 종료된 경우
     */
    public ExecNode finish(ExecId execId, int status, String output, String error) {
        return complete(execId, status, output, error, true);
    }

    /**
     * 자식 실패를 반영하지 않고 Exec 종료.
     *
     * @param execId Exec
     * @param status status
     * @param output 출력 (null 가능)
     * @param error 오류 (null 가능)
     * @return 기록된 노드
     * @throws IllegalStateException 이미 종료된 경우
     */
    public ExecNode finishOverriding(ExecId execId, int status, String output, String error) {
        return complete(execId, status, output, error, false);
    }

    /**
     * 실행 중이면 status 0으로 종료. 아직 실행 중이거나 실패한 자식이 있으면 그 status가 반영됩니다.
     *
     * @param execId Exec
     * @return 이번 호출로 종료되었으면 기록된 노드
     */
    Optional<ExecNode> finishIfRunning(ExecId execId) {
        return finishIfRunning(execId, ExecStatus.SUCCESS, null, true);
    }

    /**
     * 실행 중이면 주어진 status로 종료 (자식 status 미반영). 이미 종료된 노드는 그대로 둡니다.
     *
     * @param execId Exec
     * @param status status
     * @param error 오류 (null 가능)
     * @return 이번 호출로 종료되었으면 기록된 노드
     */
    public Optional<ExecNode> finishIfRunning(ExecId execId, int status, String error) {
        return finishIfRunning(execId, status, error, false);
    }

    private Optional<ExecNode> finishIfRunning(ExecId execId, int status, String error, boolean propagate) {
        if (execId == null) {
            throw new IllegalArgumentException("execId cannot be null");
        }
        AtomicBoolean changed = new AtomicBoolean(false);
        int effective = effectiveStatus(execId, status, propagate);
        Instant now = clock.instant();
        ExecNode result = store.updateExec(execId, current -> {
            if (!current.isRunning()) {
                return current;
            }
            changed.set(true);
            return current.finished(effective, null, error, now);
        });
        return changed.get() ? Optional.of(result) : Optional.empty();
    }

    public Optional<ExecNode> findExec(ExecId execId) {
        return store.findExec(execId);
    }

    /**
     * 부모 아래에서 작업 하나를 실행하고 결과를 기록합니다.
     *
     * <p><strong>결과 기록:</strong></p>
     * <ul>
     *   <li>{@link Ok} → status 0, 출력과 출력 종류 기록</li>
     *   <li>{@link Retry} / {@link Fail} → 해당 status와 오류 기록</li>
     *   <li>검증/참조 오류 → {@link ExecStatus#ENGINE_FAILURE}</li>
     *   <li>{@link AdapterException} → {@link ExecStatus#ADAPTER_FAILURE}</li>
     *   <li>그 외 예외 → {@link ExecStatus#UNHANDLED_FAILURE}</li>
     * </ul>
     *
     * <p>실패는 이 노드에만 기록되고, 부모가 종료될 때 부모 status로 전파됩니다.
     * 저장소 접근 불가는 치명적 오류이므로 그대로 던집니다.</p>
     *
     * @param parent 부모 handle
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @param body 작업
     * @return 실행 결과
     */
    public Outcome run(ExecHandle parent, String nature, String code, String input, ExecBody body) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        ExecHandle child = parent.child(nature, code, input);
        Outcome outcome;
        try {
            outcome = body.execute(child);
            if (outcome == null) {
                outcome = Ok.empty();
            }
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while running {} ({})", child.getExecId(), nature, e);
            abort(child, e);
            throw e;
        } catch (ValidationException | ReferentialException e) {
            log.warn("Engine error in {} ({}): {}", child.getExecId(), nature, e.getMessage());
            outcome = Fail.of(ExecStatus.ENGINE_FAILURE, e.getClass().getSimpleName(), e.getMessage());
        } catch (AdapterException e) {
            log.warn("Adapter error in {} ({}): {}", child.getExecId(), nature, e.getMessage());
            outcome = Fail.of(ExecStatus.ADAPTER_FAILURE, e.getClass().getSimpleName(), e.getMessage());
        } catch (Exception e) {
            log.error("Unhandled error in {} ({})", child.getExecId(), nature, e);
            outcome = Fail.of(ExecStatus.UNHANDLED_FAILURE, e.getClass().getSimpleName(),
                e.getMessage() == null ? e.getClass().getName() : e.getMessage());
        }
        recordOutcome(child, outcome);
        return outcome;
    }

    // ========================================
    // Issues / Transitions / Logs
    // ========================================

    /**
     * Issue 기록 (append-only).
     *
     * @param sessionId 세션
     * @param entryId 엔트리 (null 가능)
     * @param type 종류
     * @param message 메시지
     * @param location 위치 (null 가능)
     * @param remediation 조치 안내 (null 가능)
     * @return Issue ID
     * @throws ReferentialException 엔트리가 없거나 다른 세션에 속한 경우
     */
    public IssueId recordIssue(OrchestrationSessionId sessionId, SessionEntryId entryId, String type,
                               String message, IssueLocation location, String remediation) {
        requireSession(sessionId);
        requireEntryOf(sessionId, entryId);
        SessionIssue issue = store.appendIssue(new SessionIssue(IssueId.generate(), sessionId, entryId, type,
            message, location, remediation, null, Housekeeping.created(clock.instant(), null)));
        log.debug("Issue recorded in {}: [{}] {}", sessionId, type, message);
        return issue.id();
    }

    /**
     * 상태 전이 기록. 같은 (owner, from, to)의 기존 행을 덮어씁니다.
     *
     * @param owner Orchestration Session, Session Entry 또는 Ingest Session ID
     * @param fromState 이전 상태
     * @param toState 다음 상태
     * @param result 결과 JSON (null 가능)
     * @param reason 사유 (null 가능)
     * @return 기록된 행
     * @throws ReferentialException 소유자를 알 수 없는 경우
     */
    public SessionTransition recordTransition(Identifier owner, String fromState, String toState,
                                              String result, String reason) {
        requireOwner(owner);
        SessionTransition stored = store.upsertTransition(owner, fromState, toState, result, reason,
            clock.instant());
        log.debug("Transition recorded: {} {} -> {} (seq={})", owner, fromState, toState, stored.sequence());
        return stored;
    }

    /**
     * 표준 상태 라벨로 전이 기록 (전이 규칙 검증 후).
     *
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     * @see #recordTransition(Identifier, String, String, String, String)
     */
    public SessionTransition recordTransition(Identifier owner, OrchestrationState from, OrchestrationState to,
                                              String result, String reason) {
        StateTransition.validate(from, to);
        return recordTransition(owner, from.name(), to.name(), result, reason);
    }

    /**
     * 구조화 로그 기록.
     *
     * @param sessionId 세션
     * @param parentLogId 부모 로그 (null이면 루트)
     * @param execId 관련 Exec (null 가능)
     * @param category 분류 (null 가능)
     * @param content 내용
     * @param order 명시 순서 (null이면 다음 값)
     * @return 로그 ID
     * @throws ValidationException 명시 순서가 형제와 겹치는 경우
     * @throws ReferentialException Exec이 없거나 다른 세션에 속한 경우
     */
    public LogId log(OrchestrationSessionId sessionId, LogId parentLogId, ExecId execId, String category,
                     String content, Integer order) {
        requireSession(sessionId);
        requireExecOf(sessionId, execId);
        int siblingOrder = order == null ? ExecNode.UNASSIGNED_ORDER : order;
        if (order != null && order < 0) {
            throw new ValidationException("siblingOrder", "explicit order must be non-negative (current: " + order + ")");
        }
        SessionLogEntry stored = store.appendLog(new SessionLogEntry(LogId.generate(), sessionId, parentLogId,
            execId, category, content, siblingOrder, null, Housekeeping.created(clock.instant(), null)));
        return stored.id();
    }

    // ========================================
    // Read models
    // ========================================

    /**
     * 세션의 Exec 트리.
     *
     * @param sessionId 세션
     * @return 형제 순서로 정렬된 트리
     */
    public ArenaTree<ExecId, ExecNode> execTree(OrchestrationSessionId sessionId) {
        requireSession(sessionId);
        return ArenaTree.build(store.execsOf(sessionId), ExecNode::id, ExecNode::parentId, ExecNode::siblingOrder);
    }

    /**
     * 세션의 로그 트리.
     *
     * @param sessionId 세션
     * @return 형제 순서로 정렬된 트리
     */
    public ArenaTree<LogId, SessionLogEntry> logTree(OrchestrationSessionId sessionId) {
        requireSession(sessionId);
        return ArenaTree.build(store.logsOf(sessionId), SessionLogEntry::id, SessionLogEntry::parentLogId,
            SessionLogEntry::siblingOrder);
    }

    /**
     * 세션 보고서 (Exec별 status + Issue 목록).
     *
     * @param sessionId 세션
     * @return 보고서
     */
    public OrchestrationReport report(OrchestrationSessionId sessionId) {
        OrchestrationSession session = requireSession(sessionId);
        return new OrchestrationReport(session, execTree(sessionId), store.issuesOf(sessionId));
    }

    /**
     * 수집 신호를 이 세션의 감사 기록으로 연결하는 observer.
     *
     * <p>Ingest Session 전이는 Ingest Session을 소유자로 하는 전이 행으로,
     * 어댑터 실패는 이 세션의 Issue로 기록됩니다.</p>
     *
     * @param sessionId 세션
     * @param entryId 엔트리 (null 가능)
     * @return observer
     */
    public IngestionObserver observerFor(OrchestrationSessionId sessionId, SessionEntryId entryId) {
        requireSession(sessionId);
        return new IngestionObserver() {
            @Override
            public void onTransition(IngestSessionId ingestSessionId, String fromState, String toState,
                                     String reason) {
                recordTransition(ingestSessionId, fromState, toState, null, reason);
            }

            @Override
            public void onIssue(IngestSessionId ingestSessionId, String type, String message, String unitId) {
                recordIssue(sessionId, entryId, type, message == null ? type : message,
                    new IssueLocation(null, null, unitId), null);
            }
        };
    }

    public List<SessionTransition> transitionsOf(Identifier owner) {
        return store.transitionsOf(owner);
    }

    public List<SessionTransition> transitionHistory(Identifier owner) {
        return store.transitionHistory(owner);
    }

    // ========================================
    // internals
    // ========================================

    private OrchestrationSession requireSession(OrchestrationSessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return store.findSession(sessionId)
            .orElseThrow(() -> new ReferentialException("OrchestrationSession", sessionId.getValue()));
    }

    private void requireEntryOf(OrchestrationSessionId sessionId, SessionEntryId entryId) {
        if (entryId == null) {
            return;
        }
        SessionEntry entry = store.findEntry(entryId)
            .orElseThrow(() -> new ReferentialException("SessionEntry", entryId.getValue()));
        if (!entry.sessionId().equals(sessionId)) {
            throw new ReferentialException("SessionEntry", entryId.getValue(),
                "SessionEntry " + entryId.getValue() + " belongs to another session");
        }
    }

    private void requireExecOf(OrchestrationSessionId sessionId, ExecId execId) {
        if (execId == null) {
            return;
        }
        ExecNode exec = store.findExec(execId)
            .orElseThrow(() -> new ReferentialException("SessionExec", execId.getValue()));
        if (!exec.sessionId().equals(sessionId)) {
            throw new ReferentialException("SessionExec", execId.getValue(),
                "SessionExec " + execId.getValue() + " belongs to another session");
        }
    }

    private void requireOwner(Identifier owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        boolean known;
        if (owner instanceof OrchestrationSessionId sessionId) {
            known = store.findSession(sessionId).isPresent();
        } else if (owner instanceof SessionEntryId entryId) {
            known = store.findEntry(entryId).isPresent();
        } else if (owner instanceof IngestSessionId ingestSessionId) {
            known = ingestSessions.findSession(ingestSessionId).isPresent();
        } else {
            throw new ReferentialException(owner.getClass().getSimpleName(), owner.getValue(),
                "Unsupported transition owner type: " + owner.getClass().getSimpleName());
        }
        if (!known) {
            throw new ReferentialException(owner.getClass().getSimpleName(), owner.getValue());
        }
    }

    private ExecNode complete(ExecId execId, int status, String output, String error, boolean propagate) {
        if (execId == null) {
            throw new IllegalArgumentException("execId cannot be null");
        }
        int effective = effectiveStatus(execId, status, propagate);
        Instant now = clock.instant();
        ExecNode finished = store.updateExec(execId, current -> {
            if (!current.isRunning()) {
                throw new IllegalStateException("Exec already finished: " + execId.getValue());
            }
            return current.finished(effective, output, error, now);
        });
        if (effective != status) {
            log.debug("Exec {} finished with child failure status {} (requested {})", execId, effective, status);
        }
        return finished;
    }

    private int effectiveStatus(ExecId execId, int status, boolean propagate) {
        if (!propagate || status != ExecStatus.SUCCESS) {
            return status;
        }
        ExecNode node = store.findExec(execId)
            .orElseThrow(() -> new ReferentialException("SessionExec", execId.getValue()));
        return store.execsOf(node.sessionId()).stream()
            .filter(child -> execId.equals(child.parentId()))
            .filter(child -> child.isRunning() || child.isFailed())
            .min(Comparator.comparingInt(ExecNode::siblingOrder))
            .map(child -> child.isRunning() ? ExecStatus.UNHANDLED_FAILURE : child.status())
            .orElse(ExecStatus.SUCCESS);
    }

    /**
     * 치명적 오류로 중단된 Exec을 ENGINE_FAILURE로 종료 (저장소 자체가 불가할 수 있으므로 가능한 경우에만).
     */
    private void abort(ExecHandle child, StoreUnavailableException cause) {
        try {
            finishIfRunning(child.getExecId(), ExecStatus.ENGINE_FAILURE,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not record abort of exec {}: {}", child.getExecId(), e.getMessage());
        }
    }

    private void recordOutcome(ExecHandle child, Outcome outcome) {
        if (outcome instanceof Ok ok) {
            if (ok.outputNature() != null) {
                store.updateExec(child.getExecId(), node -> node.withOutputNature(ok.outputNature()));
            }
            complete(child.getExecId(), ExecStatus.SUCCESS, ok.output(), null, true);
        } else if (outcome instanceof Retry retry) {
            complete(child.getExecId(), retry.status(), null, retry.reason(), false);
        } else if (outcome instanceof Fail fail) {
            complete(child.getExecId(), fail.status(), null, fail.errorCode() + ": " + fail.message(), false);
        }
    }
}
