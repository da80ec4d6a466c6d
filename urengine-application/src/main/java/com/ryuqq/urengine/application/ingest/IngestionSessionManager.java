package com.ryuqq.urengine.application.ingest;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.IngestPath;
import com.ryuqq.urengine.core.ingest.IngestSession;
import com.ryuqq.urengine.core.ingest.IngestTask;
import com.ryuqq.urengine.core.ingest.IngestionSummary;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.ingest.PathEntryStatus;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.IngestTaskId;
import com.ryuqq.urengine.core.model.PathEntryId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.rule.GlobFilter;
import com.ryuqq.urengine.core.rule.MatchResult;
import com.ryuqq.urengine.core.rule.PathRuleCatalog;
import com.ryuqq.urengine.core.rule.PathRuleSet;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.core.spi.ResourceStore;
import com.ryuqq.urengine.core.spi.SourceAdapter;
import com.ryuqq.urengine.core.statemachine.IngestSessionState;
import com.ryuqq.urengine.core.statemachine.PathEntryState;
import com.ryuqq.urengine.core.statemachine.StateTransition;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ingest Session 생명주기와 Path Entry 처리를 담당하는 서비스.
 *
 * <p><strong>세션:</strong> OPEN → CLOSED. 종료된 세션에는 새 경로를 등록할 수 없지만,
 * 아직 돌고 있는 worker가 늦게 보내는 엔트리와 태스크는 받아서 연결합니다.</p>
 *
 * <p><strong>엔트리 처리 순서:</strong></p>
 * <ol>
 *   <li>같은 (session, path, absPath) 엔트리가 이미 있으면 그대로 반환</li>
 *   <li>경로 include/exclude glob → EXCLUDED</li>
 *   <li>namespace match rule → strict namespace에서 매칭 실패 시 UNMATCHED</li>
 *   <li>Source Adapter 호출 → 실패 시 ERRORED + Issue</li>
 *   <li>Resource Store admit → ADMITTED(신규) 또는 DUPLICATE(기존)</li>
 * </ol>
 *
 * <p><strong>동시성:</strong> {@link #recordEntry}는 여러 worker 스레드에서 동시에 호출해도 안전하며,
 * 같은 (session, path, absPath)는 한 번만 처리되고 동시에 들어온 나머지 호출은 그 결과를 받습니다.
 * 집계 카운터는 원자적으로 증가합니다. 저장소 접근 불가({@code StoreUnavailableException})는
 * 레코드 단위 오류로 흡수하지 않고 호출자에게 전파합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class IngestionSessionManager {

    private static final Logger log = LoggerFactory.getLogger(IngestionSessionManager.class);

    static final String ISSUE_ADAPTER_FAILURE = "adapter-failure";
    static final String ISSUE_ADMISSION_FAILURE = "admission-failure";

    private final DeviceRegistry devices;
    private final IngestSessionStore sessions;
    private final ResourceStore resources;
    private final PathRuleCatalog rules;
    private final SourceAdapterRegistry adapters;
    private final Clock clock;
    private final Map<IngestSessionId, SessionContext> contexts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PathEntry.Key, CompletableFuture<PathEntry>> inFlight = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param devices Device 저장소
     * @param sessions Ingest Session 저장소
     * @param resources Resource Store
     * @param rules 경로 규칙 등록부
     * @param adapters Source Adapter 등록부
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public IngestionSessionManager(DeviceRegistry devices, IngestSessionStore sessions, ResourceStore resources,
                                   PathRuleCatalog rules, SourceAdapterRegistry adapters, Clock clock) {
        if (devices == null) {
            throw new IllegalArgumentException("devices cannot be null");
        }
        if (sessions == null) {
            throw new IllegalArgumentException("sessions cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (adapters == null) {
            throw new IllegalArgumentException("adapters cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.devices = devices;
        this.sessions = sessions;
        this.resources = resources;
        this.rules = rules;
        this.adapters = adapters;
        this.clock = clock;
    }

    /**
     * 세션 시작 (observer 없음).
     *
     * @see #open(DeviceId, String, BehaviorConfig, IngestionObserver)
     */
    public IngestSessionId open(DeviceId deviceId, String agent, BehaviorConfig behavior) {
        return open(deviceId, agent, behavior, IngestionObserver.NOOP);
    }

    /**
     * 세션 시작.
     *
     * @param deviceId 대상 Device
     * @param agent 수집 에이전트 정보 (JSON, null 가능)
     * @param behavior behavior 설정 (null이면 기본값)
     * @param observer 전이/Issue 수신자
     * @return 새 세션 ID
     * @throws DeviceUnknownException Device가 없거나 삭제된 경우
     * @throws ReferentialException behavior의 SourceKind에 등록된 어댑터가 없는 경우
     * @throws ValidationException agent가 JSON이 아닌 경우
     */
    public IngestSessionId open(DeviceId deviceId, String agent, BehaviorConfig behavior,
                                IngestionObserver observer) {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        BehaviorConfig effective = behavior == null ? new BehaviorConfig() : behavior;

        // 1. Device 확인
        if (devices.findLive(deviceId).isEmpty()) {
            throw new DeviceUnknownException(deviceId);
        }
        StructuredPayloadValidator.requireValid("agent", agent);

        // 2. 어댑터/규칙 결정 (open 시점 고정)
        SourceAdapter adapter = adapters.require(effective.sourceKind());
        PathRuleSet ruleSet = rules.ruleSet(effective.ruleNamespace());

        // 3. 세션 기록
        devices.saveBehavior(deviceId, effective);
        IngestSession session = new IngestSession(
            IngestSessionId.generate(), deviceId, effective, agent, clock.instant(), null, null,
            Housekeeping.created(clock.instant(), null)
        );
        sessions.insertSession(session);
        contexts.put(session.id(), new SessionContext(session.id(), deviceId, adapter, ruleSet, observer));

        log.info("Ingest session opened: {} (device={}, behavior={}, source={})",
            session.id(), deviceId, effective.name(), effective.sourceKind());
        return session.id();
    }

    /**
     * 탐색할 루트 경로 등록.
     *
     * @param sessionId 세션
     * @param rootPath 루트 위치
     * @param includeGlobs 포함 glob (null 가능)
     * @param excludeGlobs 제외 glob (null 가능)
     * @return 경로 ID
     * @throws ReferentialException 세션이 없는 경우
     * @throws AlreadyClosedException 세션이 종료된 경우
     */
    public IngestPathId registerPath(IngestSessionId sessionId, String rootPath,
                                     List<String> includeGlobs, List<String> excludeGlobs) {
        IngestSession session = requireSession(sessionId);
        if (session.state().isTerminal()) {
            throw new AlreadyClosedException("IngestSession", sessionId.getValue());
        }
        IngestPath stored = sessions.insertPath(new IngestPath(
            IngestPathId.generate(), sessionId, rootPath, includeGlobs, excludeGlobs, null,
            Housekeeping.created(clock.instant(), null)
        ));
        log.info("Ingest path registered: {} -> {}", sessionId, rootPath);
        return stored.id();
    }

    /**
     * 경로 엔트리 기록 (규칙은 세션의 namespace로 평가).
     *
     * @see #recordEntry(IngestPathId, String, String, MatchResult)
     */
    public PathEntry recordEntry(IngestPathId pathId, String absPath, String relPath) {
        return recordEntry(pathId, absPath, relPath, null);
    }

    /**
     * 경로 엔트리 기록.
     *
     * @param pathId 루트 경로
     * @param absPath 절대 경로
     * @param relPath 루트 기준 상대 경로
     * @param precomputed 미리 계산된 규칙 평가 결과 (null이면 평가)
     * @return 저장된 엔트리 (같은 키의 엔트리가 이미 있으면 그 엔트리)
     * @throws ReferentialException 경로가 없는 경우
     * @throws com.ryuqq.urengine.core.exception.StoreUnavailableException 저장소 접근 불가
     */
    public PathEntry recordEntry(IngestPathId pathId, String absPath, String relPath, MatchResult precomputed) {
        if (pathId == null) {
            throw new IllegalArgumentException("pathId cannot be null");
        }
        if (absPath == null || absPath.isBlank()) {
            throw new IllegalArgumentException("absPath cannot be null or blank");
        }
        IngestPath path = sessions.findPath(pathId)
            .orElseThrow(() -> new ReferentialException("IngestPath", pathId.getValue()));
        String rel = relPath == null ? absPath : relPath;
        PathEntry.Key key = new PathEntry.Key(path.sessionId(), pathId, absPath);

        // 1. 이미 기록된 엔트리는 다시 처리하지 않음
        Optional<PathEntry> existing = sessions.findEntry(key);
        if (existing.isPresent()) {
            log.debug("Entry already recorded: {}", absPath);
            return existing.get();
        }

        // 같은 키는 한 스레드만 처리하고 나머지는 그 결과를 기다림
        CompletableFuture<PathEntry> mine = new CompletableFuture<>();
        CompletableFuture<PathEntry> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Entry already in progress, waiting: {}", absPath);
            return await(running);
        }
        try {
            PathEntry recorded = sessions.findEntry(key)
                .orElseGet(() -> process(path, absPath, rel, precomputed));
            mine.complete(recorded);
            return recorded;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private PathEntry process(IngestPath path, String absPath, String rel, MatchResult precomputed) {
        IngestPathId pathId = path.id();
        SessionContext ctx = context(path.sessionId());
        PathEntryState state = StateTransition.transition(PathEntryState.DISCOVERING, PathEntryState.MATCHING);

        // 2. 경로 glob
        if (!GlobFilter.of(path.includeGlobs(), path.excludeGlobs()).accepts(rel)) {
            log.debug("Entry excluded by path glob: {}", absPath);
            return store(ctx, path, absPath, rel, state, PathEntryStatus.EXCLUDED,
                diagnostics("excluded by path glob", null), null, null);
        }

        // 3. match rule
        MatchResult match = precomputed != null ? precomputed : ctx.ruleSet.evaluate(absPath);
        if (!match.matched()) {
            log.debug("Entry unmatched in strict namespace {}: {}", ctx.ruleSet.namespace(), absPath);
            return store(ctx, path, absPath, rel, state, PathEntryStatus.UNMATCHED,
                diagnostics("no match rule in strict namespace " + ctx.ruleSet.namespace(), null), null, null);
        }
        state = StateTransition.transition(state, PathEntryState.RESOLVING);
        String transformations = transformations(match);

        // 4. 어댑터
        SourceCandidate candidate;
        try {
            candidate = ctx.adapter.produceCandidate(path.sessionId(), absPath);
        } catch (AdapterException e) {
            log.warn("Adapter failed for {}: {}", absPath, e.getMessage());
            ctx.observer.onIssue(path.sessionId(), ISSUE_ADAPTER_FAILURE, e.getMessage(), absPath);
            return store(ctx, path, absPath, rel, state, PathEntryStatus.ERRORED,
                diagnostics(e.getMessage(), ISSUE_ADAPTER_FAILURE), transformations, null);
        }

        // 5. admit
        Admission<ResourceId> admission;
        try {
            admission = resources.admit(toResourceCandidate(ctx.deviceId, pathId, candidate, match),
                path.sessionId());
        } catch (ValidationException | ReferentialException e) {
            log.warn("Admission rejected for {}: {}", absPath, e.getMessage());
            ctx.observer.onIssue(path.sessionId(), ISSUE_ADMISSION_FAILURE, e.getMessage(), absPath);
            return store(ctx, path, absPath, rel, state, PathEntryStatus.ERRORED,
                diagnostics(e.getMessage(), ISSUE_ADMISSION_FAILURE), transformations, null);
        }
        PathEntryStatus status = admission.isNewRecord() ? PathEntryStatus.ADMITTED : PathEntryStatus.DUPLICATE;
        return store(ctx, path, absPath, rel, state, status, null, transformations, admission.id());
    }

    /**
     * 경로가 아닌 수집 단위 기록 (메일 메시지, 이슈, 텔레메트리 레코드, 캡처된 실행 결과).
     *
     * @param sessionId 세션
     * @param unitId 단위 식별자 (어댑터에 그대로 전달)
     * @param capturedExecutableJson 캡처 정보 (JSON)
     * @return 저장된 태스크
     * @throws ValidationException capturedExecutableJson이 JSON이 아닌 경우
     */
    public IngestTask recordTask(IngestSessionId sessionId, String unitId, String capturedExecutableJson) {
        if (unitId == null || unitId.isBlank()) {
            throw new IllegalArgumentException("unitId cannot be null or blank");
        }
        StructuredPayloadValidator.requirePresent("capturedExecutable", capturedExecutableJson);
        SessionContext ctx = context(sessionId);

        PathEntryStatus status;
        String diagnostics = null;
        ResourceId resourceId = null;
        try {
            SourceCandidate candidate = ctx.adapter.produceCandidate(sessionId, unitId);
            Admission<ResourceId> admission = resources.admit(
                toResourceCandidate(ctx.deviceId, null, candidate, null), sessionId);
            status = admission.isNewRecord() ? PathEntryStatus.ADMITTED : PathEntryStatus.DUPLICATE;
            resourceId = admission.id();
        } catch (AdapterException e) {
            log.warn("Adapter failed for task {}: {}", unitId, e.getMessage());
            ctx.observer.onIssue(sessionId, ISSUE_ADAPTER_FAILURE, e.getMessage(), unitId);
            status = PathEntryStatus.ERRORED;
            diagnostics = diagnostics(e.getMessage(), ISSUE_ADAPTER_FAILURE);
        } catch (ValidationException | ReferentialException e) {
            log.warn("Admission rejected for task {}: {}", unitId, e.getMessage());
            ctx.observer.onIssue(sessionId, ISSUE_ADMISSION_FAILURE, e.getMessage(), unitId);
            status = PathEntryStatus.ERRORED;
            diagnostics = diagnostics(e.getMessage(), ISSUE_ADMISSION_FAILURE);
        }

        IngestTask task = new IngestTask(IngestTaskId.generate(), sessionId, unitId, capturedExecutableJson,
            status, diagnostics, null, resourceId, Housekeeping.created(clock.instant(), null));
        sessions.insertTask(task);
        ctx.count(status);
        log.debug("Task recorded: {} -> {}", unitId, status);
        return task;
    }

    /**
     * 세션 종료.
     *
     * @param sessionId 세션
     * @return 종료 시점 집계
     * @throws AlreadyClosedException 이미 종료된 경우
     */
    public IngestionSummary close(IngestSessionId sessionId) {
        SessionContext ctx = context(sessionId);
        IngestionSummary summary = ctx.summary();
        sessions.markFinished(sessionId, clock.instant(), summaryJson(summary));
        ctx.observer.onTransition(sessionId, IngestSessionState.OPEN.name(), IngestSessionState.CLOSED.name(),
            "ingestion closed");
        log.info("Ingest session closed: {} (admitted={}, duplicate={}, rejected={}, errored={})",
            sessionId, summary.admitted(), summary.duplicate(), summary.rejected(), summary.errored());
        return summary;
    }

    /**
     * 현재 집계.
     *
     * @param sessionId 세션
     * @return 집계
     */
    public IngestionSummary summary(IngestSessionId sessionId) {
        return context(sessionId).summary();
    }

    // ========================================
    // internals
    // ========================================

    private IngestSession requireSession(IngestSessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return sessions.findSession(sessionId)
            .orElseThrow(() -> new ReferentialException("IngestSession", sessionId.getValue()));
    }

    /**
     * 세션 컨텍스트 조회. 메모리에 없으면 저장소에서 재구성합니다 (observer는 NOOP).
     */
    private SessionContext context(IngestSessionId sessionId) {
        SessionContext ctx = contexts.get(sessionId);
        if (ctx != null) {
            return ctx;
        }
        IngestSession session = requireSession(sessionId);
        return contexts.computeIfAbsent(sessionId, id -> {
            SessionContext rebuilt = new SessionContext(id, session.deviceId(),
                adapters.require(session.behavior().sourceKind()),
                rules.ruleSet(session.behavior().ruleNamespace()),
                IngestionObserver.NOOP);
            sessions.entriesOf(id).forEach(entry -> rebuilt.count(entry.status()));
            sessions.tasksOf(id).forEach(task -> rebuilt.count(task.status()));
            log.debug("Ingest session context rebuilt from store: {}", id);
            return rebuilt;
        });
    }

    private PathEntry store(SessionContext ctx, IngestPath path, String absPath, String relPath,
                            PathEntryState current, PathEntryStatus status, String diagnostics,
                            String transformations, ResourceId resourceId) {
        PathEntryState terminal = StateTransition.transition(current, status.terminalState());
        String basename = PathEntry.basenameOf(relPath);
        PathEntry entry = new PathEntry(
            PathEntryId.generate(), path.sessionId(), path.id(), absPath, relPath,
            PathEntry.parentOf(relPath), basename, PathEntry.extensionOf(basename), null,
            terminal, status, diagnostics, transformations, resourceId,
            Housekeeping.created(clock.instant(), null)
        );
        PathEntry stored = sessions.putEntryIfAbsent(entry);
        if (stored.id().equals(entry.id())) {
            ctx.count(status);
            log.debug("Entry recorded: {} -> {}", absPath, status);
        }
        return stored;
    }

    private static PathEntry await(CompletableFuture<PathEntry> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static ResourceCandidate toResourceCandidate(DeviceId deviceId, IngestPathId pathId,
                                                         SourceCandidate candidate, MatchResult match) {
        String uri = match != null && match.rewrite() != null ? match.canonicalUri() : candidate.uri();
        // 규칙의 nature 우선, match-all처럼 규칙에 nature가 없을 때만 어댑터 값
        String nature = match != null && match.nature() != null ? match.nature() : candidate.nature();
        return new ResourceCandidate(deviceId, pathId, uri, candidate.content(), null, candidate.sizeBytes(),
            nature, null, null, null, candidate.metadataJson());
    }

    private static String diagnostics(String message, String issueType) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", message == null ? "unknown" : message);
        fields.put("issueType", issueType);
        return StructuredPayloadValidator.toJson(fields);
    }

    private static String transformations(MatchResult match) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("matchRule", match.rule().regex());
        fields.put("priority", match.rule().priority());
        fields.put("nature", match.nature());
        if (match.rewrite() != null) {
            fields.put("rewriteRule", match.rewrite().regex());
            fields.put("canonicalUri", match.canonicalUri());
        }
        return StructuredPayloadValidator.toJson(fields);
    }

    private static String summaryJson(IngestionSummary summary) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("admitted", summary.admitted());
        fields.put("duplicate", summary.duplicate());
        fields.put("rejected", summary.rejected());
        fields.put("errored", summary.errored());
        return StructuredPayloadValidator.toJson(fields);
    }

    /**
     * open 시점에 고정되는 세션별 실행 컨텍스트와 집계 카운터.
     */
    private static final class SessionContext {

        private final IngestSessionId sessionId;
        private final DeviceId deviceId;
        private final SourceAdapter adapter;
        private final PathRuleSet ruleSet;
        private final IngestionObserver observer;
        private final AtomicLong admitted = new AtomicLong();
        private final AtomicLong duplicate = new AtomicLong();
        private final AtomicLong rejected = new AtomicLong();
        private final AtomicLong errored = new AtomicLong();

        SessionContext(IngestSessionId sessionId, DeviceId deviceId, SourceAdapter adapter,
                       PathRuleSet ruleSet, IngestionObserver observer) {
            this.sessionId = sessionId;
            this.deviceId = deviceId;
            this.adapter = adapter;
            this.ruleSet = ruleSet;
            this.observer = observer;
        }

        void count(PathEntryStatus status) {
            switch (status) {
                case ADMITTED -> admitted.incrementAndGet();
                case DUPLICATE -> duplicate.incrementAndGet();
                case UNMATCHED, EXCLUDED -> rejected.incrementAndGet();
                case ERRORED -> errored.incrementAndGet();
            }
        }

        IngestionSummary summary() {
            return new IngestionSummary(admitted.get(), duplicate.get(), rejected.get(), errored.get());
        }

        @Override
        public String toString() {
            return "SessionContext{" + sessionId + '}';
        }
    }
}
