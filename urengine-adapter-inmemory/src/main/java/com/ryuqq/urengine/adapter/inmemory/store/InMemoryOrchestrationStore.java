package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.Identifier;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.orchestration.ExecNode;
import com.ryuqq.urengine.core.orchestration.OrchestrationNature;
import com.ryuqq.urengine.core.orchestration.OrchestrationSession;
import com.ryuqq.urengine.core.orchestration.SessionEntry;
import com.ryuqq.urengine.core.orchestration.SessionIssue;
import com.ryuqq.urengine.core.orchestration.SessionLogEntry;
import com.ryuqq.urengine.core.orchestration.SessionTransition;
import com.ryuqq.urengine.core.spi.OrchestrationStore;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory {@link OrchestrationStore}.
 *
 * <p>Sibling orders are assigned per parent scope: an {@link AtomicInteger} per exec parent, and a
 * guarded set of used orders per log parent. Transitions are kept twice: a current-value table keyed
 * on {@code (owner, from, to)} that is overwritten on repeat, and an append-only history ordered by a
 * global sequence number.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class InMemoryOrchestrationStore implements OrchestrationStore {

    private final ConcurrentHashMap<NatureKey, OrchestrationNature> natures = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<OrchestrationSessionId, OrchestrationSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<OrchestrationSessionId> sessionOrder = new ConcurrentLinkedQueue<>();

    private final ConcurrentHashMap<SessionEntryId, SessionEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<SessionEntryId> entryOrder = new ConcurrentLinkedQueue<>();

    private final ConcurrentHashMap<ExecId, ExecNode> execs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<ExecId> execOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<SiblingScope, AtomicInteger> execCounters = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<LogId, SessionLogEntry> logs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<LogId> logOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<SiblingScope, LogSiblings> logSiblings = new ConcurrentHashMap<>();

    private final ConcurrentLinkedQueue<SessionIssue> issues = new ConcurrentLinkedQueue<>();

    private final ConcurrentHashMap<SessionTransition.Key, SessionTransition> transitions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<SessionTransition> transitionLog = new ConcurrentLinkedQueue<>();
    private final AtomicLong transitionSequence = new AtomicLong();

    @Override
    public OrchestrationNature ensureNature(String natureId, String nature, Instant at) {
        if (natureId == null || nature == null || at == null) {
            throw new IllegalArgumentException("natureId, nature and at cannot be null");
        }
        return natures.computeIfAbsent(new NatureKey(natureId, nature),
            key -> new OrchestrationNature(natureId, nature, null, Housekeeping.created(at, null)));
    }

    @Override
    public Optional<OrchestrationNature> findNature(String natureId) {
        return natures.values().stream()
            .filter(candidate -> candidate.natureId().equals(natureId))
            .findFirst();
    }

    @Override
    public void insertSession(OrchestrationSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        StructuredPayloadValidator.requireValid("argsJson", session.argsJson());
        StructuredPayloadValidator.requireValid("elaboration", session.elaboration());
        if (sessions.putIfAbsent(session.id(), session) != null) {
            throw new IllegalStateException("OrchestrationSession already exists: " + session.id());
        }
        sessionOrder.add(session.id());
    }

    @Override
    public Optional<OrchestrationSession> findSession(OrchestrationSessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public OrchestrationSession markSessionFinished(OrchestrationSessionId sessionId, Instant at,
                                                    String diagnosticsJson, String diagnosticsMd) {
        StructuredPayloadValidator.requireValid("diagnosticsJson", diagnosticsJson);
        return sessions.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new ReferentialException("OrchestrationSession", id.getValue());
            }
            if (current.isFinished()) {
                throw new AlreadyClosedException("OrchestrationSession", id.getValue());
            }
            return current.finished(at, diagnosticsJson, diagnosticsMd);
        });
    }

    @Override
    public List<OrchestrationSession> listOpenSessions() {
        return sessionOrder.stream()
            .map(sessions::get)
            .filter(session -> session.isLive() && !session.isFinished())
            .sorted(Comparator.comparing(OrchestrationSession::startedAt))
            .toList();
    }

    @Override
    public void insertEntry(SessionEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        requireSession(entry.sessionId());
        StructuredPayloadValidator.requireValid("elaboration", entry.elaboration());
        if (entries.putIfAbsent(entry.id(), entry) != null) {
            throw new IllegalStateException("SessionEntry already exists: " + entry.id());
        }
        entryOrder.add(entry.id());
    }

    @Override
    public Optional<SessionEntry> findEntry(SessionEntryId entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public List<SessionEntry> entriesOf(OrchestrationSessionId sessionId) {
        return entryOrder.stream()
            .map(entries::get)
            .filter(entry -> entry.sessionId().equals(sessionId))
            .toList();
    }

    @Override
    public ExecNode insertExec(ExecNode exec) {
        if (exec == null) {
            throw new IllegalArgumentException("exec cannot be null");
        }
        if (exec.siblingOrder() != ExecNode.UNASSIGNED_ORDER) {
            throw new IllegalArgumentException("exec sibling order is assigned on insert");
        }
        requireSession(exec.sessionId());
        if (exec.parentId() != null) {
            ExecNode parent = execs.get(exec.parentId());
            if (parent == null || !parent.sessionId().equals(exec.sessionId())) {
                throw new ReferentialException("ExecNode", exec.parentId().getValue(),
                    "Parent exec not found in session " + exec.sessionId() + ": " + exec.parentId());
            }
        }

        SiblingScope scope = new SiblingScope(exec.sessionId(), exec.parentId());
        int order = execCounters.computeIfAbsent(scope, s -> new AtomicInteger()).getAndIncrement();
        ExecNode stored = exec.withSiblingOrder(order);
        if (execs.putIfAbsent(stored.id(), stored) != null) {
            throw new IllegalStateException("ExecNode already exists: " + stored.id());
        }
        execOrder.add(stored.id());
        return stored;
    }

    @Override
    public Optional<ExecNode> findExec(ExecId execId) {
        if (execId == null) {
            throw new IllegalArgumentException("execId cannot be null");
        }
        return Optional.ofNullable(execs.get(execId));
    }

    @Override
    public ExecNode updateExec(ExecId execId, UnaryOperator<ExecNode> update) {
        if (execId == null || update == null) {
            throw new IllegalArgumentException("execId and update cannot be null");
        }
        return execs.compute(execId, (id, current) -> {
            if (current == null) {
                throw new ReferentialException("ExecNode", id.getValue());
            }
            ExecNode next = update.apply(current);
            if (!next.id().equals(id) || next.siblingOrder() != current.siblingOrder()) {
                throw new IllegalStateException("exec identity and order cannot change: " + id);
            }
            return next;
        });
    }

    @Override
    public List<ExecNode> execsOf(OrchestrationSessionId sessionId) {
        return execOrder.stream()
            .map(execs::get)
            .filter(exec -> exec.sessionId().equals(sessionId))
            .toList();
    }

    @Override
    public SessionLogEntry appendLog(SessionLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        requireSession(entry.sessionId());
        StructuredPayloadValidator.requireValid("elaboration", entry.elaboration());
        if (entry.parentLogId() != null) {
            SessionLogEntry parent = logs.get(entry.parentLogId());
            if (parent == null || !parent.sessionId().equals(entry.sessionId())) {
                throw new ReferentialException("SessionLogEntry", entry.parentLogId().getValue(),
                    "Parent log not found in session " + entry.sessionId() + ": " + entry.parentLogId());
            }
        }
        if (entry.execId() != null) {
            ExecNode exec = execs.get(entry.execId());
            if (exec == null || !exec.sessionId().equals(entry.sessionId())) {
                throw new ReferentialException("ExecNode", entry.execId().getValue(),
                    "Exec not found in session " + entry.sessionId() + ": " + entry.execId());
            }
        }

        LogSiblings siblings = logSiblings.computeIfAbsent(
            new SiblingScope(entry.sessionId(), entry.parentLogId()), s -> new LogSiblings());
        SessionLogEntry stored = entry.withSiblingOrder(siblings.claim(entry.siblingOrder()));
        logs.put(stored.id(), stored);
        logOrder.add(stored.id());
        return stored;
    }

    @Override
    public Optional<SessionLogEntry> findLog(LogId logId) {
        return Optional.ofNullable(logs.get(logId));
    }

    @Override
    public List<SessionLogEntry> logsOf(OrchestrationSessionId sessionId) {
        return logOrder.stream()
            .map(logs::get)
            .filter(entry -> entry.sessionId().equals(sessionId))
            .toList();
    }

    @Override
    public SessionIssue appendIssue(SessionIssue issue) {
        if (issue == null) {
            throw new IllegalArgumentException("issue cannot be null");
        }
        requireSession(issue.sessionId());
        StructuredPayloadValidator.requireValid("elaboration", issue.elaboration());
        if (issue.entryId() != null) {
            SessionEntry entry = entries.get(issue.entryId());
            if (entry == null || !entry.sessionId().equals(issue.sessionId())) {
                throw new ReferentialException("SessionEntry", issue.entryId().getValue(),
                    "Entry not found in session " + issue.sessionId() + ": " + issue.entryId());
            }
        }
        issues.add(issue);
        return issue;
    }

    @Override
    public List<SessionIssue> issuesOf(OrchestrationSessionId sessionId) {
        return issues.stream().filter(issue -> issue.sessionId().equals(sessionId)).toList();
    }

    @Override
    public SessionTransition upsertTransition(Identifier owner, String fromState, String toState,
                                              String result, String reason, Instant at) {
        StructuredPayloadValidator.requireValid("result", result);
        SessionTransition.Key key = new SessionTransition.Key(owner, fromState, toState);
        // History append happens inside compute so per-key history matches the current value
        return transitions.compute(key, (k, previous) -> {
            SessionTransition next = new SessionTransition(owner, fromState, toState, result, reason, at,
                transitionSequence.incrementAndGet());
            transitionLog.add(next);
            return next;
        });
    }

    @Override
    public Optional<SessionTransition> findTransition(SessionTransition.Key key) {
        return Optional.ofNullable(transitions.get(key));
    }

    @Override
    public List<SessionTransition> transitionsOf(Identifier owner) {
        return transitions.values().stream()
            .filter(transition -> transition.owner().equals(owner))
            .sorted(Comparator.comparingLong(SessionTransition::sequence))
            .toList();
    }

    @Override
    public List<SessionTransition> transitionHistory(Identifier owner) {
        return transitionLog.stream()
            .filter(transition -> transition.owner().equals(owner))
            .sorted(Comparator.comparingLong(SessionTransition::sequence))
            .toList();
    }

    private void requireSession(OrchestrationSessionId sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new ReferentialException("OrchestrationSession", sessionId.getValue());
        }
    }

    private record NatureKey(String natureId, String nature) {
    }

    private record SiblingScope(OrchestrationSessionId sessionId, Identifier parent) {
    }

    /**
     * Orders used under one log parent.
     */
    private static final class LogSiblings {

        private final Set<Integer> used = new HashSet<>();
        private int next;

        synchronized int claim(int requested) {
            if (requested == ExecNode.UNASSIGNED_ORDER) {
                while (used.contains(next)) {
                    next++;
                }
                used.add(next);
                return next++;
            }
            if (requested < 0) {
                throw new ValidationException("siblingOrder", "sibling order must be non-negative: " + requested);
            }
            if (!used.add(requested)) {
                throw new ValidationException("siblingOrder", "sibling order already used: " + requested);
            }
            next = Math.max(next, requested + 1);
            return requested;
        }
    }
}
