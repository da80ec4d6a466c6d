package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.exception.AlreadyClosedException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.ingest.IngestPath;
import com.ryuqq.urengine.core.ingest.IngestSession;
import com.ryuqq.urengine.core.ingest.IngestTask;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.statemachine.IngestSessionState;
import com.ryuqq.urengine.core.statemachine.StateTransition;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory {@link IngestSessionStore}.
 *
 * <p>Entries are keyed by {@code (sessionId, pathId, absPath)}; insertion is a single
 * {@link ConcurrentHashMap#computeIfAbsent} call. Finishing a session is a
 * {@link ConcurrentHashMap#compute} point update.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class InMemoryIngestSessionStore implements IngestSessionStore {

    private final Clock clock;
    private final ConcurrentHashMap<IngestSessionId, IngestSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<IngestSessionId> sessionOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<IngestPathId, IngestPath> paths = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PathKey, IngestPathId> pathsByKey = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<IngestPathId> pathOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<PathEntry.Key, PathEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<PathEntry.Key> entryOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<IngestTask> tasks = new ConcurrentLinkedQueue<>();

    public InMemoryIngestSessionStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void insertSession(IngestSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        StructuredPayloadValidator.requireValid("agent", session.agent());
        StructuredPayloadValidator.requireValid("elaboration", session.elaboration());
        if (sessions.putIfAbsent(session.id(), session) != null) {
            throw new IllegalStateException("IngestSession already exists: " + session.id());
        }
        sessionOrder.add(session.id());
    }

    @Override
    public Optional<IngestSession> findSession(IngestSessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<IngestSession> sessionsOf(DeviceId deviceId) {
        return sessionOrder.stream()
            .map(sessions::get)
            .filter(session -> session.deviceId().equals(deviceId))
            .toList();
    }

    @Override
    public IngestSession markFinished(IngestSessionId sessionId, Instant finishedAt, String summaryJson) {
        StructuredPayloadValidator.requireValid("elaboration", summaryJson);
        return sessions.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new ReferentialException("IngestSession", id.getValue());
            }
            if (current.state().isTerminal()) {
                throw new AlreadyClosedException("IngestSession", id.getValue());
            }
            StateTransition.validate(current.state(), IngestSessionState.CLOSED);
            return current.finished(finishedAt, summaryJson);
        });
    }

    @Override
    public IngestPath insertPath(IngestPath path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        requireSession(path.sessionId());
        StructuredPayloadValidator.requireValid("elaboration", path.elaboration());
        PathKey key = new PathKey(path.sessionId(), path.rootPath(), path.housekeeping().createdAt());
        IngestPathId id = pathsByKey.computeIfAbsent(key, k -> {
            paths.put(path.id(), path);
            pathOrder.add(path.id());
            return path.id();
        });
        return paths.get(id);
    }

    @Override
    public Optional<IngestPath> findPath(IngestPathId pathId) {
        if (pathId == null) {
            throw new IllegalArgumentException("pathId cannot be null");
        }
        return Optional.ofNullable(paths.get(pathId));
    }

    @Override
    public List<IngestPath> pathsOf(IngestSessionId sessionId) {
        return pathOrder.stream()
            .map(paths::get)
            .filter(path -> path.sessionId().equals(sessionId))
            .toList();
    }

    @Override
    public PathEntry putEntryIfAbsent(PathEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        requireSession(entry.sessionId());
        StructuredPayloadValidator.requireValid("capturedExecutable", entry.capturedExecutable());
        StructuredPayloadValidator.requireValid("diagnostics", entry.diagnostics());
        StructuredPayloadValidator.requireValid("transformations", entry.transformations());
        return entries.computeIfAbsent(entry.key(), key -> {
            entryOrder.add(key);
            return entry;
        });
    }

    @Override
    public Optional<PathEntry> findEntry(PathEntry.Key key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public List<PathEntry> entriesOf(IngestSessionId sessionId) {
        return entryOrder.stream()
            .filter(key -> key.sessionId().equals(sessionId))
            .map(entries::get)
            .toList();
    }

    @Override
    public void insertTask(IngestTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        requireSession(task.sessionId());
        StructuredPayloadValidator.requirePresent("capturedExecutable", task.capturedExecutable());
        StructuredPayloadValidator.requireValid("diagnostics", task.diagnostics());
        StructuredPayloadValidator.requireValid("transformations", task.transformations());
        tasks.add(task);
    }

    @Override
    public List<IngestTask> tasksOf(IngestSessionId sessionId) {
        return tasks.stream().filter(task -> task.sessionId().equals(sessionId)).toList();
    }

    @Override
    public boolean softDeleteSession(IngestSessionId sessionId, String actor) {
        boolean[] wasLive = {false};
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (!current.isLive()) {
                return current;
            }
            wasLive[0] = true;
            return current.withHousekeeping(current.housekeeping().softDeleted(clock.instant(), actor));
        });
        return wasLive[0];
    }

    private void requireSession(IngestSessionId sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new ReferentialException("IngestSession", sessionId.getValue());
        }
    }

    private record PathKey(IngestSessionId sessionId, String rootPath, Instant createdAt) {
    }
}
