package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.ingest.IngestPath;
import com.ryuqq.urengine.core.ingest.IngestSession;
import com.ryuqq.urengine.core.ingest.IngestTask;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ingest session, path, entry and task storage SPI.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: entries are written by many worker threads</li>
 *   <li>{@link #putEntryIfAbsent(PathEntry)} is an atomic compare-and-insert on {@code (sessionId, pathId, absPath)}</li>
 *   <li>{@link #markFinished} is an atomic point update that fails on a second call</li>
 *   <li>Structured fields are validated before any write</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface IngestSessionStore {

    /**
     * Inserts a new session.
     *
     * @param session the session
     * @throws com.ryuqq.urengine.core.exception.ValidationException if the agent or elaboration is malformed
     */
    void insertSession(IngestSession session);

    Optional<IngestSession> findSession(IngestSessionId sessionId);

    /**
     * Lists sessions of a device in start order.
     *
     * @param deviceId the device
     * @return sessions (including soft-deleted ones)
     */
    List<IngestSession> sessionsOf(DeviceId deviceId);

    /**
     * Sets {@code ingestFinishedAt}.
     *
     * @param sessionId the session
     * @param finishedAt the finish instant
     * @param summaryJson closing summary recorded as elaboration (null keeps the current value)
     * @return the finished session
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the session is unknown
     * @throws com.ryuqq.urengine.core.exception.AlreadyClosedException if the session is already finished
     */
    IngestSession markFinished(IngestSessionId sessionId, Instant finishedAt, String summaryJson);

    /**
     * Inserts a root path, or returns the existing one for the same {@code (sessionId, rootPath, createdAt)}.
     *
     * @param path the path
     * @return the stored path
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the session is unknown
     */
    IngestPath insertPath(IngestPath path);

    Optional<IngestPath> findPath(IngestPathId pathId);

    List<IngestPath> pathsOf(IngestSessionId sessionId);

    /**
     * Inserts a path entry unless one exists for its key.
     *
     * @param entry the entry
     * @return the stored entry; equal to {@code entry} when inserted, the earlier one otherwise
     * @throws com.ryuqq.urengine.core.exception.ValidationException if diagnostics or transformations are malformed
     */
    PathEntry putEntryIfAbsent(PathEntry entry);

    Optional<PathEntry> findEntry(PathEntry.Key key);

    /**
     * Lists entries of a session in insertion order.
     *
     * @param sessionId the session
     * @return entries
     */
    List<PathEntry> entriesOf(IngestSessionId sessionId);

    /**
     * Inserts a non-path task record.
     *
     * @param task the task
     * @throws com.ryuqq.urengine.core.exception.ValidationException if a structured field is malformed
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the session is unknown
     */
    void insertTask(IngestTask task);

    List<IngestTask> tasksOf(IngestSessionId sessionId);

    /**
     * Marks a session deleted.
     *
     * @param sessionId the session
     * @param actor the acting principal
     * @return true if the session was live before this call
     */
    boolean softDeleteSession(IngestSessionId sessionId, String actor);
}
