package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.model.ExecId;
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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Orchestration audit trail storage SPI.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Natures, sessions and entries</li>
 *   <li>Exec tree with atomic per-parent sibling ordering</li>
 *   <li>Log tree with unique per-parent sibling ordering</li>
 *   <li>Append-only issues</li>
 *   <li>State transitions: last-write-wins current value plus append-only history</li>
 * </ul>
 *
 * <p><strong>Sibling order:</strong> for an exec or log inserted with
 * {@link ExecNode#UNASSIGNED_ORDER}, the store assigns the next value for its parent atomically;
 * values are strictly increasing per parent in insertion order.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe for concurrent writers of the same session</li>
 *   <li>Structured fields are validated before any write</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface OrchestrationStore {

    /**
     * Returns the nature for {@code (natureId, nature)}, registering it if absent.
     *
     * @param natureId the nature id
     * @param nature the nature label
     * @param at registration instant
     * @return the stored nature
     */
    OrchestrationNature ensureNature(String natureId, String nature, Instant at);

    Optional<OrchestrationNature> findNature(String natureId);

    /**
     * Inserts a session.
     *
     * @param session the session
     * @throws com.ryuqq.urengine.core.exception.ValidationException if args or elaboration are malformed
     */
    void insertSession(OrchestrationSession session);

    Optional<OrchestrationSession> findSession(OrchestrationSessionId sessionId);

    /**
     * Sets the finish instant and diagnostics.
     *
     * @param sessionId the session
     * @param at finish instant
     * @param diagnosticsJson diagnostics JSON (null allowed)
     * @param diagnosticsMd diagnostics markdown (null allowed)
     * @return the finished session
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the session is unknown
     * @throws com.ryuqq.urengine.core.exception.AlreadyClosedException if already finished
     * @throws com.ryuqq.urengine.core.exception.ValidationException if diagnostics JSON is malformed
     */
    OrchestrationSession markSessionFinished(OrchestrationSessionId sessionId, Instant at,
                                             String diagnosticsJson, String diagnosticsMd);

    /**
     * Lists live sessions that have not finished, oldest first.
     *
     * @return open sessions
     */
    List<OrchestrationSession> listOpenSessions();

    void insertEntry(SessionEntry entry);

    Optional<SessionEntry> findEntry(SessionEntryId entryId);

    List<SessionEntry> entriesOf(OrchestrationSessionId sessionId);

    /**
     * Inserts an exec, assigning its sibling order.
     *
     * @param exec the exec with {@link ExecNode#UNASSIGNED_ORDER}
     * @return the stored exec carrying its assigned order
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the parent is unknown or in another session
     */
    ExecNode insertExec(ExecNode exec);

    Optional<ExecNode> findExec(ExecId execId);

    /**
     * Atomically replaces an exec with the result of {@code update}.
     *
     * @param execId the exec
     * @param update the transformation applied to the current value
     * @return the stored result
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the exec is unknown
     */
    ExecNode updateExec(ExecId execId, UnaryOperator<ExecNode> update);

    /**
     * Lists execs of a session in insertion order.
     *
     * @param sessionId the session
     * @return execs
     */
    List<ExecNode> execsOf(OrchestrationSessionId sessionId);

    /**
     * Appends a log entry.
     *
     * <p>An {@link ExecNode#UNASSIGNED_ORDER} order takes the next value for the parent log;
     * an explicit order must not already be used by a sibling.</p>
     *
     * @param entry the log entry
     * @return the stored entry carrying its order
     * @throws com.ryuqq.urengine.core.exception.ValidationException if the explicit order is taken
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the parent log or the exec is unknown or in another session
     */
    SessionLogEntry appendLog(SessionLogEntry entry);

    Optional<SessionLogEntry> findLog(LogId logId);

    List<SessionLogEntry> logsOf(OrchestrationSessionId sessionId);

    /**
     * Appends an issue.
     *
     * @param issue the issue
     * @return the stored issue
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the entry is unknown or in another session
     */
    SessionIssue appendIssue(SessionIssue issue);

    List<SessionIssue> issuesOf(OrchestrationSessionId sessionId);

    /**
     * Overwrites the current transition row for {@code (owner, from, to)} and appends it to the history.
     *
     * <p>Concurrent writers of one key serialize; the last writer wins.</p>
     *
     * @param owner the owning session, entry or ingest session id
     * @param fromState the source state
     * @param toState the target state
     * @param result result JSON (null allowed)
     * @param reason reason text (null allowed)
     * @param at transition instant
     * @return the stored row
     * @throws com.ryuqq.urengine.core.exception.ValidationException if the result is malformed
     * @throws com.ryuqq.urengine.core.exception.ConcurrencyConflictException if concurrent writes to the
     *         same key cannot be serialized
     */
    SessionTransition upsertTransition(Identifier owner, String fromState, String toState,
                                       String result, String reason, Instant at);

    Optional<SessionTransition> findTransition(SessionTransition.Key key);

    /**
     * Lists current transition rows of an owner, ordered by their last write.
     *
     * @param owner the owner
     * @return current rows
     */
    List<SessionTransition> transitionsOf(Identifier owner);

    /**
     * Lists every transition write of an owner in write order.
     *
     * @param owner the owner
     * @return history rows
     */
    List<SessionTransition> transitionHistory(Identifier owner);
}
