package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.model.IngestSessionId;

/**
 * Receives ingestion lifecycle signals.
 *
 * <p>Used to bridge ingestion into an orchestration audit trail. Implementations must be
 * thread-safe because worker threads report concurrently.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface IngestionObserver {

    /**
     * Observer that ignores every signal.
     */
    IngestionObserver NOOP = new IngestionObserver() {
        @Override
        public void onTransition(IngestSessionId sessionId, String fromState, String toState, String reason) {
        }

        @Override
        public void onIssue(IngestSessionId sessionId, String type, String message, String unitId) {
        }
    };

    /**
     * Called when the session changes state.
     *
     * @param sessionId the session
     * @param fromState source state
     * @param toState target state
     * @param reason reason text (null allowed)
     */
    void onTransition(IngestSessionId sessionId, String fromState, String toState, String reason);

    /**
     * Called when a unit fails in the adapter or at admission.
     *
     * @param sessionId the session
     * @param type issue type
     * @param message issue message
     * @param unitId the failing path or unit id
     */
    void onIssue(IngestSessionId sessionId, String type, String message, String unitId);
}
