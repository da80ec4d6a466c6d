package com.ryuqq.urengine.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>Ingest Session: OPEN → CLOSED만 허용</li>
 *   <li>Path Entry: DISCOVERING → MATCHING → RESOLVING → 종료 상태</li>
 *   <li>Orchestration: OPEN → RUNNING ⇄ RETRYING → COMPLETED/FAILED</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== Ingest Session ==========

    @Test
    void validate_OpenToClosed_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(IngestSessionState.OPEN, IngestSessionState.CLOSED));
    }

    @Test
    void validate_ClosedToClosed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(IngestSessionState.CLOSED, IngestSessionState.CLOSED)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    // ========== Path Entry ==========

    @Test
    void transition_AdmittedFlow_Succeeds() {
        // Given
        PathEntryState state = PathEntryState.DISCOVERING;

        // When
        state = StateTransition.transition(state, PathEntryState.MATCHING);
        state = StateTransition.transition(state, PathEntryState.RESOLVING);
        state = StateTransition.transition(state, PathEntryState.ADMITTED);

        // Then
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_MatchingToRejected_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PathEntryState.MATCHING, PathEntryState.REJECTED));
    }

    @Test
    void validate_ResolvingToRejected_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(PathEntryState.RESOLVING, PathEntryState.REJECTED));
    }

    @Test
    void validate_DiscoveringToAdmitted_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(PathEntryState.DISCOVERING, PathEntryState.ADMITTED));
    }

    // ========== Orchestration ==========

    @Test
    void transition_RetryCycle_Succeeds() {
        // Given
        OrchestrationState state = OrchestrationState.OPEN;

        // When
        state = StateTransition.transition(state, OrchestrationState.RUNNING);
        state = StateTransition.transition(state, OrchestrationState.RETRYING);
        state = StateTransition.transition(state, OrchestrationState.RUNNING);
        state = StateTransition.transition(state, OrchestrationState.COMPLETED);

        // Then
        assertEquals(OrchestrationState.COMPLETED, state);
    }

    @Test
    void validate_OpenToCompleted_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(OrchestrationState.OPEN, OrchestrationState.COMPLETED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_FailedToRunning_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(OrchestrationState.FAILED, OrchestrationState.RUNNING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.validate((OrchestrationState) null, OrchestrationState.RUNNING));
    }
}
