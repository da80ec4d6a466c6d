package com.ryuqq.urengine.core.statemachine;

/**
 * 상태 전이 검증.
 *
 * <p><strong>Ingest Session:</strong> OPEN → CLOSED</p>
 *
 * <p><strong>Path Entry:</strong></p>
 * <ul>
 *   <li>DISCOVERING → MATCHING | ERRORED</li>
 *   <li>MATCHING → RESOLVING | REJECTED | ERRORED</li>
 *   <li>RESOLVING → ADMITTED | ERRORED</li>
 * </ul>
 *
 * <p><strong>Orchestration:</strong></p>
 * <ul>
 *   <li>OPEN → RUNNING | FAILED</li>
 *   <li>RUNNING → RETRYING | COMPLETED | FAILED</li>
 *   <li>RETRYING → RUNNING | FAILED</li>
 * </ul>
 *
 * <p>종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Ingest Session 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(IngestSessionState from, IngestSessionState to) {
        requireStates(from, to);
        if (from.isTerminal()) {
            throw terminal(from, to);
        }
        if (to != IngestSessionState.CLOSED) {
            throw invalid(from, to);
        }
    }

    /**
     * Path Entry 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PathEntryState from, PathEntryState to) {
        requireStates(from, to);
        if (from.isTerminal()) {
            throw terminal(from, to);
        }
        boolean valid = switch (from) {
            case DISCOVERING -> to == PathEntryState.MATCHING || to == PathEntryState.ERRORED;
            case MATCHING -> to == PathEntryState.RESOLVING
                || to == PathEntryState.REJECTED
                || to == PathEntryState.ERRORED;
            case RESOLVING -> to == PathEntryState.ADMITTED || to == PathEntryState.ERRORED;
            case ADMITTED, REJECTED, ERRORED -> false;
        };
        if (!valid) {
            throw invalid(from, to);
        }
    }

    /**
     * Orchestration 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OrchestrationState from, OrchestrationState to) {
        requireStates(from, to);
        if (from.isTerminal()) {
            throw terminal(from, to);
        }
        boolean valid = switch (from) {
            case OPEN -> to == OrchestrationState.RUNNING || to == OrchestrationState.FAILED;
            case RUNNING -> to == OrchestrationState.RETRYING
                || to == OrchestrationState.COMPLETED
                || to == OrchestrationState.FAILED;
            case RETRYING -> to == OrchestrationState.RUNNING || to == OrchestrationState.FAILED;
            case COMPLETED, FAILED -> false;
        };
        if (!valid) {
            throw invalid(from, to);
        }
    }

    /**
     * Path Entry 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static PathEntryState transition(PathEntryState current, PathEntryState next) {
        validate(current, next);
        return next;
    }

    /**
     * Orchestration 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static OrchestrationState transition(OrchestrationState current, OrchestrationState next) {
        validate(current, next);
        return next;
    }

    private static void requireStates(Object from, Object to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    private static IllegalStateException terminal(Object from, Object to) {
        return new IllegalStateException(
            String.format("Cannot transition from terminal state: %s → %s", from, to)
        );
    }

    private static IllegalStateException invalid(Object from, Object to) {
        return new IllegalStateException(
            String.format("Invalid state transition: %s → %s", from, to)
        );
    }
}
