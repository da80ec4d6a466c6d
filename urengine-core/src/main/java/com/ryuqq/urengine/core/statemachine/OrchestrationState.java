package com.ryuqq.urengine.core.statemachine;

/**
 * Orchestration Session 및 Session Entry의 상태 라벨.
 *
 * <p>Session State 테이블에는 문자열로 기록되며, 이 enum은 파이프라인 러너가
 * 사용하는 표준 라벨 집합입니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public enum OrchestrationState {

    OPEN,

    RUNNING,

    /**
     * 일시적 실패 후 재시도 대기.
     */
    RETRYING,

    COMPLETED,

    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
