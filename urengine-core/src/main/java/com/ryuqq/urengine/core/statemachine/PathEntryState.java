package com.ryuqq.urengine.core.statemachine;

/**
 * Path Entry 처리 상태.
 *
 * <p>DISCOVERING → MATCHING → RESOLVING → {ADMITTED | REJECTED | ERRORED}.
 * 규칙/glob 단계에서 걸러진 경로는 MATCHING에서 곧바로 REJECTED로,
 * 어댑터 실패는 어느 진행 단계에서든 ERRORED로 갑니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public enum PathEntryState {

    /**
     * 경로가 발견되어 기록 대기 중.
     */
    DISCOVERING,

    /**
     * include/exclude glob과 match rule 평가 중.
     */
    MATCHING,

    /**
     * 어댑터 호출 및 Resource Store 수집(admit) 중.
     */
    RESOLVING,

    /**
     * 리소스로 해석됨 (신규 또는 중복).
     */
    ADMITTED,

    /**
     * glob 또는 strict namespace 규칙에 의해 거부됨.
     */
    REJECTED,

    /**
     * 어댑터 또는 수집 단계 오류.
     */
    ERRORED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ADMITTED, REJECTED, ERRORED이면 true
     */
    public boolean isTerminal() {
        return this == ADMITTED || this == REJECTED || this == ERRORED;
    }
}
