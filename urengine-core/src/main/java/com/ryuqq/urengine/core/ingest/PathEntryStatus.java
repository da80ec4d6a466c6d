package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.statemachine.PathEntryState;

/**
 * Path Entry / Ingest Task 처리 결과.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public enum PathEntryStatus {

    /**
     * 신규 리소스로 수집됨.
     */
    ADMITTED(PathEntryState.ADMITTED),

    /**
     * 기존 리소스로 해석됨.
     */
    DUPLICATE(PathEntryState.ADMITTED),

    /**
     * strict namespace에서 어떤 match rule에도 걸리지 않음.
     */
    UNMATCHED(PathEntryState.REJECTED),

    /**
     * include/exclude glob에 의해 제외됨.
     */
    EXCLUDED(PathEntryState.REJECTED),

    /**
     * 어댑터 또는 수집 오류.
     */
    ERRORED(PathEntryState.ERRORED);

    private final PathEntryState terminalState;

    PathEntryStatus(PathEntryState terminalState) {
        this.terminalState = terminalState;
    }

    /**
     * 이 결과에 대응하는 종료 상태.
     *
     * @return 종료 PathEntryState
     */
    public PathEntryState terminalState() {
        return terminalState;
    }
}
