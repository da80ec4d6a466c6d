package com.ryuqq.urengine.core.statemachine;

/**
 * Ingest Session 생명주기 상태.
 *
 * <p>{@code OPEN}은 {@code ingestFinishedAt}이 비어 있는 상태, {@code CLOSED}는 채워진 상태입니다.
 * 종료된 세션은 다시 열 수 없습니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public enum IngestSessionState {

    /**
     * 경로 등록과 엔트리 기록을 받는 상태.
     */
    OPEN,

    /**
     * 종료 상태. 새 경로 등록 불가, 늦게 도착한 엔트리는 허용.
     */
    CLOSED;

    /**
     * 종료 상태인지 확인.
     *
     * @return CLOSED이면 true
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }
}
