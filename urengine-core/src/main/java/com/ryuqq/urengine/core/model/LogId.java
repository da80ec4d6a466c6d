package com.ryuqq.urengine.core.model;

/**
 * Orchestration Session 로그 트리 노드의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class LogId extends Identifier {

    private LogId(String value) {
        super(value);
    }

    /**
     * LogId 생성.
     *
     * @param value 식별자 값
     * @return LogId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static LogId of(String value) {
        return new LogId(value);
    }

    /**
     * 새로운 LogId 발급 (UUID 기반).
     *
     * @return 신규 LogId
     */
    public static LogId generate() {
        return new LogId(newValue());
    }
}
