package com.ryuqq.urengine.core.model;

/**
 * Orchestration Session 내 단계(Session Entry)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class SessionEntryId extends Identifier {

    private SessionEntryId(String value) {
        super(value);
    }

    /**
     * SessionEntryId 생성.
     *
     * @param value 식별자 값
     * @return SessionEntryId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionEntryId of(String value) {
        return new SessionEntryId(value);
    }

    /**
     * 새로운 SessionEntryId 발급 (UUID 기반).
     *
     * @return 신규 SessionEntryId
     */
    public static SessionEntryId generate() {
        return new SessionEntryId(newValue());
    }
}
