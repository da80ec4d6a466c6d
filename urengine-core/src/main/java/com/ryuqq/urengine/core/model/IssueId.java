package com.ryuqq.urengine.core.model;

/**
 * Orchestration Session Issue의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class IssueId extends Identifier {

    private IssueId(String value) {
        super(value);
    }

    /**
     * IssueId 생성.
     *
     * @param value 식별자 값
     * @return IssueId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IssueId of(String value) {
        return new IssueId(value);
    }

    /**
     * 새로운 IssueId 발급 (UUID 기반).
     *
     * @return 신규 IssueId
     */
    public static IssueId generate() {
        return new IssueId(newValue());
    }
}
