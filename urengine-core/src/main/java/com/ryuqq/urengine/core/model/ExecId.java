package com.ryuqq.urengine.core.model;

/**
 * Exec 트리 노드의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ExecId extends Identifier {

    private ExecId(String value) {
        super(value);
    }

    /**
     * ExecId 생성.
     *
     * @param value 식별자 값
     * @return ExecId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ExecId of(String value) {
        return new ExecId(value);
    }

    /**
     * 새로운 ExecId 발급 (UUID 기반).
     *
     * @return 신규 ExecId
     */
    public static ExecId generate() {
        return new ExecId(newValue());
    }
}
