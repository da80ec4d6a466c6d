package com.ryuqq.urengine.core.model;

/**
 * Uniform Resource Transform(파생 산출물)의 식별자.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class TransformId extends Identifier {

    private TransformId(String value) {
        super(value);
    }

    /**
     * TransformId 생성.
     *
     * @param value 식별자 값
     * @return TransformId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TransformId of(String value) {
        return new TransformId(value);
    }

    /**
     * 새로운 TransformId 발급 (UUID 기반).
     *
     * @return 신규 TransformId
     */
    public static TransformId generate() {
        return new TransformId(newValue());
    }
}
