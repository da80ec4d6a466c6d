package com.ryuqq.urengine.core.model;

/**
 * Uniform Resource의 식별자.
 *
 * <p>외부 소비자가 재수집 간 산출물을 연관 짓는 안정적 식별 수단은 ResourceId가 아니라
 * {@link ContentDigest}입니다. ResourceId는 저장소 내부 행 식별자입니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ResourceId extends Identifier {

    private ResourceId(String value) {
        super(value);
    }

    /**
     * ResourceId 생성.
     *
     * @param value 식별자 값
     * @return ResourceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * 새로운 ResourceId 발급 (UUID 기반).
     *
     * @return 신규 ResourceId
     */
    public static ResourceId generate() {
        return new ResourceId(newValue());
    }
}
