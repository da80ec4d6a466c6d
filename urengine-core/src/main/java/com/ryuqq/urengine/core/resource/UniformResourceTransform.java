package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.SoftDeletable;
import com.ryuqq.urengine.core.model.TransformId;

/**
 * 리소스의 파생 표현 (예: HTML → Markdown).
 *
 * <p>{@code (resourceId, contentDigest, nature, sizeBytes)}로 유일합니다.
 * 같은 리소스라도 nature가 다르면 별도 Transform입니다.</p>
 *
 * @param id Transform ID
 * @param resourceId 원본 리소스
 * @param uri 위치
 * @param contentDigest 변환 결과 digest
 * @param nature 변환 결과 종류
 * @param sizeBytes 변환 결과 크기
 * @param content 변환 결과 텍스트 (null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record UniformResourceTransform(
    TransformId id,
    ResourceId resourceId,
    String uri,
    ContentDigest contentDigest,
    String nature,
    long sizeBytes,
    String content,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public UniformResourceTransform {
        if (id == null || resourceId == null || contentDigest == null || housekeeping == null) {
            throw new IllegalArgumentException("id, resourceId, contentDigest and housekeeping cannot be null");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
    }

    /**
     * 중복 제거 키.
     *
     * @return (resourceId, digest, nature, sizeBytes)
     */
    public TransformKey key() {
        return new TransformKey(resourceId, contentDigest, nature, sizeBytes);
    }

    /**
     * Transform 중복 제거 키.
     *
     * @param resourceId 원본 리소스
     * @param contentDigest 변환 결과 digest
     * @param nature 변환 결과 종류
     * @param sizeBytes 변환 결과 크기
     */
    public record TransformKey(ResourceId resourceId, ContentDigest contentDigest, String nature, long sizeBytes) {
    }
}
