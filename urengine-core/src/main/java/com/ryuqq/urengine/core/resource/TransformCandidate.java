package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.ResourceId;

import java.nio.charset.StandardCharsets;

/**
 * Transform 수집 요청.
 *
 * <p>digest와 크기는 content의 UTF-8 바이트로부터 계산됩니다.</p>
 *
 * @param resourceId 원본 리소스
 * @param uri 위치 (null이면 원본 uri를 사용하는 것은 호출자 책임)
 * @param nature 변환 결과 종류
 * @param content 변환 결과 텍스트
 * @param elaboration 부가 정보 (JSON, null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record TransformCandidate(
    ResourceId resourceId,
    String uri,
    String nature,
    String content,
    String elaboration
) {

    public TransformCandidate {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public static TransformCandidate of(ResourceId resourceId, String uri, String nature, String content) {
        return new TransformCandidate(resourceId, uri, nature, content, null);
    }

    public ContentDigest contentDigest() {
        return ContentDigest.sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    public long sizeBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}
