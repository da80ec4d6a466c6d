package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestPathId;

import java.time.Instant;

/**
 * Resource Store에 수집을 요청하는 후보 리소스.
 *
 * <p>digest는 {@link #resolveDigest()}로 결정됩니다:</p>
 * <ul>
 *   <li>content가 있으면 SHA-256을 계산하고, 함께 제공된 digest와 다르면 거부</li>
 *   <li>content 없이 digest만 있으면 참조 전용 리소스로 그대로 사용</li>
 *   <li>둘 다 없으면 거부</li>
 * </ul>
 *
 * @param deviceId 소유 Device
 * @param ingestPathId 원본 경로 (null 가능)
 * @param uri 정규화된 위치
 * @param content 콘텐츠 바이트 (null 가능)
 * @param contentDigest 제공된 digest (null 가능)
 * @param sizeBytes 바이트 크기
 * @param nature 콘텐츠 종류 (null 가능)
 * @param lastModifiedAt 원본 수정 시각 (null 가능)
 * @param frontmatter frontmatter JSON (null 가능)
 * @param contentFmBodyAttrs frontmatter/body 속성 JSON (null 가능)
 * @param elaboration 부가 정보 JSON (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record ResourceCandidate(
    DeviceId deviceId,
    IngestPathId ingestPathId,
    String uri,
    byte[] content,
    ContentDigest contentDigest,
    long sizeBytes,
    String nature,
    Instant lastModifiedAt,
    String frontmatter,
    String contentFmBodyAttrs,
    String elaboration
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 크기가 음수인 경우
     */
    public ResourceCandidate {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId cannot be null");
        }
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be non-negative (current: " + sizeBytes + ")");
        }
        content = content == null ? null : content.clone();
    }

    /**
     * 콘텐츠 기반 후보 생성 (크기는 content 길이).
     *
     * @param deviceId 소유 Device
     * @param uri 위치
     * @param content 콘텐츠
     * @param nature 콘텐츠 종류
     * @return ResourceCandidate
     */
    public static ResourceCandidate of(DeviceId deviceId, String uri, byte[] content, String nature) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return new ResourceCandidate(deviceId, null, uri, content, null, content.length, nature,
            null, null, null, null);
    }

    /**
     * 콘텐츠 없이 digest만 가진 참조 전용 후보 생성.
     *
     * @param deviceId 소유 Device
     * @param uri 위치
     * @param contentDigest digest
     * @param sizeBytes 크기
     * @param nature 콘텐츠 종류
     * @return ResourceCandidate
     */
    public static ResourceCandidate reference(DeviceId deviceId, String uri, ContentDigest contentDigest,
                                              long sizeBytes, String nature) {
        if (contentDigest == null) {
            throw new IllegalArgumentException("contentDigest cannot be null");
        }
        return new ResourceCandidate(deviceId, null, uri, null, contentDigest, sizeBytes, nature,
            null, null, null, null);
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    /**
     * 최종 digest 결정.
     *
     * @return 계산되었거나 제공된 digest
     * @throws ValidationException digest를 결정할 수 없거나 제공 값이 계산 값과 다른 경우
     */
    public ContentDigest resolveDigest() {
        if (content == null) {
            if (contentDigest == null) {
                throw new ValidationException("contentDigest", "either content or contentDigest is required");
            }
            return contentDigest;
        }
        ContentDigest computed = ContentDigest.sha256(content);
        if (contentDigest != null && !contentDigest.equals(computed)) {
            throw new ValidationException("contentDigest",
                "supplied digest " + contentDigest.getValue() + " does not match content " + computed.getValue());
        }
        return computed;
    }

    public ResourceCandidate withIngestPath(IngestPathId pathId) {
        return new ResourceCandidate(deviceId, pathId, uri, content, contentDigest, sizeBytes, nature,
            lastModifiedAt, frontmatter, contentFmBodyAttrs, elaboration);
    }

    public ResourceCandidate withLastModifiedAt(Instant at) {
        return new ResourceCandidate(deviceId, ingestPathId, uri, content, contentDigest, sizeBytes, nature,
            at, frontmatter, contentFmBodyAttrs, elaboration);
    }

    public ResourceCandidate withFrontmatter(String json) {
        return new ResourceCandidate(deviceId, ingestPathId, uri, content, contentDigest, sizeBytes, nature,
            lastModifiedAt, json, contentFmBodyAttrs, elaboration);
    }

    public ResourceCandidate withContentFmBodyAttrs(String json) {
        return new ResourceCandidate(deviceId, ingestPathId, uri, content, contentDigest, sizeBytes, nature,
            lastModifiedAt, frontmatter, json, elaboration);
    }

    public ResourceCandidate withElaboration(String json) {
        return new ResourceCandidate(deviceId, ingestPathId, uri, content, contentDigest, sizeBytes, nature,
            lastModifiedAt, frontmatter, contentFmBodyAttrs, json);
    }
}
