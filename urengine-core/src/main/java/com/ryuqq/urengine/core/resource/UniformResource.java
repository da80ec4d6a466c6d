package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.SoftDeletable;

import java.time.Instant;

/**
 * 수집된 콘텐츠 단위 (Uniform Resource).
 *
 * <p>{@code (deviceId, contentDigest, uri, sizeBytes)}로 유일합니다.
 * 최초로 수집한 Ingest Session이 소유하며, 이후 재수집은 새 행을 만들지 않습니다.</p>
 *
 * <p>{@code content}는 참조 전용 리소스의 경우 null일 수 있으며, 접근자는 방어적 복사본을 반환합니다.</p>
 *
 * @param id Resource ID
 * @param deviceId 소유 Device
 * @param ingestSessionId 최초 수집 세션
 * @param ingestPathId 원본 경로 (null 가능)
 * @param uri 정규화된 위치
 * @param contentDigest 콘텐츠 digest
 * @param sizeBytes 바이트 크기
 * @param nature 콘텐츠 종류 (예: "md", "json")
 * @param content 콘텐츠 바이트 (null 가능)
 * @param lastModifiedAt 원본 수정 시각 (null 가능)
 * @param frontmatter frontmatter (JSON, null 가능)
 * @param contentFmBodyAttrs frontmatter/body 속성 (JSON, null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record UniformResource(
    ResourceId id,
    DeviceId deviceId,
    IngestSessionId ingestSessionId,
    IngestPathId ingestPathId,
    String uri,
    ContentDigest contentDigest,
    long sizeBytes,
    String nature,
    byte[] content,
    Instant lastModifiedAt,
    String frontmatter,
    String contentFmBodyAttrs,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public UniformResource {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId cannot be null");
        }
        if (ingestSessionId == null) {
            throw new IllegalArgumentException("ingestSessionId cannot be null");
        }
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (contentDigest == null) {
            throw new IllegalArgumentException("contentDigest cannot be null");
        }
        if (housekeeping == null) {
            throw new IllegalArgumentException("housekeeping cannot be null");
        }
        content = content == null ? null : content.clone();
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    /**
     * 중복 제거 키.
     *
     * @return (deviceId, digest, uri, sizeBytes)
     */
    public ResourceKey key() {
        return new ResourceKey(deviceId, contentDigest, uri, sizeBytes);
    }

    /**
     * envelope 교체.
     *
     * @param next 새 envelope
     * @return 새 UniformResource 인스턴스
     */
    public UniformResource withHousekeeping(Housekeeping next) {
        return new UniformResource(id, deviceId, ingestSessionId, ingestPathId, uri, contentDigest, sizeBytes,
            nature, content, lastModifiedAt, frontmatter, contentFmBodyAttrs, elaboration, next);
    }
}
