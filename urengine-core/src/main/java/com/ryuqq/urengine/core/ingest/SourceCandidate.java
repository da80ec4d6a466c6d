package com.ryuqq.urengine.core.ingest;

/**
 * Source Adapter가 만든 후보 리소스.
 *
 * @param uri 위치
 * @param content 콘텐츠 바이트 (참조 전용이면 null)
 * @param sizeBytes 크기
 * @param nature 콘텐츠 종류 (null이면 match rule의 nature 사용)
 * @param metadataJson 어댑터 메타데이터 (JSON, null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record SourceCandidate(
    String uri,
    byte[] content,
    long sizeBytes,
    String nature,
    String metadataJson
) {

    public SourceCandidate {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be non-negative (current: " + sizeBytes + ")");
        }
        content = content == null ? null : content.clone();
    }

    public static SourceCandidate of(String uri, byte[] content, String nature) {
        return new SourceCandidate(uri, content, content == null ? 0 : content.length, nature, null);
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }
}
