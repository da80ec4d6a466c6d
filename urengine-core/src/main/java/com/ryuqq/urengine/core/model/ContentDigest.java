package com.ryuqq.urengine.core.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 리소스 바이트의 결정적 해시 (content-addressed identity).
 *
 * <p>동일 바이트는 항상 동일한 ContentDigest를 가지며, Lineage Graph, Transform 조회,
 * 리포팅 등 하위 소비자가 재수집 간 산출물을 연관 짓는 안정적 외부 식별자입니다.</p>
 *
 * <p><strong>정규화:</strong> 값은 소문자로 저장됩니다.
 * 어댑터가 다른 알고리즘의 digest를 제공하는 경우 그대로 허용합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ContentDigest {

    private static final String ALGORITHM = "SHA-256";

    private final String value;

    private ContentDigest(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ContentDigest cannot be null or blank");
        }
        this.value = value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 이미 계산된 digest 값으로 생성.
     *
     * @param value digest 문자열 (hex)
     * @return ContentDigest 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static ContentDigest of(String value) {
        return new ContentDigest(value);
    }

    /**
     * 바이트 배열의 SHA-256 digest 계산.
     *
     * @param content 리소스 바이트
     * @return SHA-256 hex digest
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static ContentDigest sha256(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return new ContentDigest(HexFormat.of().formatHex(digest.digest(content)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " algorithm not available", e);
        }
    }

    /**
     * digest 값 조회.
     *
     * @return 소문자 hex 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentDigest that = (ContentDigest) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ContentDigest{" + value + '}';
    }
}
