package com.ryuqq.urengine.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 엔티티 식별자의 공통 기반 클래스.
 *
 * <p>Device, Ingest Session, Uniform Resource, Orchestration Session 등
 * 모든 저장 엔티티의 식별자는 이 클래스를 상속한 불변 값 객체입니다.
 * 식별자는 각 서브시스템 생성자/메서드에 값으로 전달되며, 전역 가변 상태로 공유되지 않습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 콜론(:), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p><strong>동등성:</strong> 구체 타입과 값이 모두 같아야 동일합니다.
 * 즉 같은 문자열이라도 {@code DeviceId}와 {@code IngestSessionId}는 서로 다릅니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class Identifier {

    private static final int MAX_LENGTH = 255;
    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9._:\\-]+$");

    private final String value;

    /**
     * 식별자 생성 (하위 클래스 전용).
     *
     * @param value 식별자 값
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    protected Identifier(String value) {
        String typeName = getClass().getSimpleName();
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(typeName + " cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(typeName + " length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(typeName
                + " contains invalid characters. Only alphanumeric, dot, colon, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 새로운 식별자 값 생성 (UUID 기반).
     *
     * @return UUID 문자열
     */
    protected static String newValue() {
        return UUID.randomUUID().toString();
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + value + '}';
    }
}
