package com.ryuqq.urengine.core.model;

/**
 * 수집 대상 호스트/소스(Device)의 식별자.
 *
 * <p>Device는 최초 접촉 시 생성되며 물리적으로 삭제되지 않습니다 (soft-delete만 허용).
 * 리소스 중복 제거(dedup)는 DeviceId 범위 안에서만 수행됩니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class DeviceId extends Identifier {

    private DeviceId(String value) {
        super(value);
    }

    /**
     * DeviceId 생성.
     *
     * @param value 식별자 값
     * @return DeviceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static DeviceId of(String value) {
        return new DeviceId(value);
    }

    /**
     * 새로운 DeviceId 발급 (UUID 기반).
     *
     * @return 신규 DeviceId
     */
    public static DeviceId generate() {
        return new DeviceId(newValue());
    }
}
