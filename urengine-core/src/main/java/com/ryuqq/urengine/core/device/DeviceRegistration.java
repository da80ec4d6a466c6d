package com.ryuqq.urengine.core.device;

import java.util.Objects;

/**
 * Device 등록 요청.
 *
 * <p>{@code (name, state, boundary)}가 유일 키입니다. 같은 키로 다시 등록하면
 * 기존 Device가 그대로 반환됩니다 (get-or-create).</p>
 *
 * @param name 호스트명 등 표시 이름
 * @param state 호스트 상태 (JSON)
 * @param boundary 네트워크/조직 경계
 * @param segmentation 세그먼트 정보 (JSON, null 가능)
 * @param stateSysinfo 시스템 정보 (JSON, null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record DeviceRegistration(
    String name,
    String state,
    String boundary,
    String segmentation,
    String stateSysinfo,
    String elaboration
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name/state/boundary가 비어 있는 경우
     */
    public DeviceRegistration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (boundary == null || boundary.isBlank()) {
            throw new IllegalArgumentException("boundary cannot be null or blank");
        }
    }

    /**
     * 필수 필드만으로 등록 요청 생성.
     *
     * @param name 표시 이름
     * @param state 상태 JSON
     * @param boundary 경계
     * @return DeviceRegistration
     */
    public static DeviceRegistration of(String name, String state, String boundary) {
        return new DeviceRegistration(name, state, boundary, null, null, null);
    }

    /**
     * 유일 키가 같은지 비교.
     *
     * @param device 비교 대상 Device
     * @return name/state/boundary가 모두 같으면 true
     */
    public boolean sameKeyAs(Device device) {
        return Objects.equals(name, device.name())
            && Objects.equals(state, device.state())
            && Objects.equals(boundary, device.boundary());
    }
}
