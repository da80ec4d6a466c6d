package com.ryuqq.urengine.core.device;

import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 수집 대상 호스트/소스.
 *
 * <p>{@code (name, state, boundary)} 조합으로 유일하며 최초 접촉 시 생성됩니다.
 * {@code state}, {@code segmentation}, {@code stateSysinfo}, {@code elaboration}은 구조화 payload(JSON)입니다.</p>
 *
 * @param id Device ID
 * @param name 호스트명 등 표시 이름
 * @param state 호스트 상태 (JSON, 필수)
 * @param boundary 네트워크/조직 경계
 * @param segmentation 세그먼트 정보 (JSON, null 가능)
 * @param stateSysinfo 시스템 정보 (JSON, null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Device(
    DeviceId id,
    String name,
    String state,
    String boundary,
    String segmentation,
    String stateSysinfo,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public Device {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (boundary == null || boundary.isBlank()) {
            throw new IllegalArgumentException("boundary cannot be null or blank");
        }
        if (housekeeping == null) {
            throw new IllegalArgumentException("housekeeping cannot be null");
        }
    }

    /**
     * 등록 정보로부터 신규 Device 생성.
     *
     * @param id 발급된 ID
     * @param registration 등록 정보
     * @param housekeeping 생성 envelope
     * @return Device 인스턴스
     */
    public static Device from(DeviceId id, DeviceRegistration registration, Housekeeping housekeeping) {
        return new Device(
            id,
            registration.name(),
            registration.state(),
            registration.boundary(),
            registration.segmentation(),
            registration.stateSysinfo(),
            registration.elaboration(),
            housekeeping
        );
    }

    /**
     * envelope 교체.
     *
     * @param next 새 envelope
     * @return 새 Device 인스턴스
     */
    public Device withHousekeeping(Housekeeping next) {
        return new Device(id, name, state, boundary, segmentation, stateSysinfo, elaboration, next);
    }
}
