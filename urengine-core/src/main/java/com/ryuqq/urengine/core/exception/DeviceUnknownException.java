package com.ryuqq.urengine.core.exception;

import com.ryuqq.urengine.core.model.DeviceId;

/**
 * Device가 없거나 soft-delete된 상태에서 세션을 열려고 한 경우.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class DeviceUnknownException extends ReferentialException {

    /**
     * 생성자.
     *
     * @param deviceId 알 수 없는 Device ID
     */
    public DeviceUnknownException(DeviceId deviceId) {
        super("Device", deviceId.getValue(), "Device unknown or deleted: " + deviceId.getValue());
    }
}
