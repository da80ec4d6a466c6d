package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.device.Device;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.model.DeviceId;

import java.util.List;
import java.util.Optional;

/**
 * Device and behavior configuration storage SPI.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Get-or-create registration keyed by {@code (name, state, boundary)}</li>
 *   <li>Live and history reads (live reads skip soft-deleted devices)</li>
 *   <li>Per-device behavior configurations keyed by {@code (deviceId, behaviorName)}</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent registrations of the same key yield one device</li>
 *   <li>Structured fields are validated before any write</li>
 *   <li>Devices are never physically removed</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface DeviceRegistry {

    /**
     * Registers a device on first contact, or returns the existing one.
     *
     * <p>A soft-deleted device with the same key is returned as-is; it is not revived.</p>
     *
     * @param registration the registration request
     * @param actor the acting principal (null means unknown)
     * @return the new or existing device
     * @throws com.ryuqq.urengine.core.exception.ValidationException if a structured field is malformed
     */
    Device register(DeviceRegistration registration, String actor);

    /**
     * Finds a live device.
     *
     * @param deviceId the device ID
     * @return the device, or empty if unknown or soft-deleted
     */
    Optional<Device> findLive(DeviceId deviceId);

    /**
     * Finds a device regardless of its deletion marker.
     *
     * @param deviceId the device ID
     * @return the device, or empty if unknown
     */
    Optional<Device> findIncludingDeleted(DeviceId deviceId);

    /**
     * Lists live devices in registration order.
     *
     * @return live devices
     */
    List<Device> listLive();

    /**
     * Lists every device, including soft-deleted ones.
     *
     * @return all devices
     */
    List<Device> listAll();

    /**
     * Marks a device deleted.
     *
     * @param deviceId the device ID
     * @param actor the acting principal
     * @return true if the device was live before this call
     */
    boolean softDelete(DeviceId deviceId, String actor);

    /**
     * Stores a behavior configuration for a device (last write wins per name).
     *
     * @param deviceId the owning device
     * @param behavior the configuration
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the device is unknown
     */
    void saveBehavior(DeviceId deviceId, BehaviorConfig behavior);

    /**
     * Finds a behavior configuration.
     *
     * @param deviceId the owning device
     * @param behaviorName the behavior name
     * @return the configuration, or empty
     */
    Optional<BehaviorConfig> findBehavior(DeviceId deviceId, String behaviorName);
}
