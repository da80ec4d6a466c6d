package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.device.Device;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory {@link DeviceRegistry}.
 *
 * <p>Registration is a compare-and-insert on {@code (name, state, boundary)} through
 * {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first contacts yield one device.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class InMemoryDeviceRegistry implements DeviceRegistry {

    private final Clock clock;
    private final ConcurrentHashMap<DeviceId, Device> devices = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DeviceKey, DeviceId> byKey = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<DeviceId> registrationOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<BehaviorKey, BehaviorConfig> behaviors = new ConcurrentHashMap<>();

    public InMemoryDeviceRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Device register(DeviceRegistration registration, String actor) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        StructuredPayloadValidator.requirePresent("state", registration.state());
        StructuredPayloadValidator.requireValid("segmentation", registration.segmentation());
        StructuredPayloadValidator.requireValid("stateSysinfo", registration.stateSysinfo());
        StructuredPayloadValidator.requireValid("elaboration", registration.elaboration());

        DeviceKey key = new DeviceKey(registration.name(), registration.state(), registration.boundary());
        DeviceId id = byKey.computeIfAbsent(key, k -> {
            Device device = Device.from(DeviceId.generate(), registration,
                Housekeeping.created(clock.instant(), actor));
            devices.put(device.id(), device);
            registrationOrder.add(device.id());
            return device.id();
        });
        return devices.get(id);
    }

    @Override
    public Optional<Device> findLive(DeviceId deviceId) {
        return findIncludingDeleted(deviceId).filter(Device::isLive);
    }

    @Override
    public Optional<Device> findIncludingDeleted(DeviceId deviceId) {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId cannot be null");
        }
        return Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public List<Device> listLive() {
        return registrationOrder.stream().map(devices::get).filter(Device::isLive).toList();
    }

    @Override
    public List<Device> listAll() {
        return registrationOrder.stream().map(devices::get).toList();
    }

    @Override
    public boolean softDelete(DeviceId deviceId, String actor) {
        boolean[] wasLive = {false};
        devices.computeIfPresent(deviceId, (id, current) -> {
            if (!current.isLive()) {
                return current;
            }
            wasLive[0] = true;
            return current.withHousekeeping(current.housekeeping().softDeleted(clock.instant(), actor));
        });
        return wasLive[0];
    }

    @Override
    public void saveBehavior(DeviceId deviceId, BehaviorConfig behavior) {
        if (behavior == null) {
            throw new IllegalArgumentException("behavior cannot be null");
        }
        if (findIncludingDeleted(deviceId).isEmpty()) {
            throw new ReferentialException("Device", deviceId.getValue());
        }
        behaviors.put(new BehaviorKey(deviceId, behavior.name()), behavior);
    }

    @Override
    public Optional<BehaviorConfig> findBehavior(DeviceId deviceId, String behaviorName) {
        return Optional.ofNullable(behaviors.get(new BehaviorKey(deviceId, behaviorName)));
    }

    private record DeviceKey(String name, String state, String boundary) {
    }

    private record BehaviorKey(DeviceId deviceId, String name) {
    }
}
