package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.device.Device;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.model.DeviceId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryDeviceRegistry 단위 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryDeviceRegistryTest {

    private InMemoryDeviceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryDeviceRegistry(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void register_같은_name_state_boundary면_같은_Device() {
        // when
        Device first = registry.register(DeviceRegistration.of("D1", "{\"os\":\"linux\"}", "local"), "a");
        Device second = registry.register(DeviceRegistration.of("D1", "{\"os\":\"linux\"}", "local"), "b");
        Device other = registry.register(DeviceRegistration.of("D1", "{\"os\":\"mac\"}", "local"), "a");

        // then
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.housekeeping().createdBy()).isEqualTo("a");
        assertThat(other.id()).isNotEqualTo(first.id());
        assertThat(registry.listLive()).hasSize(2);
    }

    @Test
    void register_state가_JSON이_아니면_ValidationException() {
        assertThatThrownBy(() -> registry.register(DeviceRegistration.of("D1", "linux", "local"), "a"))
            .isInstanceOf(ValidationException.class);
        assertThat(registry.listAll()).isEmpty();
    }

    @Test
    void saveBehavior_Device를_모르면_ReferentialException() {
        assertThatThrownBy(() -> registry.saveBehavior(DeviceId.generate(), new BehaviorConfig()))
            .isInstanceOf(ReferentialException.class);
    }

    @Test
    void saveBehavior_같은_이름이면_마지막_설정으로_덮어씀() {
        // given
        DeviceId id = registry.register(DeviceRegistration.of("D1", "{}", "local"), "a").id();
        BehaviorConfig first = new BehaviorConfig().withName("nightly");
        BehaviorConfig second = first.withRuleNamespace("docs");

        // when
        registry.saveBehavior(id, first);
        registry.saveBehavior(id, second);

        // then
        assertThat(registry.findBehavior(id, "nightly")).contains(second);
        assertThat(registry.findBehavior(id, "missing")).isEmpty();
    }
}
