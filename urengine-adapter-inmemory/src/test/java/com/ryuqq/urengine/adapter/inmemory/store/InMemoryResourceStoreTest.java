package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.IngestSession;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryResourceStore 고유 동작 테스트.
 *
 * <p>저장소 접근 불가 시뮬레이션과 Device 단위 집계를 검증합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class InMemoryResourceStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryStores stores;
    private DeviceId deviceId;
    private IngestSessionId sessionId;

    @BeforeEach
    void setUp() {
        stores = InMemoryStores.create(Clock.fixed(NOW, ZoneOffset.UTC));
        deviceId = stores.devices()
            .register(DeviceRegistration.of("D1", "{\"os\":\"linux\"}", "local"), "tester")
            .id();
        sessionId = IngestSessionId.generate();
        stores.ingestSessions().insertSession(new IngestSession(sessionId, deviceId, new BehaviorConfig(),
            null, NOW, null, null, Housekeeping.created(NOW, null)));
    }

    private ResourceCandidate candidate(String uri, String text) {
        return ResourceCandidate.of(deviceId, uri, text.getBytes(StandardCharsets.UTF_8), "txt");
    }

    @Test
    void admit_저장소가_접근_불가면_StoreUnavailableException() {
        // given
        stores.resources().setAvailable(false);

        // when & then
        assertThatThrownBy(() -> stores.resources().admit(candidate("/a.txt", "a"), sessionId))
            .isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> stores.resources().countForDevice(deviceId))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void admit_접근이_복구되면_다시_admission됨() {
        // given
        stores.resources().setAvailable(false);
        stores.resources().setAvailable(true);

        // when
        Admission<ResourceId> admission = stores.resources().admit(candidate("/a.txt", "a"), sessionId);

        // then
        assertThat(admission.isNewRecord()).isTrue();
        assertThat(stores.resources().countForDevice(deviceId)).isEqualTo(1);
    }

    @Test
    void countForDevice_삭제된_리소스는_집계하지_않음() {
        // given
        ResourceId kept = stores.resources().admit(candidate("/a.txt", "a"), sessionId).id();
        ResourceId removed = stores.resources().admit(candidate("/b.txt", "b"), sessionId).id();

        // when
        boolean first = stores.resources().softDelete(removed, "tester");
        boolean second = stores.resources().softDelete(removed, "tester");

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(stores.resources().countForDevice(deviceId)).isEqualTo(1);
        assertThat(stores.resources().find(kept)).isPresent();
        assertThat(stores.resources().find(removed)).isEmpty();
        assertThat(stores.resources().findIncludingDeleted(removed)).isPresent();
    }

    @Test
    void findByDigest_같은_내용의_리소스를_찾음() {
        // given
        ResourceCandidate a = candidate("/a.txt", "same");
        ResourceId id = stores.resources().admit(a, sessionId).id();

        // when & then
        assertThat(stores.resources().findByDigest(deviceId, a.resolveDigest()))
            .map(resource -> resource.id())
            .contains(id);
    }
}
