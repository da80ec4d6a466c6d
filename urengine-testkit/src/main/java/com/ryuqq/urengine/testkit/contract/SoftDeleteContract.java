package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.core.device.Device;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.UniformResource;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract for soft-delete visibility across the stores.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public abstract class SoftDeleteContract extends AbstractEngineContractTest {

    // ============================================================
    // 1. Device
    // ============================================================

    @Test
    void softDelete_Device는_live_조회에서_빠지고_전체_조회에는_남음() {
        // given
        DeviceId d1 = registerDevice("D1");
        DeviceId d2 = registerDevice("D2");
        clock.advance(Duration.ofMinutes(5));

        // when
        boolean deleted = fixture.devices().softDelete(d1, "admin");

        // then
        assertThat(deleted).isTrue();
        assertThat(fixture.devices().findLive(d1)).isEmpty();
        assertThat(fixture.devices().listLive()).extracting(Device::id).containsExactly(d2);
        assertThat(fixture.devices().listAll()).extracting(Device::id).containsExactly(d1, d2);

        Housekeeping hk = fixture.devices().findIncludingDeleted(d1).orElseThrow().housekeeping();
        assertThat(hk.deletedAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(hk.deletedBy()).isEqualTo("admin");
        assertThat(hk.createdAt()).isEqualTo(START);
    }

    @Test
    void softDelete_두번째_삭제는_false이고_최초_삭제_정보_유지() {
        // given
        DeviceId d1 = registerDevice("D1");
        fixture.devices().softDelete(d1, "first");
        clock.advance(Duration.ofMinutes(1));

        // when
        boolean again = fixture.devices().softDelete(d1, "second");

        // then
        assertThat(again).isFalse();
        Housekeeping hk = fixture.devices().findIncludingDeleted(d1).orElseThrow().housekeeping();
        assertThat(hk.deletedBy()).isEqualTo("first");
        assertThat(hk.deletedAt()).isEqualTo(START);
    }

    @Test
    void softDelete_actor가_없으면_UNKNOWN으로_기록() {
        DeviceId d1 = registerDevice("D1");

        fixture.devices().softDelete(d1, null);

        assertThat(fixture.devices().findIncludingDeleted(d1).orElseThrow().housekeeping().deletedBy())
            .isEqualTo(Housekeeping.UNKNOWN_ACTOR);
    }

    @Test
    void register_삭제된_Device와_같은_키면_삭제된_Device를_그대로_반환() {
        // given
        DeviceRegistration registration = DeviceRegistration.of("D1", "{\"os\":\"linux\"}", "local");
        Device original = fixture.devices().register(registration, "tester");
        fixture.devices().softDelete(original.id(), "admin");

        // when
        Device again = fixture.devices().register(registration, "tester");

        // then
        assertThat(again.id()).isEqualTo(original.id());
        assertThat(again.isLive()).isFalse();
        assertThat(fixture.devices().listAll()).hasSize(1);
    }

    @Test
    void open_삭제된_Device면_DeviceUnknownException() {
        DeviceId d1 = registerDevice("D1");
        fixture.devices().softDelete(d1, "admin");

        assertThatThrownBy(() -> openSession(d1)).isInstanceOf(DeviceUnknownException.class);
    }

    // ============================================================
    // 2. Resource
    // ============================================================

    @Test
    void softDelete_리소스는_find와_count에서_빠지고_이력_조회에는_남음() {
        // given
        DeviceId d1 = registerDevice("D1");
        IngestSessionId session = openSession(d1);
        ResourceId r1 = fixture.resources().admit(textCandidate(d1, "/a.txt", "a"), session).id();

        // when
        fixture.resources().softDelete(r1, "cleaner");

        // then
        assertThat(fixture.resources().find(r1)).isEmpty();
        assertThat(fixture.resources().findIncludingDeleted(r1)).isPresent();
        assertThat(fixture.resources().countForDevice(d1)).isZero();
    }

    @Test
    void admit_삭제된_리소스와_같은_키면_같은_ID로_복원됨() {
        // given
        DeviceId d1 = registerDevice("D1");
        IngestSessionId session = openSession(d1);
        ResourceId r1 = fixture.resources().admit(textCandidate(d1, "/a.txt", "a"), session).id();
        fixture.resources().softDelete(r1, "cleaner");

        // when
        Admission<ResourceId> again = fixture.resources().admit(textCandidate(d1, "/a.txt", "a"), session);

        // then
        assertThat(again.isNewRecord()).isFalse();
        assertThat(again.id()).isEqualTo(r1);
        UniformResource restored = fixture.resources().find(r1).orElseThrow();
        assertThat(restored.housekeeping().activityLog()).contains("restored");
    }

    @Test
    void admit_삭제된_Device의_리소스는_ReferentialException() {
        // given
        DeviceId d1 = registerDevice("D1");
        IngestSessionId session = openSession(d1);
        fixture.devices().softDelete(d1, "admin");

        // when / then
        assertThatThrownBy(() -> fixture.resources().admit(textCandidate(d1, "/a.txt", "a"), session))
            .isInstanceOf(ReferentialException.class);
    }

    // ============================================================
    // 3. Session
    // ============================================================

    @Test
    void softDeleteSession_세션은_삭제_표시만_되고_엔트리는_유지됨() {
        // given
        DeviceId d1 = registerDevice("D1");
        adapter.put("/d/a.txt", "a");
        IngestSessionId session = openSession(d1);
        IngestPathId pathId = manager.registerPath(session, "/d", null, null);
        manager.recordEntry(pathId, "/d/a.txt", "a.txt");

        // when
        boolean deleted = fixture.ingestSessions().softDeleteSession(session, "admin");

        // then
        assertThat(deleted).isTrue();
        assertThat(fixture.ingestSessions().findSession(session).orElseThrow().isLive()).isFalse();
        assertThat(fixture.ingestSessions().entriesOf(session)).hasSize(1);
    }
}
