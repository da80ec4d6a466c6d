package com.ryuqq.urengine.application.ingest;

import com.ryuqq.urengine.core.device.Device;
import com.ryuqq.urengine.core.device.DeviceRegistration;
import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.exception.DeviceUnknownException;
import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.ingest.BehaviorConfig;
import com.ryuqq.urengine.core.ingest.IngestPath;
import com.ryuqq.urengine.core.ingest.PathEntry;
import com.ryuqq.urengine.core.ingest.PathEntryStatus;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestPathId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.PathEntryId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.rule.PathMatchRule;
import com.ryuqq.urengine.core.rule.PathRuleCatalog;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.IngestionObserver;
import com.ryuqq.urengine.core.spi.ResourceStore;
import com.ryuqq.urengine.core.spi.SourceAdapter;
import com.ryuqq.urengine.core.statemachine.PathEntryState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * IngestionSessionManager 유닛 테스트.
 *
 * <p>저장소와 어댑터를 mock으로 두고 엔트리 처리 흐름을 검증합니다:</p>
 * <ul>
 *   <li>Device 확인 후에만 세션 기록</li>
 *   <li>규칙 nature가 admission 후보로 전달됨</li>
 *   <li>어댑터 실패는 observer Issue + ERRORED 엔트리</li>
 *   <li>이미 기록된 엔트리는 어댑터를 다시 호출하지 않음</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class IngestionSessionManagerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private DeviceRegistry devices;

    @Mock
    private IngestSessionStore sessions;

    @Mock
    private ResourceStore resources;

    @Mock
    private SourceAdapter adapter;

    @Mock
    private IngestionObserver observer;

    private PathRuleCatalog rules;
    private IngestionSessionManager manager;
    private DeviceId deviceId;

    @BeforeEach
    void setUp() {
        when(adapter.kind()).thenReturn(SourceKind.FILESYSTEM);
        rules = new PathRuleCatalog();
        manager = new IngestionSessionManager(devices, sessions, resources, rules,
            new SourceAdapterRegistry().register(adapter), Clock.fixed(NOW, ZoneOffset.UTC));
        deviceId = DeviceId.of("d1");
    }

    private void deviceExists() {
        Device device = Device.from(deviceId, DeviceRegistration.of("D1", "{}", "local"),
            Housekeeping.created(NOW, null));
        when(devices.findLive(deviceId)).thenReturn(Optional.of(device));
    }

    private IngestPathId pathOf(IngestSessionId sessionId) {
        IngestPathId pathId = IngestPathId.generate();
        when(sessions.findPath(pathId)).thenReturn(Optional.of(
            new IngestPath(pathId, sessionId, "/root", null, null, null, Housekeeping.created(NOW, null))));
        return pathId;
    }

    // ============================================================
    // 1. open
    // ============================================================

    @Test
    void open_Device가_없으면_세션을_기록하지_않음() {
        // given
        when(devices.findLive(deviceId)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> manager.open(deviceId, null, new BehaviorConfig()))
            .isInstanceOf(DeviceUnknownException.class);
        verify(sessions, never()).insertSession(any());
        verify(devices, never()).saveBehavior(any(), any());
    }

    @Test
    void open_어댑터가_없는_SourceKind면_ReferentialException() {
        // given
        deviceExists();

        // when & then
        assertThatThrownBy(() -> manager.open(deviceId, null, new BehaviorConfig().withSourceKind(SourceKind.MAILBOX)))
            .isInstanceOf(ReferentialException.class);
        verify(sessions, never()).insertSession(any());
    }

    // ============================================================
    // 2. recordEntry
    // ============================================================

    @Test
    void recordEntry_규칙_nature와_경로가_admission_후보로_전달됨() throws Exception {
        // given
        deviceExists();
        rules.register(PathMatchRule.of("docs", "\\.md$", "markdown", 1));
        IngestSessionId sessionId = manager.open(deviceId, null, new BehaviorConfig().withRuleNamespace("docs"));
        IngestPathId pathId = pathOf(sessionId);
        when(sessions.findEntry(any())).thenReturn(Optional.empty());
        when(adapter.produceCandidate(sessionId, "/root/a.md"))
            .thenReturn(SourceCandidate.of("/root/a.md", "# A".getBytes(StandardCharsets.UTF_8), null));
        ResourceId resourceId = ResourceId.generate();
        when(resources.admit(any(), eq(sessionId))).thenReturn(Admission.created(resourceId));
        when(sessions.putEntryIfAbsent(any())).then(returnsFirstArg());

        // when
        PathEntry entry = manager.recordEntry(pathId, "/root/a.md", "a.md");

        // then
        ArgumentCaptor<ResourceCandidate> captor = ArgumentCaptor.forClass(ResourceCandidate.class);
        verify(resources).admit(captor.capture(), eq(sessionId));
        assertThat(captor.getValue().nature()).isEqualTo("markdown");
        assertThat(captor.getValue().ingestPathId()).isEqualTo(pathId);
        assertThat(entry.status()).isEqualTo(PathEntryStatus.ADMITTED);
        assertThat(entry.resourceId()).isEqualTo(resourceId);
        assertThat(manager.summary(sessionId).admitted()).isEqualTo(1);
    }

    @Test
    void recordEntry_기존_리소스면_DUPLICATE로_집계됨() throws Exception {
        // given
        deviceExists();
        IngestSessionId sessionId = manager.open(deviceId, null, new BehaviorConfig());
        IngestPathId pathId = pathOf(sessionId);
        when(sessions.findEntry(any())).thenReturn(Optional.empty());
        when(adapter.produceCandidate(any(), anyString()))
            .thenReturn(SourceCandidate.of("/root/a.md", new byte[]{1}, "bin"));
        when(resources.admit(any(), eq(sessionId))).thenReturn(Admission.existing(ResourceId.generate()));
        when(sessions.putEntryIfAbsent(any())).then(returnsFirstArg());

        // when
        PathEntry entry = manager.recordEntry(pathId, "/root/a.md", "a.md");

        // then
        assertThat(entry.status()).isEqualTo(PathEntryStatus.DUPLICATE);
        assertThat(manager.summary(sessionId).duplicate()).isEqualTo(1);
    }

    @Test
    void recordEntry_어댑터_실패는_observer_Issue와_ERRORED_엔트리() throws Exception {
        // given
        deviceExists();
        IngestSessionId sessionId = manager.open(deviceId, null, new BehaviorConfig(), observer);
        IngestPathId pathId = pathOf(sessionId);
        when(sessions.findEntry(any())).thenReturn(Optional.empty());
        when(adapter.produceCandidate(sessionId, "/root/a.md"))
            .thenThrow(new AdapterException("/root/a.md", "permission denied"));
        when(sessions.putEntryIfAbsent(any())).then(returnsFirstArg());

        // when
        PathEntry entry = manager.recordEntry(pathId, "/root/a.md", "a.md");

        // then
        assertThat(entry.status()).isEqualTo(PathEntryStatus.ERRORED);
        assertThat(entry.diagnostics()).contains("permission denied").contains("adapter-failure");
        verify(observer).onIssue(eq(sessionId), anyString(), eq("permission denied"), eq("/root/a.md"));
        verify(resources, never()).admit(any(), any());
    }

    @Test
    void recordEntry_이미_기록된_엔트리는_어댑터를_호출하지_않음() throws Exception {
        // given
        deviceExists();
        IngestSessionId sessionId = manager.open(deviceId, null, new BehaviorConfig());
        IngestPathId pathId = pathOf(sessionId);
        PathEntry existing = new PathEntry(PathEntryId.generate(), sessionId,
            pathId, "/root/a.md", "a.md", "", "a.md", "md", null,
            PathEntryState.ADMITTED, PathEntryStatus.ADMITTED, null, null,
            ResourceId.generate(), Housekeeping.created(NOW, null));
        when(sessions.findEntry(new PathEntry.Key(sessionId, pathId, "/root/a.md"))).thenReturn(Optional.of(existing));

        // when
        PathEntry entry = manager.recordEntry(pathId, "/root/a.md", "a.md");

        // then
        assertThat(entry).isSameAs(existing);
        verify(adapter, never()).produceCandidate(any(), anyString());
        assertThat(manager.summary(sessionId).total()).isZero();
    }

    @Test
    void recordEntry_경로가_없으면_ReferentialException() {
        // given
        IngestPathId unknown = IngestPathId.generate();
        when(sessions.findPath(unknown)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> manager.recordEntry(unknown, "/root/a.md", "a.md"))
            .isInstanceOf(ReferentialException.class);
    }
}
