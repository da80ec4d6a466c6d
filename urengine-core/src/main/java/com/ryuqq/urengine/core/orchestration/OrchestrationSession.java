package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SoftDeletable;

import java.time.Instant;

/**
 * 하나의 파이프라인 실행.
 *
 * @param id 세션 ID
 * @param deviceId 대상 Device
 * @param natureId 파이프라인 종류
 * @param version 파이프라인 버전
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각 (null이면 진행 중)
 * @param argsJson 실행 인자 (JSON, null 가능)
 * @param diagnosticsJson 종료 진단 (JSON, null 가능)
 * @param diagnosticsMd 종료 진단 (Markdown, null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record OrchestrationSession(
    OrchestrationSessionId id,
    DeviceId deviceId,
    String natureId,
    String version,
    Instant startedAt,
    Instant finishedAt,
    String argsJson,
    String diagnosticsJson,
    String diagnosticsMd,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public OrchestrationSession {
        if (id == null || deviceId == null || startedAt == null || housekeeping == null) {
            throw new IllegalArgumentException("id, deviceId, startedAt and housekeeping cannot be null");
        }
        if (natureId == null || natureId.isBlank()) {
            throw new IllegalArgumentException("natureId cannot be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    /**
     * 종료 표시된 사본 생성.
     *
     * @param at 종료 시각
     * @param json 진단 JSON
     * @param md 진단 Markdown
     * @return 종료된 세션
     */
    public OrchestrationSession finished(Instant at, String json, String md) {
        return new OrchestrationSession(id, deviceId, natureId, version, startedAt, at, argsJson, json, md,
            elaboration, housekeeping.touched(at, null));
    }
}
