package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.SoftDeletable;
import com.ryuqq.urengine.core.statemachine.IngestSessionState;

import java.time.Instant;

/**
 * 한 Device에 대한 한 번의 수집 실행.
 *
 * <p>{@code ingestFinishedAt}이 채워지면 종료 상태이며, 이후에는 soft-delete 외에 변경되지 않습니다.</p>
 *
 * @param id 세션 ID
 * @param deviceId 대상 Device
 * @param behavior behavior 설정
 * @param agent 수집 에이전트 정보 (JSON, null 가능)
 * @param ingestStartedAt 시작 시각
 * @param ingestFinishedAt 종료 시각 (null이면 진행 중)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestSession(
    IngestSessionId id,
    DeviceId deviceId,
    BehaviorConfig behavior,
    String agent,
    Instant ingestStartedAt,
    Instant ingestFinishedAt,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public IngestSession {
        if (id == null || deviceId == null || behavior == null) {
            throw new IllegalArgumentException("id, deviceId and behavior cannot be null");
        }
        if (ingestStartedAt == null) {
            throw new IllegalArgumentException("ingestStartedAt cannot be null");
        }
        if (housekeeping == null) {
            throw new IllegalArgumentException("housekeeping cannot be null");
        }
    }

    /**
     * 현재 상태.
     *
     * @return 종료 시각이 있으면 CLOSED
     */
    public IngestSessionState state() {
        return ingestFinishedAt == null ? IngestSessionState.OPEN : IngestSessionState.CLOSED;
    }

    /**
     * 종료 표시된 사본 생성.
     *
     * @param finishedAt 종료 시각
     * @param summaryJson 종료 시점 요약 (elaboration으로 기록, null 가능)
     * @return 종료된 세션
     */
    public IngestSession finished(Instant finishedAt, String summaryJson) {
        return new IngestSession(id, deviceId, behavior, agent, ingestStartedAt, finishedAt,
            summaryJson == null ? elaboration : summaryJson, housekeeping.touched(finishedAt, null));
    }

    public IngestSession withHousekeeping(Housekeeping next) {
        return new IngestSession(id, deviceId, behavior, agent, ingestStartedAt, ingestFinishedAt, elaboration, next);
    }
}
