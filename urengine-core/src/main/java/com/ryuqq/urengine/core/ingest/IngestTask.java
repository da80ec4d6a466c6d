package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.IngestTaskId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 경로가 아닌 수집 단위의 기록.
 *
 * <p>메일 메시지, 이슈, 텔레메트리 레코드, 캡처된 실행 결과 등을 Path Entry와 같은
 * status/diagnostics 필드로 기록합니다.</p>
 *
 * @param id 태스크 ID
 * @param sessionId 소유 세션
 * @param unitId 단위 식별자 (메시지 ID 등)
 * @param capturedExecutable 캡처 정보 (JSON, 필수)
 * @param status 처리 결과
 * @param diagnostics 진단 정보 (JSON, null 가능)
 * @param transformations 변환 기록 (JSON, null 가능)
 * @param resourceId 해석된 리소스 (null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestTask(
    IngestTaskId id,
    IngestSessionId sessionId,
    String unitId,
    String capturedExecutable,
    PathEntryStatus status,
    String diagnostics,
    String transformations,
    ResourceId resourceId,
    Housekeeping housekeeping
) implements SoftDeletable {

    public IngestTask {
        if (id == null || sessionId == null || status == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId, status and housekeeping cannot be null");
        }
        if (unitId == null || unitId.isBlank()) {
            throw new IllegalArgumentException("unitId cannot be null or blank");
        }
        if (capturedExecutable == null) {
            throw new IllegalArgumentException("capturedExecutable cannot be null");
        }
    }
}
