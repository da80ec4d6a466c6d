package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 세션 안의 이름 있는 단계 (stage).
 *
 * @param id 엔트리 ID
 * @param sessionId 소유 세션
 * @param ingestSrc 입력 소스 (파일 경로, 테이블 등)
 * @param ingestTableName 적재 대상 테이블명 (null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record SessionEntry(
    SessionEntryId id,
    OrchestrationSessionId sessionId,
    String ingestSrc,
    String ingestTableName,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public SessionEntry {
        if (id == null || sessionId == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId and housekeeping cannot be null");
        }
        if (ingestSrc == null || ingestSrc.isBlank()) {
            throw new IllegalArgumentException("ingestSrc cannot be null or blank");
        }
    }
}
