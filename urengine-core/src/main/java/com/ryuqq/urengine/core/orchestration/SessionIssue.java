package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IssueId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 세션 중 발견된 진단 (append-only).
 *
 * <p>Issue 기록은 어떤 Exec의 status도 바꾸지 않습니다.</p>
 *
 * @param id Issue ID
 * @param sessionId 소유 세션
 * @param entryId 관련 엔트리 (null 가능)
 * @param type 종류 (예: "adapter-failure", "missing-column")
 * @param message 메시지
 * @param location 입력 위치 (null 가능)
 * @param remediation 조치 안내 (null 가능)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record SessionIssue(
    IssueId id,
    OrchestrationSessionId sessionId,
    SessionEntryId entryId,
    String type,
    String message,
    IssueLocation location,
    String remediation,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public SessionIssue {
        if (id == null || sessionId == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId and housekeeping cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
