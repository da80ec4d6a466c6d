package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.LogId;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 세션 구조화 로그.
 *
 * <p>부모 로그는 같은 세션에 있어야 하며, 형제 간 {@code siblingOrder}는 유일합니다.</p>
 *
 * @param id 로그 ID
 * @param sessionId 소유 세션
 * @param parentLogId 부모 로그 (null이면 루트)
 * @param execId 관련 Exec (null 가능)
 * @param category 분류 (null 가능)
 * @param content 내용
 * @param siblingOrder 형제 순서 ({@link ExecNode#UNASSIGNED_ORDER}이면 저장소가 부여)
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record SessionLogEntry(
    LogId id,
    OrchestrationSessionId sessionId,
    LogId parentLogId,
    ExecId execId,
    String category,
    String content,
    int siblingOrder,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public SessionLogEntry {
        if (id == null || sessionId == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId and housekeeping cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public SessionLogEntry withSiblingOrder(int order) {
        return new SessionLogEntry(id, sessionId, parentLogId, execId, category, content, order,
            elaboration, housekeeping);
    }
}
