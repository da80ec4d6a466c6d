package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.ExecId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.OrchestrationSessionId;
import com.ryuqq.urengine.core.model.SessionEntryId;
import com.ryuqq.urengine.core.model.SoftDeletable;

import java.time.Instant;

/**
 * 실행 트리의 한 노드 (Session Exec).
 *
 * <p>부모는 같은 세션의 Exec이어야 합니다. 형제 간 {@code siblingOrder}는 저장소가
 * 부모별로 단조 증가하도록 원자적으로 부여합니다.</p>
 *
 * <p>{@code status}는 실행 중에는 null이며, 종료 시 정수 값이 기록됩니다.</p>
 *
 * @param id Exec ID
 * @param sessionId 소유 세션
 * @param entryId 관련 엔트리 (null 가능)
 * @param parentId 부모 Exec (null이면 루트)
 * @param nature 실행 종류
 * @param namespace namespace (null 가능)
 * @param identity 실행 식별 문자열 (null 가능)
 * @param code 실행 코드 (SQL, 명령 등)
 * @param status 종료 status (실행 중이면 null)
 * @param input 입력 텍스트 (null 가능)
 * @param output 출력 텍스트 (null 가능)
 * @param error 오류 텍스트 (null 가능)
 * @param outputNature 출력 종류 (null 가능)
 * @param narrativeMd 서술 (Markdown, null 가능)
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각 (실행 중이면 null)
 * @param siblingOrder 형제 순서
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record ExecNode(
    ExecId id,
    OrchestrationSessionId sessionId,
    SessionEntryId entryId,
    ExecId parentId,
    String nature,
    String namespace,
    String identity,
    String code,
    Integer status,
    String input,
    String output,
    String error,
    String outputNature,
    String narrativeMd,
    Instant startedAt,
    Instant finishedAt,
    int siblingOrder,
    Housekeeping housekeeping
) implements SoftDeletable {

    /**
     * 저장소가 순서를 아직 부여하지 않았음을 나타내는 값.
     */
    public static final int UNASSIGNED_ORDER = -1;

    public ExecNode {
        if (id == null || sessionId == null || startedAt == null || housekeeping == null) {
            throw new IllegalArgumentException("id, sessionId, startedAt and housekeeping cannot be null");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
    }

    /**
     * 시작 시점 노드 생성.
     *
     * @param id Exec ID
     * @param sessionId 세션
     * @param entryId 엔트리 (null 가능)
     * @param parentId 부모 (null 가능)
     * @param nature 실행 종류
     * @param code 실행 코드
     * @param input 입력 (null 가능)
     * @param housekeeping 생성 envelope
     * @return 실행 중 노드 (순서 미부여)
     */
    public static ExecNode started(ExecId id, OrchestrationSessionId sessionId, SessionEntryId entryId,
                                   ExecId parentId, String nature, String code, String input,
                                   Housekeeping housekeeping) {
        return new ExecNode(id, sessionId, entryId, parentId, nature, null, null, code, null, input,
            null, null, null, null, housekeeping.createdAt(), null, UNASSIGNED_ORDER, housekeeping);
    }

    public boolean isRunning() {
        return finishedAt == null;
    }

    public boolean isFailed() {
        return status != null && status != ExecStatus.SUCCESS;
    }

    /**
     * 종료된 사본 생성.
     *
     * @param finalStatus 종료 status
     * @param finalOutput 출력
     * @param finalError 오류
     * @param at 종료 시각
     * @return 종료된 노드
     */
    public ExecNode finished(int finalStatus, String finalOutput, String finalError, Instant at) {
        return new ExecNode(id, sessionId, entryId, parentId, nature, namespace, identity, code, finalStatus,
            input, finalOutput, finalError, outputNature, narrativeMd, startedAt, at, siblingOrder,
            housekeeping.touched(at, null));
    }

    public ExecNode withOutputNature(String value) {
        return new ExecNode(id, sessionId, entryId, parentId, nature, namespace, identity, code, status,
            input, output, error, value, narrativeMd, startedAt, finishedAt, siblingOrder, housekeeping);
    }

    public ExecNode withNarrative(String markdown) {
        return new ExecNode(id, sessionId, entryId, parentId, nature, namespace, identity, code, status,
            input, output, error, outputNature, markdown, startedAt, finishedAt, siblingOrder, housekeeping);
    }

    public ExecNode withSiblingOrder(int order) {
        return new ExecNode(id, sessionId, entryId, parentId, nature, namespace, identity, code, status,
            input, output, error, outputNature, narrativeMd, startedAt, finishedAt, order, housekeeping);
    }
}
