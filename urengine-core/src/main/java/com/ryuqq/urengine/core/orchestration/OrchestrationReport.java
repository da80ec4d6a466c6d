package com.ryuqq.urengine.core.orchestration;

import com.ryuqq.urengine.core.model.ExecId;

import java.util.List;
import java.util.Optional;

/**
 * 세션 결과 보고: Exec별 status와 누적 Issue 목록.
 *
 * @param session 세션
 * @param execTree 실행 트리
 * @param issues Issue 목록 (기록 순)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record OrchestrationReport(
    OrchestrationSession session,
    ArenaTree<ExecId, ExecNode> execTree,
    List<SessionIssue> issues
) {

    public OrchestrationReport {
        if (session == null || execTree == null) {
            throw new IllegalArgumentException("session and execTree cannot be null");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Exec status 조회.
     *
     * @param execId Exec ID
     * @return status (실행 중이거나 없으면 empty)
     */
    public Optional<Integer> statusOf(ExecId execId) {
        return execTree.find(execId).map(ExecNode::status);
    }

    /**
     * 실패한 Exec 목록 (깊이 우선 순서).
     *
     * @return 실패 노드
     */
    public List<ExecNode> failedExecs() {
        return execTree.depthFirst().stream()
            .map(ArenaTree.Visit::node)
            .filter(ExecNode::isFailed)
            .toList();
    }

    /**
     * 모든 루트 Exec이 성공으로 끝났는지 여부.
     *
     * @return 실행 중이거나 실패한 루트가 없으면 true
     */
    public boolean isSuccessful() {
        return execTree.roots().stream()
            .allMatch(node -> node.status() != null && node.status() == ExecStatus.SUCCESS);
    }
}
