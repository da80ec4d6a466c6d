package com.ryuqq.urengine.core.graph;

import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.SoftDeletable;

/**
 * 외부 노드와 리소스 사이의 typed 관계.
 *
 * <p>{@code (graphName, nature, nodeId, resourceId)}로 유일합니다.</p>
 *
 * @param graphName 그래프 이름
 * @param nature 관계 종류
 * @param nodeId 외부 노드 식별자
 * @param resourceId 연결된 리소스
 * @param elaboration 부가 정보 (JSON, null 가능)
 * @param housekeeping housekeeping envelope
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record LineageEdge(
    String graphName,
    String nature,
    String nodeId,
    ResourceId resourceId,
    String elaboration,
    Housekeeping housekeeping
) implements SoftDeletable {

    public LineageEdge {
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("graphName cannot be null or blank");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be null or blank");
        }
        if (resourceId == null || housekeeping == null) {
            throw new IllegalArgumentException("resourceId and housekeeping cannot be null");
        }
    }

    public Key key() {
        return new Key(graphName, nature, nodeId, resourceId);
    }

    /**
     * Edge 유일 키.
     *
     * @param graphName 그래프 이름
     * @param nature 관계 종류
     * @param nodeId 외부 노드
     * @param resourceId 리소스
     */
    public record Key(String graphName, String nature, String nodeId, ResourceId resourceId) {
    }
}
