package com.ryuqq.urengine.application.lineage;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.UnknownGraphException;
import com.ryuqq.urengine.core.graph.LineageEdge;
import com.ryuqq.urengine.core.graph.LineageGraphDefinition;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.spi.LineageStore;
import com.ryuqq.urengine.core.spi.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * 외부 노드와 리소스 사이의 typed edge를 관리하는 서비스.
 *
 * <p>{@link #link}의 멱등성은 저장소의 유일 키(insert-if-absent)로 보장되며, 사전 조회에 의존하지 않습니다.
 * {@link #neighbors}는 지연 평가되는 재시작 가능한 {@link Iterable}을 돌려줍니다.
 * {@code iterator()}를 부를 때마다 edge 집합을 다시 읽습니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class LineageGraph {

    private static final Logger log = LoggerFactory.getLogger(LineageGraph.class);

    private final LineageStore store;
    private final ResourceStore resources;
    private final Clock clock;

    public LineageGraph(LineageStore store, ResourceStore resources, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.resources = resources;
        this.clock = clock;
    }

    /**
     * 그래프 등록 (멱등).
     *
     * @param name 그래프 이름
     * @param elaboration 부가 정보 (JSON, null 가능)
     * @return 새로 등록되었으면 true
     */
    public boolean registerGraph(String name, String elaboration) {
        boolean created = store.registerGraph(
            new LineageGraphDefinition(name, elaboration, Housekeeping.created(clock.instant(), null)));
        if (created) {
            log.info("Lineage graph registered: {}", name);
        }
        return created;
    }

    /**
     * edge 연결 (멱등).
     *
     * @see #link(String, String, String, ResourceId, String)
     */
    public boolean link(String graphName, String nature, String nodeId, ResourceId resourceId) {
        return link(graphName, nature, nodeId, resourceId, null);
    }

    /**
     * edge 연결 (멱등).
     *
     * @param graphName 그래프
     * @param nature 관계 종류
     * @param nodeId 외부 노드
     * @param resourceId 리소스
     * @param elaboration 부가 정보 (JSON, null 가능)
     * @return 새 edge가 기록되었으면 true
     * @throws UnknownGraphException 그래프가 등록되지 않은 경우
     * @throws ReferentialException 리소스가 없거나 삭제된 경우
     */
    public boolean link(String graphName, String nature, String nodeId, ResourceId resourceId, String elaboration) {
        requireGraph(graphName);
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (resources.find(resourceId).isEmpty()) {
            throw new ReferentialException("UniformResource", resourceId.getValue());
        }
        boolean created = store.insertEdgeIfAbsent(new LineageEdge(graphName, nature, nodeId, resourceId,
            elaboration, Housekeeping.created(clock.instant(), null)));
        if (created) {
            log.debug("Lineage edge linked: {} [{}] {} -> {}", graphName, nature, nodeId, resourceId);
        }
        return created;
    }

    /**
     * 노드에 연결된 리소스.
     *
     * @param graphName 그래프
     * @param nodeId 외부 노드
     * @param nature 관계 종류 (null이면 전부)
     * @return 반복할 때마다 현재 edge를 다시 읽는 유한 시퀀스 (중복 없음, 삭제된 리소스 제외)
     * @throws UnknownGraphException 그래프가 등록되지 않은 경우
     */
    public Iterable<ResourceId> neighbors(String graphName, String nodeId, String nature) {
        requireGraph(graphName);
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        return () -> store.edges(graphName)
            .filter(edge -> edge.nodeId().equals(nodeId))
            .filter(edge -> nature == null || edge.nature().equals(nature))
            .map(LineageEdge::resourceId)
            .distinct()
            .filter(id -> resources.find(id).isPresent())
            .iterator();
    }

    /**
     * 리소스에 연결된 노드 (역방향 조회).
     *
     * @param graphName 그래프
     * @param resourceId 리소스
     * @return 노드 ID 목록 (중복 없음, 기록 순)
     * @throws UnknownGraphException 그래프가 등록되지 않은 경우
     */
    public List<String> nodesOf(String graphName, ResourceId resourceId) {
        requireGraph(graphName);
        return store.edges(graphName)
            .filter(edge -> edge.resourceId().equals(resourceId))
            .filter(edge -> resources.find(edge.resourceId()).isPresent())
            .map(LineageEdge::nodeId)
            .distinct()
            .toList();
    }

    private void requireGraph(String graphName) {
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("graphName cannot be null or blank");
        }
        if (store.findGraph(graphName).isEmpty()) {
            throw new UnknownGraphException(graphName);
        }
    }
}
