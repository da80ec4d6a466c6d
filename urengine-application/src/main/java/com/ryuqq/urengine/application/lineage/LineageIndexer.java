package com.ryuqq.urengine.application.lineage;

import com.ryuqq.urengine.core.resource.UniformResource;
import com.ryuqq.urengine.core.spi.AdmissionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * 새로 수집된 리소스를 지정된 그래프에 자동 연결하는 admission listener.
 *
 * <p>노드 ID는 리소스로부터 계산됩니다 (기본: Device ID). 생성 시 그래프를 등록합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class LineageIndexer implements AdmissionListener {

    private static final Logger log = LoggerFactory.getLogger(LineageIndexer.class);

    private final LineageGraph graph;
    private final String graphName;
    private final String nature;
    private final Function<UniformResource, String> nodeIdOf;

    /**
     * Device ID를 노드로 쓰는 indexer.
     *
     * @param graph 그래프 서비스
     * @param graphName 그래프 이름
     * @param nature 관계 종류
     */
    public LineageIndexer(LineageGraph graph, String graphName, String nature) {
        this(graph, graphName, nature, resource -> resource.deviceId().getValue());
    }

    /**
     * 생성자.
     *
     * @param graph 그래프 서비스
     * @param graphName 그래프 이름
     * @param nature 관계 종류
     * @param nodeIdOf 리소스 → 노드 ID
     */
    public LineageIndexer(LineageGraph graph, String graphName, String nature,
                          Function<UniformResource, String> nodeIdOf) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (nature == null || nature.isBlank()) {
            throw new IllegalArgumentException("nature cannot be null or blank");
        }
        if (nodeIdOf == null) {
            throw new IllegalArgumentException("nodeIdOf cannot be null");
        }
        this.graph = graph;
        this.graphName = graphName;
        this.nature = nature;
        this.nodeIdOf = nodeIdOf;
        graph.registerGraph(graphName, null);
    }

    @Override
    public void onAdmitted(UniformResource resource) {
        String nodeId = nodeIdOf.apply(resource);
        graph.link(graphName, nature, nodeId, resource.id());
        log.debug("Indexed {} under {} in {}", resource.id(), nodeId, graphName);
    }
}
