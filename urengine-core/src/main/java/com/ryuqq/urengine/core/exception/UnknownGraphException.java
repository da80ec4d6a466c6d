package com.ryuqq.urengine.core.exception;

/**
 * 등록되지 않은 Lineage Graph에 edge를 연결하려고 한 경우.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class UnknownGraphException extends ResourceEngineException {

    private final String graphName;

    /**
     * 생성자.
     *
     * @param graphName 등록되지 않은 그래프 이름
     */
    public UnknownGraphException(String graphName) {
        super("Lineage graph not registered: " + graphName);
        this.graphName = graphName;
    }

    /**
     * 그래프 이름.
     *
     * @return 그래프 이름
     */
    public String getGraphName() {
        return graphName;
    }
}
