package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.graph.LineageEdge;
import com.ryuqq.urengine.core.graph.LineageGraphDefinition;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Lineage graph storage SPI.
 *
 * <p>Edge uniqueness on {@code (graphName, nature, nodeId, resourceId)} is enforced by the
 * store itself through an atomic insert-if-absent, never by a caller pre-check.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface LineageStore {

    /**
     * Registers a graph if absent.
     *
     * @param graph the graph definition
     * @return true if the graph was newly registered
     */
    boolean registerGraph(LineageGraphDefinition graph);

    Optional<LineageGraphDefinition> findGraph(String name);

    /**
     * Inserts an edge unless the same key is present.
     *
     * @param edge the edge
     * @return true if the edge was newly written
     * @throws com.ryuqq.urengine.core.exception.ValidationException if the elaboration is malformed
     */
    boolean insertEdgeIfAbsent(LineageEdge edge);

    /**
     * Streams live edges of a graph as they are at the time of the terminal operation.
     *
     * @param graphName the graph
     * @return a fresh stream on every call
     */
    Stream<LineageEdge> edges(String graphName);
}
