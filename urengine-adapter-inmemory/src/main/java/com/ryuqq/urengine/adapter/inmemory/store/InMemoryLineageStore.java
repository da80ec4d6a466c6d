package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.exception.UnknownGraphException;
import com.ryuqq.urengine.core.graph.LineageEdge;
import com.ryuqq.urengine.core.graph.LineageGraphDefinition;
import com.ryuqq.urengine.core.spi.LineageStore;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Stream;

/**
 * In-memory {@link LineageStore}.
 *
 * <p>Edges are unique on {@code (graphName, nature, nodeId, resourceId)}.
 * {@link #edges(String)} returns a fresh stream on every call.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class InMemoryLineageStore implements LineageStore {

    private final ConcurrentHashMap<String, LineageGraphDefinition> graphs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<LineageEdge.Key, LineageEdge> edges = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<LineageEdge.Key> edgeOrder = new ConcurrentLinkedQueue<>();

    @Override
    public boolean registerGraph(LineageGraphDefinition graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        StructuredPayloadValidator.requireValid("elaboration", graph.elaboration());
        return graphs.putIfAbsent(graph.name(), graph) == null;
    }

    @Override
    public Optional<LineageGraphDefinition> findGraph(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return Optional.ofNullable(graphs.get(name));
    }

    @Override
    public boolean insertEdgeIfAbsent(LineageEdge edge) {
        if (edge == null) {
            throw new IllegalArgumentException("edge cannot be null");
        }
        if (!graphs.containsKey(edge.graphName())) {
            throw new UnknownGraphException(edge.graphName());
        }
        StructuredPayloadValidator.requireValid("elaboration", edge.elaboration());
        if (edges.putIfAbsent(edge.key(), edge) != null) {
            return false;
        }
        edgeOrder.add(edge.key());
        return true;
    }

    @Override
    public Stream<LineageEdge> edges(String graphName) {
        return edgeOrder.stream()
            .filter(key -> key.graphName().equals(graphName))
            .map(edges::get)
            .filter(LineageEdge::isLive);
    }
}
