package com.ryuqq.urengine.application.lineage;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.UnknownGraphException;
import com.ryuqq.urengine.core.graph.LineageEdge;
import com.ryuqq.urengine.core.graph.LineageGraphDefinition;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.resource.UniformResource;
import com.ryuqq.urengine.core.spi.LineageStore;
import com.ryuqq.urengine.core.spi.ResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LineageGraph 유닛 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LineageGraphTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final String GRAPH = "device-graph";

    @Mock
    private LineageStore store;

    @Mock
    private ResourceStore resources;

    private LineageGraph graph;

    @BeforeEach
    void setUp() {
        graph = new LineageGraph(store, resources, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void graphExists() {
        when(store.findGraph(GRAPH)).thenReturn(Optional.of(
            new LineageGraphDefinition(GRAPH, null, Housekeeping.created(NOW, null))));
    }

    private LineageEdge edge(String nature, String nodeId, ResourceId resourceId) {
        return new LineageEdge(GRAPH, nature, nodeId, resourceId, null, Housekeeping.created(NOW, null));
    }

    // ============================================================
    // link
    // ============================================================

    @Test
    void link_등록되지_않은_그래프면_UnknownGraphException() {
        // given
        when(store.findGraph("nope")).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> graph.link("nope", "discovered-on", "d1", ResourceId.generate()))
            .isInstanceOf(UnknownGraphException.class);
        verify(store, never()).insertEdgeIfAbsent(any());
    }

    @Test
    void link_삭제되었거나_없는_리소스면_ReferentialException() {
        // given
        graphExists();
        ResourceId missing = ResourceId.generate();
        when(resources.find(missing)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> graph.link(GRAPH, "discovered-on", "d1", missing))
            .isInstanceOf(ReferentialException.class);
        verify(store, never()).insertEdgeIfAbsent(any());
    }

    @Test
    void link_저장소_결과를_그대로_반환() {
        // given
        graphExists();
        ResourceId resourceId = ResourceId.generate();
        when(resources.find(resourceId)).thenReturn(Optional.of(mock(UniformResource.class)));
        when(store.insertEdgeIfAbsent(any())).thenReturn(true, false);

        // when
        boolean first = graph.link(GRAPH, "discovered-on", "d1", resourceId);
        boolean second = graph.link(GRAPH, "discovered-on", "d1", resourceId);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
    }

    // ============================================================
    // neighbors
    // ============================================================

    @Test
    void neighbors_반복할_때마다_edge를_다시_읽음() {
        // given
        graphExists();
        ResourceId r1 = ResourceId.generate();
        ResourceId r2 = ResourceId.generate();
        when(resources.find(any())).thenReturn(Optional.of(mock(UniformResource.class)));
        List<LineageEdge> edges = new ArrayList<>(List.of(edge("discovered-on", "d1", r1)));
        when(store.edges(GRAPH)).thenAnswer(invocation -> new ArrayList<>(edges).stream());

        Iterable<ResourceId> neighbors = graph.neighbors(GRAPH, "d1", null);
        List<ResourceId> before = new ArrayList<>();
        neighbors.forEach(before::add);

        // when
        edges.add(edge("discovered-on", "d1", r2));
        List<ResourceId> after = new ArrayList<>();
        neighbors.forEach(after::add);

        // then
        assertThat(before).containsExactly(r1);
        assertThat(after).containsExactly(r1, r2);
        verify(store, times(2)).edges(GRAPH);
    }

    @Test
    void neighbors_nature_필터와_중복_제거와_삭제된_리소스_제외() {
        // given
        graphExists();
        ResourceId live = ResourceId.generate();
        ResourceId deleted = ResourceId.generate();
        ResourceId other = ResourceId.generate();
        when(resources.find(live)).thenReturn(Optional.of(mock(UniformResource.class)));
        when(resources.find(deleted)).thenReturn(Optional.empty());
        when(store.edges(GRAPH)).thenAnswer(invocation -> List.of(
            edge("discovered-on", "d1", live),
            edge("discovered-on", "d1", live),
            edge("discovered-on", "d1", deleted),
            edge("mentions", "d1", other),
            edge("discovered-on", "d2", other)
        ).stream());

        // when
        List<ResourceId> result = new ArrayList<>();
        graph.neighbors(GRAPH, "d1", "discovered-on").forEach(result::add);

        // then
        assertThat(result).containsExactly(live);
    }
}
