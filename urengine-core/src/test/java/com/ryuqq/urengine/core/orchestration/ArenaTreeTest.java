package com.ryuqq.urengine.core.orchestration;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ArenaTree 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class ArenaTreeTest {

    private record Node(String id, String parent, int order) {
    }

    private static ArenaTree<String, Node> tree(List<Node> nodes) {
        return ArenaTree.build(nodes, Node::id, Node::parent, Node::order);
    }

    @Test
    void depthFirst_VisitsChildrenInSiblingOrder() {
        // Given (삽입 순서와 형제 순서가 다름)
        ArenaTree<String, Node> tree = tree(List.of(
            new Node("b", "root", 1),
            new Node("root", null, 0),
            new Node("a", "root", 0),
            new Node("a1", "a", 0)
        ));

        // When
        List<String> visited = tree.depthFirst().stream()
            .map(visit -> visit.node().id() + "@" + visit.depth())
            .toList();

        // Then
        assertEquals(List.of("root@0", "a@1", "a1@2", "b@1"), visited);
    }

    @Test
    void build_UnknownParent_TreatedAsRoot() {
        // When
        ArenaTree<String, Node> tree = tree(List.of(new Node("x", "missing", 0)));

        // Then
        assertEquals(1, tree.roots().size());
        assertEquals(1, tree.size());
    }

    @Test
    void children_LeafNode_ReturnsEmpty() {
        ArenaTree<String, Node> tree = tree(List.of(new Node("root", null, 0)));

        assertTrue(tree.children("root").isEmpty());
        assertTrue(tree.find("root").isPresent());
        assertTrue(tree.find("nope").isEmpty());
    }
}
