package com.ryuqq.urengine.core.orchestration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * 명시적 부모 ID로 연결된 노드 집합을 트리로 색인.
 *
 * <p>노드는 서로를 참조하지 않고 부모 ID만 가집니다. 자식 목록은 부모 ID로 색인되며
 * 형제 순서로 정렬됩니다. 부모가 집합에 없는 노드는 루트로 취급합니다.</p>
 *
 * @param <K> 노드 ID 타입
 * @param <N> 노드 타입
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class ArenaTree<K, N> {

    private final Map<K, N> nodes;
    private final Map<K, List<N>> children;
    private final List<N> roots;
    private final Function<N, K> idOf;

    private ArenaTree(Map<K, N> nodes, Map<K, List<N>> children, List<N> roots, Function<N, K> idOf) {
        this.nodes = nodes;
        this.children = children;
        this.roots = roots;
        this.idOf = idOf;
    }

    /**
     * 트리 구성.
     *
     * @param all 전체 노드
     * @param idOf 노드 ID 추출
     * @param parentOf 부모 ID 추출 (루트는 null)
     * @param orderOf 형제 순서 추출
     * @param <K> 노드 ID 타입
     * @param <N> 노드 타입
     * @return 구성된 트리
     */
    public static <K, N> ArenaTree<K, N> build(Collection<N> all, Function<N, K> idOf,
                                               Function<N, K> parentOf, ToIntFunction<N> orderOf) {
        Map<K, N> byId = new LinkedHashMap<>();
        for (N node : all) {
            byId.put(idOf.apply(node), node);
        }
        Comparator<N> order = Comparator.comparingInt(orderOf);
        Map<K, List<N>> children = new HashMap<>();
        List<N> roots = new ArrayList<>();
        for (N node : all) {
            K parent = parentOf.apply(node);
            if (parent == null || !byId.containsKey(parent)) {
                roots.add(node);
            } else {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(node);
            }
        }
        roots.sort(order);
        children.values().forEach(list -> list.sort(order));
        return new ArenaTree<>(byId, children, roots, idOf);
    }

    public List<N> roots() {
        return List.copyOf(roots);
    }

    /**
     * 자식 노드 (형제 순서).
     *
     * @param id 부모 ID
     * @return 자식 목록 (없으면 빈 목록)
     */
    public List<N> children(K id) {
        return List.copyOf(children.getOrDefault(id, List.of()));
    }

    public Optional<N> find(K id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * 깊이 우선 순회 (형제 순서).
     *
     * @return 방문 순서대로의 (노드, 깊이) 목록
     */
    public List<Visit<N>> depthFirst() {
        List<Visit<N>> visits = new ArrayList<>(nodes.size());
        Deque<Visit<N>> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Visit<>(roots.get(i), 0));
        }
        while (!stack.isEmpty()) {
            Visit<N> visit = stack.pop();
            visits.add(visit);
            List<N> kids = children.getOrDefault(idOf.apply(visit.node()), List.of());
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Visit<>(kids.get(i), visit.depth() + 1));
            }
        }
        return visits;
    }

    /**
     * 순회 방문 기록.
     *
     * @param node 노드
     * @param depth 루트 기준 깊이 (루트 = 0)
     * @param <N> 노드 타입
     */
    public record Visit<N>(N node, int depth) {
    }
}
