package com.ryuqq.urengine.core.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * namespace별 경로 규칙 등록부.
 *
 * <p>스레드 안전합니다. 같은 {@code (namespace, regex)} match rule이나
 * {@code (namespace, regex, replace)} rewrite rule을 다시 등록하면 무시되고 false를 반환합니다.
 * {@link #ruleSet(String)}은 호출 시점의 불변 스냅샷을 돌려줍니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class PathRuleCatalog {

    private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();

    /**
     * match rule 등록.
     *
     * @param rule 규칙
     * @return 새로 등록되었으면 true, 같은 (namespace, regex)가 이미 있으면 false
     */
    public boolean register(PathMatchRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        return namespace(rule.namespace()).add(rule);
    }

    /**
     * rewrite rule 등록.
     *
     * @param rule 규칙
     * @return 새로 등록되었으면 true, 같은 (namespace, regex, replace)가 이미 있으면 false
     */
    public boolean register(PathRewriteRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        return namespace(rule.namespace()).add(rule);
    }

    /**
     * strict 여부 설정. strict namespace에서는 어떤 규칙에도 매칭되지 않은 경로가 거부됩니다.
     *
     * @param namespace namespace
     * @param strict strict 여부
     */
    public void setStrict(String namespace, boolean strict) {
        namespace(namespace).setStrict(strict);
    }

    /**
     * namespace의 규칙 스냅샷.
     *
     * @param namespace namespace
     * @return 불변 규칙 집합 (등록된 규칙이 없으면 match-all만 적용)
     */
    public PathRuleSet ruleSet(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        Namespace ns = namespaces.get(namespace);
        return ns == null ? PathRuleSet.permissive(namespace) : ns.snapshot(namespace);
    }

    private Namespace namespace(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        return namespaces.computeIfAbsent(name, k -> new Namespace());
    }

    private static final class Namespace {

        private final List<PathMatchRule> matchRules = new ArrayList<>();
        private final List<PathRewriteRule> rewriteRules = new ArrayList<>();
        private boolean strict;

        synchronized boolean add(PathMatchRule rule) {
            boolean exists = matchRules.stream().anyMatch(r -> r.regex().equals(rule.regex()));
            if (exists) {
                return false;
            }
            return matchRules.add(rule);
        }

        synchronized boolean add(PathRewriteRule rule) {
            boolean exists = rewriteRules.stream()
                .anyMatch(r -> r.regex().equals(rule.regex()) && r.replace().equals(rule.replace()));
            if (exists) {
                return false;
            }
            return rewriteRules.add(rule);
        }

        synchronized void setStrict(boolean value) {
            this.strict = value;
        }

        synchronized PathRuleSet snapshot(String name) {
            return new PathRuleSet(name, matchRules, rewriteRules, strict);
        }
    }
}
