package com.ryuqq.urengine.core.rule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 한 namespace의 match/rewrite 규칙 스냅샷.
 *
 * <p>생성 시 규칙을 priority 기준으로 안정 정렬하므로, priority가 같은 규칙은 선언 순서를 유지합니다.
 * 불변 객체이며 여러 worker 스레드에서 공유해도 안전합니다.</p>
 *
 * <p><strong>평가 순서:</strong></p>
 * <ol>
 *   <li>정렬된 match rule을 차례로 검사 (regex find + 규칙 glob)</li>
 *   <li>처음 매칭된 규칙 채택</li>
 *   <li>매칭 없음: strict이면 UNMATCHED, 아니면 기본 match-all</li>
 *   <li>정렬된 rewrite rule 중 처음 매칭된 하나로 canonical URI 계산</li>
 * </ol>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class PathRuleSet {

    private final String namespace;
    private final boolean strict;
    private final List<CompiledMatch> matchRules;
    private final List<PathRewriteRule> rewriteRules;
    private final PathMatchRule fallback;

    /**
     * 규칙 집합 생성.
     *
     * @param namespace namespace
     * @param matchRules 선언 순서의 match rule
     * @param rewriteRules 선언 순서의 rewrite rule
     * @param strict strict namespace 여부
     */
    public PathRuleSet(String namespace, List<PathMatchRule> matchRules,
                       List<PathRewriteRule> rewriteRules, boolean strict) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        this.namespace = namespace;
        this.strict = strict;

        List<PathMatchRule> sortedMatch = new ArrayList<>(matchRules == null ? List.of() : matchRules);
        sortedMatch.sort(Comparator.comparingInt(PathMatchRule::priority));
        this.matchRules = sortedMatch.stream().map(CompiledMatch::new).toList();

        List<PathRewriteRule> sortedRewrite = new ArrayList<>(rewriteRules == null ? List.of() : rewriteRules);
        sortedRewrite.sort(Comparator.comparingInt(PathRewriteRule::priority));
        this.rewriteRules = List.copyOf(sortedRewrite);

        this.fallback = PathMatchRule.matchAll(namespace);
    }

    /**
     * 규칙 없는 기본 집합.
     *
     * @param namespace namespace
     * @return match-all만 적용되는 규칙 집합
     */
    public static PathRuleSet permissive(String namespace) {
        return new PathRuleSet(namespace, List.of(), List.of(), false);
    }

    /**
     * 경로 평가.
     *
     * @param path 평가할 경로
     * @return 매칭 결과
     */
    public MatchResult evaluate(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        PathMatchRule applied = null;
        for (CompiledMatch candidate : matchRules) {
            if (candidate.matches(path)) {
                applied = candidate.rule;
                break;
            }
        }
        if (applied == null) {
            if (strict && !matchRules.isEmpty()) {
                return MatchResult.unmatched(path);
            }
            applied = fallback;
        }
        for (PathRewriteRule rewrite : rewriteRules) {
            Matcher matcher = rewrite.pattern().matcher(path);
            if (matcher.find()) {
                return new MatchResult(path, applied, matcher.replaceAll(rewrite.replace()), rewrite);
            }
        }
        return new MatchResult(path, applied, path, null);
    }

    public String namespace() {
        return namespace;
    }

    public boolean isStrict() {
        return strict;
    }

    private static final class CompiledMatch {

        private final PathMatchRule rule;
        private final Pattern pattern;
        private final GlobFilter globs;

        CompiledMatch(PathMatchRule rule) {
            this.rule = rule;
            this.pattern = rule.pattern();
            this.globs = GlobFilter.of(rule.includeGlobs(), rule.excludeGlobs());
        }

        boolean matches(String path) {
            return pattern.matcher(path).find() && globs.accepts(path);
        }
    }
}
