package com.ryuqq.urengine.core.rule;

/**
 * 경로 규칙 평가 결과.
 *
 * @param path 평가한 경로
 * @param rule 적용된 match rule (UNMATCHED이면 null)
 * @param canonicalUri rewrite 적용 후 URI (rewrite가 없으면 path)
 * @param rewrite 적용된 rewrite rule (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record MatchResult(
    String path,
    PathMatchRule rule,
    String canonicalUri,
    PathRewriteRule rewrite
) {

    public MatchResult {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (canonicalUri == null) {
            canonicalUri = path;
        }
    }

    /**
     * strict namespace에서 매칭 실패.
     *
     * @param path 경로
     * @return 매칭되지 않은 결과
     */
    public static MatchResult unmatched(String path) {
        return new MatchResult(path, null, path, null);
    }

    public boolean matched() {
        return rule != null;
    }

    /**
     * 매칭된 규칙의 nature.
     *
     * @return nature (매칭 실패 또는 규칙에 nature가 없으면 null)
     */
    public String nature() {
        return rule == null ? null : rule.nature();
    }
}
