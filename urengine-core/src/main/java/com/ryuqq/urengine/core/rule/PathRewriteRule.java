package com.ryuqq.urengine.core.rule;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 경로를 정규(canonical) URI로 바꾸는 규칙.
 *
 * <p>{@code (namespace, regex, replace)}로 유일합니다. priority 순(동률은 선언 순)으로
 * 처음 매칭된 규칙 하나만 적용됩니다.</p>
 *
 * @param namespace 규칙 namespace
 * @param regex 경로 정규식
 * @param replace 치환 문자열 ({@code $1} 등 그룹 참조 허용)
 * @param priority 우선순위 (낮을수록 먼저)
 * @param description 설명 (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record PathRewriteRule(
    String namespace,
    String regex,
    String replace,
    int priority,
    String description
) {

    public PathRewriteRule {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("regex cannot be null or empty");
        }
        if (replace == null) {
            throw new IllegalArgumentException("replace cannot be null");
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex: " + regex, e);
        }
    }

    public static PathRewriteRule of(String namespace, String regex, String replace, int priority) {
        return new PathRewriteRule(namespace, regex, replace, priority, null);
    }

    public Pattern pattern() {
        return Pattern.compile(regex);
    }
}
