package com.ryuqq.urengine.core.rule;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 경로 매칭 규칙.
 *
 * <p>{@code (namespace, regex)}로 유일합니다. 같은 namespace 안에서는 priority가 낮을수록
 * 먼저 평가되며, priority가 같으면 선언 순서를 따릅니다. 처음 매칭된 규칙이 nature와 priority를 결정합니다.</p>
 *
 * <p><strong>flags:</strong> {@code i} (대소문자 무시), {@code m} (multiline), {@code s} (dotall),
 * {@code x} (comments), {@code u} (unicode case). 그 외 문자는 거부됩니다.</p>
 *
 * <p>규칙 자체의 include/exclude glob은 regex 매칭 후 추가 필터로 적용됩니다.</p>
 *
 * @param namespace 규칙 namespace
 * @param regex 경로 정규식 (부분 매칭, {@link java.util.regex.Matcher#find()})
 * @param flags 정규식 flag 문자열 ("" 가능)
 * @param nature 매칭 시 부여할 콘텐츠 종류 (null 가능)
 * @param priority 우선순위 (낮을수록 먼저)
 * @param description 설명 (null 가능)
 * @param includeGlobs 규칙 적용 대상 glob (비어 있으면 제한 없음)
 * @param excludeGlobs 규칙 제외 glob
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record PathMatchRule(
    String namespace,
    String regex,
    String flags,
    String nature,
    int priority,
    String description,
    List<String> includeGlobs,
    List<String> excludeGlobs
) {

    /**
     * 규칙이 없거나 non-strict namespace에서 아무 규칙도 매칭되지 않을 때 적용되는 정규식.
     */
    public static final String MATCH_ALL = ".*";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException namespace/regex가 비어 있거나 정규식/flag가 잘못된 경우
     */
    public PathMatchRule {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("regex cannot be null or empty");
        }
        flags = flags == null ? "" : flags;
        includeGlobs = includeGlobs == null ? List.of() : List.copyOf(includeGlobs);
        excludeGlobs = excludeGlobs == null ? List.of() : List.copyOf(excludeGlobs);
        compile(regex, flags);
    }

    /**
     * glob 없는 규칙 생성.
     *
     * @param namespace namespace
     * @param regex 정규식
     * @param nature nature
     * @param priority 우선순위
     * @return PathMatchRule
     */
    public static PathMatchRule of(String namespace, String regex, String nature, int priority) {
        return new PathMatchRule(namespace, regex, "", nature, priority, null, List.of(), List.of());
    }

    /**
     * 기본 match-all 규칙.
     *
     * @param namespace namespace
     * @return 모든 경로에 매칭되는 최저 우선순위 규칙
     */
    public static PathMatchRule matchAll(String namespace) {
        return new PathMatchRule(namespace, MATCH_ALL, "", null, Integer.MAX_VALUE,
            "default match-all", List.of(), List.of());
    }

    /**
     * 컴파일된 패턴.
     *
     * @return Pattern
     */
    public Pattern pattern() {
        return compile(regex, flags);
    }

    /**
     * flag 문자열을 {@link Pattern} flag 비트로 변환.
     *
     * @param flags flag 문자열
     * @return flag 비트
     * @throws IllegalArgumentException 지원하지 않는 flag가 있는 경우
     */
    static int toPatternFlags(String flags) {
        int bits = 0;
        for (char c : flags.toCharArray()) {
            bits |= switch (c) {
                case 'i' -> Pattern.CASE_INSENSITIVE;
                case 'm' -> Pattern.MULTILINE;
                case 's' -> Pattern.DOTALL;
                case 'x' -> Pattern.COMMENTS;
                case 'u' -> Pattern.UNICODE_CASE | Pattern.CASE_INSENSITIVE;
                case 'g' -> 0;
                default -> throw new IllegalArgumentException("Unsupported regex flag: " + c);
            };
        }
        return bits;
    }

    private static Pattern compile(String regex, String flags) {
        try {
            return Pattern.compile(regex, toPatternFlags(flags));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex: " + regex, e);
        }
    }
}
