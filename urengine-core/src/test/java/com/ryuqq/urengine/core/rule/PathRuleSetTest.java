package com.ryuqq.urengine.core.rule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PathRuleSet / PathRuleCatalog 평가 테스트.
 *
 * <ul>
 *   <li>priority 오름차순, 같은 priority는 선언 순서</li>
 *   <li>strict namespace의 UNMATCHED</li>
 *   <li>rewrite는 처음 매칭된 규칙 하나만 적용</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class PathRuleSetTest {

    // ========== match rule ==========

    @Test
    void evaluate_LowerPriorityWins() {
        // Given
        PathRuleSet rules = new PathRuleSet("ns", List.of(
            PathMatchRule.of("ns", "\\.txt$", "by-extension", 2),
            PathMatchRule.of("ns", "^/a/", "by-folder", 1)
        ), List.of(), false);

        // When
        MatchResult result = rules.evaluate("/a/b.txt");

        // Then
        assertEquals("by-folder", result.nature());
    }

    @Test
    void evaluate_SamePriority_DeclarationOrderWins() {
        // Given
        PathRuleSet rules = new PathRuleSet("ns", List.of(
            PathMatchRule.of("ns", "b", "first", 1),
            PathMatchRule.of("ns", "txt", "second", 1)
        ), List.of(), false);

        // When & Then
        assertEquals("first", rules.evaluate("/a/b.txt").nature());
    }

    @Test
    void evaluate_StrictWithoutMatch_ReturnsUnmatched() {
        // Given
        PathRuleSet rules = new PathRuleSet("ns", List.of(PathMatchRule.of("ns", "\\.md$", "markdown", 1)),
            List.of(), true);

        // When
        MatchResult result = rules.evaluate("/a/b.txt");

        // Then
        assertFalse(result.matched());
        assertNull(result.nature());
    }

    @Test
    void evaluate_StrictWithoutRules_FallsBackToMatchAll() {
        PathRuleSet rules = new PathRuleSet("ns", List.of(), List.of(), true);

        assertTrue(rules.evaluate("/anything").matched());
    }

    @Test
    void evaluate_NonStrictWithoutMatch_UsesMatchAll() {
        // Given
        PathRuleSet rules = new PathRuleSet("ns", List.of(PathMatchRule.of("ns", "\\.md$", "markdown", 1)),
            List.of(), false);

        // When
        MatchResult result = rules.evaluate("/a/b.txt");

        // Then
        assertTrue(result.matched());
        assertEquals(PathMatchRule.MATCH_ALL, result.rule().regex());
        assertNull(result.nature());
    }

    @Test
    void evaluate_RuleGlobsNarrowMatch() {
        // Given
        PathMatchRule docs = new PathMatchRule("ns", "\\.md$", "", "doc", 1, null,
            List.of(), List.of("README.md"));
        PathRuleSet rules = new PathRuleSet("ns", List.of(docs), List.of(), true);

        // When & Then
        assertTrue(rules.evaluate("/repo/guide.md").matched());
        assertFalse(rules.evaluate("/repo/README.md").matched());
    }

    @Test
    void evaluate_CaseInsensitiveFlag() {
        // Given
        PathMatchRule rule = new PathMatchRule("ns", "\\.MD$", "i", "doc", 1, null, null, null);
        PathRuleSet rules = new PathRuleSet("ns", List.of(rule), List.of(), true);

        // When & Then
        assertEquals("doc", rules.evaluate("/a/readme.md").nature());
    }

    @Test
    void constructor_UnsupportedFlag_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new PathMatchRule("ns", "a", "q", null, 1, null, null, null));
    }

    @Test
    void constructor_InvalidRegex_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PathMatchRule.of("ns", "([", null, 1));
    }

    // ========== rewrite rule ==========

    @Test
    void evaluate_FirstMatchingRewriteApplied() {
        // Given
        PathRuleSet rules = new PathRuleSet("ns", List.of(), List.of(
            PathRewriteRule.of("ns", "^/src/(.*)$", "other://$1", 5),
            PathRewriteRule.of("ns", "^/src/(.*)$", "repo://$1", 1)
        ), false);

        // When
        MatchResult result = rules.evaluate("/src/a.md");

        // Then
        assertEquals("repo://a.md", result.canonicalUri());
        assertEquals("repo://$1", result.rewrite().replace());
    }

    @Test
    void evaluate_NoRewrite_CanonicalUriIsPath() {
        MatchResult result = PathRuleSet.permissive("ns").evaluate("/src/a.md");

        assertEquals("/src/a.md", result.canonicalUri());
        assertNull(result.rewrite());
    }

    // ========== catalog ==========

    @Test
    void catalog_DuplicateRegex_NotRegisteredTwice() {
        // Given
        PathRuleCatalog catalog = new PathRuleCatalog();

        // When
        boolean first = catalog.register(PathMatchRule.of("ns", "\\.md$", "markdown", 1));
        boolean second = catalog.register(PathMatchRule.of("ns", "\\.md$", "doc", 0));

        // Then
        assertTrue(first);
        assertFalse(second);
        assertEquals("markdown", catalog.ruleSet("ns").evaluate("/a.md").nature());
    }

    @Test
    void catalog_UnknownNamespace_IsPermissive() {
        PathRuleSet rules = new PathRuleCatalog().ruleSet("missing");

        assertFalse(rules.isStrict());
        assertTrue(rules.evaluate("/a").matched());
    }

    @Test
    void catalog_SnapshotIgnoresLaterRegistrations() {
        // Given
        PathRuleCatalog catalog = new PathRuleCatalog();
        catalog.setStrict("ns", true);
        catalog.register(PathMatchRule.of("ns", "\\.md$", "markdown", 1));
        PathRuleSet snapshot = catalog.ruleSet("ns");

        // When
        catalog.register(PathMatchRule.of("ns", "\\.txt$", "text", 1));

        // Then
        assertFalse(snapshot.evaluate("/a.txt").matched());
        assertTrue(catalog.ruleSet("ns").evaluate("/a.txt").matched());
    }
}
