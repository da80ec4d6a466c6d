package com.ryuqq.urengine.core.rule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GlobFilter 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class GlobFilterTest {

    @Test
    void accepts_NoGlobs_AcceptsEverything() {
        assertTrue(GlobFilter.of(null, null).accepts("sub/any.bin"));
    }

    @Test
    void accepts_PatternWithoutSlash_MatchesFileName() {
        // Given
        GlobFilter filter = GlobFilter.of(List.of("*.md"), null);

        // When & Then
        assertTrue(filter.accepts("docs/guide/intro.md"));
        assertFalse(filter.accepts("docs/guide/intro.txt"));
    }

    @Test
    void accepts_PatternWithSlash_MatchesFullPath() {
        // Given
        GlobFilter filter = GlobFilter.of(List.of("docs/**"), null);

        // When & Then
        assertTrue(filter.accepts("docs/guide/intro.md"));
        assertFalse(filter.accepts("src/Main.java"));
    }

    @Test
    void accepts_ExcludeWinsOverInclude() {
        // Given
        GlobFilter filter = GlobFilter.of(List.of("*.md"), List.of("draft-*"));

        // When & Then
        assertFalse(filter.accepts("draft-notes.md"));
        assertTrue(filter.accepts("notes.md"));
    }

    @Test
    void of_BlankPattern_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> GlobFilter.of(List.of(" "), null));
    }
}
