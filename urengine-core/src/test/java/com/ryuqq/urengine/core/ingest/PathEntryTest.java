package com.ryuqq.urengine.core.ingest;

import com.ryuqq.urengine.core.statemachine.PathEntryState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PathEntry 경로 파생 필드 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class PathEntryTest {

    @Test
    void parentOf_NestedPath() {
        assertEquals("a/b", PathEntry.parentOf("a/b/c.txt"));
        assertEquals("a/b", PathEntry.parentOf("a\\b\\c.txt"));
        assertEquals("", PathEntry.parentOf("c.txt"));
    }

    @Test
    void basenameOf_NestedPath() {
        assertEquals("c.txt", PathEntry.basenameOf("a/b/c.txt"));
    }

    @Test
    void extensionOf_Variants() {
        assertEquals("gz", PathEntry.extensionOf("archive.tar.gz"));
        assertNull(PathEntry.extensionOf(".gitignore"));
        assertNull(PathEntry.extensionOf("Makefile"));
        assertNull(PathEntry.extensionOf("trailing."));
    }

    @Test
    void terminalState_MapsStatusToState() {
        assertEquals(PathEntryState.ADMITTED,
            PathEntryStatus.DUPLICATE.terminalState());
        assertEquals(PathEntryState.REJECTED,
            PathEntryStatus.EXCLUDED.terminalState());
        assertEquals(PathEntryState.ERRORED,
            PathEntryStatus.ERRORED.terminalState());
    }
}
