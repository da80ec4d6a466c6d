package com.ryuqq.urengine.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Housekeeping envelope 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class HousekeepingTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);
    private static final Instant T2 = T0.plusSeconds(120);

    @Test
    void created_NullActor_RecordsUnknown() {
        // When
        Housekeeping hk = Housekeeping.created(T0, null);

        // Then
        assertEquals(Housekeeping.UNKNOWN_ACTOR, hk.createdBy());
        assertTrue(hk.isLive());
        assertNull(hk.updatedAt());
    }

    @Test
    void softDeleted_Twice_KeepsFirstDeletion() {
        // Given
        Housekeeping deleted = Housekeeping.created(T0, "a").softDeleted(T1, "b");

        // When
        Housekeeping again = deleted.softDeleted(T2, "c");

        // Then
        assertSame(deleted, again);
        assertEquals(T1, again.deletedAt());
        assertEquals("b", again.deletedBy());
        assertFalse(again.isLive());
    }

    @Test
    void restored_ClearsDeletionAndTouches() {
        // When
        Housekeeping restored = Housekeeping.created(T0, "a").softDeleted(T1, "b").restored(T2, "c");

        // Then
        assertTrue(restored.isLive());
        assertNull(restored.deletedBy());
        assertEquals(T2, restored.updatedAt());
        assertEquals("c", restored.updatedBy());
        assertEquals("a", restored.createdBy());
    }

    @Test
    void withActivity_AppendsLines() {
        // When
        Housekeeping hk = Housekeeping.created(T0, "a")
            .withActivity("first")
            .withActivity(" ")
            .withActivity("second");

        // Then
        assertEquals("first\nsecond", hk.activityLog());
    }

    @Test
    void constructor_NullCreatedAt_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new Housekeeping(null, "a", null, null, null, null, null));
    }
}
