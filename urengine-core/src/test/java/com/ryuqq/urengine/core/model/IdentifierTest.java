package com.ryuqq.urengine.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Identifier 계열 Value Object 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class IdentifierTest {

    @Test
    void of_ValidValue_KeepsValue() {
        // When
        DeviceId id = DeviceId.of("device-01:lab.a_b");

        // Then
        assertEquals("device-01:lab.a_b", id.getValue());
    }

    @Test
    void generate_TwoCalls_ProduceDistinctValues() {
        assertNotEquals(ResourceId.generate(), ResourceId.generate());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DeviceId.of("  ")
        );
        assertTrue(exception.getMessage().contains("DeviceId"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> DeviceId.of("device/01"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> DeviceId.of("a".repeat(256)));
    }

    @Test
    void equals_SameValueDifferentType_NotEqual() {
        // Given
        String value = "same-value";

        // When & Then
        assertNotEquals(DeviceId.of(value), (Object) ResourceId.of(value));
        assertEquals(DeviceId.of(value), DeviceId.of(value));
        assertEquals(DeviceId.of(value).hashCode(), DeviceId.of(value).hashCode());
    }
}
