package com.ryuqq.urengine.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContentDigest 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class ContentDigestTest {

    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @Test
    void sha256_KnownInput_ProducesLowercaseHex() {
        // When
        ContentDigest digest = ContentDigest.sha256("hello".getBytes(StandardCharsets.UTF_8));

        // Then
        assertEquals(HELLO_SHA256, digest.getValue());
    }

    @Test
    void of_UppercaseValue_NormalizesToLowercase() {
        assertEquals(ContentDigest.sha256("hello".getBytes(StandardCharsets.UTF_8)),
            ContentDigest.of(HELLO_SHA256.toUpperCase()));
    }

    @Test
    void sha256_EmptyContent_IsValid() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            ContentDigest.sha256(new byte[0]).getValue());
    }

    @Test
    void of_Blank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ContentDigest.of(""));
    }
}
