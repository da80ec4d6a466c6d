package com.ryuqq.urengine.core.resource;

import com.ryuqq.urengine.core.exception.ValidationException;
import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResourceCandidate digest 결정 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class ResourceCandidateTest {

    private static final DeviceId DEVICE = DeviceId.of("d1");
    private static final byte[] CONTENT = "hello".getBytes(StandardCharsets.UTF_8);

    @Test
    void resolveDigest_ContentOnly_ComputesSha256() {
        ResourceCandidate candidate = ResourceCandidate.of(DEVICE, "/a.txt", CONTENT, "txt");

        assertEquals(ContentDigest.sha256(CONTENT), candidate.resolveDigest());
        assertEquals(5, candidate.sizeBytes());
    }

    @Test
    void resolveDigest_ReferenceOnly_UsesSuppliedDigest() {
        ContentDigest digest = ContentDigest.of("abc123");

        assertEquals(digest, ResourceCandidate.reference(DEVICE, "s3://b/k", digest, 10, null).resolveDigest());
    }

    @Test
    void resolveDigest_Mismatch_ThrowsException() {
        // Given
        ResourceCandidate candidate = new ResourceCandidate(DEVICE, null, "/a.txt", CONTENT,
            ContentDigest.of("deadbeef"), CONTENT.length, null, null, null, null, null);

        // When & Then
        ValidationException exception = assertThrows(ValidationException.class, candidate::resolveDigest);
        assertEquals("contentDigest", exception.getField());
    }

    @Test
    void content_ReturnsCopyOfBytes() {
        // Given
        ResourceCandidate candidate = ResourceCandidate.of(DEVICE, "/a.txt", CONTENT, "txt");

        // When
        candidate.content()[0] = 'X';

        // Then
        assertEquals('h', candidate.content()[0]);
    }
}
