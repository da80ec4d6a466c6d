package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.TransformId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.resource.TransformCandidate;
import com.ryuqq.urengine.core.resource.UniformResource;
import com.ryuqq.urengine.core.resource.UniformResourceTransform;

import java.util.List;
import java.util.Optional;

/**
 * Content-addressed resource storage SPI.
 *
 * <p><strong>Admission protocol:</strong></p>
 * <pre>
 * 1. validate structured fields and references  (nothing written on failure)
 * 2. resolve digest from content
 * 3. compare-and-insert on (deviceId, digest, uri, sizeBytes)
 *    - absent  → insert, owned by the admitting session, isNewRecord = true
 *    - present → return existing id, isNewRecord = false, no write
 * 4. notify admission listeners for new records only
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic: concurrent admissions of one key produce exactly one insert</li>
 *   <li>Never read-then-write</li>
 *   <li>Soft delete only</li>
 * </ul>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface ResourceStore {

    /**
     * Admits a candidate resource.
     *
     * @param candidate the candidate
     * @param sessionId the admitting ingest session
     * @return the resulting admission
     * @throws com.ryuqq.urengine.core.exception.ValidationException if a structured field or the digest is invalid
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the device or session is unknown
     * @throws com.ryuqq.urengine.core.exception.StoreUnavailableException if the store cannot be reached
     * @throws com.ryuqq.urengine.core.exception.ConcurrencyConflictException if the store cannot make the
     *         key check and insert atomic
     */
    Admission<ResourceId> admit(ResourceCandidate candidate, IngestSessionId sessionId);

    /**
     * Admits a derived representation of a resource.
     *
     * @param candidate the transform candidate
     * @return the resulting admission
     * @throws com.ryuqq.urengine.core.exception.ReferentialException if the resource is unknown
     */
    Admission<TransformId> admitTransform(TransformCandidate candidate);

    Optional<UniformResource> find(ResourceId resourceId);

    Optional<UniformResource> findIncludingDeleted(ResourceId resourceId);

    /**
     * Finds the first live resource of a device carrying the digest.
     *
     * @param deviceId the device
     * @param digest the content digest
     * @return the resource, or empty
     */
    Optional<UniformResource> findByDigest(DeviceId deviceId, ContentDigest digest);

    /**
     * Lists live transforms of a resource in admission order.
     *
     * @param resourceId the resource
     * @return transforms
     */
    List<UniformResourceTransform> transformsOf(ResourceId resourceId);

    /**
     * Counts live resources of a device.
     *
     * @param deviceId the device
     * @return live resource count
     */
    long countForDevice(DeviceId deviceId);

    /**
     * Marks a resource deleted.
     *
     * @param resourceId the resource
     * @param actor the acting principal
     * @return true if the resource was live before this call
     */
    boolean softDelete(ResourceId resourceId, String actor);

    /**
     * Registers a listener for new records.
     *
     * @param listener the listener
     */
    void addAdmissionListener(AdmissionListener listener);
}
