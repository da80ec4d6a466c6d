package com.ryuqq.urengine.adapter.inmemory.store;

import com.ryuqq.urengine.core.exception.ReferentialException;
import com.ryuqq.urengine.core.exception.StoreUnavailableException;
import com.ryuqq.urengine.core.model.ContentDigest;
import com.ryuqq.urengine.core.model.DeviceId;
import com.ryuqq.urengine.core.model.Housekeeping;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.model.ResourceId;
import com.ryuqq.urengine.core.model.TransformId;
import com.ryuqq.urengine.core.resource.Admission;
import com.ryuqq.urengine.core.resource.ResourceCandidate;
import com.ryuqq.urengine.core.resource.ResourceKey;
import com.ryuqq.urengine.core.resource.TransformCandidate;
import com.ryuqq.urengine.core.resource.UniformResource;
import com.ryuqq.urengine.core.resource.UniformResourceTransform;
import com.ryuqq.urengine.core.spi.AdmissionListener;
import com.ryuqq.urengine.core.spi.DeviceRegistry;
import com.ryuqq.urengine.core.spi.IngestSessionStore;
import com.ryuqq.urengine.core.spi.ResourceStore;
import com.ryuqq.urengine.core.validation.StructuredPayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory {@link ResourceStore}.
 *
 * <p>Admission validates payloads and references first, then performs a compare-and-insert on the
 * {@link ResourceKey} index. Only the caller whose insert won sees {@code newRecord = true}, and
 * only that caller notifies the admission listeners.</p>
 *
 * <p>{@link #setAvailable(boolean)} switches the store into an unreachable mode in which every
 * operation fails with {@link StoreUnavailableException}; tests use it to exercise failure paths.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class InMemoryResourceStore implements ResourceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResourceStore.class);

    private final DeviceRegistry devices;
    private final IngestSessionStore sessions;
    private final Clock clock;

    private final ConcurrentHashMap<ResourceId, UniformResource> resources = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ResourceKey, ResourceId> resourceIndex = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<ResourceId> resourceOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<TransformId, UniformResourceTransform> transforms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UniformResourceTransform.TransformKey, TransformId> transformIndex =
        new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<TransformId> transformOrder = new ConcurrentLinkedQueue<>();
    private final List<AdmissionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean available = true;

    public InMemoryResourceStore(DeviceRegistry devices, IngestSessionStore sessions, Clock clock) {
        if (devices == null) {
            throw new IllegalArgumentException("devices cannot be null");
        }
        if (sessions == null) {
            throw new IllegalArgumentException("sessions cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.devices = devices;
        this.sessions = sessions;
        this.clock = clock;
    }

    /**
     * Simulates the backing store becoming (un)reachable.
     *
     * @param available false to make every subsequent call fail
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public Admission<ResourceId> admit(ResourceCandidate candidate, IngestSessionId sessionId) {
        requireAvailable();
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }

        // 1. payload validation happens before any write
        StructuredPayloadValidator.requireValid("frontmatter", candidate.frontmatter());
        StructuredPayloadValidator.requireValid("contentFmBodyAttrs", candidate.contentFmBodyAttrs());
        StructuredPayloadValidator.requireValid("elaboration", candidate.elaboration());
        ContentDigest digest = candidate.resolveDigest();

        // 2. referential checks
        if (devices.findLive(candidate.deviceId()).isEmpty()) {
            throw new ReferentialException("Device", candidate.deviceId().getValue());
        }
        if (sessions.findSession(sessionId).isEmpty()) {
            throw new ReferentialException("IngestSession", sessionId.getValue());
        }

        // 3. compare-and-insert on the dedup key
        ResourceKey key = new ResourceKey(candidate.deviceId(), digest, candidate.uri(), candidate.sizeBytes());
        AtomicReference<UniformResource> inserted = new AtomicReference<>();
        ResourceId id = resourceIndex.computeIfAbsent(key, k -> {
            UniformResource resource = new UniformResource(
                ResourceId.generate(),
                candidate.deviceId(),
                sessionId,
                candidate.ingestPathId(),
                candidate.uri(),
                digest,
                candidate.sizeBytes(),
                candidate.nature(),
                candidate.content(),
                candidate.lastModifiedAt(),
                candidate.frontmatter(),
                candidate.contentFmBodyAttrs(),
                candidate.elaboration(),
                Housekeeping.created(clock.instant(), null)
            );
            resources.put(resource.id(), resource);
            resourceOrder.add(resource.id());
            inserted.set(resource);
            return resource.id();
        });

        UniformResource created = inserted.get();
        if (created != null) {
            log.debug("Resource admitted: id={}, uri={}, digest={}", id, created.uri(), digest);
            notifyListeners(created);
            return Admission.created(id);
        }

        // Re-admission of a soft-deleted key revives the existing row
        resources.computeIfPresent(id, (rid, current) -> {
            if (current.isLive()) {
                return current;
            }
            log.info("Soft-deleted resource restored by re-admission: id={}, session={}", rid, sessionId);
            Housekeeping next = current.housekeeping()
                .restored(clock.instant(), null)
                .withActivity("restored by re-admission in session " + sessionId.getValue());
            return current.withHousekeeping(next);
        });
        return Admission.existing(id);
    }

    @Override
    public Admission<TransformId> admitTransform(TransformCandidate candidate) {
        requireAvailable();
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
        StructuredPayloadValidator.requireValid("elaboration", candidate.elaboration());
        if (find(candidate.resourceId()).isEmpty()) {
            throw new ReferentialException("UniformResource", candidate.resourceId().getValue());
        }

        UniformResourceTransform.TransformKey key = new UniformResourceTransform.TransformKey(
            candidate.resourceId(), candidate.contentDigest(), candidate.nature(), candidate.sizeBytes());
        boolean[] created = {false};
        TransformId id = transformIndex.computeIfAbsent(key, k -> {
            UniformResourceTransform transform = new UniformResourceTransform(
                TransformId.generate(),
                candidate.resourceId(),
                candidate.uri(),
                candidate.contentDigest(),
                candidate.nature(),
                candidate.sizeBytes(),
                candidate.content(),
                candidate.elaboration(),
                Housekeeping.created(clock.instant(), null)
            );
            transforms.put(transform.id(), transform);
            transformOrder.add(transform.id());
            created[0] = true;
            return transform.id();
        });
        return created[0] ? Admission.created(id) : Admission.existing(id);
    }

    @Override
    public Optional<UniformResource> find(ResourceId resourceId) {
        return findIncludingDeleted(resourceId).filter(UniformResource::isLive);
    }

    @Override
    public Optional<UniformResource> findIncludingDeleted(ResourceId resourceId) {
        requireAvailable();
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        return Optional.ofNullable(resources.get(resourceId));
    }

    @Override
    public Optional<UniformResource> findByDigest(DeviceId deviceId, ContentDigest digest) {
        requireAvailable();
        return resourceOrder.stream()
            .map(resources::get)
            .filter(UniformResource::isLive)
            .filter(resource -> resource.deviceId().equals(deviceId) && resource.contentDigest().equals(digest))
            .findFirst();
    }

    @Override
    public List<UniformResourceTransform> transformsOf(ResourceId resourceId) {
        requireAvailable();
        return transformOrder.stream()
            .map(transforms::get)
            .filter(UniformResourceTransform::isLive)
            .filter(transform -> transform.resourceId().equals(resourceId))
            .toList();
    }

    @Override
    public long countForDevice(DeviceId deviceId) {
        requireAvailable();
        return resources.values().stream()
            .filter(UniformResource::isLive)
            .filter(resource -> resource.deviceId().equals(deviceId))
            .count();
    }

    @Override
    public boolean softDelete(ResourceId resourceId, String actor) {
        requireAvailable();
        boolean[] wasLive = {false};
        resources.computeIfPresent(resourceId, (id, current) -> {
            if (!current.isLive()) {
                return current;
            }
            wasLive[0] = true;
            return current.withHousekeeping(current.housekeeping().softDeleted(clock.instant(), actor));
        });
        return wasLive[0];
    }

    @Override
    public void addAdmissionListener(AdmissionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    private void notifyListeners(UniformResource resource) {
        for (AdmissionListener listener : listeners) {
            try {
                listener.onAdmitted(resource);
            } catch (RuntimeException e) {
                // Admission is already committed; a listener failure must not undo it
                log.error("Admission listener failed: listener={}, resource={}",
                    listener.getClass().getSimpleName(), resource.id(), e);
            }
        }
    }

    private void requireAvailable() {
        if (!available) {
            throw new StoreUnavailableException("resource store is unavailable");
        }
    }
}
