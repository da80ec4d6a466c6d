package com.ryuqq.urengine.testkit.contract;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.IngestSessionId;
import com.ryuqq.urengine.core.spi.SourceAdapter;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Source adapter backed by an in-memory map of unit id to content.
 *
 * <p>Unknown ids and ids registered with {@link #failOn(String, String)} raise
 * {@link AdapterException}.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class FixtureSourceAdapter implements SourceAdapter {

    private final SourceKind kind;
    private final Map<String, SourceCandidate> fixtures = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    public FixtureSourceAdapter() {
        this(SourceKind.FILESYSTEM);
    }

    public FixtureSourceAdapter(SourceKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * Registers UTF-8 text content under its id; the id doubles as the candidate URI.
     *
     * @param id unit id
     * @param content text content
     * @return this adapter
     */
    public FixtureSourceAdapter put(String id, String content) {
        return put(id, content, null);
    }

    public FixtureSourceAdapter put(String id, String content, String nature) {
        failures.remove(id);
        fixtures.put(id, SourceCandidate.of(id, content.getBytes(StandardCharsets.UTF_8), nature));
        return this;
    }

    public FixtureSourceAdapter failOn(String id, String message) {
        failures.put(id, message);
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public SourceKind kind() {
        return kind;
    }

    @Override
    public SourceCandidate produceCandidate(IngestSessionId sessionId, String pathOrEquivalentId)
            throws AdapterException {
        calls.incrementAndGet();
        String failure = failures.get(pathOrEquivalentId);
        if (failure != null) {
            throw new AdapterException(pathOrEquivalentId, failure);
        }
        SourceCandidate candidate = fixtures.get(pathOrEquivalentId);
        if (candidate == null) {
            throw new AdapterException(pathOrEquivalentId, "No fixture for " + pathOrEquivalentId);
        }
        return candidate;
    }
}
