package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.exception.AdapterException;
import com.ryuqq.urengine.core.ingest.SourceCandidate;
import com.ryuqq.urengine.core.ingest.SourceKind;
import com.ryuqq.urengine.core.model.IngestSessionId;

/**
 * Inbound capability implemented once per source kind.
 *
 * <p>Adapters own any I/O, credentials and asynchrony. The engine calls
 * {@link #produceCandidate} synchronously and turns an {@link AdapterException} into an
 * errored entry plus an issue; sibling units keep going.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public interface SourceAdapter {

    /**
     * The source kind this adapter serves.
     *
     * @return the kind
     */
    SourceKind kind();

    /**
     * Produces a candidate resource for one unit.
     *
     * @param sessionId the ingest session
     * @param pathOrEquivalentId a path, message id, issue key or telemetry record locator
     * @return the candidate
     * @throws AdapterException if the unit cannot be read
     */
    SourceCandidate produceCandidate(IngestSessionId sessionId, String pathOrEquivalentId) throws AdapterException;
}
