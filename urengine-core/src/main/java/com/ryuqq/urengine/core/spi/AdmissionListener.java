package com.ryuqq.urengine.core.spi;

import com.ryuqq.urengine.core.resource.UniformResource;

/**
 * Receives newly admitted resources.
 *
 * <p>Called once per new record, on the admitting thread, after the record is visible.
 * Duplicate admissions do not notify listeners.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AdmissionListener {

    /**
     * Handles a newly admitted resource.
     *
     * @param resource the stored resource
     */
    void onAdmitted(UniformResource resource);
}
