/**
 * Ingestion records: sessions, root paths, path entries, non-path tasks and behavior configuration.
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.ingest;
