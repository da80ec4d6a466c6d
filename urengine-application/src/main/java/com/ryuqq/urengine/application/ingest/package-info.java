/**
 * Ingestion session management.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.application.ingest.IngestionSessionManager} - session lifecycle, rule evaluation and admission of path entries and tasks</li>
 *   <li>{@link com.ryuqq.urengine.application.ingest.SourceAdapterRegistry} - adapter lookup by source kind</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.application.ingest;
