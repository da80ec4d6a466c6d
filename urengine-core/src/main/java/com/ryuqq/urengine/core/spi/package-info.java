/**
 * Service Provider Interfaces for storage and source adapters.
 *
 * <h2>Storage</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.core.spi.DeviceRegistry}</li>
 *   <li>{@link com.ryuqq.urengine.core.spi.ResourceStore}</li>
 *   <li>{@link com.ryuqq.urengine.core.spi.IngestSessionStore}</li>
 *   <li>{@link com.ryuqq.urengine.core.spi.LineageStore}</li>
 *   <li>{@link com.ryuqq.urengine.core.spi.OrchestrationStore}</li>
 * </ul>
 *
 * <h2>Inbound</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.core.spi.SourceAdapter}</li>
 * </ul>
 *
 * <p>Implementations must pass the contract tests in {@code urengine-testkit}.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.spi;
