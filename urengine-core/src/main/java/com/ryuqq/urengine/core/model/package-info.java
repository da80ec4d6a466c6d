/**
 * Identity value objects and the housekeeping envelope.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.core.model.Identifier} - common base for every entity identifier</li>
 *   <li>{@link com.ryuqq.urengine.core.model.ContentDigest} - SHA-256 content identity</li>
 *   <li>{@link com.ryuqq.urengine.core.model.Housekeeping} - created/updated/deleted envelope with activity log</li>
 *   <li>{@link com.ryuqq.urengine.core.model.SoftDeletable} - entities filtered by "live" reads</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> identifiers and envelopes never change after creation</li>
 *   <li><strong>Typed identity:</strong> a {@code DeviceId} never equals an {@code IngestSessionId}, even with the same value</li>
 *   <li><strong>Soft delete:</strong> rows are marked, never removed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.model;
