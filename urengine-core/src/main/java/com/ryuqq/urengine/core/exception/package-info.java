/**
 * Error taxonomy of the engine.
 *
 * <h2>Record-level errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.core.exception.ValidationException} - malformed structured payload or constraint violation, rejected before any write</li>
 *   <li>{@link com.ryuqq.urengine.core.exception.ReferentialException} - missing owning device/session/parent</li>
 *   <li>{@link com.ryuqq.urengine.core.exception.UnknownGraphException} - link into an unregistered lineage graph</li>
 *   <li>{@link com.ryuqq.urengine.core.exception.AlreadyClosedException} - double close, or new work on a closed session</li>
 *   <li>{@link com.ryuqq.urengine.core.exception.ConcurrencyConflictException} - store could not provide the atomic guarantee</li>
 * </ul>
 *
 * <h2>Boundary and fatal errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.core.exception.AdapterException} - checked, raised by source adapters, captured as issues</li>
 *   <li>{@link com.ryuqq.urengine.core.exception.StoreUnavailableException} - aborts the current session</li>
 * </ul>
 *
 * <p>Duplicate admission is not an error: it is reported as {@code isNewRecord=false}.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.exception;
