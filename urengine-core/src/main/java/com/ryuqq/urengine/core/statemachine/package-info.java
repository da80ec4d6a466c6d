/**
 * Lifecycle state machines for ingest sessions, path entries and orchestration work.
 *
 * <p>{@link com.ryuqq.urengine.core.statemachine.StateTransition} validates every move;
 * terminal states never transition again.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.statemachine;
