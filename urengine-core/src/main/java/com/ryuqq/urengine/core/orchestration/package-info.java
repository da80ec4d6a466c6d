/**
 * Orchestration records: sessions, entries, exec and log trees, issues and state transitions.
 *
 * <h2>Trees</h2>
 * <p>Exec and log trees are arenas: every node carries its parent id and a sibling order,
 * and {@link com.ryuqq.urengine.core.orchestration.ArenaTree} indexes children by parent id.</p>
 *
 * <h2>Transitions</h2>
 * <p>The current-value table keeps one row per (owner, from, to); the history keeps every write.</p>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.core.orchestration;
