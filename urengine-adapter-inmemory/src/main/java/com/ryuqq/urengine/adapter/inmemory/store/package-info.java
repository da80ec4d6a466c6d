/**
 * In-memory implementations of the engine's storage SPIs.
 *
 * <p>All stores are thread-safe and keep insertion order for listings. They back the
 * contract tests and single-process embedding.</p>
 */
package com.ryuqq.urengine.adapter.inmemory.store;
