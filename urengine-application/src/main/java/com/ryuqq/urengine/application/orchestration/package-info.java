/**
 * Orchestration executor: records nested pipeline steps as an exec tree with status,
 * diagnostics, transitions and structured logs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.urengine.application.orchestration.OrchestrationExecutor} - session, entry, exec, issue, transition and log recording</li>
 *   <li>{@link com.ryuqq.urengine.application.orchestration.ExecHandle} - try-with-resources handle over a running exec</li>
 *   <li>{@link com.ryuqq.urengine.application.orchestration.ExecBody} - unit of work run under a parent exec</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resource Engine Team
 */
package com.ryuqq.urengine.application.orchestration;
