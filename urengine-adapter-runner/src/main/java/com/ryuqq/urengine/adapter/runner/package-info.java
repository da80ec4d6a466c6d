/**
 * Runners that drive the application services.
 *
 * <ul>
 *   <li>{@link com.ryuqq.urengine.adapter.runner.DirectoryIngestionRunner}: walks a directory tree and
 *       records every file through a worker pool</li>
 *   <li>{@link com.ryuqq.urengine.adapter.runner.PipelineRunner}: runs ordered stages as one
 *       orchestration session with retry and backoff</li>
 *   <li>{@link com.ryuqq.urengine.adapter.runner.SessionReaper}: finishes orchestration sessions left
 *       open past a threshold</li>
 *   <li>{@link com.ryuqq.urengine.adapter.runner.FileSystemSourceAdapter}: reference source adapter for
 *       local files</li>
 * </ul>
 */
package com.ryuqq.urengine.adapter.runner;
