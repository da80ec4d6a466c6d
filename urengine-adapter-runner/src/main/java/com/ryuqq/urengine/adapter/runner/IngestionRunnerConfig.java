package com.ryuqq.urengine.adapter.runner;

/**
 * DirectoryIngestionRunner 설정 (불변 record).
 *
 * <ul>
 *   <li>concurrency: 엔트리를 기록하는 worker 수 (기본 4)</li>
 *   <li>awaitTimeoutMs: 한 번의 실행에서 모든 엔트리를 기다리는 최대 시간 (기본 600000ms = 10분)</li>
 * </ul>
 *
 * @param concurrency worker 수 (1 이상)
 * @param awaitTimeoutMs 대기 시간 (밀리초, 양수)
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IngestionRunnerConfig(
    int concurrency,
    long awaitTimeoutMs
) {

    /**
     * 기본 설정 생성자 (concurrency=4, awaitTimeoutMs=600000).
     */
    public IngestionRunnerConfig() {
        this(4, 600000);
    }

    public IngestionRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (awaitTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "awaitTimeoutMs must be positive (current: " + awaitTimeoutMs + ")"
            );
        }
    }

    public IngestionRunnerConfig withConcurrency(int concurrency) {
        return new IngestionRunnerConfig(concurrency, awaitTimeoutMs);
    }

    public IngestionRunnerConfig withAwaitTimeoutMs(long awaitTimeoutMs) {
        return new IngestionRunnerConfig(concurrency, awaitTimeoutMs);
    }
}
