package com.ryuqq.urengine.adapter.runner;

/**
 * SessionReaper 설정 (불변 record).
 *
 * <ul>
 *   <li>timeoutThresholdMs: 이 시간보다 오래 열린 세션을 정리 (기본 3600000ms = 1시간)</li>
 *   <li>batchSize: 한 번의 스캔에서 정리할 최대 세션 수 (기본 50)</li>
 * </ul>
 *
 * @param timeoutThresholdMs 타임아웃 임계값 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record ReaperConfig(
    long timeoutThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자 (timeoutThresholdMs=3600000, batchSize=50).
     */
    public ReaperConfig() {
        this(3600000, 50);
    }

    public ReaperConfig {
        if (timeoutThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutThresholdMs must be positive (current: " + timeoutThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ReaperConfig withTimeoutThresholdMs(long timeoutThresholdMs) {
        return new ReaperConfig(timeoutThresholdMs, batchSize);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(timeoutThresholdMs, batchSize);
    }
}
