package com.ryuqq.urengine.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>파이프라인 단계 재시도 간격을 지수적으로 늘리고, jitter를 더해
 * 여러 단계가 동시에 재시도되는 것을 분산합니다.</p>
 *
 * <pre>
 * delay = min(baseDelay * 2^(retryCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성 (baseDelay=100ms, maxDelay=5000ms, jitterFactor=0.1).
     */
    public BackoffCalculator() {
        this(100, 5000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryCount 재시도 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public long calculate(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }

        // 1. 지수 백오프 (shift overflow 방지)
        int shift = Math.min(retryCount - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        // 2. Jitter
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 상한
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
