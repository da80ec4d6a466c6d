package com.ryuqq.urengine.adapter.runner;

/**
 * PipelineRunner 설정 (불변 record).
 *
 * <ul>
 *   <li>maxAttempts: 단계당 최대 시도 횟수 (기본 3)</li>
 *   <li>continueOnFailure: 실패한 단계 이후 단계를 계속 실행할지 여부 (기본 false)</li>
 *   <li>baseDelayMs / maxDelayMs / jitterFactor: 재시도 백오프 (기본 100ms / 5000ms / 0.1)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param continueOnFailure 실패 후 계속 여부
 * @param baseDelayMs 기본 지연 (밀리초)
 * @param maxDelayMs 최대 지연 (밀리초)
 * @param jitterFactor jitter 비율
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record PipelineRunnerConfig(
    int maxAttempts,
    boolean continueOnFailure,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     */
    public PipelineRunnerConfig() {
        this(3, false, 100, 5000, 0.1);
    }

    public PipelineRunnerConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        // 백오프 범위 검증은 BackoffCalculator와 동일
        new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 설정값으로 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    public PipelineRunnerConfig withMaxAttempts(int maxAttempts) {
        return new PipelineRunnerConfig(maxAttempts, continueOnFailure, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public PipelineRunnerConfig withContinueOnFailure(boolean continueOnFailure) {
        return new PipelineRunnerConfig(maxAttempts, continueOnFailure, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public PipelineRunnerConfig withBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return new PipelineRunnerConfig(maxAttempts, continueOnFailure, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
