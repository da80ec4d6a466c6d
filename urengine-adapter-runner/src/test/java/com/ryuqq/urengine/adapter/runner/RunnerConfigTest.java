package com.ryuqq.urengine.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runner 설정 record 검증 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    // ============================================================
    // PipelineRunnerConfig
    // ============================================================

    @Test
    void PipelineRunnerConfig_기본값() {
        PipelineRunnerConfig config = new PipelineRunnerConfig();

        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.continueOnFailure()).isFalse();
        assertThat(config.backoffCalculator().getBaseDelayMs()).isEqualTo(100);
    }

    @Test
    void PipelineRunnerConfig_잘못된_값이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new PipelineRunnerConfig().withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineRunnerConfig().withBackoff(500, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // IngestionRunnerConfig / ReaperConfig
    // ============================================================

    @Test
    void IngestionRunnerConfig_with_메서드는_나머지_값을_유지() {
        IngestionRunnerConfig config = new IngestionRunnerConfig().withConcurrency(8);

        assertThat(config.concurrency()).isEqualTo(8);
        assertThat(config.awaitTimeoutMs()).isEqualTo(600000);
        assertThatThrownBy(() -> config.withAwaitTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ReaperConfig_잘못된_값이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new ReaperConfig(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReaperConfig().withBatchSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ReaperConfig().batchSize()).isEqualTo(50);
    }
}
