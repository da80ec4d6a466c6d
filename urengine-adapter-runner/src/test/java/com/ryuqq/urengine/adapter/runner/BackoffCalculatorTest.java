package com.ryuqq.urengine.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    @Test
    void calculate_jitter가_없으면_지수적으로_증가() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 5000, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
    }

    @Test
    void calculate_maxDelay를_넘지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 1000, 1.0);

        // when & then
        assertThat(calculator.calculate(10)).isEqualTo(1000);
        assertThat(calculator.calculate(100)).isEqualTo(1000);
    }

    @Test
    void calculate_jitter는_지정_비율_이내() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 5000, 0.5);

        // when & then
        for (int i = 0; i < 50; i++) {
            assertThat(calculator.calculate(2)).isBetween(200L, 300L);
        }
    }

    @Test
    void calculate_retryCount가_양수가_아니면_IllegalArgumentException() {
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_잘못된_범위면_IllegalArgumentException() {
        assertThatThrownBy(() -> new BackoffCalculator(-1, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(200, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 200, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
