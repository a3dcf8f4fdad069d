package org.javai.runner.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaults_threeRetriesFromOneSecondCappedAtTen() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.initialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.multiplier()).isEqualTo(2.0);
    }

    @Test
    void delayFor_initialAboveMax_returnsMax() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(30), Duration.ofSeconds(5), 2.0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void delayFor_multiplierOne_isConstant() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(250), Duration.ofSeconds(10), 1.0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(250));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void delayFor_negativeAttempt_isZero() {
        assertThat(RetryPolicy.defaults().delayFor(-3)).isEqualTo(Duration.ZERO);
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withMaxRetries_keepsDelays() {
        RetryPolicy policy = RetryPolicy.defaults().withMaxRetries(7);

        assertThat(policy.maxRetries()).isEqualTo(7);
        assertThat(policy.initialDelay()).isEqualTo(Duration.ofSeconds(1));
    }
}
