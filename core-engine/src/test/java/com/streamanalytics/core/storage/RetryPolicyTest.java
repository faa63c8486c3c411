package com.streamanalytics.core.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("Should grow backoff exponentially with jitter")
    void shouldGrowBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(10));

        for (int i = 0; i < 20; i++) {
            assertThat(policy.backoffFor(1).toMillis()).isBetween(100L, 199L);
            assertThat(policy.backoffFor(3).toMillis()).isBetween(400L, 799L);
        }
    }

    @Test
    @DisplayName("Should cap backoff at the maximum")
    void shouldCapBackoff() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(250));

        assertThat(policy.backoffFor(8)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("Should never wait without an initial backoff")
    void shouldNotWaitForNoRetry() {
        assertThat(RetryPolicy.noRetry().backoffFor(1)).isZero();
        assertThat(RetryPolicy.noRetry().getMaxAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
