package com.adrelay.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5, 60_000L);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5, 60_000L);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_cappedAtMaxDelay_evenWithJitterAndHugeAttempt() {
        RetryPolicy policy = new RetryPolicy(30_000L, 0.2, Integer.MAX_VALUE, 600_000L);
        assertThat(policy.delayMs(4)).isBetween(384_000L, 576_000L);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(5)).isLessThanOrEqualTo(600_000L);
        }
        assertThat(policy.delayMs(200)).isLessThanOrEqualTo(600_000L).isGreaterThanOrEqualTo(480_000L);
    }

    @Test
    void constructor_maxBelowBase_throws() {
        assertThatThrownBy(() -> new RetryPolicy(1000L, 0, 3, 10L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
        assertThat(RetryPolicy.defaultPolicy().getMaxDelayMs()).isEqualTo(30_000L);
    }
}
