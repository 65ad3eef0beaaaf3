package com.finbrain.infrastructure.ai.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    @Test
    void doublesEachAttemptUpToTheCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(4), 0.0);

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfter(5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayAfter(40)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void jitterShavesOffAFractionOfTheDelay() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 0.5, () -> 1.0);

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void jitterNeverProducesNegativeDelay() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 5.0, () -> 1.0);

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ZERO);
    }
}
