package com.finbrain.infrastructure.ai.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void remainingShrinksAsTimePasses() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(10), clock);

        clock.advance(Duration.ofSeconds(4));

        assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(6));
        assertThat(deadline.expired()).isFalse();
    }

    @Test
    void neverReportsNegativeRemaining() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(1), clock);

        clock.advance(Duration.ofSeconds(5));

        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThat(deadline.expired()).isTrue();
    }

    @Test
    void boundTakesTheSmallerDuration() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(3), clock);

        assertThat(deadline.bound(Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(3));
        assertThat(deadline.bound(Duration.ofSeconds(1))).isEqualTo(Duration.ofSeconds(1));
        assertThat(deadline.bound(null)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void negativeBudgetIsAlreadyExpired() {
        assertThat(Deadline.after(Duration.ofSeconds(-1), clock).expired()).isTrue();
    }
}
