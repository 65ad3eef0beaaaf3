package com.finbrain.infrastructure.ai.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a caller needs an answer. Every wait inside a call is bounded by it.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration budget, Clock clock) {
        Duration safe = budget == null || budget.isNegative() ? Duration.ZERO : budget;
        return new Deadline(clock, clock.instant().plus(safe));
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean expired() {
        return remaining().isZero();
    }

    /**
     * The smaller of {@code timeout} and the remaining budget.
     */
    public Duration bound(Duration timeout) {
        Duration left = remaining();
        return timeout == null || timeout.compareTo(left) > 0 ? left : timeout;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "Deadline[remaining=" + remaining().toMillis() + "ms]";
    }
}
