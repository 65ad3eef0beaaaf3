package com.finbrain.infrastructure.ai.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: {@code min(max, base * 2^(attempt-1))}, of which a {@code jitter}
 * fraction is randomly shaved off.
 */
public class BackoffPolicy {

    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.base = base;
        this.max = max;
        this.jitter = Math.max(0.0, Math.min(1.0, jitter));
        this.random = random;
    }

    /**
     * Delay before retrying after the given (1-based) failed attempt.
     */
    public Duration delayAfter(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 20);
        long exponential = base.toMillis() * (1L << shift);
        long capped = Math.min(exponential, max.toMillis());
        long jittered = Math.round(capped * (1.0 - jitter * random.getAsDouble()));
        return Duration.ofMillis(Math.max(0L, jittered));
    }
}
