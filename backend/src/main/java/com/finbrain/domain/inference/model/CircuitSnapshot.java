package com.finbrain.domain.inference.model;

import java.time.Instant;

/**
 * Point-in-time copy of the circuit state.
 *
 * @param openedAt only meaningful while {@code phase} is OPEN or HALF_OPEN (nullable)
 */
public record CircuitSnapshot(
        String name,
        CircuitPhase phase,
        int consecutiveFailures,
        Instant openedAt,
        long totalSuccesses,
        long totalFailures,
        long rejectedCalls
) {
}
