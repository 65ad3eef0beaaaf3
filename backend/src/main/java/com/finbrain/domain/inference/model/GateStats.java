package com.finbrain.domain.inference.model;

/**
 * Point-in-time counters of the admission gate.
 */
public record GateStats(
        int capacity,
        int available,
        int active,
        int waiting,
        long processed,
        long timeouts
) {
}
