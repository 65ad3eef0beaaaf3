package com.finbrain.domain.inference.model;

public enum DegradationReason {
    GATE_TIMEOUT,
    CIRCUIT_OPEN,
    REMOTE_FAILURE,
    DEADLINE_EXCEEDED,
    VALIDATION_FAILED
}
