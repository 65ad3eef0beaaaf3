package com.finbrain.domain.inference.model;

public enum CircuitPhase {
    CLOSED,
    OPEN,
    HALF_OPEN
}
