package com.finbrain.domain.inference.model;

public enum ConfidenceDecision {
    ACCEPT,
    ACCEPT_WITH_DISCLAIMER,
    /** Triggers fallback routing to the smart path. */
    REJECT
}
