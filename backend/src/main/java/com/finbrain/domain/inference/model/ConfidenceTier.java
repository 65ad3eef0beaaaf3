package com.finbrain.domain.inference.model;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
