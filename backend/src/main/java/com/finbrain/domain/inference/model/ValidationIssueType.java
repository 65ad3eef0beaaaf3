package com.finbrain.domain.inference.model;

public enum ValidationIssueType {
    MALFORMED_OUTPUT,
    UNKNOWN_CATEGORY,
    ARITHMETIC_MISMATCH,
    PII_DETECTED,
    DISALLOWED_CONTENT
}
