package com.finbrain.domain.inference.model;

import java.util.List;

/**
 * Outcome of one resilient remote call.
 *
 * @param response          answer (never null; a fallback answer when degraded)
 * @param confidence        confidence of the answer
 * @param degraded          true when any failure or unsafe output forced a reduced-trust answer
 * @param fromCache         true when served from the cache
 * @param issues            validator findings, if any
 * @param degradationReason why the answer is degraded (null when not degraded)
 */
public record BrainResult(
        BrainResponse response,
        ConfidenceResult confidence,
        boolean degraded,
        boolean fromCache,
        List<ValidationIssue> issues,
        DegradationReason degradationReason
) {
    public BrainResult {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static BrainResult success(BrainResponse response, ConfidenceResult confidence, boolean fromCache) {
        return new BrainResult(response, confidence, false, fromCache, List.of(), null);
    }

    public static BrainResult degraded(BrainResponse response, ConfidenceResult confidence,
                                       DegradationReason reason, List<ValidationIssue> issues) {
        return new BrainResult(response, confidence, true, false, issues, reason);
    }
}
