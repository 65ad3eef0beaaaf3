package com.finbrain.domain.inference.model;

import java.util.List;

/**
 * Unified answer of the categorization orchestrator.
 *
 * @param category          chosen category
 * @param source            which path produced it
 * @param confidence        confidence of the chosen answer
 * @param disclaimer        true when the answer should be displayed with a disclaimer
 * @param lowConfidence     true when the answer is explicitly a low-confidence guess
 * @param degraded          true when the smart path failed and the fast guess was used
 * @param degradationReason reason for degradation (nullable)
 * @param issues            validator findings from the smart path, if any
 */
public record CategorizationResult(
        String category,
        CategorizationSource source,
        ConfidenceResult confidence,
        boolean disclaimer,
        boolean lowConfidence,
        boolean degraded,
        DegradationReason degradationReason,
        List<ValidationIssue> issues
) {
    public CategorizationResult {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
