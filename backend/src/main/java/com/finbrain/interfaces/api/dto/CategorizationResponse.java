package com.finbrain.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.finbrain.domain.inference.model.CategorizationResult;
import com.finbrain.domain.inference.model.ValidationIssue;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategorizationResponse(
        String category,
        String source,
        double confidence,
        String tier,
        Map<String, Double> factors,
        boolean disclaimer,
        boolean lowConfidence,
        boolean degraded,
        String degradationReason,
        List<String> issues
) {
    public static CategorizationResponse from(CategorizationResult result) {
        return new CategorizationResponse(
                result.category(),
                result.source().name(),
                result.confidence().score(),
                result.confidence().tier().name(),
                result.confidence().factors(),
                result.disclaimer(),
                result.lowConfidence(),
                result.degraded(),
                result.degradationReason() != null ? result.degradationReason().name() : null,
                result.issues().isEmpty() ? null : result.issues().stream().map(ValidationIssue::message).toList());
    }
}
