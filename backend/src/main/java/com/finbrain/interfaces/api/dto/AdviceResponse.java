package com.finbrain.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.finbrain.domain.inference.model.BrainResult;
import com.finbrain.domain.inference.model.ValidationIssue;
import com.finbrain.domain.inference.model.ValidationIssueType;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdviceResponse(
        String mode,
        String content,
        double confidence,
        String tier,
        boolean degraded,
        boolean fromCache,
        String degradationReason,
        List<ValidationIssueType> issues
) {
    public static AdviceResponse from(BrainResult result) {
        return new AdviceResponse(
                result.response().mode().wireName(),
                result.response().content(),
                result.confidence().score(),
                result.confidence().tier().name(),
                result.degraded(),
                result.fromCache(),
                result.degradationReason() != null ? result.degradationReason().name() : null,
                result.issues().isEmpty() ? null
                        : result.issues().stream().map(ValidationIssue::type).distinct().toList());
    }
}
