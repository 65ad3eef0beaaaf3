package com.finbrain.domain.inference.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reliability of a single answer.
 *
 * @param score    combined score, always within [0,1]
 * @param tier     tier derived from the score
 * @param factors  ordered factor name to contribution
 * @param decision routing decision derived from the score
 */
public record ConfidenceResult(
        double score,
        ConfidenceTier tier,
        Map<String, Double> factors,
        ConfidenceDecision decision
) {
    public ConfidenceResult {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        factors = factors != null ? Collections.unmodifiableMap(new LinkedHashMap<>(factors)) : Map.of();
    }

    public boolean needsDisclaimer() {
        return decision != ConfidenceDecision.ACCEPT;
    }
}
