package com.finbrain.domain.inference.model;

/**
 * Inputs to the confidence score. A {@code null} component means the signal is absent.
 *
 * @param modelProbability        probability reported by the classifier, in [0,1]
 * @param categoryInTaxonomy      whether the predicted category belongs to the fixed taxonomy
 * @param outputWellFormed        whether the prediction was structurally well formed
 * @param historicalAgreementRate how often this description previously yielded the same category
 */
public record ConfidenceSignals(
        Double modelProbability,
        Boolean categoryInTaxonomy,
        Boolean outputWellFormed,
        Double historicalAgreementRate
) {
}
