package com.finbrain.infrastructure.ai.confidence;

import com.finbrain.domain.inference.model.ConfidenceDecision;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.ConfidenceSignals;
import com.finbrain.domain.inference.model.ConfidenceTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines classifier and validation signals into one reliability score and routing decision.
 * <p>
 * {@code score = w1*p + w2*inTaxonomy + w3*wellFormed + w4*agreement}, where {@code p} is the classifier
 * probability calibrated against {@code probabilityCeiling} and boolean signals map to {0,1}.
 * Absent signals contribute 0; the summed weight of absent signals is reported as the
 * {@value #DERATING} factor.
 * <p>
 * Pure function: no I/O, never throws.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    public static final String MODEL_PROBABILITY = "model_probability";
    public static final String CATEGORY_IN_TAXONOMY = "category_in_taxonomy";
    public static final String OUTPUT_WELL_FORMED = "output_well_formed";
    public static final String HISTORICAL_AGREEMENT = "historical_agreement_rate";
    public static final String DERATING = "derating";

    private final ConfidenceProperties properties;

    public ConfidenceResult score(ConfidenceSignals signals) {
        ConfidenceSignals s = signals != null ? signals : new ConfidenceSignals(null, null, null, null);
        Map<String, Double> factors = new LinkedHashMap<>();
        double missingWeight = 0.0;

        Double probability = usable(s.modelProbability());
        if (probability != null) {
            factors.put(MODEL_PROBABILITY, properties.getModelProbabilityWeight() * calibrate(probability));
        } else {
            factors.put(MODEL_PROBABILITY, 0.0);
            missingWeight += properties.getModelProbabilityWeight();
        }

        missingWeight += putBoolean(factors, CATEGORY_IN_TAXONOMY, s.categoryInTaxonomy(),
                properties.getCategoryInTaxonomyWeight());
        missingWeight += putBoolean(factors, OUTPUT_WELL_FORMED, s.outputWellFormed(),
                properties.getOutputWellFormedWeight());

        Double agreement = usable(s.historicalAgreementRate());
        if (agreement != null) {
            factors.put(HISTORICAL_AGREEMENT, properties.getHistoricalAgreementWeight() * agreement);
        } else {
            factors.put(HISTORICAL_AGREEMENT, 0.0);
            missingWeight += properties.getHistoricalAgreementWeight();
        }

        if (missingWeight > 0.0) {
            factors.put(DERATING, round(missingWeight));
        }

        double raw = factors.entrySet().stream()
                .filter(e -> !DERATING.equals(e.getKey()))
                .mapToDouble(Map.Entry::getValue)
                .sum();
        double score = clamp(round(raw));

        ConfidenceTier tier = tierFor(score);
        return new ConfidenceResult(score, tier, factors, decisionFor(tier));
    }

    public ConfidenceTier tierFor(double score) {
        if (score >= properties.getHighThreshold()) {
            return ConfidenceTier.HIGH;
        }
        if (score >= properties.getMediumThreshold()) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    private static ConfidenceDecision decisionFor(ConfidenceTier tier) {
        return switch (tier) {
            case HIGH -> ConfidenceDecision.ACCEPT;
            case MEDIUM -> ConfidenceDecision.ACCEPT_WITH_DISCLAIMER;
            case LOW -> ConfidenceDecision.REJECT;
        };
    }

    private double putBoolean(Map<String, Double> factors, String name, Boolean value, double weight) {
        if (value == null) {
            factors.put(name, 0.0);
            return weight;
        }
        factors.put(name, value ? weight : 0.0);
        return 0.0;
    }

    private double calibrate(double probability) {
        double ceiling = properties.getProbabilityCeiling();
        if (ceiling <= 0.0 || ceiling > 1.0) {
            return probability;
        }
        return Math.min(1.0, probability / ceiling);
    }

    private static Double usable(Double value) {
        if (value == null || value.isNaN()) {
            return null;
        }
        return clamp(value);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
