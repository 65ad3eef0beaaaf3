package com.finbrain.infrastructure.ai.confidence;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Confidence policy: signal weights, classifier calibration and tier thresholds.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "finbrain.confidence")
public class ConfidenceProperties {

    private double highThreshold = 0.85;
    private double mediumThreshold = 0.60;

    /** Classifier probability at which the probability signal saturates. */
    private double probabilityCeiling = 0.95;

    private double modelProbabilityWeight = 0.4;
    private double categoryInTaxonomyWeight = 0.2;
    private double outputWellFormedWeight = 0.2;
    private double historicalAgreementWeight = 0.2;
}
