package com.finbrain.application.categorization;

import com.finbrain.domain.inference.model.BrainResult;
import com.finbrain.domain.inference.model.CategorizationResult;
import com.finbrain.domain.inference.model.CategorizationSource;
import com.finbrain.domain.inference.model.ClassificationRequest;
import com.finbrain.domain.inference.model.ConfidenceDecision;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.ConfidenceSignals;
import com.finbrain.domain.inference.model.DegradationReason;
import com.finbrain.domain.inference.model.FastPrediction;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.service.FastClassifier;
import com.finbrain.infrastructure.ai.brain.BrainClient;
import com.finbrain.infrastructure.ai.confidence.ConfidenceScorer;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for transaction categorization.
 * <p>
 * The local fast classifier answers whenever the confidence policy accepts its guess. Only rejected
 * guesses go to the remote AI Brain in PARSE mode. If that call degrades, the fast guess is returned
 * marked low-confidence. This operation always answers and never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategorizationOrchestrator {

    private final FastClassifier fastClassifier;
    private final ConfidenceScorer scorer;
    private final CategoryTaxonomy taxonomy;
    private final BrainClient brainClient;
    private final CategoryHistory history;

    public CategorizationResult categorize(String description, Map<String, Object> sourceFacts) {
        FastPrediction fast = classifyFast(description);
        Optional<String> canonical = taxonomy.canonicalize(fast.category());
        String fastCategory = canonical.orElse(CategoryTaxonomy.OTHER);

        ConfidenceResult fastConfidence = scorer.score(new ConfidenceSignals(
                fast.probability(),
                canonical.isPresent(),
                fast.category() != null && !fast.category().isBlank(),
                history.agreementRate(description, fastCategory)));

        if (fastConfidence.decision() != ConfidenceDecision.REJECT) {
            history.recordOutcome(description, fastCategory);
            return new CategorizationResult(fastCategory, CategorizationSource.FAST_PATH, fastConfidence,
                    fastConfidence.needsDisclaimer(), false, false, null, List.of());
        }

        log.debug("[Orchestrator] Fast path rejected ({}), routing to AI Brain", fastConfidence.score());
        BrainResult smart;
        try {
            smart = brainClient.classify(ClassificationRequest.of(InferenceMode.PARSE, description, sourceFacts));
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Smart path failed unexpectedly", e);
            return lowConfidence(fastCategory, fastConfidence, DegradationReason.REMOTE_FAILURE, null);
        }

        String smartCategory = smart.response().primaryCategory();
        if (smart.degraded() || smartCategory == null) {
            DegradationReason reason = smart.degradationReason() != null
                    ? smart.degradationReason() : DegradationReason.VALIDATION_FAILED;
            return lowConfidence(fastCategory, fastConfidence, reason, smart);
        }

        history.recordOutcome(description, smartCategory);
        ConfidenceResult confidence = smart.confidence();
        return new CategorizationResult(smartCategory, CategorizationSource.SMART_PATH, confidence,
                confidence.needsDisclaimer(), confidence.decision() == ConfidenceDecision.REJECT,
                false, null, smart.issues());
    }

    private FastPrediction classifyFast(String description) {
        try {
            FastPrediction prediction = fastClassifier.classify(description);
            return prediction != null ? prediction : new FastPrediction(null, null);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Fast classifier failed: {}", e.getMessage());
            return new FastPrediction(null, null);
        }
    }

    private CategorizationResult lowConfidence(String category, ConfidenceResult confidence,
                                               DegradationReason reason, BrainResult smart) {
        return new CategorizationResult(category, CategorizationSource.FAST_PATH_FALLBACK, confidence,
                true, true, true, reason, smart != null ? smart.issues() : List.of());
    }
}
