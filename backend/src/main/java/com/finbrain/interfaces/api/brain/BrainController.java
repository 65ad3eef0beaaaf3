package com.finbrain.interfaces.api.brain;

import com.finbrain.application.advice.AdvisorService;
import com.finbrain.application.feedback.FeedbackCollector;
import com.finbrain.domain.inference.model.BrainResult;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.infrastructure.ai.brain.BrainMetricsTracker;
import com.finbrain.infrastructure.ai.cache.BrainResponseCache;
import com.finbrain.infrastructure.ai.resilience.CircuitBreaker;
import com.finbrain.infrastructure.ai.resilience.RequestGate;
import com.finbrain.interfaces.api.dto.AdviceRequest;
import com.finbrain.interfaces.api.dto.AdviceResponse;
import com.finbrain.interfaces.api.dto.ResilienceStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/brain")
@RequiredArgsConstructor
public class BrainController {

    private final AdvisorService advisorService;
    private final CircuitBreaker brainCircuitBreaker;
    private final RequestGate brainRequestGate;
    private final BrainResponseCache cache;
    private final BrainMetricsTracker metrics;
    private final FeedbackCollector feedbackCollector;

    /**
     * Free-text advice. PARSE is served by the categorization endpoint.
     */
    @PostMapping("/{mode}")
    public ResponseEntity<AdviceResponse> advise(@PathVariable String mode,
                                                 @Valid @RequestBody AdviceRequest request) {
        BrainResult result = switch (InferenceMode.fromWireName(mode)) {
            case CHAT -> advisorService.chat(request.query(), request.context());
            case ANALYZE -> advisorService.analyze(request.query(), request.context());
            case PARSE -> throw new IllegalArgumentException("Use /api/v1/categorizations for transaction parsing");
        };
        return ResponseEntity.ok(AdviceResponse.from(result));
    }

    @GetMapping("/resilience")
    public ResponseEntity<ResilienceStatusResponse> resilience() {
        return ResponseEntity.ok(new ResilienceStatusResponse(
                brainCircuitBreaker.snapshot(),
                brainRequestGate.stats(),
                cache.stats(),
                metrics.snapshot(),
                feedbackCollector.stats()));
    }

    @PostMapping("/circuit/reset")
    public ResponseEntity<ResilienceStatusResponse> resetCircuit() {
        log.info("[BrainController] Circuit reset requested");
        brainCircuitBreaker.reset();
        return resilience();
    }
}
