package com.finbrain.application.advice;

import com.finbrain.domain.inference.model.BrainResult;
import com.finbrain.domain.inference.model.ClassificationRequest;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.infrastructure.ai.brain.BrainClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Free-text financial advice through the AI Brain. Always answers; degraded answers carry the
 * rule-based fallback text.
 */
@Service
@RequiredArgsConstructor
public class AdvisorService {

    private final BrainClient brainClient;

    public BrainResult chat(String message, Map<String, Object> context) {
        return brainClient.classify(ClassificationRequest.of(InferenceMode.CHAT, message, context));
    }

    public BrainResult analyze(String request, Map<String, Object> context) {
        return brainClient.classify(ClassificationRequest.of(InferenceMode.ANALYZE, request, context));
    }
}
