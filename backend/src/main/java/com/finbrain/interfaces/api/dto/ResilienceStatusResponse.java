package com.finbrain.interfaces.api.dto;

import com.finbrain.application.feedback.FeedbackStats;
import com.finbrain.domain.inference.model.CircuitSnapshot;
import com.finbrain.domain.inference.model.GateStats;
import com.finbrain.infrastructure.ai.cache.BrainResponseCache.CacheStats;

import java.util.Map;

public record ResilienceStatusResponse(
        CircuitSnapshot circuit,
        GateStats gate,
        CacheStats cache,
        Map<String, Object> calls,
        FeedbackStats feedback
) {}
