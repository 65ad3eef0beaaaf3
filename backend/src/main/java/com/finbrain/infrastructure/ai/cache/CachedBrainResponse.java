package com.finbrain.infrastructure.ai.cache;

import com.finbrain.domain.inference.model.BrainResponse;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.LabeledEntry;

import java.time.Instant;
import java.util.List;

/**
 * Cache payload: a validated answer plus the confidence it was scored with.
 */
public record CachedBrainResponse(
        InferenceMode mode,
        String content,
        List<LabeledEntry> entries,
        ConfidenceResult confidence,
        Instant storedAt
) {
    public CachedBrainResponse {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public BrainResponse toResponse() {
        return new BrainResponse(mode, content, entries, false);
    }
}
