package com.finbrain.domain.inference.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One request to the remote AI Brain. Ephemeral, created per call.
 *
 * @param mode      operating mode
 * @param query     user query or transaction description
 * @param context   recent financial facts supplied by the caller
 * @param createdAt creation time
 */
public record ClassificationRequest(
        InferenceMode mode,
        String query,
        Map<String, Object> context,
        Instant createdAt
) {
    public ClassificationRequest {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        query = query != null ? query : "";
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static ClassificationRequest of(InferenceMode mode, String query, Map<String, Object> context) {
        return new ClassificationRequest(mode, query, context, Instant.now());
    }

    public SourceFacts sourceFacts() {
        return SourceFacts.of(context);
    }
}
