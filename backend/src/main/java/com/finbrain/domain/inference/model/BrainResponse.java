package com.finbrain.domain.inference.model;

import java.util.List;

/**
 * Validated (or fallback) answer produced for a {@link ClassificationRequest}.
 *
 * @param mode     mode that produced the answer
 * @param content  sanitized free text, or the sanitized JSON array for PARSE
 * @param entries  labeled entries for PARSE, empty otherwise
 * @param fallback true when the content was produced locally instead of by the remote service
 */
public record BrainResponse(
        InferenceMode mode,
        String content,
        List<LabeledEntry> entries,
        boolean fallback
) {
    public BrainResponse {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public String primaryCategory() {
        return entries.isEmpty() ? null : entries.get(0).category();
    }
}
