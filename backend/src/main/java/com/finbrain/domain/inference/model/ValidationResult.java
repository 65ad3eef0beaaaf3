package com.finbrain.domain.inference.model;

import java.util.List;

/**
 * Result of validating a remote response.
 * <p>
 * When {@code safe} is false for a structured mode, {@code sanitizedContent} must not be persisted or
 * displayed as-is without explicit fallback labeling.
 *
 * @param safe             true only if no check failed
 * @param issues           all findings
 * @param sanitizedContent redacted and corrected content (nullable when nothing was usable)
 * @param entries          parsed entries that survived validation (PARSE mode only)
 */
public record ValidationResult(
        boolean safe,
        List<ValidationIssue> issues,
        String sanitizedContent,
        List<LabeledEntry> entries
) {
    public ValidationResult {
        issues = List.copyOf(issues);
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public boolean has(ValidationIssueType type) {
        return issues.stream().anyMatch(i -> i.type() == type);
    }

    public List<ValidationIssueType> issueTypes() {
        return issues.stream().map(ValidationIssue::type).distinct().toList();
    }
}
