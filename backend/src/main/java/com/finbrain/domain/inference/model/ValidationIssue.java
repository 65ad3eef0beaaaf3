package com.finbrain.domain.inference.model;

/**
 * Individual finding raised while validating a remote response.
 *
 * @param type        the type of validation issue
 * @param message     human-readable description of the issue
 * @param matchedText the text that triggered this issue (nullable, PII is never echoed)
 */
public record ValidationIssue(
        ValidationIssueType type,
        String message,
        String matchedText
) {
    public static ValidationIssue of(ValidationIssueType type, String message) {
        return new ValidationIssue(type, message, null);
    }
}
