package com.finbrain.infrastructure.ai.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.LabeledEntry;
import com.finbrain.domain.inference.model.SourceFacts;
import com.finbrain.domain.inference.model.ValidationIssue;
import com.finbrain.domain.inference.model.ValidationIssueType;
import com.finbrain.domain.inference.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based post-processing validator for remote AI Brain output.
 * <p>
 * Checks, in order: structure for the mode, category taxonomy (PARSE), arithmetic against trusted
 * source facts, PII, disallowed financial advice. Every failed check adds an issue and makes the
 * result unsafe. The sanitized content has arithmetic corrected, PII masked and disallowed advice removed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseValidator {

    static final String REMOVED_ADVICE = "[removed]";

    private static final List<Pattern> DISALLOWED_ADVICE = List.of(
            Pattern.compile("\\bguaranteed\\s+(?:returns?|profits?|income|gains?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:risk[- ]free|can't\\s+lose|cannot\\s+lose)\\s+investments?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:evade|evading|avoid\\s+paying|hide\\s+income\\s+from)\\s+(?:your\\s+)?(?:taxes|tax|the\\s+irs)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:skip|stop\\s+paying|ignore)\\s+(?:your\\s+)?(?:rent|mortgage|utility\\s+bills?|utilities|insurance|loan\\s+payments?)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bget[- ]rich[- ]quick\\b", Pattern.CASE_INSENSITIVE)
    );

    private final ObjectMapper objectMapper;
    private final CategoryTaxonomy taxonomy;
    private final ArithmeticVerifier arithmeticVerifier;
    private final PiiRedactor piiRedactor;

    public ValidationResult validate(String rawResponse, InferenceMode mode, SourceFacts sourceFacts) {
        SourceFacts facts = sourceFacts != null ? sourceFacts : SourceFacts.empty();
        ValidationResult result = mode.isStructured()
                ? validateStructured(rawResponse, facts)
                : validateText(rawResponse, facts);

        if (!result.safe()) {
            log.warn("[ResponseValidator] {} output unsafe: {}", mode, result.issueTypes());
        }
        return result;
    }

    private ValidationResult validateText(String raw, SourceFacts facts) {
        if (raw == null || raw.isBlank()) {
            return malformed("Response text is empty");
        }
        List<ValidationIssue> issues = new ArrayList<>();
        String text = sanitize(raw.strip(), facts, issues);
        return new ValidationResult(issues.isEmpty(), issues, text, List.of());
    }

    private ValidationResult validateStructured(String raw, SourceFacts facts) {
        Optional<ArrayNode> items = parseItems(raw);
        if (items.isEmpty()) {
            return malformed("Expected a JSON array of {label, category} objects");
        }
        if (items.get().isEmpty()) {
            return malformed("Response contains no entries");
        }

        List<ValidationIssue> issues = new ArrayList<>();
        List<LabeledEntry> entries = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items.get()) {
            index++;
            JsonNode label = item.get("label");
            if (!item.isObject() || label == null || !label.isTextual() || label.asText().isBlank()) {
                issues.add(ValidationIssue.of(ValidationIssueType.MALFORMED_OUTPUT,
                        "Entry " + index + " has no label"));
                continue;
            }
            // Labels are checked even when the entry is dropped below
            String sanitizedLabel = sanitize(label.asText(), facts, issues);

            JsonNode category = item.get("category");
            String rawCategory = category != null && category.isTextual() ? category.asText() : null;
            Optional<String> canonical = taxonomy.canonicalize(rawCategory);
            if (canonical.isEmpty()) {
                issues.add(new ValidationIssue(ValidationIssueType.UNKNOWN_CATEGORY,
                        "Entry " + index + " has a missing category or one outside the taxonomy", rawCategory));
                continue;
            }
            entries.add(new LabeledEntry(sanitizedLabel, canonical.get()));
        }

        if (entries.isEmpty() && issues.isEmpty()) {
            issues.add(ValidationIssue.of(ValidationIssueType.MALFORMED_OUTPUT, "No usable entries"));
        }
        return new ValidationResult(issues.isEmpty(), issues, serialize(entries), entries);
    }

    private String sanitize(String text, SourceFacts facts, List<ValidationIssue> issues) {
        ArithmeticVerifier.VerificationResult arithmetic = arithmeticVerifier.verify(text, facts);
        issues.addAll(arithmetic.issues());

        PiiRedactor.RedactionResult redaction = piiRedactor.redact(arithmetic.correctedText());
        issues.addAll(redaction.issues());

        return removeDisallowedAdvice(redaction.text(), issues);
    }

    private String removeDisallowedAdvice(String text, List<ValidationIssue> issues) {
        String result = text;
        for (Pattern pattern : DISALLOWED_ADVICE) {
            Matcher m = pattern.matcher(result);
            if (m.find()) {
                issues.add(new ValidationIssue(ValidationIssueType.DISALLOWED_CONTENT,
                        "Disallowed financial advice", m.group()));
                result = m.replaceAll(REMOVED_ADVICE);
            }
        }
        return result;
    }

    /**
     * Accepts a bare array or an object wrapping it as {@code items}.
     */
    private Optional<ArrayNode> parseItems(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(stripCodeFence(raw));
            if (root instanceof ArrayNode array) {
                return Optional.of(array);
            }
            if (root != null && root.isObject() && root.get("items") instanceof ArrayNode array) {
                return Optional.of(array);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("[ResponseValidator] Unparseable structured output: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // Models often wrap JSON in ```json fences
    private static String stripCodeFence(String raw) {
        String trimmed = raw.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).strip();
            }
        }
        return trimmed;
    }

    private String serialize(List<LabeledEntry> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize labeled entries", e);
        }
    }

    private static ValidationResult malformed(String message) {
        return new ValidationResult(false,
                List.of(ValidationIssue.of(ValidationIssueType.MALFORMED_OUTPUT, message)), null, List.of());
    }
}
