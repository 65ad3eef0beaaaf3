package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finbrain.domain.inference.model.BrainResponse;
import com.finbrain.domain.inference.model.ClassificationRequest;
import com.finbrain.domain.inference.model.FastPrediction;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.LabeledEntry;
import com.finbrain.domain.inference.model.SourceFacts;
import com.finbrain.domain.inference.service.FastClassifier;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based answers used whenever the remote AI Brain cannot be used. Never calls the network.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackResponder {

    static final String CHAT_MESSAGE = "I can help you manage your finances. "
            + "Ask me about budgeting, saving, or analyzing your spending patterns.";
    static final String NO_DATA_MESSAGE = "Please provide your financial data for analysis.";

    private static final Pattern STORE_NUMBER = Pattern.compile("\\s*#?\\d{4,}.*$");
    private static final Pattern CITY_STATE_ZIP = Pattern.compile("\\s+[A-Z]{2}\\s+\\d{5}");
    private static final Pattern REFERENCE_CODE = Pattern.compile("\\*[A-Z0-9]+");

    private final FastClassifier fastClassifier;
    private final CategoryTaxonomy taxonomy;
    private final ObjectMapper objectMapper;

    public BrainResponse respond(ClassificationRequest request) {
        return switch (request.mode()) {
            case PARSE -> parse(request.query());
            case ANALYZE -> new BrainResponse(InferenceMode.ANALYZE, summarize(request.sourceFacts()), List.of(), true);
            case CHAT -> new BrainResponse(InferenceMode.CHAT, CHAT_MESSAGE, List.of(), true);
        };
    }

    private BrainResponse parse(String description) {
        String category = guessCategory(description);
        List<LabeledEntry> entries = List.of(new LabeledEntry(merchantName(description), category));
        try {
            return new BrainResponse(InferenceMode.PARSE, objectMapper.writeValueAsString(entries), entries, true);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fallback entries", e);
        }
    }

    private String guessCategory(String description) {
        FastPrediction guess;
        try {
            guess = fastClassifier.classify(description);
        } catch (RuntimeException e) {
            log.warn("[FallbackResponder] Fast classifier failed, using {}: {}", CategoryTaxonomy.OTHER, e.getMessage());
            return CategoryTaxonomy.OTHER;
        }
        if (guess == null) {
            return CategoryTaxonomy.OTHER;
        }
        return taxonomy.canonicalize(guess.category()).orElse(CategoryTaxonomy.OTHER);
    }

    static String merchantName(String description) {
        if (description == null || description.isBlank()) {
            return "Unknown";
        }
        String cleaned = STORE_NUMBER.matcher(description).replaceAll("");
        cleaned = CITY_STATE_ZIP.matcher(cleaned).replaceAll("");
        cleaned = REFERENCE_CODE.matcher(cleaned).replaceAll("").strip();
        if (cleaned.isEmpty()) {
            return "Unknown";
        }
        String first = cleaned.split("\\s+")[0];
        return first.substring(0, 1).toUpperCase(Locale.ROOT) + first.substring(1).toLowerCase(Locale.ROOT);
    }

    private String summarize(SourceFacts facts) {
        if (facts.isEmpty()) {
            return NO_DATA_MESSAGE;
        }
        List<String> parts = new ArrayList<>();
        facts.monthlyIncome().ifPresent(income ->
                parts.add("Your monthly income is " + money(income) + "."));

        Map<String, BigDecimal> spending = facts.spendingByCategory();
        facts.totalSpending().ifPresent(total ->
                parts.add("Your total monthly spending is " + money(total) + "."));
        if (!spending.isEmpty()) {
            List<String> top = spending.entrySet().stream()
                    .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                    .limit(3)
                    .map(e -> e.getKey() + " (" + money(e.getValue()) + ")")
                    .toList();
            parts.add("Top spending categories: " + String.join(", ", top) + ".");
        }

        if (facts.asMap().get("goals") instanceof Collection<?> goals) {
            parts.add("You have " + goals.size() + " active goals.");
        }
        return parts.isEmpty() ? "No analysis data available." : String.join(" ", parts);
    }

    private static String money(BigDecimal amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }
}
