package com.finbrain.application.categorization;

import com.finbrain.infrastructure.ai.preprocessing.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers which categories each transaction description has resolved to, so that the confidence
 * policy can reward descriptions that consistently yield the same category.
 * <p>
 * Keys are normalized, case-insensitive descriptions. The least recently used descriptions are evicted
 * beyond {@code maxDescriptions}. A user correction weighs as much as {@value #CORRECTION_WEIGHT}
 * accepted predictions.
 */
@Component
public class CategoryHistory {

    static final int CORRECTION_WEIGHT = 3;

    private final TextNormalizer normalizer;
    private final Map<String, Map<String, Integer>> observations;

    public CategoryHistory(TextNormalizer normalizer,
                           @Value("${finbrain.history.max-descriptions:10000}") int maxDescriptions) {
        this.normalizer = normalizer;
        this.observations = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Map<String, Integer>> eldest) {
                return size() > maxDescriptions;
            }
        };
    }

    public void recordOutcome(String description, String category) {
        record(description, category, 1);
    }

    public void recordCorrection(String description, String correctedCategory) {
        record(description, correctedCategory, CORRECTION_WEIGHT);
    }

    /**
     * Share of past outcomes for {@code description} that were {@code category}, or null when the
     * description has never been seen.
     */
    public synchronized Double agreementRate(String description, String category) {
        Map<String, Integer> counts = observations.get(key(description));
        if (counts == null || counts.isEmpty()) {
            return null;
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return (double) counts.getOrDefault(category, 0) / total;
    }

    public synchronized int size() {
        return observations.size();
    }

    private synchronized void record(String description, String category, int weight) {
        if (description == null || description.isBlank() || category == null) {
            return;
        }
        observations.computeIfAbsent(key(description), k -> new HashMap<>())
                .merge(category, weight, Integer::sum);
    }

    private String key(String description) {
        return normalizer.canonicalKey(description);
    }
}
