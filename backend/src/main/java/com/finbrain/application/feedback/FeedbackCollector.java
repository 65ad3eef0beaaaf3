package com.finbrain.application.feedback;

import com.finbrain.application.categorization.CategoryHistory;
import com.finbrain.domain.inference.service.FeedbackHook;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects user category corrections for later retraining.
 * <p>
 * Corrections are aggregated per merchant. A merchant reaches consensus once one category has at least
 * {@code consensusThreshold} corrections and more than half of all corrections for that merchant.
 * Every correction also feeds {@link CategoryHistory}.
 */
@Slf4j
@Component
public class FeedbackCollector implements FeedbackHook {

    private final CategoryHistory history;
    private final CategoryTaxonomy taxonomy;
    private final int consensusThreshold;

    private final Map<String, MerchantCorrections> merchants = new ConcurrentHashMap<>();
    private final AtomicLong totalCorrections = new AtomicLong();
    private final AtomicLong ignoredCorrections = new AtomicLong();

    public FeedbackCollector(CategoryHistory history,
                             CategoryTaxonomy taxonomy,
                             @Value("${finbrain.feedback.consensus-threshold:3}") int consensusThreshold) {
        this.history = history;
        this.taxonomy = taxonomy;
        this.consensusThreshold = consensusThreshold;
    }

    @Async
    @Override
    public void recordCorrection(String originalCategory, String correctedCategory, String description) {
        try {
            record(originalCategory, correctedCategory, description);
        } catch (RuntimeException e) {
            log.error("[FeedbackCollector] Failed to record correction", e);
        }
    }

    void record(String originalCategory, String correctedCategory, String description) {
        Optional<String> corrected = taxonomy.canonicalize(correctedCategory);
        if (corrected.isEmpty() || description == null || description.isBlank()) {
            ignoredCorrections.incrementAndGet();
            log.warn("[FeedbackCollector] Ignoring correction to unknown category or empty description");
            return;
        }
        String original = taxonomy.canonicalize(originalCategory).orElse(originalCategory);
        if (corrected.get().equals(original)) {
            ignoredCorrections.incrementAndGet();
            return;
        }

        totalCorrections.incrementAndGet();
        history.recordCorrection(description, corrected.get());

        String key = merchantKey(description);
        MerchantCorrections aggregate = merchants.computeIfAbsent(key, k -> new MerchantCorrections());
        aggregate.add(corrected.get());
        aggregate.consensus(consensusThreshold).ifPresent(category ->
                log.info("[FeedbackCollector] Consensus for merchant '{}': {}", key, category));
    }

    public Optional<String> consensusFor(String description) {
        MerchantCorrections aggregate = merchants.get(merchantKey(description));
        return aggregate == null ? Optional.empty() : aggregate.consensus(consensusThreshold);
    }

    public FeedbackStats stats() {
        Map<String, String> consensus = new TreeMap<>();
        int pending = 0;
        for (Map.Entry<String, MerchantCorrections> e : merchants.entrySet()) {
            Optional<String> category = e.getValue().consensus(consensusThreshold);
            if (category.isPresent()) {
                consensus.put(e.getKey(), category.get());
            } else {
                pending++;
            }
        }
        return new FeedbackStats(totalCorrections.get(), ignoredCorrections.get(), merchants.size(), pending,
                consensus);
    }

    /**
     * Letters only, lowercased, first three words: "STARBUCKS STORE #1234 SEATTLE" becomes
     * "starbucks store seattle".
     */
    static String merchantKey(String description) {
        String letters = description == null ? "" : description.replaceAll("[^A-Za-z\\s]", " ");
        String[] words = letters.toLowerCase(Locale.ROOT).trim().split("\\s+");
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < Math.min(3, words.length); i++) {
            if (words[i].isEmpty()) {
                continue;
            }
            if (key.length() > 0) {
                key.append(' ');
            }
            key.append(words[i]);
        }
        return key.toString();
    }

    private static final class MerchantCorrections {

        private final Map<String, Integer> counts = new HashMap<>();
        private int total;

        synchronized void add(String category) {
            counts.merge(category, 1, Integer::sum);
            total++;
        }

        synchronized Optional<String> consensus(int threshold) {
            return counts.entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .filter(top -> top.getValue() >= threshold && top.getValue() * 2 > total)
                    .map(Map.Entry::getKey);
        }
    }
}
