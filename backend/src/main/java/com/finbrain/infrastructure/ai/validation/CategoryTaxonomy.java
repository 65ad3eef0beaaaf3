package com.finbrain.infrastructure.ai.validation;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed spending taxonomy. Categories outside it are never fabricated into results.
 */
@Component
public class CategoryTaxonomy {

    public static final String OTHER = "Other";

    private static final List<String> CATEGORIES = List.of(
            "Groceries",
            "Fast Food",
            "Coffee & Beverages",
            "Food & Dining",
            "Food Delivery",
            "Shopping & Retail",
            "Transportation",
            "Gas & Fuel",
            "Entertainment",
            "Subscriptions",
            "Bills & Utilities",
            "Healthcare",
            "Transfers",
            "Income",
            "Fees",
            OTHER
    );

    // Variations the remote model commonly produces
    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("restaurants", "Food & Dining"),
            Map.entry("dining", "Food & Dining"),
            Map.entry("eating out", "Food & Dining"),
            Map.entry("grocery", "Groceries"),
            Map.entry("supermarket", "Groceries"),
            Map.entry("quick service", "Fast Food"),
            Map.entry("coffee", "Coffee & Beverages"),
            Map.entry("shopping", "Shopping & Retail"),
            Map.entry("retail", "Shopping & Retail"),
            Map.entry("gas", "Gas & Fuel"),
            Map.entry("fuel", "Gas & Fuel"),
            Map.entry("gasoline", "Gas & Fuel"),
            Map.entry("transport", "Transportation"),
            Map.entry("transit", "Transportation"),
            Map.entry("rideshare", "Transportation"),
            Map.entry("subscription", "Subscriptions"),
            Map.entry("streaming", "Subscriptions"),
            Map.entry("utilities", "Bills & Utilities"),
            Map.entry("bills", "Bills & Utilities"),
            Map.entry("health", "Healthcare"),
            Map.entry("pharmacy", "Healthcare"),
            Map.entry("transfer", "Transfers"),
            Map.entry("payment", "Transfers"),
            Map.entry("salary", "Income"),
            Map.entry("paycheck", "Income"),
            Map.entry("fee", "Fees"),
            Map.entry("delivery", "Food Delivery")
    );

    private final Map<String, String> lookup = new LinkedHashMap<>();

    public CategoryTaxonomy() {
        CATEGORIES.forEach(c -> lookup.put(key(c), c));
        ALIASES.forEach((alias, canonical) -> lookup.putIfAbsent(key(alias), canonical));
    }

    public List<String> categories() {
        return CATEGORIES;
    }

    /**
     * Resolve a category name or alias to its canonical form.
     */
    public Optional<String> canonicalize(String category) {
        if (category == null || category.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(key(category)));
    }

    public boolean contains(String category) {
        return canonicalize(category).isPresent();
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
