package com.finbrain.domain.inference.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the caller-supplied financial facts. These values are trusted; numbers produced by
 * the remote service are recomputed from them.
 * <p>
 * Recognized keys: {@code total_spending}, {@code monthly_income}, {@code spending} (category to amount)
 * and {@code transactions} (list of objects with {@code amount} and optional {@code category}).
 */
public final class SourceFacts {

    private static final SourceFacts EMPTY = new SourceFacts(Map.of());

    private final Map<String, Object> facts;

    private SourceFacts(Map<String, Object> facts) {
        this.facts = facts;
    }

    public static SourceFacts of(Map<String, Object> facts) {
        return facts == null || facts.isEmpty() ? EMPTY : new SourceFacts(facts);
    }

    public static SourceFacts empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }

    public Map<String, Object> asMap() {
        return facts;
    }

    public Optional<BigDecimal> monthlyIncome() {
        return toDecimal(facts.get("monthly_income"));
    }

    /**
     * Total spending: the explicit total when present, otherwise the sum of per-category spending,
     * otherwise the sum of transaction amounts.
     */
    public Optional<BigDecimal> totalSpending() {
        Optional<BigDecimal> explicit = toDecimal(facts.get("total_spending"));
        if (explicit.isPresent()) {
            return explicit;
        }
        Map<String, BigDecimal> byCategory = spendingByCategory();
        if (!byCategory.isEmpty()) {
            return Optional.of(sum(byCategory.values()));
        }
        List<BigDecimal> amounts = transactionAmounts();
        return amounts.isEmpty() ? Optional.empty() : Optional.of(sum(amounts));
    }

    public Optional<BigDecimal> categorySpending(String category) {
        if (category == null) {
            return Optional.empty();
        }
        String wanted = category.trim().toLowerCase(Locale.ROOT);
        Map<String, BigDecimal> byCategory = spendingByCategory();
        for (Map.Entry<String, BigDecimal> e : byCategory.entrySet()) {
            if (e.getKey().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(e.getValue());
            }
        }
        if (!byCategory.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = BigDecimal.ZERO;
        boolean found = false;
        for (Map<?, ?> tx : transactions()) {
            Object txCategory = tx.get("category");
            Optional<BigDecimal> amount = toDecimal(tx.get("amount"));
            if (txCategory != null && amount.isPresent()
                    && txCategory.toString().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                total = total.add(amount.get());
                found = true;
            }
        }
        return found ? Optional.of(total) : Optional.empty();
    }

    public Map<String, BigDecimal> spendingByCategory() {
        Object spending = facts.get("spending");
        if (!(spending instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        map.forEach((k, v) -> toDecimal(v).ifPresent(d -> result.put(String.valueOf(k), d)));
        return result;
    }

    /**
     * Every amount known to the facts, used to check that the operands of a sum are grounded.
     */
    public List<BigDecimal> knownAmounts() {
        List<BigDecimal> amounts = new ArrayList<>(transactionAmounts());
        amounts.addAll(spendingByCategory().values());
        monthlyIncome().ifPresent(amounts::add);
        toDecimal(facts.get("total_spending")).ifPresent(amounts::add);
        return amounts;
    }

    private List<BigDecimal> transactionAmounts() {
        List<BigDecimal> amounts = new ArrayList<>();
        for (Map<?, ?> tx : transactions()) {
            toDecimal(tx.get("amount")).ifPresent(amounts::add);
        }
        return amounts;
    }

    private List<Map<?, ?>> transactions() {
        Object raw = facts.get("transactions");
        if (!(raw instanceof Collection<?> list)) {
            return List.of();
        }
        List<Map<?, ?>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add(map);
            }
        }
        return result;
    }

    private static BigDecimal sum(Collection<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add).setScale(2, RoundingMode.HALF_UP);
    }

    static Optional<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal d) {
            return Optional.of(d);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(new BigDecimal(value.toString())) : Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(new BigDecimal(n.toString()));
        }
        if (value instanceof String s) {
            String cleaned = s.replace("$", "").replace(",", "").trim();
            try {
                return cleaned.isEmpty() ? Optional.empty() : Optional.of(new BigDecimal(cleaned));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
