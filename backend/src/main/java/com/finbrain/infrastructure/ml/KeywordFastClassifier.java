package com.finbrain.infrastructure.ml;

import com.finbrain.domain.inference.model.FastPrediction;
import com.finbrain.domain.inference.service.FastClassifier;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merchant keyword classifier. A trained model replaces it by registering a {@code @Primary} bean.
 * <p>
 * The first category whose keyword appears in the description wins. The probability reflects how many
 * keywords of that category matched and whether other categories matched as well.
 */
@Component
public class KeywordFastClassifier implements FastClassifier {

    static final double SINGLE_MATCH = 0.80;
    static final double MULTI_MATCH = 0.92;
    static final double AMBIGUITY_PENALTY = 0.15;
    static final double NO_MATCH = 0.30;

    // Insertion order is precedence
    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("Food Delivery", List.of("DOORDASH", "GRUBHUB", "UBEREATS", "UBER EATS", "POSTMATES", "INSTACART"));
        KEYWORDS.put("Groceries", List.of("WHOLEFDS", "WHOLE FOODS", "TRADER JOE", "COSTCO", "SAFEWAY", "KROGER",
                "PUBLIX", "ALDI", "WEGMANS", "FOOD LION", "GROCERY"));
        KEYWORDS.put("Fast Food", List.of("MCDONALD", "BURGER KING", "WENDY", "TACO BELL", "CHICK-FIL", "CHIPOTLE",
                "SUBWAY", "DOMINO", "PIZZA HUT", "KFC", "POPEYE"));
        KEYWORDS.put("Coffee & Beverages", List.of("STARBUCKS", "DUNKIN", "PEET", "DUTCH BROS", "COFFEE"));
        KEYWORDS.put("Food & Dining", List.of("RESTAURANT", "CAFE", "BISTRO", "GRILL", "KITCHEN", "DINER"));
        KEYWORDS.put("Subscriptions", List.of("SUBSCRIPTION", "MEMBERSHIP", "NETFLIX", "SPOTIFY", "HULU", "DISNEY+"));
        KEYWORDS.put("Shopping & Retail", List.of("AMAZON", "AMZN", "WALMART", "TARGET", "BESTBUY", "BEST BUY"));
        KEYWORDS.put("Transportation", List.of("UBER", "LYFT", "PARKING", "TRANSIT", "METRO"));
        KEYWORDS.put("Gas & Fuel", List.of("SHELL", "CHEVRON", "EXXON", "MOBIL", "ARCO", "FUEL"));
        KEYWORDS.put("Entertainment", List.of("MOVIE", "STEAM", "PLAYSTATION", "XBOX", "AMC", "REGAL", "TICKETMASTER"));
        KEYWORDS.put("Bills & Utilities", List.of("ELECTRIC", "WATER", "INTERNET", "UTILITY", "AT&T", "VERIZON",
                "COMCAST", "XFINITY"));
        KEYWORDS.put("Healthcare", List.of("PHARMACY", "DOCTOR", "MEDICAL", "HOSPITAL", "CLINIC", "CVS", "WALGREEN"));
        KEYWORDS.put("Transfers", List.of("ZELLE", "VENMO", "TRANSFER", "PAYPAL"));
        KEYWORDS.put("Income", List.of("PAYROLL", "DIRECT DEP", "SALARY"));
        KEYWORDS.put("Fees", List.of("OVERDRAFT", "ATM FEE", "SERVICE FEE", "LATE FEE"));
    }

    @Override
    public FastPrediction classify(String text) {
        if (text == null || text.isBlank()) {
            return new FastPrediction(CategoryTaxonomy.OTHER, null);
        }
        String upper = text.toUpperCase(Locale.ROOT);

        String best = null;
        int bestHits = 0;
        int matchedCategories = 0;
        for (Map.Entry<String, List<String>> e : KEYWORDS.entrySet()) {
            int hits = (int) e.getValue().stream().filter(upper::contains).count();
            if (hits == 0) {
                continue;
            }
            matchedCategories++;
            if (best == null) {
                best = e.getKey();
                bestHits = hits;
            }
        }

        if (best == null) {
            return new FastPrediction(CategoryTaxonomy.OTHER, NO_MATCH);
        }
        double probability = bestHits > 1 ? MULTI_MATCH : SINGLE_MATCH;
        if (matchedCategories > 1) {
            probability -= AMBIGUITY_PENALTY;
        }
        return new FastPrediction(best, probability);
    }
}
