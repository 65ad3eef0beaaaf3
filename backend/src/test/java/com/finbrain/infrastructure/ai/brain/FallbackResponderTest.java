package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finbrain.domain.inference.model.BrainResponse;
import com.finbrain.domain.inference.model.ClassificationRequest;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.LabeledEntry;
import com.finbrain.infrastructure.ai.validation.CategoryTaxonomy;
import com.finbrain.infrastructure.ml.KeywordFastClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackResponderTest {

    private final FallbackResponder responder =
            new FallbackResponder(new KeywordFastClassifier(), new CategoryTaxonomy(), new ObjectMapper());

    @Nested
    @DisplayName("PARSE")
    class Parse {

        @Test
        void guessesCategoryFromKeywords() {
            BrainResponse response = responder.respond(
                    ClassificationRequest.of(InferenceMode.PARSE, "STARBUCKS STORE 12345 SEATTLE WA 98101", Map.of()));

            assertThat(response.fallback()).isTrue();
            assertThat(response.entries()).containsExactly(new LabeledEntry("Starbucks", "Coffee & Beverages"));
            assertThat(response.content()).isEqualTo("[{\"label\":\"Starbucks\",\"category\":\"Coffee & Beverages\"}]");
        }

        @Test
        void unknownMerchantIsOther() {
            BrainResponse response = responder.respond(
                    ClassificationRequest.of(InferenceMode.PARSE, "ZZQX*AB12 HOLDINGS", Map.of()));

            assertThat(response.primaryCategory()).isEqualTo(CategoryTaxonomy.OTHER);
        }

        @Test
        @DisplayName("A failing fast classifier yields Other instead of an exception")
        void failingClassifier() {
            FallbackResponder failing = new FallbackResponder(text -> {
                throw new IllegalStateException("model not loaded");
            }, new CategoryTaxonomy(), new ObjectMapper());

            BrainResponse response = failing.respond(
                    ClassificationRequest.of(InferenceMode.PARSE, "STARBUCKS #1234", Map.of()));

            assertThat(response.entries()).containsExactly(new LabeledEntry("Starbucks", CategoryTaxonomy.OTHER));
        }

        @Test
        @DisplayName("A fast classifier with no answer yields Other")
        void silentClassifier() {
            FallbackResponder silent = new FallbackResponder(text -> null, new CategoryTaxonomy(), new ObjectMapper());

            BrainResponse response = silent.respond(
                    ClassificationRequest.of(InferenceMode.PARSE, "STARBUCKS #1234", Map.of()));

            assertThat(response.primaryCategory()).isEqualTo(CategoryTaxonomy.OTHER);
            assertThat(response.fallback()).isTrue();
        }
    }

    @Test
    void merchantNameStripsStoreNumbersAndCodes() {
        assertThat(FallbackResponder.merchantName("AMAZON*MK12AB3 #98765")).isEqualTo("Amazon");
        assertThat(FallbackResponder.merchantName("  ")).isEqualTo("Unknown");
        assertThat(FallbackResponder.merchantName("#123456")).isEqualTo("Unknown");
    }

    @Nested
    @DisplayName("ANALYZE")
    class Analyze {

        @Test
        void summarizesTrustedFacts() {
            Map<String, Object> spending = new LinkedHashMap<>();
            spending.put("Groceries", 400);
            spending.put("Food & Dining", 250.5);
            spending.put("Transportation", 120);
            spending.put("Entertainment", 60);
            Map<String, Object> facts = Map.of("monthly_income", 5000, "spending", spending,
                    "goals", List.of("emergency fund"));

            BrainResponse response = responder.respond(
                    ClassificationRequest.of(InferenceMode.ANALYZE, "how am I doing", facts));

            assertThat(response.content())
                    .contains("Your monthly income is $5,000.00.")
                    .contains("Your total monthly spending is $830.50.")
                    .contains("Top spending categories: Groceries ($400.00), Food & Dining ($250.50), "
                            + "Transportation ($120.00).")
                    .contains("You have 1 active goals.")
                    .doesNotContain("Entertainment");
        }

        @Test
        void asksForDataWhenNoneIsGiven() {
            BrainResponse response = responder.respond(
                    ClassificationRequest.of(InferenceMode.ANALYZE, "how am I doing", Map.of()));

            assertThat(response.content()).isEqualTo(FallbackResponder.NO_DATA_MESSAGE);
        }
    }

    @Test
    void chatGetsGenericHelp() {
        BrainResponse response = responder.respond(ClassificationRequest.of(InferenceMode.CHAT, "hello", Map.of()));

        assertThat(response.content()).isEqualTo(FallbackResponder.CHAT_MESSAGE);
        assertThat(response.entries()).isEmpty();
    }
}
