package com.finbrain.infrastructure.ai.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.domain.inference.model.LabeledEntry;
import com.finbrain.domain.inference.model.SourceFacts;
import com.finbrain.domain.inference.model.ValidationIssueType;
import com.finbrain.domain.inference.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseValidatorTest {

    private ResponseValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ResponseValidator(new ObjectMapper(), new CategoryTaxonomy(),
                new ArithmeticVerifier(new ValidationProperties()), new PiiRedactor());
    }

    @Nested
    @DisplayName("PARSE mode")
    class Parse {

        @Test
        @DisplayName("Wrong sum inside a label is an arithmetic mismatch")
        void arithmeticInLabel() {
            ValidationResult result = validator.validate(
                    "[{\"label\":\"Starbucks $6.50 + $156.23 = $200.00\"}]", InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isFalse();
            assertThat(result.has(ValidationIssueType.ARITHMETIC_MISMATCH)).isTrue();
        }

        @Test
        void correctedLabelIsKeptWhenCategoryIsKnown() {
            ValidationResult result = validator.validate(
                    "[{\"label\":\"Starbucks $6.50 + $156.23 = $200.00\",\"category\":\"coffee\"}]",
                    InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isFalse();
            assertThat(result.entries()).containsExactly(
                    new LabeledEntry("Starbucks $6.50 + $156.23 = $162.73", "Coffee & Beverages"));
            assertThat(result.sanitizedContent()).contains("162.73").doesNotContain("200.00");
        }

        @Test
        void cleanArrayIsSafeAndCanonicalized() {
            ValidationResult result = validator.validate(
                    "[{\"label\":\"Whole Foods\",\"category\":\"grocery\"},"
                            + "{\"label\":\"Shell\",\"category\":\"Gas & Fuel\"}]",
                    InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isTrue();
            assertThat(result.issues()).isEmpty();
            assertThat(result.entries()).extracting(LabeledEntry::category)
                    .containsExactly("Groceries", "Gas & Fuel");
        }

        @Test
        void itemsWrapperIsAccepted() {
            ValidationResult result = validator.validate(
                    "{\"items\":[{\"label\":\"Netflix\",\"category\":\"Subscriptions\"}]}",
                    InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isTrue();
            assertThat(result.entries()).hasSize(1);
        }

        @Test
        void codeFenceIsStripped() {
            ValidationResult result = validator.validate(
                    "```json\n[{\"label\":\"Uber\",\"category\":\"Transportation\"}]\n```",
                    InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isTrue();
        }

        @Test
        void unknownCategoryIsDroppedNotFabricated() {
            ValidationResult result = validator.validate(
                    "[{\"label\":\"Coinbase\",\"category\":\"Crypto\"},{\"label\":\"Target\",\"category\":\"Shopping\"}]",
                    InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isFalse();
            assertThat(result.issueTypes()).containsExactly(ValidationIssueType.UNKNOWN_CATEGORY);
            assertThat(result.entries()).containsExactly(new LabeledEntry("Target", "Shopping & Retail"));
        }

        @Test
        void proseIsMalformed() {
            ValidationResult result = validator.validate(
                    "Sure! This looks like a coffee purchase.", InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.safe()).isFalse();
            assertThat(result.issueTypes()).containsExactly(ValidationIssueType.MALFORMED_OUTPUT);
            assertThat(result.sanitizedContent()).isNull();
        }

        @Test
        void emptyArrayIsMalformed() {
            ValidationResult result = validator.validate("[]", InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.has(ValidationIssueType.MALFORMED_OUTPUT)).isTrue();
        }

        @Test
        void entryWithoutLabelIsMalformed() {
            ValidationResult result = validator.validate(
                    "[{\"category\":\"Groceries\"}]", InferenceMode.PARSE, SourceFacts.empty());

            assertThat(result.has(ValidationIssueType.MALFORMED_OUTPUT)).isTrue();
            assertThat(result.entries()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Free-text modes")
    class FreeText {

        @Test
        void cleanAnalysisIsSafe() {
            SourceFacts facts = SourceFacts.of(Map.of("spending", Map.of("Groceries", 300, "Dining", 200)));

            ValidationResult result = validator.validate(
                    "Your total spending is $500.00. Dining is your smallest category.",
                    InferenceMode.ANALYZE, facts);

            assertThat(result.safe()).isTrue();
            assertThat(result.sanitizedContent()).isEqualTo(
                    "Your total spending is $500.00. Dining is your smallest category.");
        }

        @Test
        void piiIsMaskedAndFlagged() {
            ValidationResult result = validator.validate(
                    "I emailed the summary to john@example.com.", InferenceMode.CHAT, SourceFacts.empty());

            assertThat(result.safe()).isFalse();
            assertThat(result.has(ValidationIssueType.PII_DETECTED)).isTrue();
            assertThat(result.sanitizedContent()).doesNotContain("john@example.com");
        }

        @Test
        void disallowedAdviceIsRemoved() {
            ValidationResult result = validator.validate(
                    "This fund offers guaranteed returns, so skip your rent this month.",
                    InferenceMode.CHAT, SourceFacts.empty());

            assertThat(result.issueTypes()).containsExactly(ValidationIssueType.DISALLOWED_CONTENT);
            assertThat(result.issues()).hasSize(2);
            assertThat(result.sanitizedContent())
                    .doesNotContainIgnoringCase("guaranteed returns")
                    .doesNotContainIgnoringCase("skip your rent");
        }

        @Test
        void blankTextIsMalformed() {
            ValidationResult result = validator.validate("   ", InferenceMode.CHAT, SourceFacts.empty());

            assertThat(result.issueTypes()).containsExactly(ValidationIssueType.MALFORMED_OUTPUT);
        }
    }
}
