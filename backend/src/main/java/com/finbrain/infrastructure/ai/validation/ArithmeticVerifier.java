package com.finbrain.infrastructure.ai.validation;

import com.finbrain.domain.inference.model.SourceFacts;
import com.finbrain.domain.inference.model.ValidationIssue;
import com.finbrain.domain.inference.model.ValidationIssueType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recomputes every numeric aggregate embedded in remote output from trusted source facts.
 * <p>
 * Labels and categories from the remote service are trusted; its arithmetic never is. Each stated
 * aggregate that differs from the recomputed value beyond tolerance, or that cannot be recomputed at all,
 * is reported as {@link ValidationIssueType#ARITHMETIC_MISMATCH} and replaced in the corrected text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArithmeticVerifier {

    public static final String UNVERIFIED = "[unverified amount]";

    public record VerificationResult(String correctedText, List<ValidationIssue> issues) {}

    private record Replacement(int start, int end, String text) {}

    private static final String AMOUNT = "\\$?\\s?\\d[\\d,]*(?:\\.\\d+)?";

    // "$6.50 + $156.23 = $200.00"
    private static final Pattern SUM_EXPRESSION = Pattern.compile(
            "(" + AMOUNT + "(?:\\s*\\+\\s*" + AMOUNT + ")+)\\s*=\\s*(" + AMOUNT + ")");

    // "total spending is $1,234.56", "total: $80"
    private static final Pattern TOTAL_STATEMENT = Pattern.compile(
            "\\btotal(?:\\s+(?:monthly\\s+)?(?:spending|spend|spent|expenses|outflow))?"
                    + "(?:\\s+(?:is|was|of|comes\\s+to|came\\s+to|amounts\\s+to|equals))?\\s*[:=]?\\s*(\\$\\s?\\d[\\d,]*(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);

    // "spent $412.10 on Groceries"
    private static final Pattern CATEGORY_TOTAL = Pattern.compile(
            "\\bspent\\s+(\\$\\s?\\d[\\d,]*(?:\\.\\d+)?)\\s+on\\s+([A-Za-z][A-Za-z&' ]*)",
            Pattern.CASE_INSENSITIVE);

    // "23% of your spending goes to Groceries"
    private static final Pattern PERCENT_SHARE = Pattern.compile(
            "(\\d{1,3}(?:\\.\\d+)?)\\s*%\\s+of\\s+(?:your\\s+)?(?:total\\s+)?(?:monthly\\s+)?"
                    + "(spending|expenses|budget|income)\\s+(?:is\\s+)?(?:on|for|goes\\s+to|went\\s+to|spent\\s+on)\\s+"
                    + "([A-Za-z][A-Za-z&' ]*)",
            Pattern.CASE_INSENSITIVE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final ValidationProperties properties;

    public VerificationResult verify(String text, SourceFacts facts) {
        if (text == null || text.isBlank()) {
            return new VerificationResult(text, List.of());
        }
        SourceFacts trusted = facts != null ? facts : SourceFacts.empty();
        List<ValidationIssue> issues = new ArrayList<>();
        List<Replacement> replacements = new ArrayList<>();

        checkSumExpressions(text, trusted, issues, replacements);
        checkTotals(text, trusted, issues, replacements);
        checkCategoryTotals(text, trusted, issues, replacements);
        checkPercentShares(text, trusted, issues, replacements);

        if (!issues.isEmpty()) {
            log.warn("[ArithmeticVerifier] {} aggregate(s) failed recomputation", issues.size());
        }
        return new VerificationResult(apply(text, replacements), issues);
    }

    private void checkSumExpressions(String text, SourceFacts facts,
                                     List<ValidationIssue> issues, List<Replacement> replacements) {
        Matcher m = SUM_EXPRESSION.matcher(text);
        while (m.find()) {
            List<BigDecimal> operands = new ArrayList<>();
            for (String operand : m.group(1).split("\\+")) {
                parseAmount(operand).ifPresent(operands::add);
            }
            Optional<BigDecimal> stated = parseAmount(m.group(2));
            if (stated.isEmpty() || operands.isEmpty()) {
                continue;
            }
            BigDecimal expected = scale(operands.stream().reduce(BigDecimal.ZERO, BigDecimal::add));

            if (!facts.isEmpty()) {
                for (BigDecimal operand : operands) {
                    if (!grounded(operand, facts)) {
                        issues.add(new ValidationIssue(ValidationIssueType.ARITHMETIC_MISMATCH,
                                "Operand " + format(operand) + " does not appear in the source facts",
                                m.group()));
                    }
                }
            }

            if (differs(stated.get(), expected, properties.getAmountTolerance())) {
                issues.add(new ValidationIssue(ValidationIssueType.ARITHMETIC_MISMATCH,
                        "Stated sum " + format(stated.get()) + " does not match recomputed " + format(expected),
                        m.group()));
                replacements.add(new Replacement(m.start(2), m.end(2), "$" + format(expected)));
            }
        }
    }

    private void checkTotals(String text, SourceFacts facts,
                             List<ValidationIssue> issues, List<Replacement> replacements) {
        Matcher m = TOTAL_STATEMENT.matcher(text);
        while (m.find()) {
            if (overlaps(m.start(1), m.end(1), replacements)) {
                continue;
            }
            Optional<BigDecimal> stated = parseAmount(m.group(1));
            if (stated.isEmpty()) {
                continue;
            }
            Optional<BigDecimal> expected = facts.totalSpending().map(ArithmeticVerifier::scale);
            verifyAgainst(m, 1, stated.get(), expected, "total", properties.getAmountTolerance(), true,
                    issues, replacements);
        }
    }

    private void checkCategoryTotals(String text, SourceFacts facts,
                                     List<ValidationIssue> issues, List<Replacement> replacements) {
        Matcher m = CATEGORY_TOTAL.matcher(text);
        while (m.find()) {
            if (overlaps(m.start(1), m.end(1), replacements)) {
                continue;
            }
            Optional<BigDecimal> stated = parseAmount(m.group(1));
            if (stated.isEmpty()) {
                continue;
            }
            Optional<BigDecimal> expected = resolveCategory(m.group(2), facts).map(ArithmeticVerifier::scale);
            verifyAgainst(m, 1, stated.get(), expected, "category total", properties.getAmountTolerance(), true,
                    issues, replacements);
        }
    }

    private void checkPercentShares(String text, SourceFacts facts,
                                    List<ValidationIssue> issues, List<Replacement> replacements) {
        Matcher m = PERCENT_SHARE.matcher(text);
        while (m.find()) {
            if (overlaps(m.start(1), m.end(1), replacements)) {
                continue;
            }
            Optional<BigDecimal> stated = parseAmount(m.group(1));
            if (stated.isEmpty()) {
                continue;
            }
            Optional<BigDecimal> base = "income".equalsIgnoreCase(m.group(2))
                    ? facts.monthlyIncome()
                    : facts.totalSpending();
            Optional<BigDecimal> part = resolveCategory(m.group(3), facts);

            Optional<BigDecimal> expected = Optional.empty();
            if (base.isPresent() && part.isPresent() && base.get().signum() != 0) {
                expected = Optional.of(part.get().multiply(HUNDRED).divide(base.get(), 2, RoundingMode.HALF_UP));
            }
            verifyAgainst(m, 1, stated.get(), expected, "percentage", properties.getPercentTolerance(), false,
                    issues, replacements);
        }
    }

    private void verifyAgainst(Matcher m, int group, BigDecimal stated, Optional<BigDecimal> expected,
                               String kind, BigDecimal tolerance, boolean currency,
                               List<ValidationIssue> issues, List<Replacement> replacements) {
        if (expected.isEmpty()) {
            issues.add(new ValidationIssue(ValidationIssueType.ARITHMETIC_MISMATCH,
                    "Stated " + kind + " " + format(stated) + " cannot be recomputed from the source facts",
                    m.group()));
            replacements.add(new Replacement(m.start(group), m.end(group), UNVERIFIED));
            return;
        }
        if (differs(stated, expected.get(), tolerance)) {
            issues.add(new ValidationIssue(ValidationIssueType.ARITHMETIC_MISMATCH,
                    "Stated " + kind + " " + format(stated) + " does not match recomputed " + format(expected.get()),
                    m.group()));
            String corrected = currency ? "$" + format(expected.get()) : format(expected.get());
            replacements.add(new Replacement(m.start(group), m.end(group), corrected));
        }
    }

    /**
     * Longest leading run of words that names a category present in the facts.
     */
    private Optional<BigDecimal> resolveCategory(String phrase, SourceFacts facts) {
        String[] words = phrase.trim().split("\\s+");
        for (int n = words.length; n > 0; n--) {
            String candidate = String.join(" ", Arrays.copyOfRange(words, 0, n));
            Optional<BigDecimal> amount = facts.categorySpending(candidate);
            if (amount.isPresent()) {
                return amount;
            }
        }
        return Optional.empty();
    }

    private boolean grounded(BigDecimal operand, SourceFacts facts) {
        return facts.knownAmounts().stream()
                .anyMatch(known -> !differs(operand, known.abs(), properties.getAmountTolerance())
                        || !differs(operand, known, properties.getAmountTolerance()));
    }

    private static boolean differs(BigDecimal stated, BigDecimal expected, BigDecimal tolerance) {
        return stated.subtract(expected).abs().compareTo(tolerance) > 0;
    }

    private static boolean overlaps(int start, int end, List<Replacement> replacements) {
        return replacements.stream().anyMatch(r -> start < r.end() && r.start() < end);
    }

    // Right-to-left so earlier offsets stay valid
    private static String apply(String text, List<Replacement> replacements) {
        if (replacements.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text);
        replacements.stream()
                .sorted(Comparator.comparingInt(Replacement::start).reversed())
                .forEach(r -> sb.replace(r.start(), r.end(), r.text()));
        return sb.toString();
    }

    static Optional<BigDecimal> parseAmount(String raw) {
        String cleaned = raw.replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static String format(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
