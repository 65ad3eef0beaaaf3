package com.finbrain.infrastructure.ai.validation;

import com.finbrain.domain.inference.model.ValidationIssue;
import com.finbrain.domain.inference.model.ValidationIssueType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks personally identifying substrings in remote output before it is returned or cached.
 * Matched text is never echoed into the issue list.
 */
@Slf4j
@Component
public class PiiRedactor {

    public record RedactionResult(String text, List<ValidationIssue> issues) {
        public boolean redacted() {
            return !issues.isEmpty();
        }
    }

    private record PiiRule(String name, Pattern pattern, String replacement) {}

    // Order matters: wider formats first so that their digits are not re-matched as account numbers
    private static final List<PiiRule> RULES = List.of(
            new PiiRule("email",
                    Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
                    "[EMAIL REDACTED]"),
            new PiiRule("card number",
                    Pattern.compile("\\b(?:\\d{4}[ -]){3}\\d{1,7}\\b"),
                    "[CARD REDACTED]"),
            new PiiRule("ssn",
                    Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
                    "[SSN REDACTED]"),
            new PiiRule("phone",
                    Pattern.compile("(?:\\+?1[-.\\s]?)?\\(?\\b\\d{3}\\)?[-.\\s]\\d{3}[-.\\s]\\d{4}\\b"),
                    "[PHONE REDACTED]"),
            new PiiRule("account number",
                    Pattern.compile("\\b\\d{8,19}\\b"),
                    "[ACCOUNT REDACTED]")
    );

    public RedactionResult redact(String text) {
        if (text == null || text.isEmpty()) {
            return new RedactionResult(text, List.of());
        }

        List<ValidationIssue> issues = new ArrayList<>();
        String result = text;
        for (PiiRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(result);
            int count = 0;
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(rule.replacement()));
                count++;
            }
            if (count > 0) {
                matcher.appendTail(sb);
                result = sb.toString();
                issues.add(ValidationIssue.of(ValidationIssueType.PII_DETECTED,
                        "Redacted " + count + " " + rule.name() + (count > 1 ? " occurrences" : " occurrence")));
            }
        }

        if (!issues.isEmpty()) {
            log.info("[PiiRedactor] {} PII rule(s) matched in remote output", issues.size());
        }
        return new RedactionResult(result, issues);
    }
}
