package com.finbrain.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes queries before they are sent to the AI Brain or used as cache keys:
 * - Unicode NFKC normalization
 * - Invisible/control character removal
 * - Whitespace collapse and trim
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize a query for transmission. Case is preserved.
     *
     * @param text raw query
     * @return normalized query, or empty string for null input
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");
        return result.strip();
    }

    /**
     * Case-insensitive form used for cache keys, so that "Starbucks  $5" and "starbucks $5" share an entry.
     */
    public String canonicalKey(String text) {
        return normalize(text).toLowerCase(Locale.ROOT);
    }
}
