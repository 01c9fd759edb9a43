package com.factguard.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes response and query text before analysis:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Typographic quotes and dashes folded to ASCII
 * - Whitespace normalization (collapse runs, trim)
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

    private static final Pattern SMART_DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D\\u201E\\u00AB\\u00BB]");
    private static final Pattern SMART_SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019\\u201A]");

    // En dash, em dash, minus sign, figure dash → hyphen ("7–10 days" → "7-10 days")
    private static final Pattern DASHES = Pattern.compile("[\\u2012\\u2013\\u2014\\u2212]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u00A0]{2,}|\\u00A0");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalize text for analysis while keeping it readable.
     *
     * @param text raw text
     * @return normalized text, or the input itself when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible and control characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 3. Fold typographic punctuation
        result = SMART_DOUBLE_QUOTES.matcher(result).replaceAll("\"");
        result = SMART_SINGLE_QUOTES.matcher(result).replaceAll("'");
        result = DASHES.matcher(result).replaceAll("-");

        // 4. Line endings, spaces, blank lines
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }

    /**
     * Aggressive normalization for cache keys and fingerprints:
     * lowercase, punctuation removed, whitespace collapsed.
     */
    public String normalizeForKey(String text) {
        if (text == null) {
            return "";
        }
        String result = normalize(text).toLowerCase(Locale.ROOT);
        result = NON_WORD.matcher(result).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }
}
