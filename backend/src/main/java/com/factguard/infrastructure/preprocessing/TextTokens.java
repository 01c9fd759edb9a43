package com.factguard.infrastructure.preprocessing;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level helpers shared by the overlap, consistency and policy checks.
 */
public final class TextTokens {

    public static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with",
            "by", "from", "as", "is", "was", "are", "were", "be", "been", "being", "have", "has",
            "had", "do", "does", "did", "will", "would", "should", "could", "may", "might", "must",
            "can", "this", "that", "these", "those", "it", "its", "they", "them", "their", "there",
            "what", "which", "who", "whom", "when", "where", "why", "how", "you", "your", "yours",
            "we", "our", "ours", "i", "me", "my", "he", "she", "his", "her", "not", "no", "yes",
            "so", "than", "then", "too", "very", "just", "also", "about", "into", "over", "under",
            "all", "any", "each", "some", "such", "only", "own", "same", "other", "more", "most",
            "if", "because", "while", "within", "after", "before"
    );

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'-]*");

    private TextTokens() {
    }

    /**
     * Lowercased words of at least {@code minLength} characters that are not stopwords,
     * in order of first appearance.
     */
    public static Set<String> contentWords(String text, int minLength) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() >= minLength && !STOPWORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Share of {@code source} words that also appear in {@code target}. Zero when source is empty.
     */
    public static double coverage(Set<String> source, Set<String> target) {
        if (source.isEmpty()) {
            return 0.0;
        }
        long hits = source.stream().filter(target::contains).count();
        return (double) hits / source.size();
    }

    /**
     * Jaccard similarity of two word sets. Zero when both are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        long intersection = a.stream().filter(b::contains).count();
        return (double) intersection / union.size();
    }

    /**
     * Case-insensitive whole-phrase containment. Phrases match on word boundaries so that
     * "act" does not match "fact".
     */
    public static boolean containsPhrase(String text, String phrase) {
        return findPhrase(text, phrase) >= 0;
    }

    /**
     * Index of the first whole-phrase occurrence, or -1.
     */
    public static int findPhrase(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) {
            return -1;
        }
        Matcher matcher = phrasePattern(phrase).matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }

    public static Pattern phrasePattern(String phrase) {
        String quoted = Pattern.quote(phrase.strip());
        String prefix = Character.isLetterOrDigit(phrase.strip().charAt(0)) ? "(?<![\\p{L}\\p{N}])" : "";
        String last = phrase.strip();
        String suffix = Character.isLetterOrDigit(last.charAt(last.length() - 1)) ? "(?![\\p{L}\\p{N}])" : "";
        return Pattern.compile(prefix + quoted + suffix, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
