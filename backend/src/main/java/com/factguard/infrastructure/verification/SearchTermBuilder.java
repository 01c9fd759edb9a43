package com.factguard.infrastructure.verification;

import com.factguard.infrastructure.preprocessing.TextTokens;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives a search term from a claim, preferring proper-noun phrases, then the subject of
 * an "X is Y" sentence, then the first content words. The query topic disambiguates
 * terms that name several things ("Python" the language vs. the snake).
 */
@Component
@RequiredArgsConstructor
public class SearchTermBuilder {

    private static final int FALLBACK_WORDS = 5;

    private static final Pattern PROPER_NOUN = Pattern.compile(
            "\\b[A-Z][\\p{L}\\p{N}+#.'&-]*(?:\\s+(?:(?:of|de|van|von|der|da|the|and)\\s+)?[A-Z][\\p{L}\\p{N}+#.'&-]*)*"
    );

    private static final Pattern IS_A = Pattern.compile(
            "^(.{2,60}?)\\s+(?:is|was|are|were)\\s+(?:a|an|the)?\\s*(.+)$", Pattern.CASE_INSENSITIVE
    );

    // Capitalized words that open sentences without naming anything
    private static final Set<String> STARTERS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "it", "its", "yes", "no", "in", "on",
            "at", "according", "as", "by", "for", "from", "however", "also", "today", "there",
            "we", "our", "you", "your", "they", "he", "she", "i", "if", "when", "while", "after", "before"
    );

    // Well-known ambiguous names mapped to their encyclopedic titles per topic
    private static final Map<String, Map<Topic, String>> DISAMBIGUATIONS = Map.of(
            "python", Map.of(Topic.PROGRAMMING, "Python (programming language)", Topic.ANIMAL, "Python (genus)"),
            "java", Map.of(Topic.PROGRAMMING, "Java (programming language)", Topic.FOOD, "Java coffee"),
            "react", Map.of(Topic.PROGRAMMING, "React (JavaScript library)"),
            "ruby", Map.of(Topic.PROGRAMMING, "Ruby (programming language)"),
            "rust", Map.of(Topic.PROGRAMMING, "Rust (programming language)"),
            "go", Map.of(Topic.PROGRAMMING, "Go (programming language)"),
            "swift", Map.of(Topic.PROGRAMMING, "Swift (programming language)"),
            "apple", Map.of(Topic.FOOD, "Apple (fruit)")
    );

    private final TopicClassifier topicClassifier;

    /**
     * @param claimText    the claim sentence
     * @param queryContext the original user question (nullable)
     * @return the search term, or empty when nothing usable could be derived
     */
    public Optional<SearchTerm> build(String claimText, String queryContext) {
        Optional<String> subject = properNoun(claimText)
                .or(() -> isASubject(claimText))
                .or(() -> firstWords(claimText));
        if (subject.isEmpty()) {
            return Optional.empty();
        }

        String base = subject.get();
        Optional<Topic> topic = topicClassifier.contextTopic(queryContext, claimText);
        return Optional.of(new SearchTerm(base, disambiguate(base, topic.orElse(null))));
    }

    String disambiguate(String subject, Topic topic) {
        if (topic == null) {
            return subject;
        }
        Map<Topic, String> known = DISAMBIGUATIONS.get(subject.toLowerCase(Locale.ROOT));
        if (known != null && known.containsKey(topic)) {
            return known.get(topic);
        }
        // Single ambiguous words get the topic qualifier; full names are already specific
        boolean singleWord = !subject.contains(" ");
        boolean alreadyQualified = topic.keywords().stream()
                .anyMatch(k -> TextTokens.containsPhrase(subject, k));
        return singleWord && !alreadyQualified ? subject + " " + topic.qualifier() : subject;
    }

    Optional<String> properNoun(String text) {
        Matcher matcher = PROPER_NOUN.matcher(text);
        while (matcher.find()) {
            String phrase = stripStarters(matcher.group().replaceAll("[.]+$", ""));
            if (!phrase.isEmpty()) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }

    Optional<String> isASubject(String text) {
        Matcher matcher = IS_A.matcher(text.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String subject = Arrays.stream(matcher.group(1).split("\\s+"))
                .filter(w -> !STARTERS.contains(w.toLowerCase(Locale.ROOT)))
                .limit(4)
                .collect(Collectors.joining(" "))
                .replaceAll("[^\\p{L}\\p{N} +#-]", "")
                .strip();
        return subject.isEmpty() ? Optional.empty() : Optional.of(subject);
    }

    Optional<String> firstWords(String text) {
        List<String> words = TextTokens.contentWords(text, 3).stream()
                .limit(FALLBACK_WORDS)
                .toList();
        return words.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", words));
    }

    private String stripStarters(String phrase) {
        String[] words = phrase.split("\\s+");
        int start = 0;
        while (start < words.length && STARTERS.contains(words[start].toLowerCase(Locale.ROOT))) {
            start++;
        }
        return String.join(" ", Arrays.copyOfRange(words, start, words.length)).strip();
    }
}
