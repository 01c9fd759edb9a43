package com.factguard.infrastructure.extraction;

import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds sentences that assert certainty no source can back up
 * ("crypto always goes up", "guaranteed", "cannot lose").
 * Imperative advice that merely starts with such a word ("Always back up your data.") is ignored.
 */
@Component
@RequiredArgsConstructor
public class AbsoluteLanguageDetector {

    private static final Pattern ABSOLUTE = Pattern.compile(
            "(?<![\\p{L}])(?:always|guaranteed?|guarantees|certainly will|definitely will|cannot lose"
            + "|can't lose|can not lose|risk-free|no risk|sure thing|never fails?|without fail"
            + "|100 percent|every single time)(?![\\p{L}])|\\b100\\s?%",
            Pattern.CASE_INSENSITIVE
    );

    private static final Set<String> IMPERATIVE_OPENERS = Set.of("always", "never fail", "never fails");

    private final TextNormalizer textNormalizer;
    private final SentenceSplitter sentenceSplitter;

    /**
     * @return sentences containing absolute-certainty language, in response order
     */
    public List<AbsoluteAssertion> detect(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return List.of();
        }
        return sentenceSplitter.split(textNormalizer.normalize(responseText)).stream()
                .map(this::toAssertion)
                .filter(Objects::nonNull)
                .toList();
    }

    private AbsoluteAssertion toAssertion(String sentence) {
        Matcher matcher = ABSOLUTE.matcher(sentence);
        while (matcher.find()) {
            String marker = matcher.group().toLowerCase(Locale.ROOT);
            if (matcher.start() == 0 && IMPERATIVE_OPENERS.contains(marker) && isImperative(sentence, matcher.end())) {
                continue;
            }
            return new AbsoluteAssertion(sentence, marker);
        }
        return null;
    }

    // "Always consult a doctor." - the absolute word opens the sentence and a verb follows
    private boolean isImperative(String sentence, int afterWord) {
        String rest = sentence.substring(afterWord).strip();
        return !rest.isEmpty() && Character.isLowerCase(rest.charAt(0));
    }

    /**
     * @param sentence the sentence making the assertion
     * @param marker   the absolute word or phrase found
     */
    public record AbsoluteAssertion(String sentence, String marker) {
    }
}
