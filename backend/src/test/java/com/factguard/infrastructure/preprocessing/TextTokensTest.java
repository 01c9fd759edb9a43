package com.factguard.infrastructure.preprocessing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextTokensTest {

    @Test
    @DisplayName("Content words skip stopwords and short words, keeping first-seen order")
    void content_words() {
        Set<String> words = TextTokens.contentWords("The Python language is a Python snake's cousin", 3);

        assertThat(words).containsExactly("python", "language", "snake's", "cousin");
    }

    @Test
    @DisplayName("Coverage is the share of source words found in target")
    void coverage() {
        double coverage = TextTokens.coverage(Set.of("python", "language", "guido"), Set.of("python", "guido", "van"));

        assertThat(coverage).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(TextTokens.coverage(Set.of(), Set.of("python"))).isZero();
    }

    @Test
    @DisplayName("Jaccard similarity of word sets")
    void jaccard() {
        assertThat(TextTokens.jaccard(Set.of("a1", "b2"), Set.of("b2", "c3"))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(TextTokens.jaccard(Set.of(), Set.of())).isZero();
    }

    @Test
    @DisplayName("Phrases match on word boundaries only")
    void phrase_word_boundaries() {
        assertThat(TextTokens.containsPhrase("This is a fact.", "act")).isFalse();
        assertThat(TextTokens.containsPhrase("Under the EU AI Act rules", "ai act")).isTrue();
        assertThat(TextTokens.findPhrase("Returns are Guaranteed.", "guaranteed")).isEqualTo(12);
        assertThat(TextTokens.findPhrase("anything", " ")).isEqualTo(-1);
    }
}
