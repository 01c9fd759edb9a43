package com.factguard.infrastructure.verification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchTermBuilderTest {

    private SearchTermBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SearchTermBuilder(new TopicClassifier());
    }

    @Test
    @DisplayName("Programming question disambiguates Python to the language article")
    void python_programming() {
        SearchTerm term = builder.build("Python was created by Guido van Rossum in 1991.",
                "Tell me about the Python programming language").orElseThrow();

        assertThat(term.subject()).isEqualTo("Python");
        assertThat(term.query()).isEqualTo("Python (programming language)");
    }

    @Test
    @DisplayName("Animal question disambiguates Python to the genus article")
    void python_animal() {
        SearchTerm term = builder.build("Python is a snake.", "What kind of animal is a python?").orElseThrow();

        assertThat(term.query()).isEqualTo("Python (genus)");
    }

    @Test
    @DisplayName("Sentence-opening articles are stripped from proper nouns")
    void starters_stripped() {
        SearchTerm term = builder.build("The Eiffel Tower is in Paris.", null).orElseThrow();

        assertThat(term.subject()).isEqualTo("Eiffel Tower");
        assertThat(term.query()).isEqualTo("Eiffel Tower");
    }

    @Test
    @DisplayName("Without capitalized words the subject of 'X is Y' is used")
    void is_a_subject() {
        assertThat(builder.isASubject("the river nile is the longest river")).contains("river nile");
    }

    @Test
    @DisplayName("Unknown single words get the topic qualifier, full names stay as they are")
    void topic_qualifier() {
        assertThat(builder.disambiguate("Kotlin", Topic.PROGRAMMING)).isEqualTo("Kotlin programming language");
        assertThat(builder.disambiguate("Guido van Rossum", Topic.PROGRAMMING)).isEqualTo("Guido van Rossum");
        assertThat(builder.disambiguate("Kotlin", null)).isEqualTo("Kotlin");
    }

    @Test
    @DisplayName("Text without usable words yields no term")
    void nothing_usable() {
        assertThat(builder.build("it is so.", null)).isEmpty();
    }
}
