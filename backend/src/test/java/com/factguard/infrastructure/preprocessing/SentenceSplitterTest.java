package com.factguard.infrastructure.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceSplitterTest {

    private SentenceSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new SentenceSplitter();
    }

    @Test
    @DisplayName("Splits on terminal punctuation")
    void splits_on_punctuation() {
        List<String> sentences = splitter.split("Python is a language. Is it fast? It is popular!");

        assertThat(sentences).containsExactly("Python is a language.", "Is it fast?", "It is popular!");
    }

    @Test
    @DisplayName("Decimal numbers do not end a sentence")
    void decimals_kept() {
        List<String> sentences = splitter.split("Version 3.12 was released in 2023. It is faster.");

        assertThat(sentences).containsExactly("Version 3.12 was released in 2023.", "It is faster.");
    }

    @Test
    @DisplayName("Initials and abbreviations do not end a sentence")
    void abbreviations_kept() {
        List<String> sentences = splitter.split("The U.S. market grew. Dr. Smith agreed, e.g. in interviews.");

        assertThat(sentences).containsExactly("The U.S. market grew.", "Dr. Smith agreed, e.g. in interviews.");
    }

    @Test
    @DisplayName("Line breaks always end a sentence")
    void line_breaks_split() {
        List<String> sentences = splitter.split("First line without stop\nSecond line.");

        assertThat(sentences).containsExactly("First line without stop", "Second line.");
    }

    @Test
    @DisplayName("Blank input yields no sentences")
    void blank_input() {
        assertThat(splitter.split(null)).isEmpty();
        assertThat(splitter.split("   ")).isEmpty();
    }
}
