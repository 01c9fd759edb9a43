package com.factguard.infrastructure.verification;

import java.util.List;

/**
 * Coarse topic domains used to disambiguate search terms and detect context mismatches.
 */
public enum Topic {

    PROGRAMMING("programming language", List.of(
            "programming", "code", "coding", "language", "software", "framework", "library",
            "javascript", "react", "vue", "angular", "web", "development", "developer", "developers",
            "compiler", "interpreter", "syntax", "api")),

    ANIMAL("animal", List.of(
            "snake", "snakes", "reptile", "reptiles", "genus", "species", "animal", "animals",
            "mammal", "predator", "habitat")),

    FOOD("food", List.of(
            "fruit", "food", "eat", "eating", "cooking", "recipe", "nutrition", "dish",
            "ingredient", "cuisine")),

    ANATOMY("anatomy", List.of(
            "body part", "body", "organ", "anatomy", "muscle", "bone", "tissue"));

    private final String qualifier;
    private final List<String> keywords;

    Topic(String qualifier, List<String> keywords) {
        this.qualifier = qualifier;
        this.keywords = keywords;
    }

    /** Word appended to an ambiguous search term, e.g. "Python programming language". */
    public String qualifier() {
        return qualifier;
    }

    public List<String> keywords() {
        return keywords;
    }
}
