package com.factguard.infrastructure.citation;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.Violation;

import java.util.List;

/**
 * @param citations  every URL found in the response, in order of appearance
 * @param violations one citation violation per invalid URL
 */
public record CitationOutcome(List<Citation> citations, List<Violation> violations) {

    public static CitationOutcome empty() {
        return new CitationOutcome(List.of(), List.of());
    }

    public long validCount() {
        return citations.stream().filter(Citation::valid).count();
    }
}
