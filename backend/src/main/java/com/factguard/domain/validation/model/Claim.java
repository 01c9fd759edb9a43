package com.factguard.domain.validation.model;

/**
 * A checkable factual statement extracted from a response.
 *
 * @param text            the sentence the claim was taken from
 * @param kind            coarse category from keyword heuristics
 * @param hasNumber       the sentence contains a number
 * @param hasDate         the sentence contains a date or year
 * @param hasEntity       the sentence contains a capitalized multi-word entity
 * @param hasSpecificFact the sentence contains a specific-fact phrase ("founded in", ...)
 */
public record Claim(
        String text,
        ClaimKind kind,
        boolean hasNumber,
        boolean hasDate,
        boolean hasEntity,
        boolean hasSpecificFact
) {
}
