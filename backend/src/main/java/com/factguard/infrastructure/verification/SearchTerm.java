package com.factguard.infrastructure.verification;

/**
 * Disambiguated search term for a claim.
 *
 * @param subject the entity the claim is about, e.g. "Python"
 * @param query   the term sent to knowledge sources, e.g. "Python (programming language)"
 */
public record SearchTerm(String subject, String query) {
}
