package com.factguard.domain.validation.model;

/**
 * A problem found in the response.
 *
 * @param type          what kind of check produced it
 * @param severity      content-derived severity
 * @param description   human-readable description
 * @param origin        producing component and reference
 * @param matchedText   the offending text in the response (nullable)
 * @param suggestedText replacement or text to append when correcting (nullable)
 */
public record Violation(
        ViolationType type,
        Severity severity,
        String description,
        ViolationOrigin origin,
        String matchedText,
        String suggestedText
) {

    public Violation withSeverity(Severity newSeverity) {
        return new Violation(type, newSeverity, description, origin, matchedText, suggestedText);
    }
}
