package com.factguard.domain.validation.model;

/**
 * One entry of the correction change log.
 *
 * @param type        the violation type that triggered the change
 * @param original    text that was removed or replaced (nullable for appended text)
 * @param replacement text that was inserted (nullable for removals)
 * @param reason      why the change was made
 */
public record CorrectionChange(
        ViolationType type,
        String original,
        String replacement,
        String reason
) {
}
