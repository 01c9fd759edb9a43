package com.factguard.domain.rule.model;

/**
 * Immutable per-request snapshot of a company policy.
 */
public record Policy(
        String id,
        String organizationId,
        String name,
        String content,
        String category,
        int priority
) {
}
