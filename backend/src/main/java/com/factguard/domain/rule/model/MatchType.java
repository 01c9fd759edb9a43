package com.factguard.domain.rule.model;

/**
 * Discriminator selecting the evaluator applied after the required/forbidden text checks.
 */
public enum MatchType {
    /** Any listed keyword present fails the rule. */
    KEYWORD,
    /** Any listed regular expression matching (case-insensitive) fails the rule. */
    PATTERN,
    /** Reserved. Evaluated as KEYWORD until a semantic model is wired in. */
    SEMANTIC
}
