package com.factguard.domain.verification.model;

/**
 * Knowledge source categories in verification priority order (first wins).
 */
public enum SourceTier {
    ENCYCLOPEDIC,
    INSTANT_ANSWER,
    NEWS
}
