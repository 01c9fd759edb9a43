package com.factguard.domain.validation.model;

/**
 * Component scores and the weighted confidence score.
 */
public record ScoreBreakdown(
        double fact,
        double consistency,
        double citation,
        double compliance,
        double clarity,
        double total
) {
}
