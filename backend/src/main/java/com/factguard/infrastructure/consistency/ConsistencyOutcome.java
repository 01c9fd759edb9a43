package com.factguard.infrastructure.consistency;

import com.factguard.domain.validation.model.Violation;

import java.util.Optional;

/**
 * @param score       consistency score within [0, 1]
 * @param sampleSize  number of prior responses compared against
 * @param violation   low-severity finding when the score is below the threshold (nullable)
 * @param degraded    the history store could not be read
 */
public record ConsistencyOutcome(double score, int sampleSize, Violation violation, boolean degraded) {

    public Optional<Violation> finding() {
        return Optional.ofNullable(violation);
    }
}
