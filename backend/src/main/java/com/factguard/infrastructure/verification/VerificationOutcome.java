package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.VerificationResult;

import java.util.List;

/**
 * @param results  one result per claim, in claim order
 * @param degraded true when the phase timed out or was interrupted before every lookup finished
 */
public record VerificationOutcome(List<VerificationResult> results, boolean degraded) {

    public static VerificationOutcome empty() {
        return new VerificationOutcome(List.of(), false);
    }
}
