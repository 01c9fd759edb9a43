package com.factguard.domain.validation.model;

import java.util.List;

/**
 * Complete outcome of one validation run.
 *
 * @param status              approved, flagged or blocked
 * @param confidenceScore     weighted score within [0, 1]
 * @param scores              component scores
 * @param claims              extracted claims
 * @param verificationResults one result per claim, in claim order
 * @param violations          every violation found
 * @param citations           checked citations
 * @param correction          corrected text and change log
 * @param validatedResponse   text safe to show: corrected text if it changed, the original if approved, else null
 * @param explanation         human-readable explanation
 * @param degradedComponents  components that fell back to a degraded path
 */
public record ValidationResult(
        ValidationStatus status,
        double confidenceScore,
        ScoreBreakdown scores,
        List<Claim> claims,
        List<VerificationResult> verificationResults,
        List<Violation> violations,
        List<Citation> citations,
        CorrectionResult correction,
        String validatedResponse,
        String explanation,
        List<String> degradedComponents
) {

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public long countByStatus(VerificationStatus verificationStatus) {
        return verificationResults.stream()
                .filter(r -> r.status() == verificationStatus)
                .count();
    }
}
