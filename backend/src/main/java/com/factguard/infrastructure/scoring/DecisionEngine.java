package com.factguard.infrastructure.scoring;

import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns violations and the confidence score into approved, flagged or blocked.
 * <p>
 * Violations dominate: a low score alone never blocks. Blocking needs a critical violation,
 * or a high-severity violation with a score under the block threshold backed by a
 * confidently false claim. Degraded components turn an approval into a flag.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionEngine {

    private final ScoringProperties properties;

    public ValidationStatus decide(List<Violation> violations,
                                   double confidenceScore,
                                   List<VerificationResult> verificationResults,
                                   List<String> degradedComponents) {
        ScoringProperties.Thresholds thresholds = properties.getThresholds();

        if (hasSeverity(violations, Severity.CRITICAL)) {
            return ValidationStatus.BLOCKED;
        }
        if (hasSeverity(violations, Severity.HIGH)
                && confidenceScore < thresholds.getBlock()
                && hasConfidentFalseClaim(verificationResults, thresholds.getBlockingFalseConfidence())) {
            return ValidationStatus.BLOCKED;
        }
        if (!violations.isEmpty() || confidenceScore < thresholds.getFlag()) {
            return ValidationStatus.FLAGGED;
        }
        if (!degradedComponents.isEmpty()) {
            log.info("Approval downgraded to flagged, degraded components: {}", degradedComponents);
            return ValidationStatus.FLAGGED;
        }
        return ValidationStatus.APPROVED;
    }

    private boolean hasSeverity(List<Violation> violations, Severity severity) {
        return violations.stream().anyMatch(v -> v.severity() == severity);
    }

    private boolean hasConfidentFalseClaim(List<VerificationResult> results, double minConfidence) {
        return results.stream().anyMatch(r -> r.isFalse() && r.confidence() >= minConfidence);
    }
}
