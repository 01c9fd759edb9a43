package com.factguard.interfaces.api.dto;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.CorrectionChange;
import com.factguard.domain.validation.model.CorrectionResult;
import com.factguard.domain.validation.model.ScoreBreakdown;
import com.factguard.domain.validation.model.ValidationResult;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateResponse(
        ValidationStatus status,
        double confidenceScore,
        ScoreBreakdown scores,
        List<Violation> violations,
        List<VerificationResult> verificationResults,
        List<Citation> citations,
        String correctedResponse,
        String validatedResponse,
        List<CorrectionChange> changes,
        String explanation,
        List<String> degradedComponents,
        UUID interactionId,
        ErrorResponse error
) {

    public static ValidateResponse from(ValidationResult result, UUID interactionId) {
        return of(result, interactionId, null);
    }

    /**
     * Decision body returned with a 5xx when the audit trail could not be saved.
     */
    public static ValidateResponse withError(ValidationResult result, ErrorResponse error) {
        return of(result, null, error);
    }

    private static ValidateResponse of(ValidationResult result, UUID interactionId, ErrorResponse error) {
        CorrectionResult correction = result.correction();
        boolean corrected = correction != null && (!correction.changes().isEmpty() || correction.rewrittenByModel());

        return new ValidateResponse(
                result.status(),
                result.confidenceScore(),
                result.scores(),
                result.violations(),
                result.verificationResults(),
                result.citations(),
                corrected ? correction.correctedText() : null,
                result.validatedResponse(),
                correction != null ? correction.changes() : List.of(),
                result.explanation(),
                result.degradedComponents(),
                interactionId,
                error);
    }
}
