package com.factguard.interfaces.api.dto;

import com.factguard.application.audit.AuditTrail;
import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditTrailResponse(
        UUID id,
        String organizationId,
        String query,
        String response,
        String validatedResponse,
        ValidationStatus status,
        double confidenceScore,
        String aiModel,
        String sessionId,
        String explanation,
        long processingTimeMs,
        LocalDateTime createdAt,
        List<Violation> violations,
        List<VerificationResult> verificationResults,
        List<Citation> citations
) {
    public static AuditTrailResponse from(AuditTrail trail) {
        Interaction i = trail.interaction();
        return new AuditTrailResponse(
                i.getId(),
                i.getOrganizationId(),
                i.getQuery(),
                i.getResponse(),
                i.getValidatedResponse(),
                i.getStatus(),
                i.getConfidenceScore(),
                i.getAiModel(),
                i.getSessionId(),
                i.getExplanation(),
                i.getProcessingTimeMs(),
                i.getCreatedAt(),
                trail.violations(),
                trail.verificationResults(),
                trail.citations());
    }
}
