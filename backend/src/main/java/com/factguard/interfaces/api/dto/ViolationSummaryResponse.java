package com.factguard.interfaces.api.dto;

import com.factguard.domain.audit.model.ViolationRecord;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ViolationType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationSummaryResponse(
        Long id,
        UUID interactionId,
        ViolationType type,
        Severity severity,
        String description,
        String matchedText,
        LocalDateTime createdAt
) {
    public static ViolationSummaryResponse from(ViolationRecord record) {
        return new ViolationSummaryResponse(
                record.getId(),
                record.getInteractionId(),
                record.getViolationType(),
                record.getSeverity(),
                record.getDescription(),
                record.getMatchedText(),
                record.getCreatedAt());
    }
}
