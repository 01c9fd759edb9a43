package com.factguard.interfaces.api.dto;

import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.validation.model.ValidationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record InteractionSummaryResponse(
        UUID id,
        String organizationId,
        String query,
        ValidationStatus status,
        double confidenceScore,
        String aiModel,
        String sessionId,
        LocalDateTime createdAt
) {
    public static InteractionSummaryResponse from(Interaction interaction) {
        return new InteractionSummaryResponse(
                interaction.getId(),
                interaction.getOrganizationId(),
                interaction.getQuery(),
                interaction.getStatus(),
                interaction.getConfidenceScore(),
                interaction.getAiModel(),
                interaction.getSessionId(),
                interaction.getCreatedAt());
    }
}
