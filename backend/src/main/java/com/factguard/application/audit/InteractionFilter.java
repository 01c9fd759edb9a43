package com.factguard.application.audit;

import com.factguard.domain.validation.model.ValidationStatus;

import java.time.LocalDateTime;

/**
 * Optional filters for listing interactions. Null fields are ignored.
 */
public record InteractionFilter(
        String organizationId,
        ValidationStatus status,
        String aiModel,
        String sessionId,
        LocalDateTime from,
        LocalDateTime to
) {
}
