package com.factguard.application.audit;

import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ViolationType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Optional filters for listing violations. Null fields are ignored.
 */
public record ViolationFilter(
        String organizationId,
        UUID interactionId,
        ViolationType type,
        Severity severity,
        LocalDateTime from,
        LocalDateTime to
) {
}
