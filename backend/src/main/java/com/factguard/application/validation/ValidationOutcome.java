package com.factguard.application.validation;

import com.factguard.domain.validation.model.ValidationResult;

import java.util.UUID;

public record ValidationOutcome(ValidationResult result, UUID interactionId) {
}
