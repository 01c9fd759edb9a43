package com.factguard.interfaces.api.dto;

import com.factguard.domain.validation.model.ValidationInput;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ValidateRequest(
        @NotBlank(message = "Query is required")
        @Size(max = 4000, message = "Query must not exceed 4000 characters")
        String query,

        @NotBlank(message = "Response text is required")
        @Size(max = 20000, message = "Response text must not exceed 20000 characters")
        String responseText,

        @NotBlank(message = "Organization id is required")
        @Size(max = 64, message = "Organization id must not exceed 64 characters")
        String organizationId,

        @NotBlank(message = "AI model is required")
        @Size(max = 100, message = "AI model must not exceed 100 characters")
        String aiModel,

        @Size(max = 100, message = "Session id must not exceed 100 characters")
        String sessionId,

        @Size(max = 50, message = "Industry must not exceed 50 characters")
        String industry
) {
    public ValidationInput toInput() {
        return new ValidationInput(query, responseText, organizationId, aiModel, sessionId, industry);
    }
}
