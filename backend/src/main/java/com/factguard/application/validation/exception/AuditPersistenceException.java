package com.factguard.application.validation.exception;

import com.factguard.domain.validation.model.ValidationResult;
import lombok.Getter;

/**
 * The audit trail could not be written. Carries the completed decision so the caller
 * still receives it alongside the error.
 */
@Getter
public class AuditPersistenceException extends RuntimeException {

    private final transient ValidationResult result;

    public AuditPersistenceException(ValidationResult result, Throwable cause) {
        super("Validation completed but the audit trail could not be saved", cause);
        this.result = result;
    }
}
