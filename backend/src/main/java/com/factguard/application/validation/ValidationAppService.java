package com.factguard.application.validation;

import com.factguard.application.validation.exception.AuditPersistenceException;
import com.factguard.domain.validation.model.ValidationInput;
import com.factguard.domain.validation.model.ValidationResult;
import com.factguard.infrastructure.audit.AuditLogger;
import com.factguard.infrastructure.consistency.QueryFingerprinter;
import com.factguard.infrastructure.pipeline.ValidationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationAppService {

    private final ValidationPipeline validationPipeline;
    private final QueryFingerprinter queryFingerprinter;
    private final AuditLogger auditLogger;

    /**
     * Validate a response and persist the audit trail.
     *
     * @throws AuditPersistenceException when the decision was made but could not be saved
     */
    public ValidationOutcome validate(ValidationInput input) {
        long start = System.currentTimeMillis();
        ValidationResult result = validationPipeline.execute(input);
        long elapsed = System.currentTimeMillis() - start;

        try {
            UUID interactionId = auditLogger.save(input, result, queryFingerprinter.fingerprint(input.query()), elapsed);
            return new ValidationOutcome(result, interactionId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Audit write failed for org {} (status {})", input.organizationId(), result.status(), e);
            throw new AuditPersistenceException(result, e);
        }
    }
}
