package com.factguard.application.validation;

import com.factguard.application.validation.exception.AuditPersistenceException;
import com.factguard.domain.validation.model.ScoreBreakdown;
import com.factguard.domain.validation.model.ValidationInput;
import com.factguard.domain.validation.model.ValidationResult;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.infrastructure.audit.AuditLogger;
import com.factguard.infrastructure.consistency.QueryFingerprinter;
import com.factguard.infrastructure.pipeline.ValidationPipeline;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationAppServiceTest {

    private static final ValidationInput INPUT = new ValidationInput(
            "Who created Python?", "Guido van Rossum created Python.", "acme", "gpt-4o", null, null);

    private static final ValidationResult RESULT = new ValidationResult(
            ValidationStatus.APPROVED, 0.8, new ScoreBreakdown(0.6, 0.9, 1.0, 1.0, 0.8, 0.8),
            List.of(), List.of(), List.of(), List.of(), null,
            "Guido van Rossum created Python.", "Response approved", List.of());

    @Mock
    private ValidationPipeline validationPipeline;

    @Mock
    private AuditLogger auditLogger;

    private QueryFingerprinter queryFingerprinter;
    private ValidationAppService service;

    @BeforeEach
    void setUp() {
        queryFingerprinter = new QueryFingerprinter(new TextNormalizer());
        service = new ValidationAppService(validationPipeline, queryFingerprinter, auditLogger);
    }

    @Test
    void validate_returns_result_with_saved_interaction_id() {
        UUID id = UUID.randomUUID();
        when(validationPipeline.execute(INPUT)).thenReturn(RESULT);
        when(auditLogger.save(eq(INPUT), eq(RESULT), eq(queryFingerprinter.fingerprint(INPUT.query())), anyLong()))
                .thenReturn(id);

        ValidationOutcome outcome = service.validate(INPUT);

        assertThat(outcome.result()).isSameAs(RESULT);
        assertThat(outcome.interactionId()).isEqualTo(id);
    }

    @Test
    void validate_keeps_the_decision_when_the_audit_write_fails() {
        when(validationPipeline.execute(INPUT)).thenReturn(RESULT);
        when(auditLogger.save(eq(INPUT), eq(RESULT), eq(queryFingerprinter.fingerprint(INPUT.query())), anyLong()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.validate(INPUT))
                .isInstanceOf(AuditPersistenceException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class)
                .satisfies(e -> assertThat(((AuditPersistenceException) e).getResult()).isSameAs(RESULT));
    }
}
