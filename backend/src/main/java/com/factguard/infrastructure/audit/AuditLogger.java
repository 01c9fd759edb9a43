package com.factguard.infrastructure.audit;

import com.factguard.domain.audit.model.CitationRecord;
import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.audit.model.VerificationRecord;
import com.factguard.domain.audit.model.ViolationRecord;
import com.factguard.domain.audit.repository.CitationRecordRepository;
import com.factguard.domain.audit.repository.InteractionRepository;
import com.factguard.domain.audit.repository.VerificationRecordRepository;
import com.factguard.domain.audit.repository.ViolationRecordRepository;
import com.factguard.domain.validation.model.ValidationInput;
import com.factguard.domain.validation.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Persists one validation run as a single unit: the interaction row plus its violations,
 * verification results and citations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogger {

    private final InteractionRepository interactionRepository;
    private final ViolationRecordRepository violationRecordRepository;
    private final VerificationRecordRepository verificationRecordRepository;
    private final CitationRecordRepository citationRecordRepository;

    @Transactional
    public UUID save(ValidationInput input, ValidationResult result, String queryFingerprint, long processingTimeMs) {
        Interaction interaction = interactionRepository.save(Interaction.builder()
                .organizationId(input.organizationId())
                .query(input.query())
                .response(input.responseText())
                .validatedResponse(result.validatedResponse())
                .status(result.status())
                .confidenceScore(result.confidenceScore())
                .aiModel(input.aiModel())
                .sessionId(input.sessionId())
                .queryFingerprint(queryFingerprint)
                .explanation(result.explanation())
                .processingTimeMs(processingTimeMs)
                .build());

        UUID id = interaction.getId();
        violationRecordRepository.saveAll(result.violations().stream()
                .map(v -> new ViolationRecord(id, v))
                .toList());
        verificationRecordRepository.saveAll(result.verificationResults().stream()
                .map(r -> new VerificationRecord(id, r))
                .toList());
        citationRecordRepository.saveAll(result.citations().stream()
                .map(c -> new CitationRecord(id, c))
                .toList());

        log.info("Audit saved - interaction: {}, status: {}, violations: {}, claims: {}",
                id, result.status(), result.violations().size(), result.verificationResults().size());
        return id;
    }
}
