package com.factguard.application.audit;

import com.factguard.application.audit.exception.InteractionNotFoundException;
import com.factguard.domain.audit.model.CitationRecord;
import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.audit.model.VerificationRecord;
import com.factguard.domain.audit.model.ViolationRecord;
import com.factguard.domain.audit.repository.CitationRecordRepository;
import com.factguard.domain.audit.repository.InteractionRepository;
import com.factguard.domain.audit.repository.VerificationRecordRepository;
import com.factguard.domain.audit.repository.ViolationRecordRepository;
import com.factguard.domain.audit.repository.ViolationSpecifications;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import static com.factguard.domain.audit.repository.InteractionSpecifications.*;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuditQueryService {

    private static final LocalDateTime EPOCH = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final InteractionRepository interactionRepository;
    private final ViolationRecordRepository violationRecordRepository;
    private final VerificationRecordRepository verificationRecordRepository;
    private final CitationRecordRepository citationRecordRepository;

    public AuditTrail getTrail(UUID interactionId) {
        Interaction interaction = interactionRepository.findById(interactionId)
                .orElseThrow(() -> new InteractionNotFoundException(interactionId));

        return new AuditTrail(
                interaction,
                violationRecordRepository.findByInteractionIdOrderByIdAsc(interactionId).stream()
                        .map(ViolationRecord::toViolation)
                        .toList(),
                verificationRecordRepository.findByInteractionIdOrderByIdAsc(interactionId).stream()
                        .map(VerificationRecord::toResult)
                        .toList(),
                citationRecordRepository.findByInteractionIdOrderByIdAsc(interactionId).stream()
                        .map(CitationRecord::toCitation)
                        .toList());
    }

    public Page<Interaction> list(InteractionFilter filter, Pageable pageable) {
        Specification<Interaction> spec = Specification.where(organization(filter.organizationId()))
                .and(status(filter.status()))
                .and(aiModel(filter.aiModel()))
                .and(session(filter.sessionId()))
                .and(createdFrom(filter.from()))
                .and(createdTo(filter.to()));
        return interactionRepository.findAll(spec, pageable);
    }

    public Page<ViolationRecord> listViolations(ViolationFilter filter, Pageable pageable) {
        Specification<ViolationRecord> spec = Specification.where(ViolationSpecifications.organization(filter.organizationId()))
                .and(ViolationSpecifications.interaction(filter.interactionId()))
                .and(ViolationSpecifications.type(filter.type()))
                .and(ViolationSpecifications.severity(filter.severity()))
                .and(ViolationSpecifications.createdFrom(filter.from()))
                .and(ViolationSpecifications.createdTo(filter.to()));
        return violationRecordRepository.findAll(spec, pageable);
    }

    public AuditStats stats(String organizationId, LocalDateTime from, LocalDateTime to) {
        LocalDateTime start = from != null ? from : EPOCH;
        LocalDateTime end = to != null ? to : LocalDateTime.now();

        Map<String, Long> byStatus = toCounts(interactionRepository.countByStatus(organizationId, start, end));
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        Double average = interactionRepository.averageConfidence(organizationId, start, end);

        return new AuditStats(
                total,
                byStatus,
                toCounts(violationRecordRepository.countByType(organizationId, start, end)),
                toCounts(violationRecordRepository.countBySeverity(organizationId, start, end)),
                toCounts(interactionRepository.countByModel(organizationId, start, end)),
                average != null ? average : 0.0);
    }

    private Map<String, Long> toCounts(List<Object[]> rows) {
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : rows) {
            counts.put(label(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private String label(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name().toLowerCase(Locale.ROOT);
        }
        return String.valueOf(key);
    }
}
