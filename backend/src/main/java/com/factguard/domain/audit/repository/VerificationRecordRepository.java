package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.VerificationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface VerificationRecordRepository extends JpaRepository<VerificationRecord, Long> {

    List<VerificationRecord> findByInteractionIdOrderByIdAsc(UUID interactionId);
}
