package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.CitationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CitationRecordRepository extends JpaRepository<CitationRecord, Long> {

    List<CitationRecord> findByInteractionIdOrderByIdAsc(UUID interactionId);
}
