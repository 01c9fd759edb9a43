package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.ViolationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ViolationRecordRepository extends JpaRepository<ViolationRecord, Long>,
        JpaSpecificationExecutor<ViolationRecord> {

    List<ViolationRecord> findByInteractionIdOrderByIdAsc(UUID interactionId);

    List<ViolationRecord> findByInteractionIdIn(Collection<UUID> interactionIds);

    @Query("select v.violationType, count(v) from ViolationRecord v, Interaction i "
            + "where v.interactionId = i.id and i.organizationId = :organizationId "
            + "and i.createdAt between :from and :to group by v.violationType")
    List<Object[]> countByType(@Param("organizationId") String organizationId,
                               @Param("from") LocalDateTime from,
                               @Param("to") LocalDateTime to);

    @Query("select v.severity, count(v) from ViolationRecord v, Interaction i "
            + "where v.interactionId = i.id and i.organizationId = :organizationId "
            + "and i.createdAt between :from and :to group by v.severity")
    List<Object[]> countBySeverity(@Param("organizationId") String organizationId,
                                   @Param("from") LocalDateTime from,
                                   @Param("to") LocalDateTime to);
}
