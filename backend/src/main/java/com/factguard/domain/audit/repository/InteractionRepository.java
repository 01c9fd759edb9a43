package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.Interaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface InteractionRepository extends JpaRepository<Interaction, UUID>, JpaSpecificationExecutor<Interaction> {

    List<Interaction> findByOrganizationIdAndQueryFingerprintOrderByCreatedAtDesc(
            String organizationId, String queryFingerprint, Pageable pageable);

    @Query("select i.status, count(i) from Interaction i "
            + "where i.organizationId = :organizationId and i.createdAt between :from and :to "
            + "group by i.status")
    List<Object[]> countByStatus(@Param("organizationId") String organizationId,
                                 @Param("from") LocalDateTime from,
                                 @Param("to") LocalDateTime to);

    @Query("select i.aiModel, count(i) from Interaction i "
            + "where i.organizationId = :organizationId and i.createdAt between :from and :to "
            + "group by i.aiModel")
    List<Object[]> countByModel(@Param("organizationId") String organizationId,
                                @Param("from") LocalDateTime from,
                                @Param("to") LocalDateTime to);

    @Query("select avg(i.confidenceScore) from Interaction i "
            + "where i.organizationId = :organizationId and i.createdAt between :from and :to")
    Double averageConfidence(@Param("organizationId") String organizationId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to);
}
