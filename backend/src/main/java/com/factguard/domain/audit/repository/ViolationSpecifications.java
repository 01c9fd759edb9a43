package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.audit.model.ViolationRecord;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ViolationType;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Composable filters for violation records, same null handling as {@link InteractionSpecifications}.
 */
public final class ViolationSpecifications {

    private ViolationSpecifications() {
    }

    // violations only reference their interaction, so the organization comes from a subquery
    public static Specification<ViolationRecord> organization(String organizationId) {
        return organizationId == null ? null : (root, query, cb) -> {
            Subquery<UUID> interactionIds = query.subquery(UUID.class);
            Root<Interaction> interaction = interactionIds.from(Interaction.class);
            interactionIds.select(interaction.<UUID>get("id"))
                    .where(cb.equal(interaction.get("organizationId"), organizationId));
            return root.get("interactionId").in(interactionIds);
        };
    }

    public static Specification<ViolationRecord> interaction(UUID interactionId) {
        return interactionId == null ? null : (root, query, cb) -> cb.equal(root.get("interactionId"), interactionId);
    }

    public static Specification<ViolationRecord> type(ViolationType type) {
        return type == null ? null : (root, query, cb) -> cb.equal(root.get("violationType"), type);
    }

    public static Specification<ViolationRecord> severity(Severity severity) {
        return severity == null ? null : (root, query, cb) -> cb.equal(root.get("severity"), severity);
    }

    public static Specification<ViolationRecord> createdFrom(LocalDateTime from) {
        return from == null ? null : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    public static Specification<ViolationRecord> createdTo(LocalDateTime to) {
        return to == null ? null : (root, query, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), to);
    }
}
