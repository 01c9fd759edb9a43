package com.factguard.domain.audit.repository;

import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.validation.model.ValidationStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

/**
 * Composable filters for {@link InteractionRepository#findAll(Specification, org.springframework.data.domain.Pageable)}.
 * Each factory returns null for a null argument, which {@link Specification#where} ignores.
 */
public final class InteractionSpecifications {

    private InteractionSpecifications() {
    }

    public static Specification<Interaction> organization(String organizationId) {
        return organizationId == null ? null : (root, query, cb) -> cb.equal(root.get("organizationId"), organizationId);
    }

    public static Specification<Interaction> status(ValidationStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Interaction> aiModel(String aiModel) {
        return aiModel == null ? null : (root, query, cb) -> cb.equal(root.get("aiModel"), aiModel);
    }

    public static Specification<Interaction> session(String sessionId) {
        return sessionId == null ? null : (root, query, cb) -> cb.equal(root.get("sessionId"), sessionId);
    }

    public static Specification<Interaction> createdFrom(LocalDateTime from) {
        return from == null ? null : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    public static Specification<Interaction> createdTo(LocalDateTime to) {
        return to == null ? null : (root, query, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), to);
    }
}
