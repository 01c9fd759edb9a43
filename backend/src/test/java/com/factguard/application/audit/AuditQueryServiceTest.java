package com.factguard.application.audit;

import com.factguard.application.audit.exception.InteractionNotFoundException;
import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.audit.model.ViolationRecord;
import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.ScoreBreakdown;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ValidationInput;
import com.factguard.domain.validation.model.ValidationResult;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.audit.AuditLogger;
import com.factguard.infrastructure.consistency.JpaHistoryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import({AuditLogger.class, AuditQueryService.class, JpaHistoryStore.class})
class AuditQueryServiceTest {

    @Autowired
    private AuditLogger auditLogger;

    @Autowired
    private AuditQueryService auditQueryService;

    @Autowired
    private JpaHistoryStore historyStore;

    private static ValidationInput input(String org, String model, String response) {
        return new ValidationInput("Can I get a refund?", response, org, model, "session-1", "airline");
    }

    private static ValidationResult result(ValidationStatus status, double score, List<Violation> violations) {
        return new ValidationResult(
                status,
                score,
                new ScoreBreakdown(0.7, 0.9, 0.8, 0.4, 0.8, score),
                List.of(),
                List.of(new VerificationResult("Refunds take 7 days.", VerificationStatus.UNVERIFIED,
                        0.3, "none", "No matching document found", null, "search")),
                violations,
                List.of(new Citation("https://example.com/policy", false, false, 404, "HTTP 404")),
                null,
                "corrected",
                "explanation",
                List.of());
    }

    private static Violation policyViolation() {
        return new Violation(ViolationType.POLICY, Severity.HIGH, "Refund timeframe contradicts policy",
                ViolationOrigin.policy("policy-1"), "24 hours", "7-10 business days");
    }

    private static Violation citationViolation() {
        return new Violation(ViolationType.CITATION, Severity.MEDIUM, "Invalid citation",
                ViolationOrigin.citation("https://example.com/policy"), "https://example.com/policy", null);
    }

    @Nested
    @DisplayName("Audit trail")
    class Trail {

        @Test
        void saved_interaction_is_returned_with_its_records() {
            UUID id = auditLogger.save(input("acme", "gpt-4o", "Refunds take 24 hours."),
                    result(ValidationStatus.FLAGGED, 0.55, List.of(policyViolation(), citationViolation())),
                    "fp-1", 42);

            AuditTrail trail = auditQueryService.getTrail(id);

            Interaction interaction = trail.interaction();
            assertThat(interaction.getOrganizationId()).isEqualTo("acme");
            assertThat(interaction.getStatus()).isEqualTo(ValidationStatus.FLAGGED);
            assertThat(interaction.getValidatedResponse()).isEqualTo("corrected");
            assertThat(interaction.getProcessingTimeMs()).isEqualTo(42);
            assertThat(trail.violations()).extracting(Violation::type)
                    .containsExactly(ViolationType.POLICY, ViolationType.CITATION);
            assertThat(trail.violations().get(0).origin()).isEqualTo(ViolationOrigin.policy("policy-1"));
            assertThat(trail.verificationResults()).singleElement()
                    .extracting(VerificationResult::status).isEqualTo(VerificationStatus.UNVERIFIED);
            assertThat(trail.citations()).singleElement()
                    .extracting(Citation::httpStatus).isEqualTo(404);
        }

        @Test
        void unknown_interaction_is_not_found() {
            UUID id = UUID.randomUUID();

            assertThatThrownBy(() -> auditQueryService.getTrail(id))
                    .isInstanceOf(InteractionNotFoundException.class)
                    .hasMessageContaining(id.toString());
        }
    }

    @Nested
    @DisplayName("Listing and statistics")
    class Listing {

        @Test
        void list_applies_only_the_given_filters() {
            auditLogger.save(input("acme", "gpt-4o", "a"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp", 1);
            auditLogger.save(input("acme", "claude", "b"),
                    result(ValidationStatus.FLAGGED, 0.5, List.of(policyViolation())), "fp", 1);
            auditLogger.save(input("other", "gpt-4o", "c"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp", 1);

            Page<Interaction> acme = auditQueryService.list(
                    new InteractionFilter("acme", null, null, null, null, null), PageRequest.of(0, 10));
            Page<Interaction> acmeFlagged = auditQueryService.list(
                    new InteractionFilter("acme", ValidationStatus.FLAGGED, null, null, null, null), PageRequest.of(0, 10));
            Page<Interaction> future = auditQueryService.list(
                    new InteractionFilter(null, null, null, null, LocalDateTime.now().plusDays(1), null), PageRequest.of(0, 10));

            assertThat(acme.getTotalElements()).isEqualTo(2);
            assertThat(acmeFlagged.getContent()).singleElement()
                    .extracting(Interaction::getAiModel).isEqualTo("claude");
            assertThat(future.getTotalElements()).isZero();
        }

        @Test
        void stats_group_interactions_and_violations() {
            auditLogger.save(input("acme", "gpt-4o", "a"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp", 1);
            auditLogger.save(input("acme", "gpt-4o", "b"),
                    result(ValidationStatus.FLAGGED, 0.5, List.of(policyViolation(), citationViolation())), "fp", 1);
            auditLogger.save(input("other", "claude", "c"),
                    result(ValidationStatus.BLOCKED, 0.2, List.of(policyViolation())), "fp", 1);

            AuditStats stats = auditQueryService.stats("acme", null, null);

            assertThat(stats.totalInteractions()).isEqualTo(2);
            assertThat(stats.byStatus()).containsEntry("approved", 1L).containsEntry("flagged", 1L)
                    .doesNotContainKey("blocked");
            assertThat(stats.violationsByType()).containsEntry("policy", 1L).containsEntry("citation", 1L);
            assertThat(stats.violationsBySeverity()).containsEntry("high", 1L).containsEntry("medium", 1L);
            assertThat(stats.byModel()).containsOnlyKeys("gpt-4o");
            assertThat(stats.averageConfidence()).isCloseTo(0.7, within(1e-9));
        }

        @Test
        void violations_are_filtered_by_organization_type_and_interaction() {
            UUID flagged = auditLogger.save(input("acme", "gpt-4o", "b"),
                    result(ValidationStatus.FLAGGED, 0.5, List.of(policyViolation(), citationViolation())), "fp", 1);
            UUID blocked = auditLogger.save(input("acme", "gpt-4o", "c"),
                    result(ValidationStatus.BLOCKED, 0.2, List.of(policyViolation())), "fp", 1);
            auditLogger.save(input("other", "claude", "d"),
                    result(ValidationStatus.BLOCKED, 0.2, List.of(policyViolation())), "fp", 1);

            Page<ViolationRecord> acme = auditQueryService.listViolations(
                    new ViolationFilter("acme", null, null, null, null, null), PageRequest.of(0, 10));
            Page<ViolationRecord> acmePolicy = auditQueryService.listViolations(
                    new ViolationFilter("acme", null, ViolationType.POLICY, null, null, null), PageRequest.of(0, 10));
            Page<ViolationRecord> oneInteraction = auditQueryService.listViolations(
                    new ViolationFilter(null, flagged, null, Severity.MEDIUM, null, null), PageRequest.of(0, 10));
            Page<ViolationRecord> future = auditQueryService.listViolations(
                    new ViolationFilter(null, null, null, null, LocalDateTime.now().plusDays(1), null), PageRequest.of(0, 10));

            assertThat(acme.getTotalElements()).isEqualTo(3);
            assertThat(acmePolicy.getContent()).extracting(ViolationRecord::getInteractionId)
                    .containsExactlyInAnyOrder(flagged, blocked);
            assertThat(oneInteraction.getContent()).singleElement()
                    .extracting(ViolationRecord::getViolationType).isEqualTo(ViolationType.CITATION);
            assertThat(future.getTotalElements()).isZero();
        }

        @Test
        void stats_for_an_empty_window_are_zero() {
            AuditStats stats = auditQueryService.stats("nobody", null, null);

            assertThat(stats.totalInteractions()).isZero();
            assertThat(stats.byStatus()).isEmpty();
            assertThat(stats.averageConfidence()).isZero();
        }
    }

    @Test
    void history_store_returns_recent_responses_for_the_same_query() {
        auditLogger.save(input("acme", "gpt-4o", "first"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp-a", 1);
        auditLogger.save(input("acme", "gpt-4o", "second"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp-a", 1);
        auditLogger.save(input("acme", "gpt-4o", "third"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp-b", 1);
        auditLogger.save(input("other", "gpt-4o", "fourth"), result(ValidationStatus.APPROVED, 0.9, List.of()), "fp-a", 1);

        List<String> recent = historyStore.recentResponses("acme", "fp-a", 5);
        List<String> limited = historyStore.recentResponses("acme", "fp-a", 1);

        assertThat(recent).containsExactlyInAnyOrder("first", "second");
        assertThat(limited).hasSize(1);
    }
}
