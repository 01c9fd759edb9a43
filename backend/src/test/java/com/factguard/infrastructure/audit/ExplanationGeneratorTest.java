package com.factguard.infrastructure.audit;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    private static Violation violation(ViolationType type, Severity severity, String description) {
        return new Violation(type, severity, description, ViolationOrigin.rule("r1"), null, null);
    }

    private static VerificationResult result(VerificationStatus status) {
        return new VerificationResult("claim", status, 0.8, "wikipedia", "details", null, "summary");
    }

    @Nested
    @DisplayName("Status and confidence")
    class StatusLine {

        @Test
        void approved_response_has_status_line_and_reasoning() {
            String explanation = generator.generate(ValidationStatus.APPROVED, 0.82,
                    List.of(), List.of(), List.of(), List.of());

            assertThat(explanation).startsWith("Response approved (confidence: 82%)\n");
            assertThat(explanation).contains("High confidence in validation results.");
            assertThat(explanation).endsWith("Reasoning: No violations were found and the response "
                    + "complies with applicable rules and policies.");
            assertThat(explanation).doesNotContain("Issues detected");
        }

        @Test
        void blocked_response_mentions_critical_violations() {
            String explanation = generator.generate(ValidationStatus.BLOCKED, 0.4,
                    List.of(violation(ViolationType.COMPLIANCE, Severity.CRITICAL, "guarantee")),
                    List.of(), List.of(), List.of());

            assertThat(explanation).startsWith("Response blocked (confidence: 40%)");
            assertThat(explanation).contains("critical violations");
        }

        @Test
        void confidence_bands_follow_thresholds() {
            assertThat(generator.confidenceBand(0.8)).isEqualTo("High confidence in validation results.");
            assertThat(generator.confidenceBand(0.6)).isEqualTo("Moderate confidence in validation results.");
            assertThat(generator.confidenceBand(0.59))
                    .isEqualTo("Low confidence in validation results, manual review recommended.");
        }
    }

    @Nested
    @DisplayName("Detail sections")
    class Sections {

        @Test
        void issues_are_listed_most_severe_first() {
            String explanation = generator.generate(ValidationStatus.FLAGGED, 0.65,
                    List.of(
                            violation(ViolationType.POLICY, Severity.MEDIUM, "timeframe"),
                            violation(ViolationType.COMPLIANCE, Severity.CRITICAL, "guarantee")),
                    List.of(), List.of(), List.of());

            assertThat(explanation).contains("Issues detected (2):\n"
                    + "1. [CRITICAL] compliance: guarantee\n"
                    + "2. [MEDIUM] policy: timeframe\n");
            assertThat(explanation).startsWith("Response flagged for review (confidence: 65%)");
        }

        @Test
        void verification_and_citation_counts_are_reported() {
            String explanation = generator.generate(ValidationStatus.FLAGGED, 0.7,
                    List.of(),
                    List.of(result(VerificationStatus.VERIFIED), result(VerificationStatus.VERIFIED),
                            result(VerificationStatus.UNVERIFIED), result(VerificationStatus.FALSE)),
                    List.of(new Citation("https://a.example", true, true, 200, null),
                            new Citation("https://b.example", false, false, 404, "HTTP 404")),
                    List.of());

            assertThat(explanation).contains("Fact verification: 2 verified, 1 unverified, 1 false");
            assertThat(explanation).contains("Citations: 1 valid, 1 invalid");
        }

        @Test
        void degraded_components_without_violations_explain_the_review() {
            String explanation = generator.generate(ValidationStatus.FLAGGED, 0.7,
                    List.of(), List.of(), List.of(), List.of("rules", "verification"));

            assertThat(explanation).contains("Degraded components: rules, verification");
            assertThat(explanation).endsWith("Reasoning: Some checks could not complete, "
                    + "so the response needs review before use.");
        }
    }
}
