package com.factguard.infrastructure.scoring;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.ScoreBreakdown;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ConfidenceScorer(new ScoringProperties());
    }

    private static VerificationResult result(VerificationStatus status, double confidence) {
        return new VerificationResult("claim", status, confidence, "wikipedia", "details", null, "summary");
    }

    private static Violation violation(ViolationType type, Severity severity) {
        return new Violation(type, severity, "desc", ViolationOrigin.rule("1"), null, null);
    }

    @Nested
    @DisplayName("Weighted total")
    class Total {

        @Test
        @DisplayName("No claims and no findings scores 0.825")
        void no_claims() {
            ScoreBreakdown scores = scorer.score(List.of(), 0.9, List.of(), List.of());

            assertThat(scores.fact()).isEqualTo(0.7);
            assertThat(scores.citation()).isEqualTo(1.0);
            assertThat(scores.compliance()).isEqualTo(1.0);
            assertThat(scores.clarity()).isEqualTo(0.8);
            assertThat(scores.total()).isEqualTo(0.825);
        }

        @Test
        @DisplayName("A single unverified claim stays above the flag threshold")
        void single_unverified_claim() {
            ScoreBreakdown scores = scorer.score(
                    List.of(result(VerificationStatus.UNVERIFIED, 0.3)), 0.9, List.of(), List.of());

            assertThat(scores.fact()).isEqualTo(0.6);
            assertThat(scores.total()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("A critical rule violation zeroes the compliance component")
        void critical_violation() {
            ScoreBreakdown scores = scorer.score(List.of(), 0.9, List.of(),
                    List.of(violation(ViolationType.COMPLIANCE, Severity.CRITICAL)));

            assertThat(scores.compliance()).isZero();
            assertThat(scores.total()).isEqualTo(0.575);
        }
    }

    @Nested
    @DisplayName("Components")
    class Components {

        @Test
        @DisplayName("False claims pull the fact score down to zero")
        void false_claims() {
            assertThat(scorer.factScore(List.of(result(VerificationStatus.FALSE, 0.9)))).isZero();
            assertThat(scorer.factScore(List.of(
                    result(VerificationStatus.VERIFIED, 0.85),
                    result(VerificationStatus.FALSE, 0.75)))).isZero();
        }

        @Test
        @DisplayName("Verified claims count with their confidence")
        void verified_claims() {
            assertThat(scorer.factScore(List.of(
                    result(VerificationStatus.VERIFIED, 0.8),
                    result(VerificationStatus.UNVERIFIED, 0.3)))).isCloseTo(0.7, within(1e-9));
        }

        @Test
        @DisplayName("Citation score is the share of valid citations")
        void citation_share() {
            List<Citation> citations = List.of(
                    new Citation("https://a.example", true, true, 200, null),
                    new Citation("https://b.example", false, false, 404, "HTTP 404"));

            assertThat(scorer.citationScore(citations)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Only rule and policy violations affect compliance, by highest severity")
        void compliance_highest_severity() {
            double compliance = scorer.complianceScore(List.of(
                    violation(ViolationType.POLICY, Severity.HIGH),
                    violation(ViolationType.COMPLIANCE, Severity.LOW),
                    violation(ViolationType.HALLUCINATION, Severity.CRITICAL)));

            assertThat(compliance).isEqualTo(0.4);
        }
    }
}
