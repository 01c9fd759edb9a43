package com.factguard.infrastructure.scoring;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.ScoreBreakdown;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Weighted confidence score:
 * {@code fact·w1 + consistency·w2 + citation·w3 + compliance·w4 + clarity·w5}.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    private final ScoringProperties properties;

    public ScoreBreakdown score(List<VerificationResult> verificationResults,
                                double consistencyScore,
                                List<Citation> citations,
                                List<Violation> violations) {
        double fact = factScore(verificationResults);
        double citation = citationScore(citations);
        double compliance = complianceScore(violations);
        double clarity = properties.getClarity();

        ScoringProperties.Weights w = properties.getWeights();
        double total = fact * w.getFact()
                + consistencyScore * w.getConsistency()
                + citation * w.getCitation()
                + compliance * w.getCompliance()
                + clarity * w.getClarity();

        return new ScoreBreakdown(fact, consistencyScore, citation, compliance, clarity, round(clamp(total)));
    }

    double factScore(List<VerificationResult> results) {
        if (results.isEmpty()) {
            return properties.getFact().getNoClaims();
        }
        double average = results.stream()
                .mapToDouble(this::claimValue)
                .average()
                .orElse(properties.getFact().getNoClaims());
        return clamp(average);
    }

    double citationScore(List<Citation> citations) {
        if (citations.isEmpty()) {
            return 1.0;
        }
        long valid = citations.stream().filter(Citation::valid).count();
        return (double) valid / citations.size();
    }

    /**
     * 1.0 without rule or policy violations, else the configured score of the highest severity.
     */
    double complianceScore(List<Violation> violations) {
        return violations.stream()
                .filter(v -> v.type().affectsCompliance())
                .map(Violation::severity)
                .max(Comparator.naturalOrder())
                .map(properties.getCompliance()::scoreFor)
                .orElse(1.0);
    }

    private double claimValue(VerificationResult result) {
        return switch (result.status()) {
            case VERIFIED -> result.confidence();
            case UNVERIFIED -> properties.getFact().getUnverified();
            case FALSE -> properties.getFact().getFalseClaim();
        };
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
