package com.factguard.infrastructure.audit;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.validation.model.Violation;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable explanation of a validation decision, stored with the audit trail.
 */
@Component
public class ExplanationGenerator {

    public String generate(ValidationStatus status,
                           double confidenceScore,
                           List<Violation> violations,
                           List<VerificationResult> verificationResults,
                           List<Citation> citations,
                           List<String> degradedComponents) {
        StringBuilder sb = new StringBuilder();

        sb.append(statusLine(status, confidenceScore)).append('\n');
        sb.append(confidenceBand(confidenceScore)).append('\n');

        if (!violations.isEmpty()) {
            sb.append('\n').append("Issues detected (").append(violations.size()).append("):\n");
            List<Violation> bySeverity = violations.stream()
                    .sorted(Comparator.comparing(Violation::severity).reversed())
                    .toList();
            int index = 1;
            for (Violation violation : bySeverity) {
                sb.append(index++).append(". [")
                        .append(violation.severity().value().toUpperCase(Locale.ROOT)).append("] ")
                        .append(violation.type().value()).append(": ")
                        .append(violation.description()).append('\n');
            }
        }

        if (!verificationResults.isEmpty()) {
            sb.append('\n').append("Fact verification: ")
                    .append(count(verificationResults, VerificationStatus.VERIFIED)).append(" verified, ")
                    .append(count(verificationResults, VerificationStatus.UNVERIFIED)).append(" unverified, ")
                    .append(count(verificationResults, VerificationStatus.FALSE)).append(" false\n");
        }

        if (!citations.isEmpty()) {
            long valid = citations.stream().filter(Citation::valid).count();
            sb.append("Citations: ").append(valid).append(" valid, ")
                    .append(citations.size() - valid).append(" invalid\n");
        }

        if (!degradedComponents.isEmpty()) {
            sb.append("Degraded components: ").append(String.join(", ", degradedComponents)).append('\n');
        }

        sb.append('\n').append("Reasoning: ").append(reasoning(status, violations, degradedComponents));
        return sb.toString();
    }

    private String statusLine(ValidationStatus status, double confidenceScore) {
        String label = switch (status) {
            case APPROVED -> "Response approved";
            case FLAGGED -> "Response flagged for review";
            case BLOCKED -> "Response blocked";
        };
        return String.format(Locale.ROOT, "%s (confidence: %.0f%%)", label, confidenceScore * 100);
    }

    String confidenceBand(double confidenceScore) {
        if (confidenceScore >= 0.8) {
            return "High confidence in validation results.";
        }
        if (confidenceScore >= 0.6) {
            return "Moderate confidence in validation results.";
        }
        return "Low confidence in validation results, manual review recommended.";
    }

    private String reasoning(ValidationStatus status, List<Violation> violations, List<String> degradedComponents) {
        if (status == ValidationStatus.APPROVED) {
            return "No violations were found and the response complies with applicable rules and policies.";
        }
        if (status == ValidationStatus.BLOCKED) {
            boolean critical = violations.stream().anyMatch(v -> v.severity() == Severity.CRITICAL);
            return critical
                    ? "The response contains critical violations and must not be shown as is. A corrected version was generated."
                    : "The response contains a confidently false claim with a high-severity violation. A corrected version was generated.";
        }
        if (violations.isEmpty() && !degradedComponents.isEmpty()) {
            return "Some checks could not complete, so the response needs review before use.";
        }
        return "The response needs review because of the issues listed above. A corrected version was generated.";
    }

    private long count(List<VerificationResult> results, VerificationStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
