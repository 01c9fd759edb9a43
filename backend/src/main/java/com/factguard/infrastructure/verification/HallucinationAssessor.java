package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.extraction.AbsoluteLanguageDetector.AbsoluteAssertion;
import com.factguard.infrastructure.scoring.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns verification outcomes into hallucination violations:
 * claims verified as {@code false}, and absolute assertions no source verified.
 * Unverified claims alone are not violations.
 */
@Component
@RequiredArgsConstructor
public class HallucinationAssessor {

    private final SeverityClassifier severityClassifier;

    /**
     * @param claims     extracted claims
     * @param results    verification results, index-aligned with claims
     * @param assertions absolute-language sentences found in the response
     */
    public List<Violation> assess(List<Claim> claims,
                                  List<VerificationResult> results,
                                  List<AbsoluteAssertion> assertions) {
        List<Violation> violations = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        Set<String> verifiedSentences = new HashSet<>();

        for (int i = 0; i < results.size(); i++) {
            VerificationResult result = results.get(i);
            Claim claim = i < claims.size() ? claims.get(i) : null;
            if (result.isVerified()) {
                verifiedSentences.add(result.claim());
            }
            if (!result.isFalse()) {
                continue;
            }
            Severity base = claim != null && claim.kind().isMaterial() ? Severity.HIGH : Severity.MEDIUM;
            Violation violation = new Violation(
                    ViolationType.HALLUCINATION,
                    base,
                    "Claim contradicted by " + result.source() + ": " + result.details(),
                    ViolationOrigin.claim(result.claim()),
                    result.claim(),
                    null);
            violations.add(severityClassifier.classify(violation, result.claim()));
            reported.add(result.claim());
        }

        for (AbsoluteAssertion assertion : assertions) {
            if (reported.contains(assertion.sentence()) || verifiedSentences.contains(assertion.sentence())) {
                continue;
            }
            Violation violation = new Violation(
                    ViolationType.HALLUCINATION,
                    Severity.MEDIUM,
                    "Unverifiable absolute claim ('" + assertion.marker() + "'): " + assertion.sentence(),
                    ViolationOrigin.claim(assertion.sentence()),
                    assertion.sentence(),
                    null);
            violations.add(severityClassifier.classify(violation, assertion.sentence()));
            reported.add(assertion.sentence());
        }
        return violations;
    }
}
