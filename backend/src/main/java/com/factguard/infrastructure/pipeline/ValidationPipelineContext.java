package com.factguard.infrastructure.pipeline;

import com.factguard.domain.validation.model.*;
import com.factguard.infrastructure.citation.CitationOutcome;
import com.factguard.infrastructure.consistency.ConsistencyOutcome;
import com.factguard.infrastructure.extraction.AbsoluteLanguageDetector.AbsoluteAssertion;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class ValidationPipelineContext {

    // --- Input ---
    private ValidationInput input;

    // --- Preprocessing ---
    private String normalizedResponse;
    private String queryFingerprint;

    // --- Extraction ---
    private List<Claim> claims = new ArrayList<>();
    private List<AbsoluteAssertion> absoluteAssertions = new ArrayList<>();

    // --- Parallel checks ---
    private List<VerificationResult> verificationResults = new ArrayList<>();
    private List<Violation> ruleViolations = new ArrayList<>();
    private List<Violation> policyViolations = new ArrayList<>();
    private List<Violation> hallucinationViolations = new ArrayList<>();
    private ConsistencyOutcome consistency;
    private CitationOutcome citationOutcome = CitationOutcome.empty();

    // Written from stage threads
    private final List<String> degradedComponents = new CopyOnWriteArrayList<>();

    // --- Decision ---
    private ScoreBreakdown scores;
    private ValidationStatus status;
    private CorrectionResult correction;
    private String explanation;

    public void markDegraded(String component) {
        if (!degradedComponents.contains(component)) {
            degradedComponents.add(component);
        }
    }

    /**
     * All violations in a fixed producer order: rules, policies, hallucinations, citations, consistency.
     */
    public List<Violation> allViolations() {
        List<Violation> all = new ArrayList<>(ruleViolations);
        all.addAll(policyViolations);
        all.addAll(hallucinationViolations);
        all.addAll(citationOutcome.violations());
        if (consistency != null) {
            consistency.finding().ifPresent(all::add);
        }
        return all;
    }

    public List<String> sortedDegradedComponents() {
        return degradedComponents.stream().sorted().toList();
    }

    /**
     * The text safe to show: the correction when it changed the response,
     * the original when approved, otherwise nothing.
     */
    public String validatedResponse() {
        if (correction != null && correction.changed(normalizedResponse)) {
            return correction.correctedText();
        }
        return status == ValidationStatus.APPROVED ? input.responseText() : null;
    }

    /**
     * Build the final ValidationResult from accumulated context.
     */
    public ValidationResult toValidationResult() {
        return new ValidationResult(
                status,
                scores.total(),
                scores,
                List.copyOf(claims),
                List.copyOf(verificationResults),
                allViolations(),
                citationOutcome.citations(),
                correction,
                validatedResponse(),
                explanation,
                sortedDegradedComponents()
        );
    }
}
