package com.factguard.application.audit;

import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;

import java.util.List;

/**
 * Everything stored for one interaction.
 */
public record AuditTrail(
        Interaction interaction,
        List<Violation> violations,
        List<VerificationResult> verificationResults,
        List<Citation> citations
) {
}
