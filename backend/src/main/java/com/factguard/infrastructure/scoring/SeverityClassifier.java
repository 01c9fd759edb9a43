package com.factguard.infrastructure.scoring;

import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationType;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Assigns severity from the content of a violation rather than from its type alone.
 * <ul>
 *   <li>medical, legal, named-regulation or financial-guarantee content → CRITICAL</li>
 *   <li>missing required disclaimers → at least HIGH</li>
 *   <li>otherwise the producer's base severity stands</li>
 *   <li>consistency findings are always LOW</li>
 * </ul>
 * Severity is only ever raised, never lowered below what the producer declared.
 */
@Component
public class SeverityClassifier {

    private static final Pattern MEDICAL = Pattern.compile(
            "\\b(?:diagnos\\w*|dosage|prescriptions?|medications?|overdose|cures?|cured|chemotherapy"
            + "|insulin|medical advice|treatment for|side effects?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LEGAL = Pattern.compile(
            "\\b(?:legal advice|lawsuits?|sue|liable|liability|court|attorney|lawyer)\\b",
            Pattern.CASE_INSENSITIVE
    );

    // Acronyms are matched case-sensitively so "sec" (seconds) does not count
    private static final Pattern REGULATION = Pattern.compile(
            "\\b(?:SEC|FDA|GDPR|HIPAA|CFPB|FINRA)\\b|\\bEU AI Act\\b"
    );

    private static final Pattern GUARANTEE = Pattern.compile(
            "\\b(?:guarantee[ds]?|always goes up|always go up|cannot lose|can't lose|risk-free"
            + "|sure thing|always profitable|no risk)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FINANCIAL = Pattern.compile(
            "\\b(?:invest\\w*|crypto\\w*|bitcoin|stocks?|returns?|profits?|savings|portfolio|trading"
            + "|shares|market|retirement|401k|funds?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern MISSING_DISCLAIMER = Pattern.compile(
            "missing required|disclaimer", Pattern.CASE_INSENSITIVE
    );

    /**
     * @param violation violation carrying its producer's base severity
     * @param evidence  response text the violation refers to (sentence or matched text); may be null
     * @return the violation with its final severity
     */
    public Violation classify(Violation violation, String evidence) {
        if (violation.type() == ViolationType.CONSISTENCY) {
            return violation.withSeverity(Severity.LOW);
        }
        Severity contentSeverity = contentSeverity(violation, evidence);
        return violation.withSeverity(Severity.max(violation.severity(), contentSeverity));
    }

    Severity contentSeverity(Violation violation, String evidence) {
        String text = (evidence != null ? evidence : "") + " "
                + (violation.matchedText() != null ? violation.matchedText() : "");

        if (MEDICAL.matcher(text).find()
                || LEGAL.matcher(text).find()
                || REGULATION.matcher(text).find()
                || isFinancialGuarantee(text)) {
            return Severity.CRITICAL;
        }
        if (MISSING_DISCLAIMER.matcher(violation.description()).find()) {
            return Severity.HIGH;
        }
        return Severity.LOW;
    }

    public boolean isFinancialGuarantee(String text) {
        return GUARANTEE.matcher(text).find() && FINANCIAL.matcher(text).find();
    }
}
