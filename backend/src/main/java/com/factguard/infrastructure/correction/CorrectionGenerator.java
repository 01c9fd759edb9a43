package com.factguard.infrastructure.correction;

import com.factguard.domain.correction.service.CorrectionRewriteException;
import com.factguard.domain.correction.service.CorrectionRewriter;
import com.factguard.domain.validation.model.CorrectionChange;
import com.factguard.domain.validation.model.CorrectionResult;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import com.factguard.infrastructure.preprocessing.TextTokens;
import com.factguard.infrastructure.scoring.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces a corrected response from the violation list.
 * <p>
 * Deterministic rewrites run first, grouped by violation type:
 * compliance and policy (replace, strip or append), hallucination (remove sentences with
 * false claims, note unverifiable absolutes), then citation (drop invalid URLs).
 * The optional {@link CorrectionRewriter} then polishes the draft; its output replaces the
 * draft only when non-blank.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrectionGenerator {

    static final String FINANCIAL_DISCLAIMER = "Note: This is not financial advice. Please consult a licensed "
            + "financial advisor. Past performance does not guarantee future results.";
    static final String VERIFICATION_NOTE = "Note: Some information may require verification.";

    private static final List<ViolationType> TYPE_ORDER = List.of(
            ViolationType.COMPLIANCE, ViolationType.POLICY, ViolationType.HALLUCINATION, ViolationType.CITATION);

    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([,.;:!?])");
    private static final Pattern REPEATED_COMMA = Pattern.compile(",(\\s*,)+");
    private static final Pattern COMMA_BEFORE_STOP = Pattern.compile(",\\s*([.!?])");
    private static final Pattern MULTI_SPACE = Pattern.compile("[ \\t]{2,}");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final SentenceSplitter sentenceSplitter;
    private final TextNormalizer textNormalizer;
    private final SeverityClassifier severityClassifier;
    private final CorrectionRewriter correctionRewriter;

    public CorrectionResult generate(String original,
                                     List<Violation> violations,
                                     List<VerificationResult> verificationResults,
                                     String query) {
        if (violations.isEmpty()) {
            return CorrectionResult.unchanged(original);
        }

        Set<String> falseClaims = verificationResults.stream()
                .filter(VerificationResult::isFalse)
                .map(VerificationResult::claim)
                .collect(Collectors.toSet());

        Draft draft = new Draft(original);
        boolean needsVerificationNote = false;

        List<Violation> ordered = violations.stream()
                .filter(v -> TYPE_ORDER.contains(v.type()))
                .sorted(Comparator.comparingInt(v -> TYPE_ORDER.indexOf(v.type())))
                .toList();

        for (Violation violation : ordered) {
            switch (violation.type()) {
                case COMPLIANCE, POLICY -> applyRuleOrPolicy(draft, violation);
                case HALLUCINATION -> {
                    if (violation.matchedText() != null && falseClaims.contains(violation.matchedText())) {
                        removeSentence(draft, violation);
                    } else {
                        needsVerificationNote = true;
                    }
                }
                case CITATION -> strip(draft, violation, "Removed invalid citation");
                default -> {
                }
            }
        }

        if (needsFinancialDisclaimer(original, violations)) {
            append(draft, FINANCIAL_DISCLAIMER, ViolationType.COMPLIANCE, "Added financial disclaimer");
        }
        if (needsVerificationNote) {
            append(draft, VERIFICATION_NOTE, ViolationType.HALLUCINATION, "Added verification note for unverifiable claims");
        }

        String corrected = tidy(draft.text);
        log.info("Deterministic correction: {} changes", draft.changes.size());
        return rewrite(corrected, draft.changes, violations, query);
    }

    private CorrectionResult rewrite(String draftText, List<CorrectionChange> changes,
                                     List<Violation> violations, String query) {
        try {
            Optional<String> rewritten = correctionRewriter.rewrite(draftText, violations, query)
                    .filter(text -> !text.isBlank());
            if (rewritten.isPresent()) {
                return new CorrectionResult(rewritten.get(), List.copyOf(changes), true);
            }
        } catch (CorrectionRewriteException e) {
            log.warn("Generative correction failed, keeping deterministic draft: {}", e.getMessage());
        }
        return new CorrectionResult(draftText, List.copyOf(changes), false);
    }

    private void applyRuleOrPolicy(Draft draft, Violation violation) {
        String matched = violation.matchedText();
        String suggested = violation.suggestedText();

        if (matched != null && suggested != null) {
            if (draft.text.contains(matched)) {
                draft.text = draft.text.replaceFirst(Pattern.quote(matched), Matcher.quoteReplacement(suggested));
                draft.changes.add(new CorrectionChange(violation.type(), matched, suggested,
                        "Replaced to match " + violation.origin().kind().value() + " " + violation.origin().reference()));
            }
        } else if (suggested != null) {
            append(draft, suggested, violation.type(), "Added required text");
        } else if (matched != null) {
            strip(draft, violation, "Removed prohibited text");
        }
    }

    private void strip(Draft draft, Violation violation, String reason) {
        String matched = violation.matchedText();
        if (matched == null || matched.isBlank()) {
            return;
        }
        Matcher matcher = TextTokens.phrasePattern(matched).matcher(draft.text);
        if (matcher.find()) {
            draft.text = matcher.replaceAll("");
            draft.changes.add(new CorrectionChange(violation.type(), matched, null, reason));
        }
    }

    private void removeSentence(Draft draft, Violation violation) {
        String claim = textNormalizer.normalize(violation.matchedText());
        for (String sentence : sentenceSplitter.split(draft.text)) {
            if (textNormalizer.normalize(sentence).equals(claim) || sentence.contains(violation.matchedText())) {
                draft.text = draft.text.replace(sentence, "");
                draft.changes.add(new CorrectionChange(ViolationType.HALLUCINATION, sentence, null,
                        "Removed claim contradicted by verification"));
                return;
            }
        }
    }

    private void append(Draft draft, String addition, ViolationType type, String reason) {
        if (draft.text.toLowerCase(Locale.ROOT).contains(addition.toLowerCase(Locale.ROOT))) {
            return;
        }
        draft.text = draft.text.stripTrailing() + "\n\n" + addition;
        draft.changes.add(new CorrectionChange(type, null, addition, reason));
    }

    private boolean needsFinancialDisclaimer(String original, List<Violation> violations) {
        boolean critical = violations.stream().anyMatch(v -> v.severity() == Severity.CRITICAL);
        return critical
                && severityClassifier.isFinancialGuarantee(original)
                && !original.toLowerCase(Locale.ROOT).contains("not financial advice");
    }

    String tidy(String text) {
        String result = SPACE_BEFORE_PUNCTUATION.matcher(text).replaceAll("$1");
        result = REPEATED_COMMA.matcher(result).replaceAll(",");
        result = COMMA_BEFORE_STOP.matcher(result).replaceAll("$1");
        result = MULTI_SPACE.matcher(result).replaceAll(" ");
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    private static final class Draft {
        private String text;
        private final List<CorrectionChange> changes = new ArrayList<>();

        private Draft(String text) {
            this.text = text;
        }
    }
}
