package com.factguard.infrastructure.policy;

import com.factguard.domain.rule.model.Policy;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextTokens;
import com.factguard.infrastructure.scoring.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compares a response against company policies.
 * <p>
 * Two checks per policy:
 * 1. Contradiction: the response uses the opposite side of a term pair the policy uses
 *    ("immediate" vs. "within") while talking about the same subject.
 * 2. Time promise: the response promises a timeframe for the same action that is outside
 *    the policy's stated timeframe ("24 hours" vs. "7-10 business days").
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyMatcher {

    private static final int KEY_TERM_MIN_LENGTH = 4;

    private static final List<OppositePair> OPPOSITES = List.of(
            new OppositePair("always", "\\balways\\b", "never", "\\bnever\\b"),
            new OppositePair("cannot guarantee", "\\b(?:cannot|can't|can not|do not|don't) guarantee\\b",
                    "guaranteed", "(?<!not )(?<!cannot )\\bguaranteed?\\b"),
            new OppositePair("within", "\\bwithin\\b", "immediate", "\\bimmediate(?:ly)?\\b|\\binstant(?:ly)?\\b"),
            new OppositePair("charge", "\\b(?:charges?|charged|fees?)\\b", "free", "\\bfree\\b(?! of charge)")
    );

    private static final List<String> ACTION_STEMS = List.of(
            "refund", "deliver", "ship", "return", "replace", "cancel", "respon", "reply", "process",
            "approv", "credit", "exchange", "repair", "compensat", "reimburs", "transfer", "payout"
    );

    private final SentenceSplitter sentenceSplitter;
    private final SeverityClassifier severityClassifier;

    public List<Violation> match(List<Policy> policies, String responseText) {
        if (policies.isEmpty() || responseText == null || responseText.isBlank()) {
            return List.of();
        }

        List<String> sentences = sentenceSplitter.split(responseText);
        List<Violation> violations = new ArrayList<>();
        for (Policy policy : policies) {
            checkTimePromise(policy, sentences).ifPresent(violations::add);
            checkContradiction(policy, sentences).ifPresent(violations::add);
        }

        log.info("Policy matcher: {} violations across {} policies", violations.size(), policies.size());
        return violations;
    }

    Optional<Violation> checkTimePromise(Policy policy, List<String> sentences) {
        Optional<Timeframe> policyTimeframe = Timeframe.find(policy.content());
        if (policyTimeframe.isEmpty()) {
            return Optional.empty();
        }
        Set<String> policyActions = actions(policy.content() + " " + nullToEmpty(policy.category()) + " " + policy.name());

        for (String sentence : sentences) {
            Optional<Timeframe> promised = Timeframe.find(sentence);
            if (promised.isEmpty()) {
                continue;
            }
            Set<String> shared = actions(sentence).stream()
                    .filter(policyActions::contains)
                    .collect(Collectors.toSet());
            if (shared.isEmpty()) {
                continue;
            }

            Timeframe stated = policyTimeframe.get();
            Timeframe offered = promised.get();
            String action = shared.iterator().next();
            if (offered.isShorterThan(stated)) {
                return Optional.of(timeViolation(policy, sentence, offered, stated, action, "shorter", Severity.HIGH));
            }
            if (offered.isLongerThan(stated)) {
                return Optional.of(timeViolation(policy, sentence, offered, stated, action, "longer", Severity.MEDIUM));
            }
        }
        return Optional.empty();
    }

    Optional<Violation> checkContradiction(Policy policy, List<String> sentences) {
        Set<String> policyTerms = TextTokens.contentWords(policy.content(), KEY_TERM_MIN_LENGTH);

        for (String sentence : sentences) {
            Set<String> sentenceTerms = TextTokens.contentWords(sentence, KEY_TERM_MIN_LENGTH);
            if (sentenceTerms.stream().noneMatch(policyTerms::contains)) {
                continue;
            }
            for (OppositePair pair : OPPOSITES) {
                Optional<String[]> conflict = pair.conflict(policy.content(), sentence);
                if (conflict.isEmpty()) {
                    continue;
                }
                String policySide = conflict.get()[0];
                String responseSide = conflict.get()[1];
                Violation violation = new Violation(
                        ViolationType.POLICY,
                        Severity.MEDIUM,
                        "Response says '" + responseSide + "' but policy '" + policy.name()
                                + "' says '" + policySide + "'",
                        ViolationOrigin.policy(policy.id()),
                        sentence,
                        policy.content());
                return Optional.of(severityClassifier.classify(violation, sentence));
            }
        }
        return Optional.empty();
    }

    private Violation timeViolation(Policy policy, String sentence, Timeframe offered, Timeframe stated,
                                    String action, String direction, Severity base) {
        Violation violation = new Violation(
                ViolationType.POLICY,
                base,
                "Response promises " + offered.text() + " for " + action + " but policy '" + policy.name()
                        + "' states " + stated.text() + " (" + direction + " than policy)",
                ViolationOrigin.policy(policy.id()),
                offered.text(),
                stated.text());
        return severityClassifier.classify(violation, sentence);
    }

    private Set<String> actions(String text) {
        Set<String> words = TextTokens.contentWords(text, 3);
        return ACTION_STEMS.stream()
                .filter(stem -> words.stream().anyMatch(w -> w.startsWith(stem)))
                .collect(Collectors.toSet());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record OppositePair(String left, Pattern leftPattern, String right, Pattern rightPattern) {

        OppositePair(String left, String leftRegex, String right, String rightRegex) {
            this(left, Pattern.compile(leftRegex, Pattern.CASE_INSENSITIVE),
                    right, Pattern.compile(rightRegex, Pattern.CASE_INSENSITIVE));
        }

        /**
         * @return [policy side, response side] when the two texts take opposite sides
         */
        Optional<String[]> conflict(String policyText, String responseText) {
            String policy = policyText.toLowerCase(Locale.ROOT);
            String response = responseText.toLowerCase(Locale.ROOT);
            boolean policyLeft = leftPattern.matcher(policy).find();
            boolean policyRight = rightPattern.matcher(policy).find();
            boolean responseLeft = leftPattern.matcher(response).find();
            boolean responseRight = rightPattern.matcher(response).find();

            if (policyLeft && !policyRight && responseRight && !responseLeft) {
                return Optional.of(new String[]{left, right});
            }
            if (policyRight && !policyLeft && responseLeft && !responseRight) {
                return Optional.of(new String[]{right, left});
            }
            return Optional.empty();
        }
    }
}
