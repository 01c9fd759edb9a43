package com.factguard.infrastructure.consistency;

import com.factguard.domain.audit.service.HistoryStore;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.preprocessing.TextTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compares a response with the organization's prior responses to the same query fingerprint.
 * <p>
 * Lack of history is never penalized: fewer than two prior responses score the
 * no-history default. Similarity is the average Jaccard overlap of content words,
 * floored so a single odd answer cannot drag the score to zero.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsistencyChecker {

    private static final int MIN_HISTORY = 2;
    private static final int SMALL_SAMPLE = 3;
    private static final double VERY_LOW_SIMILARITY = 0.2;
    private static final double SMALL_SAMPLE_SCORE = 0.7;

    private final HistoryStore historyStore;

    @Value("${factguard.consistency.history-size:5}")
    private int historySize;

    @Value("${factguard.consistency.no-history-score:0.9}")
    private double noHistoryScore;

    @Value("${factguard.consistency.unavailable-score:0.8}")
    private double unavailableScore;

    @Value("${factguard.consistency.floor:0.4}")
    private double floor;

    @Value("${factguard.consistency.violation-threshold:0.5}")
    private double violationThreshold;

    public ConsistencyOutcome check(String organizationId, String queryFingerprint, String responseText) {
        List<String> history;
        try {
            history = historyStore.recentResponses(organizationId, queryFingerprint, historySize);
        } catch (DataAccessException | TransactionException e) {
            log.warn("History store unavailable, using default consistency score: {}", e.getMessage());
            return new ConsistencyOutcome(unavailableScore, 0, null, true);
        }

        if (history.size() < MIN_HISTORY) {
            log.debug("Only {} prior responses, using no-history score", history.size());
            return new ConsistencyOutcome(noHistoryScore, history.size(), null, false);
        }

        double score = score(responseText, history);
        Violation violation = null;
        if (score < violationThreshold) {
            violation = new Violation(
                    ViolationType.CONSISTENCY,
                    Severity.LOW,
                    String.format(Locale.ROOT, "Response is inconsistent with %d prior responses (score: %.2f)", history.size(), score),
                    ViolationOrigin.consistency(),
                    null,
                    null);
        }
        return new ConsistencyOutcome(score, history.size(), violation, false);
    }

    double score(String responseText, List<String> history) {
        Set<String> current = TextTokens.contentWords(responseText, 3);
        double average = history.stream()
                .mapToDouble(prior -> TextTokens.jaccard(current, TextTokens.contentWords(prior, 3)))
                .average()
                .orElse(noHistoryScore);

        if (average < VERY_LOW_SIMILARITY && history.size() < SMALL_SAMPLE) {
            return SMALL_SAMPLE_SCORE;
        }
        return Math.max(average, floor);
    }
}
