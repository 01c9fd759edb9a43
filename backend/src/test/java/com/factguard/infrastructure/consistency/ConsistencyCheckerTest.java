package com.factguard.infrastructure.consistency;

import com.factguard.domain.audit.service.HistoryStore;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsistencyCheckerTest {

    private static final String RESPONSE = "Refunds are processed within seven to ten business days.";

    @Mock
    private HistoryStore historyStore;

    private ConsistencyChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ConsistencyChecker(historyStore);
        ReflectionTestUtils.setField(checker, "historySize", 5);
        ReflectionTestUtils.setField(checker, "noHistoryScore", 0.9);
        ReflectionTestUtils.setField(checker, "unavailableScore", 0.8);
        ReflectionTestUtils.setField(checker, "floor", 0.4);
        ReflectionTestUtils.setField(checker, "violationThreshold", 0.5);
    }

    @Test
    @DisplayName("Fewer than two prior responses gives the no-history score")
    void not_enough_history() {
        when(historyStore.recentResponses("acme", "fp", 5)).thenReturn(List.of("Refunds take a week."));

        ConsistencyOutcome outcome = checker.check("acme", "fp", RESPONSE);

        assertThat(outcome.score()).isEqualTo(0.9);
        assertThat(outcome.sampleSize()).isEqualTo(1);
        assertThat(outcome.finding()).isEmpty();
        assertThat(outcome.degraded()).isFalse();
    }

    @Test
    @DisplayName("Unavailable history store degrades to the default score")
    void store_unavailable() {
        when(historyStore.recentResponses("acme", "fp", 5)).thenThrow(new QueryTimeoutException("timeout"));

        ConsistencyOutcome outcome = checker.check("acme", "fp", RESPONSE);

        assertThat(outcome.score()).isEqualTo(0.8);
        assertThat(outcome.degraded()).isTrue();
    }

    @Test
    @DisplayName("Identical prior responses are fully consistent")
    void identical_history() {
        when(historyStore.recentResponses("acme", "fp", 5)).thenReturn(List.of(RESPONSE, RESPONSE, RESPONSE));

        ConsistencyOutcome outcome = checker.check("acme", "fp", RESPONSE);

        assertThat(outcome.score()).isEqualTo(1.0);
        assertThat(outcome.finding()).isEmpty();
    }

    @Test
    @DisplayName("Unrelated prior responses produce a low severity finding at the floor score")
    void inconsistent_history() {
        when(historyStore.recentResponses("acme", "fp", 5)).thenReturn(List.of(
                "Contact support for assistance.",
                "Shipping costs depend on destination.",
                "Gift cards cannot be exchanged."));

        ConsistencyOutcome outcome = checker.check("acme", "fp", RESPONSE);

        assertThat(outcome.score()).isEqualTo(0.4);
        Violation violation = outcome.finding().orElseThrow();
        assertThat(violation.type()).isEqualTo(ViolationType.CONSISTENCY);
        assertThat(violation.severity()).isEqualTo(Severity.LOW);
        assertThat(violation.description()).isEqualTo("Response is inconsistent with 3 prior responses (score: 0.40)");
    }

    @Test
    @DisplayName("Very low similarity over a small sample is not trusted")
    void small_sample() {
        when(historyStore.recentResponses("acme", "fp", 5)).thenReturn(List.of(
                "Contact support for assistance.",
                "Shipping costs depend on destination."));

        ConsistencyOutcome outcome = checker.check("acme", "fp", RESPONSE);

        assertThat(outcome.score()).isEqualTo(0.7);
        assertThat(outcome.finding()).isEmpty();
    }
}
