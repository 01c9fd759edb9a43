package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VerificationCacheTest {

    private static final VerificationResult FALSE_RESULT = new VerificationResult(
            "Python is a snake.", VerificationStatus.FALSE, 0.9, "wikipedia", "Context mismatch", null, "summary");

    private final VerificationCache cache = new VerificationCache(new TextNormalizer(), Duration.ofHours(1), 100);

    @Test
    @DisplayName("Keys ignore casing and punctuation but not the topic")
    void keys() {
        assertThat(cache.key("Python is a snake.", Topic.PROGRAMMING))
                .isEqualTo(cache.key("PYTHON IS A SNAKE!", Topic.PROGRAMMING))
                .isNotEqualTo(cache.key("Python is a snake.", null));
    }

    @Test
    @DisplayName("Hits and misses are counted")
    void stats() {
        String key = cache.key("Python is a snake.", null);

        assertThat(cache.get(key)).isEmpty();
        cache.put(key, FALSE_RESULT);
        assertThat(cache.get(key)).contains(FALSE_RESULT);

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.hitRate()).isCloseTo(0.5, within(1e-9));
    }
}
