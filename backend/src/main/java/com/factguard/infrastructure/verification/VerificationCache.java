package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Process-wide cache of completed verification results, keyed by normalized claim text
 * and context topic. Concurrent puts for the same key are last-writer-wins.
 */
@Component
public class VerificationCache {

    private final TextNormalizer textNormalizer;
    private final Cache<String, VerificationResult> cache;

    public VerificationCache(TextNormalizer textNormalizer,
                             @Value("${factguard.verification.cache.ttl:6h}") Duration ttl,
                             @Value("${factguard.verification.cache.max-size:10000}") long maxSize) {
        this.textNormalizer = textNormalizer;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    public String key(String claimText, Topic topic) {
        return textNormalizer.normalizeForKey(claimText) + "|" + (topic != null ? topic.name() : "-");
    }

    public Optional<VerificationResult> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, VerificationResult result) {
        cache.put(key, result);
    }

    public double hitRate() {
        return cache.stats().hitRate();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
