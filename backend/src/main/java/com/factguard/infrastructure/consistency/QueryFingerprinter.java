package com.factguard.infrastructure.consistency;

import com.factguard.infrastructure.preprocessing.TextNormalizer;
import com.factguard.infrastructure.preprocessing.TextTokens;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Builds deterministic SHA-256 fingerprints of user queries.
 * Queries that differ only in word order, casing, punctuation or stopwords share a fingerprint,
 * which is the key the history store groups prior responses under.
 */
@Component
@RequiredArgsConstructor
public class QueryFingerprinter {

    private final TextNormalizer textNormalizer;

    /**
     * @param query the raw user query
     * @return hex-encoded SHA-256 hash of the sorted content words
     */
    public String fingerprint(String query) {
        String normalized = textNormalizer.normalizeForKey(query);
        String sortedWords = TextTokens.contentWords(normalized, 2).stream()
                .sorted()
                .collect(Collectors.joining(" "));
        return sha256(sortedWords);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
