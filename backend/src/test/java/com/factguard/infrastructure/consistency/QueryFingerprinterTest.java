package com.factguard.infrastructure.consistency;

import com.factguard.infrastructure.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryFingerprinterTest {

    private QueryFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new QueryFingerprinter(new TextNormalizer());
    }

    @Test
    @DisplayName("Fingerprint is a 64 character hex SHA-256")
    void hex_sha256() {
        assertThat(fingerprinter.fingerprint("How long do refunds take?")).matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("Casing, punctuation, word order and stopwords do not change the fingerprint")
    void equivalent_queries() {
        String base = fingerprinter.fingerprint("How long do refunds take?");

        assertThat(fingerprinter.fingerprint("refunds TAKE how long")).isEqualTo(base);
        assertThat(fingerprinter.fingerprint("  How long do the refunds take!! ")).isEqualTo(base);
    }

    @Test
    @DisplayName("Different questions get different fingerprints")
    void different_queries() {
        assertThat(fingerprinter.fingerprint("How long do refunds take?"))
                .isNotEqualTo(fingerprinter.fingerprint("How long does shipping take?"));
    }
}
