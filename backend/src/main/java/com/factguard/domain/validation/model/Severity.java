package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Violation severity, ordered from least to most severe.
 * CRITICAL always blocks; LOW is informational only.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Severity fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
