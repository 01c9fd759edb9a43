package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationStatus {
    APPROVED,
    FLAGGED,
    BLOCKED;

    public static ValidationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
