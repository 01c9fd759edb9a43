package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ViolationType {
    COMPLIANCE,
    POLICY,
    HALLUCINATION,
    CITATION,
    CONSISTENCY;

    /**
     * Rule and policy findings are the ones that lower the compliance score.
     */
    public boolean affectsCompliance() {
        return this == COMPLIANCE || this == POLICY;
    }

    public static ViolationType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
