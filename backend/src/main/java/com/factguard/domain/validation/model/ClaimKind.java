package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse claim category. Used for display and severity hints, never for scoring.
 */
public enum ClaimKind {
    FINANCIAL,
    STATISTICAL,
    REGULATORY,
    TEMPORAL,
    GENERAL;

    /**
     * Material claims are the ones where a factual error carries real-world risk.
     */
    public boolean isMaterial() {
        return this == FINANCIAL || this == STATISTICAL || this == REGULATORY;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
