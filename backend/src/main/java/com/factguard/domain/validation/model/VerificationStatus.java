package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerificationStatus {
    VERIFIED,
    UNVERIFIED,
    FALSE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
