package com.factguard.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The single component that produced a violation.
 *
 * @param kind      producing component
 * @param reference rule id, policy id, claim text, citation url or "consistency"
 */
public record ViolationOrigin(Kind kind, String reference) {

    public enum Kind {
        RULE,
        POLICY,
        CLAIM,
        CITATION,
        CONSISTENCY;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ViolationOrigin rule(String ruleId) {
        return new ViolationOrigin(Kind.RULE, ruleId);
    }

    public static ViolationOrigin policy(String policyId) {
        return new ViolationOrigin(Kind.POLICY, policyId);
    }

    public static ViolationOrigin claim(String claimText) {
        return new ViolationOrigin(Kind.CLAIM, claimText);
    }

    public static ViolationOrigin citation(String url) {
        return new ViolationOrigin(Kind.CITATION, url);
    }

    public static ViolationOrigin consistency() {
        return new ViolationOrigin(Kind.CONSISTENCY, "consistency");
    }
}
