package com.factguard.domain.rule.model;

public enum RuleType {
    REGULATORY,
    POLICY,
    CUSTOM
}
