package com.factguard.domain.rule.model;

public enum RuleAction {
    BLOCK,
    FLAG,
    WARN
}
