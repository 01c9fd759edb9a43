package com.factguard.domain.rule.service;

import com.factguard.domain.rule.model.Policy;
import com.factguard.domain.rule.model.Rule;

import java.util.List;

/**
 * Read-only access to organization rules and policies.
 * Implementations return a fresh snapshot per call and never hand out mutable state.
 */
public interface RuleStore {

    /**
     * @throws RuleLoadException if the backing store cannot be read
     */
    List<Rule> listActiveRules(String organizationId, String industry);

    /**
     * @throws RuleLoadException if the backing store cannot be read
     */
    List<Policy> listActivePolicies(String organizationId);
}
