package com.factguard.infrastructure.rules;

import com.factguard.domain.rule.model.CompanyPolicy;
import com.factguard.domain.rule.model.ComplianceRule;
import com.factguard.domain.rule.model.Policy;
import com.factguard.domain.rule.model.Rule;
import com.factguard.domain.rule.repository.CompanyPolicyRepository;
import com.factguard.domain.rule.repository.ComplianceRuleRepository;
import com.factguard.domain.rule.service.RuleLoadException;
import com.factguard.domain.rule.service.RuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule store backed by the organization tables, plus the built-in regulatory templates.
 * Each repository call runs in its own transaction; any failure to reach the database,
 * including a transaction that cannot be started, becomes a {@link RuleLoadException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRuleStore implements RuleStore {

    private final ComplianceRuleRepository ruleRepository;
    private final CompanyPolicyRepository policyRepository;
    private final RegulatoryTemplateCatalog templateCatalog;

    @Value("${factguard.rules.regulatory-templates-enabled:true}")
    private boolean templatesEnabled;

    @Override
    public List<Rule> listActiveRules(String organizationId, String industry) {
        List<Rule> rules = new ArrayList<>();
        if (templatesEnabled) {
            templateCatalog.templates().stream()
                    .filter(rule -> rule.appliesTo(organizationId, industry))
                    .forEach(rules::add);
        }

        try {
            ruleRepository.findByOrganizationIdAndActiveTrue(organizationId).stream()
                    .map(ComplianceRule::toRule)
                    .filter(rule -> rule.appliesTo(organizationId, industry))
                    .forEach(rules::add);
        } catch (DataAccessException | TransactionException e) {
            throw new RuleLoadException("Failed to load rules for organization " + organizationId, e);
        }

        log.debug("Loaded {} rules for organization {} (industry={})", rules.size(), organizationId, industry);
        return List.copyOf(rules);
    }

    @Override
    public List<Policy> listActivePolicies(String organizationId) {
        try {
            return policyRepository.findByOrganizationIdAndActiveTrueOrderByPriorityDesc(organizationId).stream()
                    .map(CompanyPolicy::toPolicy)
                    .toList();
        } catch (DataAccessException | TransactionException e) {
            throw new RuleLoadException("Failed to load policies for organization " + organizationId, e);
        }
    }
}
