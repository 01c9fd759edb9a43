package com.factguard.domain.rule.repository;

import com.factguard.domain.rule.model.ComplianceRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ComplianceRuleRepository extends JpaRepository<ComplianceRule, Long> {

    List<ComplianceRule> findByOrganizationIdAndActiveTrue(String organizationId);
}
