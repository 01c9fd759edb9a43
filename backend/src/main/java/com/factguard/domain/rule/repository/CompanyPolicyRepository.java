package com.factguard.domain.rule.repository;

import com.factguard.domain.rule.model.CompanyPolicy;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CompanyPolicyRepository extends JpaRepository<CompanyPolicy, Long> {

    List<CompanyPolicy> findByOrganizationIdAndActiveTrueOrderByPriorityDesc(String organizationId);
}
