package com.factguard.domain.rule.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "company_policies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CompanyPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String organizationId;

    @Column(nullable = false, length = 200)
    private String policyName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String policyContent;

    @Column(length = 100)
    private String category;

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public CompanyPolicy(String organizationId, String policyName, String policyContent,
                         String category, int priority) {
        this.organizationId = organizationId;
        this.policyName = policyName;
        this.policyContent = policyContent;
        this.category = category;
        this.priority = priority;
        this.active = true;
        this.createdAt = LocalDateTime.now();
    }

    public Policy toPolicy() {
        return new Policy(String.valueOf(id), organizationId, policyName, policyContent, category, priority);
    }
}
