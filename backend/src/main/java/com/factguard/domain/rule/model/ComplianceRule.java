package com.factguard.domain.rule.model;

import com.factguard.domain.validation.model.Severity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Organization-administered compliance rule. Read-only for this service.
 * List-valued columns are stored one entry per line.
 */
@Entity
@Table(name = "compliance_rules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ComplianceRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String organizationId;

    @Column(length = 64)
    private String industry;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RuleType ruleType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MatchType matchType;

    @Column(columnDefinition = "TEXT")
    private String keywords;

    @Column(columnDefinition = "TEXT")
    private String patterns;

    @Column(columnDefinition = "TEXT")
    private String requiredText;

    @Column(columnDefinition = "TEXT")
    private String forbiddenText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RuleAction action;

    @Column(length = 500)
    private String message;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public ComplianceRule(String organizationId, String industry, String name,
                          RuleType ruleType, MatchType matchType,
                          List<String> keywords, List<String> patterns,
                          List<String> requiredText, List<String> forbiddenText,
                          Severity severity, RuleAction action, String message, boolean active) {
        this.organizationId = organizationId;
        this.industry = industry;
        this.name = name;
        this.ruleType = ruleType != null ? ruleType : RuleType.CUSTOM;
        this.matchType = matchType != null ? matchType : MatchType.KEYWORD;
        this.keywords = join(keywords);
        this.patterns = join(patterns);
        this.requiredText = join(requiredText);
        this.forbiddenText = join(forbiddenText);
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.action = action != null ? action : RuleAction.FLAG;
        this.message = message;
        this.active = active;
        this.createdAt = LocalDateTime.now();
    }

    public Rule toRule() {
        return Rule.builder()
                .id(String.valueOf(id))
                .organizationId(organizationId)
                .industry(industry)
                .name(name)
                .type(ruleType)
                .matchType(matchType)
                .keywords(split(keywords))
                .patterns(split(patterns))
                .requiredText(split(requiredText))
                .forbiddenText(split(forbiddenText))
                .severity(severity)
                .action(action)
                .message(message)
                .active(active)
                .build();
    }

    private static String join(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join("\n", values);
    }

    private static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split("\n"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
