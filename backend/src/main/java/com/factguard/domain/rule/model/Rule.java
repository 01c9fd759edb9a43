package com.factguard.domain.rule.model;

import com.factguard.domain.validation.model.Severity;
import lombok.Builder;

import java.util.List;

/**
 * Immutable per-request snapshot of a compliance rule.
 * Built from a {@link ComplianceRule} row or from a built-in regulatory template.
 * The {@code action} is descriptive metadata; the decision comes from severities and scores.
 */
@Builder
public record Rule(
        String id,
        String organizationId,
        String industry,
        String name,
        RuleType type,
        MatchType matchType,
        List<String> keywords,
        List<String> patterns,
        List<String> requiredText,
        List<String> forbiddenText,
        Severity severity,
        RuleAction action,
        String message,
        boolean active
) {

    public Rule {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        requiredText = requiredText != null ? List.copyOf(requiredText) : List.of();
        forbiddenText = forbiddenText != null ? List.copyOf(forbiddenText) : List.of();
        matchType = matchType != null ? matchType : MatchType.KEYWORD;
        severity = severity != null ? severity : Severity.MEDIUM;
        action = action != null ? action : RuleAction.FLAG;
    }

    /**
     * A rule applies to a request when it is global (no organization and no industry),
     * scoped to the requesting organization, or scoped to the request's industry.
     */
    public boolean appliesTo(String requestOrganizationId, String requestIndustry) {
        if (!active) {
            return false;
        }
        boolean orgMatches = organizationId == null || organizationId.equals(requestOrganizationId);
        boolean industryMatches = industry == null
                || (requestIndustry != null && industry.equalsIgnoreCase(requestIndustry));
        return orgMatches && industryMatches;
    }
}
