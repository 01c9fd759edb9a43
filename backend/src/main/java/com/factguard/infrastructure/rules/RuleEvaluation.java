package com.factguard.infrastructure.rules;

import com.factguard.domain.rule.model.Rule;

/**
 * Result of evaluating one rule against one text.
 *
 * @param rule        the evaluated rule
 * @param passed      true if the text complies
 * @param details     why the rule failed, or "passed"
 * @param matchedText offending text found in the response (nullable)
 * @param missingText required text that was absent (nullable)
 */
public record RuleEvaluation(
        Rule rule,
        boolean passed,
        String details,
        String matchedText,
        String missingText
) {

    static RuleEvaluation pass(Rule rule) {
        return new RuleEvaluation(rule, true, "passed", null, null);
    }

    static RuleEvaluation matched(Rule rule, String details, String matchedText) {
        return new RuleEvaluation(rule, false, details, matchedText, null);
    }

    static RuleEvaluation missing(Rule rule, String details, String missingText) {
        return new RuleEvaluation(rule, false, details, null, missingText);
    }
}
