package com.factguard.infrastructure.rules;

import com.factguard.domain.rule.model.MatchType;
import com.factguard.domain.rule.model.Rule;
import com.factguard.domain.rule.model.RuleAction;
import com.factguard.domain.rule.model.RuleType;
import com.factguard.domain.validation.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Built-in regulatory rules. Templates without an industry apply to every organization;
 * the others only when the request names their industry.
 */
@Component
public class RegulatoryTemplateCatalog {

    private static final List<Rule> TEMPLATES = List.of(
            // Global
            template("eu-ai-act-transparency", null, "EU AI Act - Transparency", MatchType.KEYWORD,
                    List.of(), List.of(), List.of("cannot explain", "black box", "proprietary algorithm"),
                    Severity.CRITICAL, RuleAction.BLOCK,
                    "AI systems must not claim they cannot explain their output"),
            template("gdpr-false-data-claims", null, "GDPR - No False Data Claims", MatchType.KEYWORD,
                    List.of("we never delete", "data stored forever", "permanent storage"), List.of(), List.of(),
                    Severity.CRITICAL, RuleAction.BLOCK,
                    "Personal data must remain deletable on request"),
            template("consumer-investment-guarantees", null, "Consumer Protection - No Investment Guarantees",
                    MatchType.KEYWORD,
                    List.of("guaranteed returns", "guaranteed profit", "always goes up", "always go up",
                            "cannot lose", "can't lose", "risk-free investment", "sure thing"),
                    List.of(), List.of(),
                    Severity.HIGH, RuleAction.BLOCK,
                    "Investment outcomes must never be presented as certain"),

            // Finance
            template("sec-no-guarantees", "finance", "SEC - No Financial Guarantees", MatchType.KEYWORD,
                    List.of("guarantee", "guaranteed", "always profitable", "risk-free", "sure thing", "cannot lose"),
                    List.of(), List.of(),
                    Severity.CRITICAL, RuleAction.BLOCK,
                    "Guarantees of investment returns are prohibited"),
            template("sec-risk-disclaimer", "finance", "SEC - Required Risk Disclaimer", MatchType.KEYWORD,
                    List.of(), List.of("risk"), List.of(),
                    Severity.HIGH, RuleAction.FLAG,
                    "Investment discussion must disclose risk. Past performance does not guarantee future results"),
            template("sec-investment-advice", "finance", "SEC - No Specific Investment Advice", MatchType.PATTERN,
                    List.of("buy\\s+\\w+\\s+stock", "invest\\s+all", "you should\\s+buy"), List.of(), List.of(),
                    Severity.HIGH, RuleAction.FLAG,
                    "Specific investment recommendations require a registered advisor"),
            template("cfpb-false-promises", "finance", "CFPB - No False Promises", MatchType.KEYWORD,
                    List.of("guaranteed approval", "definitely approved", "100% approved", "cannot be denied"),
                    List.of(), List.of(),
                    Severity.CRITICAL, RuleAction.BLOCK,
                    "Loan or credit approval must not be promised"),
            template("cfpb-clear-terms", "finance", "CFPB - Clear Terms Required", MatchType.KEYWORD,
                    List.of(), List.of(), List.of("hidden fees", "fine print", "terms not disclosed"),
                    Severity.HIGH, RuleAction.FLAG,
                    "All terms and fees must be disclosed clearly"),

            // Airline
            template("dot-refund-accuracy", "airline", "DOT - Accurate Refund Information", MatchType.KEYWORD,
                    List.of(), List.of(), List.of("instant refund", "immediate refund", "refund in 24 hours"),
                    Severity.HIGH, RuleAction.FLAG,
                    "Refund processing times must be stated accurately"),
            template("dot-compensation-promises", "airline", "DOT - No False Compensation Promises", MatchType.KEYWORD,
                    List.of("guaranteed compensation", "automatic refund", "always refund"), List.of(), List.of(),
                    Severity.CRITICAL, RuleAction.BLOCK,
                    "Compensation must not be promised unconditionally")
    );

    public List<Rule> templates() {
        return TEMPLATES;
    }

    private static Rule template(String id, String industry, String name, MatchType matchType,
                                 List<String> keywords, List<String> requiredText, List<String> forbiddenText,
                                 Severity severity, RuleAction action, String message) {
        boolean patterns = matchType == MatchType.PATTERN;
        return Rule.builder()
                .id("template:" + id)
                .industry(industry)
                .name(name)
                .type(RuleType.REGULATORY)
                .matchType(matchType)
                .keywords(patterns ? List.of() : keywords)
                .patterns(patterns ? keywords : List.of())
                .requiredText(requiredText)
                .forbiddenText(forbiddenText)
                .severity(severity)
                .action(action)
                .message(message)
                .active(true)
                .build();
    }
}
