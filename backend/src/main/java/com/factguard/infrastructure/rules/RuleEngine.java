package com.factguard.infrastructure.rules;

import com.factguard.domain.rule.model.Rule;
import com.factguard.domain.rule.model.RuleType;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextTokens;
import com.factguard.infrastructure.scoring.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates compliance rules against the full response text.
 * <p>
 * Per rule: forbidden text → required text → match type evaluator. Every applicable rule is
 * evaluated; one failing rule never hides another.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleEngine {

    private final SeverityClassifier severityClassifier;
    private final SentenceSplitter sentenceSplitter;

    // Compiled patterns per source string; empty when the pattern is invalid
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    /**
     * Evaluate every rule that applies to the organization and industry.
     *
     * @return one violation per failing rule
     */
    public List<Violation> evaluateAll(List<Rule> rules, String text, String organizationId, String industry) {
        List<Violation> violations = new ArrayList<>();
        int applicable = 0;

        for (Rule rule : rules) {
            if (!rule.appliesTo(organizationId, industry)) {
                continue;
            }
            applicable++;
            RuleEvaluation evaluation = evaluate(rule, text);
            if (!evaluation.passed()) {
                violations.add(toViolation(evaluation, text));
            }
        }

        log.info("Rule engine: {} of {} applicable rules failed", violations.size(), applicable);
        return violations;
    }

    public RuleEvaluation evaluate(Rule rule, String text) {
        String content = text != null ? text : "";

        // 1. Forbidden text
        for (String forbidden : rule.forbiddenText()) {
            Optional<String> found = findPhrase(content, forbidden);
            if (found.isPresent()) {
                return RuleEvaluation.matched(rule, "forbidden text '" + forbidden + "' present", found.get());
            }
        }

        // 2. Required text
        for (String required : rule.requiredText()) {
            if (!TextTokens.containsPhrase(content, required)) {
                return RuleEvaluation.missing(rule, "missing required text '" + required + "'", required);
            }
        }

        // 3. Match type
        return switch (rule.matchType()) {
            case KEYWORD, SEMANTIC -> evaluateKeywords(rule, content);
            case PATTERN -> evaluatePatterns(rule, content);
        };
    }

    private RuleEvaluation evaluateKeywords(Rule rule, String content) {
        for (String keyword : rule.keywords()) {
            Optional<String> found = findPhrase(content, keyword);
            if (found.isPresent()) {
                return RuleEvaluation.matched(rule, "prohibited keyword '" + keyword + "' found", found.get());
            }
        }
        return RuleEvaluation.pass(rule);
    }

    private RuleEvaluation evaluatePatterns(Rule rule, String content) {
        for (String source : rule.patterns()) {
            Optional<Pattern> pattern = compile(rule, source);
            if (pattern.isEmpty()) {
                continue;
            }
            Matcher matcher = pattern.get().matcher(content);
            if (matcher.find()) {
                return RuleEvaluation.matched(rule, "prohibited pattern '" + source + "' matched", matcher.group());
            }
        }
        return RuleEvaluation.pass(rule);
    }

    private Optional<Pattern> compile(Rule rule, String source) {
        return patternCache.computeIfAbsent(source, s -> {
            try {
                return Optional.of(Pattern.compile(s, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                log.warn("Skipping invalid pattern in rule '{}' ({}): {}", rule.name(), rule.id(), e.getDescription());
                return Optional.empty();
            }
        });
    }

    private Optional<String> findPhrase(String content, String phrase) {
        int index = TextTokens.findPhrase(content, phrase);
        return index < 0 ? Optional.empty() : Optional.of(content.substring(index, index + phrase.strip().length()));
    }

    private Violation toViolation(RuleEvaluation evaluation, String text) {
        Rule rule = evaluation.rule();
        ViolationType type = rule.type() == RuleType.POLICY ? ViolationType.POLICY : ViolationType.COMPLIANCE;

        StringBuilder description = new StringBuilder("Rule '").append(rule.name()).append("' failed: ")
                .append(evaluation.details());
        if (rule.message() != null && !rule.message().isBlank()) {
            description.append(". ").append(rule.message());
        }

        String suggested = null;
        if (evaluation.missingText() != null) {
            suggested = rule.message() != null && !rule.message().isBlank()
                    ? "Disclaimer: " + rule.message() + "."
                    : "Disclaimer: " + evaluation.missingText() + ".";
        }

        Violation violation = new Violation(type, rule.severity(), description.toString(),
                ViolationOrigin.rule(rule.id()), evaluation.matchedText(), suggested);
        return severityClassifier.classify(violation, sentenceContaining(text, evaluation.matchedText()));
    }

    private String sentenceContaining(String text, String fragment) {
        if (fragment == null || text == null) {
            return null;
        }
        return sentenceSplitter.split(text).stream()
                .filter(s -> TextTokens.containsPhrase(s, fragment))
                .findFirst()
                .orElse(fragment);
    }
}
