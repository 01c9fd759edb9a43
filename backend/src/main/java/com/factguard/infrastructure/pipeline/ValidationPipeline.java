package com.factguard.infrastructure.pipeline;

import com.factguard.domain.rule.model.Policy;
import com.factguard.domain.rule.model.Rule;
import com.factguard.domain.rule.service.RuleLoadException;
import com.factguard.domain.rule.service.RuleStore;
import com.factguard.domain.validation.model.CorrectionResult;
import com.factguard.domain.validation.model.ValidationInput;
import com.factguard.domain.validation.model.ValidationResult;
import com.factguard.domain.validation.model.Violation;
import com.factguard.infrastructure.audit.ExplanationGenerator;
import com.factguard.infrastructure.citation.CitationOutcome;
import com.factguard.infrastructure.citation.CitationVerifier;
import com.factguard.infrastructure.consistency.ConsistencyChecker;
import com.factguard.infrastructure.consistency.ConsistencyOutcome;
import com.factguard.infrastructure.consistency.QueryFingerprinter;
import com.factguard.infrastructure.correction.CorrectionGenerator;
import com.factguard.infrastructure.extraction.AbsoluteLanguageDetector;
import com.factguard.infrastructure.extraction.ClaimExtractor;
import com.factguard.infrastructure.policy.PolicyMatcher;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import com.factguard.infrastructure.rules.RuleEngine;
import com.factguard.infrastructure.scoring.ConfidenceScorer;
import com.factguard.infrastructure.scoring.DecisionEngine;
import com.factguard.infrastructure.verification.HallucinationAssessor;
import com.factguard.infrastructure.verification.VerificationOrchestrator;
import com.factguard.infrastructure.verification.VerificationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Orchestrates one validation run:
 * <p>
 * preprocess → extract → (verify ‖ rules ‖ policies ‖ consistency ‖ citations)
 * → hallucinations → score → decide → correct → explain
 * </p>
 * The five checks are independent and run on the pipeline executor. Infrastructure failures
 * degrade a single component and bias the decision toward flagged, never toward approved.
 */
@Slf4j
@Component
public class ValidationPipeline {

    private final TextNormalizer textNormalizer;
    private final QueryFingerprinter queryFingerprinter;
    private final ClaimExtractor claimExtractor;
    private final AbsoluteLanguageDetector absoluteLanguageDetector;
    private final VerificationOrchestrator verificationOrchestrator;
    private final HallucinationAssessor hallucinationAssessor;
    private final RuleStore ruleStore;
    private final RuleEngine ruleEngine;
    private final PolicyMatcher policyMatcher;
    private final ConsistencyChecker consistencyChecker;
    private final CitationVerifier citationVerifier;
    private final ConfidenceScorer confidenceScorer;
    private final DecisionEngine decisionEngine;
    private final CorrectionGenerator correctionGenerator;
    private final ExplanationGenerator explanationGenerator;
    private final ExecutorService executor;

    public ValidationPipeline(TextNormalizer textNormalizer,
                              QueryFingerprinter queryFingerprinter,
                              ClaimExtractor claimExtractor,
                              AbsoluteLanguageDetector absoluteLanguageDetector,
                              VerificationOrchestrator verificationOrchestrator,
                              HallucinationAssessor hallucinationAssessor,
                              RuleStore ruleStore,
                              RuleEngine ruleEngine,
                              PolicyMatcher policyMatcher,
                              ConsistencyChecker consistencyChecker,
                              CitationVerifier citationVerifier,
                              ConfidenceScorer confidenceScorer,
                              DecisionEngine decisionEngine,
                              CorrectionGenerator correctionGenerator,
                              ExplanationGenerator explanationGenerator,
                              @Qualifier("pipelineExecutor") ExecutorService executor) {
        this.textNormalizer = textNormalizer;
        this.queryFingerprinter = queryFingerprinter;
        this.claimExtractor = claimExtractor;
        this.absoluteLanguageDetector = absoluteLanguageDetector;
        this.verificationOrchestrator = verificationOrchestrator;
        this.hallucinationAssessor = hallucinationAssessor;
        this.ruleStore = ruleStore;
        this.ruleEngine = ruleEngine;
        this.policyMatcher = policyMatcher;
        this.consistencyChecker = consistencyChecker;
        this.citationVerifier = citationVerifier;
        this.confidenceScorer = confidenceScorer;
        this.decisionEngine = decisionEngine;
        this.correctionGenerator = correctionGenerator;
        this.explanationGenerator = explanationGenerator;
        this.executor = executor;
    }

    public ValidationResult execute(ValidationInput input) {
        ValidationPipelineContext ctx = new ValidationPipelineContext();
        ctx.setInput(input);

        // 1. Preprocess
        preprocess(ctx);

        // 2. Extract claims and absolute assertions
        extract(ctx);

        // 3. Independent checks in parallel
        runChecks(ctx);

        // 4. Hallucinations from verification + absolute language
        ctx.setHallucinationViolations(hallucinationAssessor.assess(
                ctx.getClaims(), ctx.getVerificationResults(), ctx.getAbsoluteAssertions()));

        // 5. Score and decide
        decide(ctx);

        // 6. Correct
        correct(ctx);

        // 7. Explain
        ctx.setExplanation(explanationGenerator.generate(
                ctx.getStatus(), ctx.getScores().total(), ctx.allViolations(),
                ctx.getVerificationResults(), ctx.getCitationOutcome().citations(),
                ctx.sortedDegradedComponents()));

        log.info("Validation complete - org: {}, status: {}, score: {}, violations: {}, degraded: {}",
                input.organizationId(), ctx.getStatus(), ctx.getScores().total(),
                ctx.allViolations().size(), ctx.sortedDegradedComponents());

        return ctx.toValidationResult();
    }

    // ===== Internal methods =====

    private void preprocess(ValidationPipelineContext ctx) {
        ValidationInput input = ctx.getInput();
        ctx.setNormalizedResponse(textNormalizer.normalize(input.responseText()));
        ctx.setQueryFingerprint(queryFingerprinter.fingerprint(input.query()));
    }

    private void extract(ValidationPipelineContext ctx) {
        ctx.setClaims(claimExtractor.extract(ctx.getNormalizedResponse()));
        ctx.setAbsoluteAssertions(absoluteLanguageDetector.detect(ctx.getNormalizedResponse()));

        if (!ctx.getAbsoluteAssertions().isEmpty()) {
            log.info("Absolute language in {} sentences: {}", ctx.getAbsoluteAssertions().size(),
                    ctx.getAbsoluteAssertions().stream().map(AbsoluteLanguageDetector.AbsoluteAssertion::marker).toList());
        }
    }

    private void runChecks(ValidationPipelineContext ctx) {
        ValidationInput input = ctx.getInput();
        String text = ctx.getNormalizedResponse();

        List<Future<?>> stages = new ArrayList<>();
        Future<VerificationOutcome> verification = submit(stages,
                () -> verificationOrchestrator.verifyAll(ctx.getClaims(), input.query()));
        Future<List<Violation>> rules = submit(stages, () -> evaluateRules(ctx, text));
        Future<List<Violation>> policies = submit(stages, () -> matchPolicies(ctx, text));
        Future<ConsistencyOutcome> consistency = submit(stages,
                () -> consistencyChecker.check(input.organizationId(), ctx.getQueryFingerprint(), text));
        Future<CitationOutcome> citations = submit(stages, () -> citationVerifier.verify(text));

        VerificationOutcome verificationOutcome = await(verification, "verification", ctx, stages);
        if (verificationOutcome == null) {
            verificationOutcome = verificationOrchestrator.unfinished(ctx.getClaims());
        }
        if (verificationOutcome.degraded()) {
            ctx.markDegraded("verification");
        }
        ctx.setVerificationResults(verificationOutcome.results());

        List<Violation> ruleViolations = await(rules, "rules", ctx, stages);
        ctx.setRuleViolations(ruleViolations != null ? ruleViolations : List.of());

        List<Violation> policyViolations = await(policies, "policies", ctx, stages);
        ctx.setPolicyViolations(policyViolations != null ? policyViolations : List.of());

        ConsistencyOutcome consistencyOutcome = await(consistency, "consistency", ctx, stages);
        if (consistencyOutcome == null || consistencyOutcome.degraded()) {
            ctx.markDegraded("consistency");
        }
        ctx.setConsistency(consistencyOutcome != null
                ? consistencyOutcome
                : new ConsistencyOutcome(0.8, 0, null, true));

        CitationOutcome citationOutcome = await(citations, "citations", ctx, stages);
        ctx.setCitationOutcome(citationOutcome != null ? citationOutcome : CitationOutcome.empty());
    }

    private List<Violation> evaluateRules(ValidationPipelineContext ctx, String text) {
        ValidationInput input = ctx.getInput();
        List<Rule> rules;
        try {
            rules = ruleStore.listActiveRules(input.organizationId(), input.industry());
        } catch (RuleLoadException e) {
            log.error("Rule store unavailable, evaluating zero rules for org {}", input.organizationId(), e);
            ctx.markDegraded("rules");
            return List.of();
        }
        return ruleEngine.evaluateAll(rules, text, input.organizationId(), input.industry());
    }

    private List<Violation> matchPolicies(ValidationPipelineContext ctx, String text) {
        ValidationInput input = ctx.getInput();
        List<Policy> policies;
        try {
            policies = ruleStore.listActivePolicies(input.organizationId());
        } catch (RuleLoadException e) {
            log.error("Policy store unavailable, matching zero policies for org {}", input.organizationId(), e);
            ctx.markDegraded("policies");
            return List.of();
        }
        return policyMatcher.match(policies, text);
    }

    private void decide(ValidationPipelineContext ctx) {
        List<Violation> violations = ctx.allViolations();
        ctx.setScores(confidenceScorer.score(
                ctx.getVerificationResults(),
                ctx.getConsistency().score(),
                ctx.getCitationOutcome().citations(),
                violations));
        ctx.setStatus(decisionEngine.decide(
                violations, ctx.getScores().total(), ctx.getVerificationResults(), ctx.sortedDegradedComponents()));
    }

    private void correct(ValidationPipelineContext ctx) {
        List<Violation> violations = ctx.allViolations();
        if (violations.isEmpty()) {
            ctx.setCorrection(CorrectionResult.unchanged(ctx.getNormalizedResponse()));
            return;
        }
        ctx.setCorrection(correctionGenerator.generate(
                ctx.getNormalizedResponse(), violations, ctx.getVerificationResults(), ctx.getInput().query()));
    }

    private <T> Future<T> submit(List<Future<?>> stages, Callable<T> stage) {
        Future<T> future = executor.submit(stage);
        stages.add(future);
        return future;
    }

    /**
     * Waits for a stage. Interruption of the caller cancels every stage still running,
     * which interrupts their in-flight lookups, and marks the component degraded.
     *
     * @return the stage result, or null when the stage was interrupted or cancelled
     */
    private <T> T await(Future<T> stage, String component, ValidationPipelineContext ctx, List<Future<?>> stages) {
        try {
            return stage.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stages.forEach(s -> s.cancel(true));
            log.warn("Interrupted while waiting for {}, cancelling remaining checks", component);
            ctx.markDegraded(component);
            return null;
        } catch (CancellationException e) {
            log.warn("Check {} was cancelled, continuing degraded", component);
            ctx.markDegraded(component);
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Pipeline stage failed: " + component, e.getCause());
        }
    }
}
