package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.domain.verification.service.KnowledgeSource;
import com.factguard.domain.verification.service.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Verifies claims against every available knowledge source concurrently.
 * <p>
 * All lookups of one request run as a single task group bounded by the phase timeout;
 * lookups still running when it expires (or when the caller is interrupted) are cancelled
 * and their claims fall back to unverified.
 * </p>
 * Merge per claim: any {@code false} wins, else the first {@code verified} in source
 * priority order (corroboration by further sources raises its confidence), else the best
 * {@code unverified}.
 */
@Slf4j
@Component
public class VerificationOrchestrator {

    private static final double CORROBORATION_BONUS = 0.1;
    private static final double MAX_CONFIDENCE = 0.95;

    private final List<KnowledgeSource> sources;
    private final SearchTermBuilder searchTermBuilder;
    private final DocumentAssessor documentAssessor;
    private final TopicClassifier topicClassifier;
    private final VerificationCache cache;
    private final ExecutorService executor;

    @Value("${factguard.verification.phase-timeout:8s}")
    private Duration phaseTimeout;

    public VerificationOrchestrator(List<KnowledgeSource> sources,
                                    SearchTermBuilder searchTermBuilder,
                                    DocumentAssessor documentAssessor,
                                    TopicClassifier topicClassifier,
                                    VerificationCache cache,
                                    @Qualifier("verificationExecutor") ExecutorService executor) {
        this.sources = sources.stream()
                .sorted(Comparator.comparing(KnowledgeSource::tier))
                .toList();
        this.searchTermBuilder = searchTermBuilder;
        this.documentAssessor = documentAssessor;
        this.topicClassifier = topicClassifier;
        this.cache = cache;
        this.executor = executor;
    }

    public VerificationOutcome verifyAll(List<Claim> claims, String queryContext) {
        if (claims.isEmpty()) {
            return VerificationOutcome.empty();
        }

        List<KnowledgeSource> available = sources.stream().filter(KnowledgeSource::isAvailable).toList();
        VerificationResult[] results = new VerificationResult[claims.size()];
        List<ClaimLookup> lookups = new ArrayList<>();

        // 1. Resolve cache hits and ambiguous claims, plan lookups for the rest
        for (int i = 0; i < claims.size(); i++) {
            Claim claim = claims.get(i);
            String key = cache.key(claim.text(), topicClassifier.contextTopic(queryContext, claim.text()).orElse(null));

            Optional<VerificationResult> cached = cache.get(key);
            // keys are normalized, so a hit may come from differently cased or punctuated text
            if (cached.isPresent()) {
                results[i] = cached.get().withClaim(claim.text()).withMethod("cache");
                continue;
            }

            Optional<SearchTerm> term = searchTermBuilder.build(claim.text(), queryContext);
            if (term.isEmpty()) {
                results[i] = VerificationResult.unverified(claim.text(),
                        "Claim could not be turned into a search term", "ambiguous");
                continue;
            }
            if (available.isEmpty()) {
                results[i] = VerificationResult.unverified(claim.text(),
                        "No knowledge source is available", "unavailable");
                continue;
            }
            for (KnowledgeSource source : available) {
                lookups.add(new ClaimLookup(i, key, claim, term.get(), source));
            }
        }

        if (lookups.isEmpty()) {
            return new VerificationOutcome(List.of(results), false);
        }

        // 2. Run every lookup as one bounded task group
        List<Callable<Optional<VerificationResult>>> tasks = lookups.stream()
                .<Callable<Optional<VerificationResult>>>map(l -> () -> lookupAndAssess(l, queryContext))
                .toList();

        List<Future<Optional<VerificationResult>>> futures;
        boolean degraded = false;
        try {
            futures = executor.invokeAll(tasks, phaseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Verification interrupted, {} lookups abandoned", tasks.size());
            futures = List.of();
            degraded = true;
        }

        // 3. Merge per claim in source priority order
        List<List<Optional<VerificationResult>>> perClaim = new ArrayList<>();
        boolean[] incomplete = new boolean[claims.size()];
        for (int i = 0; i < claims.size(); i++) {
            perClaim.add(new ArrayList<>());
        }
        for (int t = 0; t < lookups.size(); t++) {
            ClaimLookup lookup = lookups.get(t);
            Optional<VerificationResult> answer = Optional.empty();
            if (t < futures.size()) {
                try {
                    answer = futures.get(t).get();
                } catch (CancellationException e) {
                    incomplete[lookup.claimIndex()] = true;
                    log.warn("[{}] Lookup timed out for '{}'", lookup.source().name(), lookup.term().query());
                } catch (ExecutionException e) {
                    log.warn("[{}] Lookup failed for '{}': {}", lookup.source().name(),
                            lookup.term().query(), e.getCause().toString());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    incomplete[lookup.claimIndex()] = true;
                }
            } else {
                incomplete[lookup.claimIndex()] = true;
            }
            perClaim.get(lookup.claimIndex()).add(answer);
        }

        for (ClaimLookup lookup : lookups) {
            int i = lookup.claimIndex();
            if (results[i] != null) {
                continue;
            }
            List<Optional<VerificationResult>> answers = perClaim.get(i);
            VerificationResult merged = merge(lookup.claim(), answers, incomplete[i]);
            results[i] = merged;
            degraded |= incomplete[i];
            if (!incomplete[i] && answers.stream().anyMatch(Optional::isPresent)) {
                cache.put(lookup.cacheKey(), merged);
            }
        }

        log.info("Verified {} claims with {} lookups across {} sources (degraded={}, cache size={}, hit rate={})",
                claims.size(), lookups.size(), available.size(), degraded, cache.size(),
                String.format(Locale.ROOT, "%.2f", cache.hitRate()));
        return new VerificationOutcome(List.of(results), degraded);
    }

    /**
     * Outcome for claims whose verification never completed: every claim unverified, method "timeout".
     */
    public VerificationOutcome unfinished(List<Claim> claims) {
        List<VerificationResult> results = claims.stream()
                .map(c -> VerificationResult.unverified(c.text(), "Verification did not complete", "timeout"))
                .toList();
        return new VerificationOutcome(results, !claims.isEmpty());
    }

    private Optional<VerificationResult> lookupAndAssess(ClaimLookup lookup, String queryContext) {
        KnowledgeSource source = lookup.source();
        try {
            List<KnowledgeDocument> documents = lookupWithRetry(source, lookup.term().query());
            return Optional.of(documentAssessor.assess(
                    lookup.claim(), queryContext, lookup.term(), source.name(), documents));
        } catch (SourceUnavailableException e) {
            log.warn("[{}] No opinion on '{}': {}", source.name(), lookup.term().query(), e.getMessage());
            return Optional.empty();
        }
    }

    // Lookups are idempotent reads, so one retry on timeout is safe
    private List<KnowledgeDocument> lookupWithRetry(KnowledgeSource source, String query) {
        try {
            return source.lookup(query);
        } catch (SourceUnavailableException e) {
            if (!e.isTimeout() || Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.debug("[{}] Timeout for '{}', retrying once", source.name(), query);
            return source.lookup(query);
        }
    }

    /**
     * @param answers one entry per source, in priority order; empty means no opinion
     */
    VerificationResult merge(Claim claim, List<Optional<VerificationResult>> answers, boolean incomplete) {
        List<VerificationResult> present = answers.stream().flatMap(Optional::stream).toList();

        Optional<VerificationResult> contradiction = present.stream()
                .filter(VerificationResult::isFalse)
                .max(Comparator.comparingDouble(VerificationResult::confidence));
        if (contradiction.isPresent()) {
            return contradiction.get();
        }

        List<VerificationResult> verified = present.stream().filter(VerificationResult::isVerified).toList();
        if (!verified.isEmpty()) {
            VerificationResult first = verified.get(0);
            if (verified.size() == 1) {
                return first;
            }
            double boosted = Math.min(first.confidence() + CORROBORATION_BONUS, MAX_CONFIDENCE);
            return new VerificationResult(first.claim(), first.status(), boosted, first.source(),
                    first.details() + " (corroborated by " + verified.size() + " sources)",
                    first.url(), first.method());
        }

        return present.stream()
                .max(Comparator.comparingDouble(VerificationResult::confidence))
                .orElseGet(() -> VerificationResult.unverified(claim.text(),
                        incomplete ? "Verification did not finish in time" : "No knowledge source answered",
                        incomplete ? "timeout" : "unavailable"));
    }

    private record ClaimLookup(int claimIndex, String cacheKey, Claim claim, SearchTerm term, KnowledgeSource source) {
    }
}
