package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.infrastructure.preprocessing.TextTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Judges a claim against documents returned by one knowledge source.
 * <p>
 * Order of checks per document: context mismatch, predicate mismatch, year contradiction,
 * then word overlap. Only the first three can produce {@code false}; overlap alone never does.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentAssessor {

    private static final double MISMATCH_CONFIDENCE = 0.9;
    private static final double CONTRADICTION_CONFIDENCE = 0.75;

    private static final Pattern EVENT_YEAR = Pattern.compile(
            "\\b(founded|released|created|established|launched|introduced|invented|born|published|discovered)"
            + "\\b[^.;]{0,40}?\\b(1[5-9]\\d{2}|20\\d{2})\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PREDICATE = Pattern.compile(
            "\\b(?:is|was|are|were)\\s+(?:a|an|the)?\\s*(.+)$", Pattern.CASE_INSENSITIVE
    );

    private final TopicClassifier topicClassifier;

    @Value("${factguard.verification.min-overlap:0.2}")
    private double minOverlap;

    /**
     * @param claim        the claim under test
     * @param queryContext the original user question (nullable)
     * @param term         search term used for the lookup
     * @param source       knowledge source name
     * @param documents    documents returned, most relevant first
     */
    public VerificationResult assess(Claim claim, String queryContext, SearchTerm term,
                                     String source, List<KnowledgeDocument> documents) {
        if (documents.isEmpty()) {
            return new VerificationResult(claim.text(), VerificationStatus.UNVERIFIED, 0.3, source,
                    "No matching document found for '" + term.query() + "'", null, "search");
        }

        Optional<Topic> contextTopic = topicClassifier.contextTopic(queryContext, claim.text());
        List<VerificationResult> judged = documents.stream()
                .map(doc -> judge(claim, contextTopic.orElse(null), term, source, doc))
                .toList();

        Optional<VerificationResult> verified = judged.stream()
                .filter(VerificationResult::isVerified)
                .max(Comparator.comparingDouble(VerificationResult::confidence));
        if (verified.isPresent()) {
            return verified.get();
        }

        Optional<VerificationResult> contradicted = judged.stream()
                .filter(VerificationResult::isFalse)
                .findFirst();
        if (contradicted.isPresent()) {
            log.info("[{}] Claim contradicted: '{}' ({})", source, claim.text(), contradicted.get().details());
            return contradicted.get();
        }

        return judged.stream()
                .max(Comparator.comparingDouble(VerificationResult::confidence))
                .orElseThrow();
    }

    VerificationResult judge(Claim claim, Topic contextTopic, SearchTerm term, String source, KnowledgeDocument doc) {
        String docText = doc.fullText();
        Map<Topic, Integer> docTopics = topicClassifier.hits(docText);

        // 1. Document is about another sense of the term than the question
        if (contextTopic != null && isMismatch(contextTopic, docTopics)) {
            Topic other = strongestOther(contextTopic, docTopics);
            return result(claim, VerificationStatus.FALSE, MISMATCH_CONFIDENCE, source,
                    "Context mismatch: source '" + doc.title() + "' is about " + label(other)
                            + " but the question is about " + label(contextTopic), doc);
        }

        // 2. Claim calls the subject something the document says it is not
        Optional<Topic> predicateTopic = predicateTopic(claim.text());
        if (predicateTopic.isPresent() && isMismatch(predicateTopic.get(), docTopics)) {
            return result(claim, VerificationStatus.FALSE, MISMATCH_CONFIDENCE, source,
                    "Claim describes the subject as " + label(predicateTopic.get()) + " but source '"
                            + doc.title() + "' describes " + label(strongestOther(predicateTopic.get(), docTopics)), doc);
        }

        // 3. Same event, different year
        Optional<String> yearConflict = yearContradiction(claim.text(), docText);
        if (yearConflict.isPresent()) {
            return result(claim, VerificationStatus.FALSE, CONTRADICTION_CONFIDENCE, source,
                    yearConflict.get() + " (source: '" + doc.title() + "')", doc);
        }

        // 4. Word overlap
        Set<String> claimWords = TextTokens.contentWords(claim.text(), 3);
        Set<String> docWords = TextTokens.contentWords(docText, 3);
        double overlap = TextTokens.coverage(claimWords, docWords);
        boolean subjectInTitle = doc.title() != null
                && doc.title().toLowerCase(Locale.ROOT).contains(term.subject().toLowerCase(Locale.ROOT));

        if (overlap >= minOverlap || (subjectInTitle && overlap >= minOverlap / 2)) {
            double cap = "summary".equals(doc.method()) ? 0.85 : 0.8;
            double confidence = Math.min(0.6 + 0.25 * overlap, cap);
            return result(claim, VerificationStatus.VERIFIED, round(confidence), source,
                    String.format(Locale.ROOT, "Supported by '%s' (%.0f%% word overlap)", doc.title(), overlap * 100), doc);
        }

        return result(claim, VerificationStatus.UNVERIFIED, round(0.3 + 0.2 * overlap), source,
                String.format(Locale.ROOT, "Source '%s' does not support the claim (%.0f%% word overlap)",
                        doc.title(), overlap * 100), doc);
    }

    private boolean isMismatch(Topic expected, Map<Topic, Integer> docTopics) {
        return !docTopics.containsKey(expected)
                && docTopics.keySet().stream().anyMatch(t -> t != expected);
    }

    private Topic strongestOther(Topic expected, Map<Topic, Integer> docTopics) {
        return docTopics.entrySet().stream()
                .filter(e -> e.getKey() != expected)
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private Optional<Topic> predicateTopic(String claimText) {
        Matcher matcher = PREDICATE.matcher(claimText);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return topicClassifier.dominant(matcher.group(1));
    }

    Optional<String> yearContradiction(String claimText, String docText) {
        Matcher claimMatcher = EVENT_YEAR.matcher(claimText);
        if (!claimMatcher.find()) {
            return Optional.empty();
        }
        String event = claimMatcher.group(1).toLowerCase(Locale.ROOT);
        String claimedYear = claimMatcher.group(2);

        Set<String> documentedYears = new HashSet<>();
        Matcher docMatcher = EVENT_YEAR.matcher(docText);
        while (docMatcher.find()) {
            if (docMatcher.group(1).equalsIgnoreCase(event)) {
                documentedYears.add(docMatcher.group(2));
            }
        }
        if (documentedYears.isEmpty() || documentedYears.contains(claimedYear)) {
            return Optional.empty();
        }
        return Optional.of("Claim says " + event + " in " + claimedYear
                + " but source says " + event + " in " + String.join("/", documentedYears));
    }

    private VerificationResult result(Claim claim, VerificationStatus status, double confidence,
                                      String source, String details, KnowledgeDocument doc) {
        return new VerificationResult(claim.text(), status, confidence, source, details, doc.url(), doc.method());
    }

    private static String label(Topic topic) {
        return topic == null ? "another topic" : topic.name().toLowerCase(Locale.ROOT);
    }

    private static double round(double value) {
        return Math.round(value * 1000) / 1000.0;
    }
}
