package com.factguard.infrastructure.extraction;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.ClaimKind;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts checkable factual claims from a response.
 * <p>
 * A sentence is kept only when it carries a concrete signal: a number, a date,
 * a capitalized multi-word entity, or a specific-fact phrase. Everything else
 * (general statements, opinions, fragments) is dropped and never sent to verification.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimExtractor {

    private static final Pattern NUMBER = Pattern.compile("\\d");

    private static final String MONTHS =
            "January|February|March|April|May|June|July|August|September|October|November|December";

    private static final Pattern DATE = Pattern.compile(
            "\\b(?:1[5-9]\\d{2}|20\\d{2})\\b"                          // year
            + "|\\b(?:" + MONTHS + ")\\s+\\d{1,4}\\b"                 // March 2021, March 14
            + "|\\b\\d{1,2}\\s+(?:" + MONTHS + ")\\b"                 // 14 March
            + "|\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"                    // 03/14/2021
            + "|\\b\\d{4}-\\d{2}-\\d{2}\\b"                          // 2021-03-14
    );

    // Two or more capitalized words, optionally joined by a lowercase particle ("Guido van Rossum")
    private static final Pattern MULTI_WORD_ENTITY = Pattern.compile(
            "\\b[A-Z][\\p{L}\\p{N}'&-]*(?:\\s+(?:(?:of|de|van|von|der|da|la|the|and|for)\\s+)?[A-Z][\\p{L}\\p{N}'&-]*)+"
    );

    private static final Pattern SPECIFIC_FACT = Pattern.compile(
            "\\b(?:created by|founded (?:in|by)|according to|released in|developed by|invented by"
            + "|established in|headquartered in|born (?:in|on)|launched in|introduced in|discovered by"
            + "|acquired by|published in|located in|died (?:in|on)|won the)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GENERAL_STATEMENT = Pattern.compile(
            "\\b(?:is known for|is versatile|allows developers to|is widely used|is popular|is used for"
            + "|is great for|can be used|helps (?:you|users|developers)|is easy to|is a powerful|is designed to)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern OPINION = Pattern.compile(
            "\\b(?:i think|i believe|i feel|in my opinion|we believe|i guess|personally)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FINANCIAL = Pattern.compile(
            "[$€£¥]|\\b(?:usd|eur|dollars?|euros?|revenue|profits?|stocks?|shares|invest\\w*|prices?"
            + "|market cap\\w*|crypto\\w*|bitcoin|interest rates?|returns|dividends?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern STATISTICAL = Pattern.compile(
            "%|\\b(?:percent|percentage|statistics?|survey|study|average|median|majority|million|billion)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern REGULATORY = Pattern.compile(
            "\\b(?:regulations?|regulatory|laws?|act|rules?|compliance|statutes?|legal(?:ly)?"
            + "|SEC|FDA|GDPR|HIPAA|CFPB|FTC)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final TextNormalizer textNormalizer;
    private final SentenceSplitter sentenceSplitter;

    @Value("${factguard.extraction.min-sentence-length:10}")
    private int minSentenceLength;

    @Value("${factguard.extraction.max-claims:10}")
    private int maxClaims;

    /**
     * Extract checkable claims in response order, without duplicates.
     *
     * @param responseText the AI response
     * @return claims, at most {@code maxClaims}
     */
    public List<Claim> extract(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return List.of();
        }

        String normalized = textNormalizer.normalize(responseText);
        List<String> sentences = sentenceSplitter.split(normalized);

        List<Claim> claims = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int dropped = 0;

        for (String sentence : sentences) {
            if (claims.size() >= maxClaims) {
                log.info("Claim limit {} reached, {} sentences not examined", maxClaims,
                        sentences.size() - sentences.indexOf(sentence));
                break;
            }
            Claim claim = toClaim(sentence);
            if (claim == null) {
                dropped++;
                continue;
            }
            if (seen.add(textNormalizer.normalizeForKey(sentence))) {
                claims.add(claim);
            }
        }

        log.debug("Extracted {} claims from {} sentences ({} dropped)", claims.size(), sentences.size(), dropped);
        return claims;
    }

    /**
     * Classify a single sentence. Returns null when the sentence is not checkable.
     */
    Claim toClaim(String sentence) {
        if (sentence.length() < minSentenceLength) {
            return null;
        }
        if (OPINION.matcher(sentence).find()) {
            log.trace("Dropped opinion: {}", sentence);
            return null;
        }

        boolean hasDate = DATE.matcher(sentence).find();
        boolean hasNumber = NUMBER.matcher(sentence).find();
        boolean hasEntity = MULTI_WORD_ENTITY.matcher(sentence).find();
        boolean hasSpecificFact = SPECIFIC_FACT.matcher(sentence).find();

        if (!hasDate && !hasNumber && !hasEntity && !hasSpecificFact) {
            if (GENERAL_STATEMENT.matcher(sentence).find()) {
                log.trace("Dropped general statement: {}", sentence);
            }
            return null;
        }

        return new Claim(sentence, classify(sentence, hasNumber, hasDate),
                hasNumber, hasDate, hasEntity, hasSpecificFact);
    }

    private ClaimKind classify(String sentence, boolean hasNumber, boolean hasDate) {
        if (FINANCIAL.matcher(sentence).find()) {
            return ClaimKind.FINANCIAL;
        }
        if (STATISTICAL.matcher(sentence).find()) {
            return ClaimKind.STATISTICAL;
        }
        if (REGULATORY.matcher(sentence).find()) {
            return ClaimKind.REGULATORY;
        }
        if (hasDate && !hasNumberBesidesDate(sentence, hasNumber)) {
            return ClaimKind.TEMPORAL;
        }
        return ClaimKind.GENERAL;
    }

    private boolean hasNumberBesidesDate(String sentence, boolean hasNumber) {
        if (!hasNumber) {
            return false;
        }
        String withoutDates = DATE.matcher(sentence).replaceAll(" ");
        return NUMBER.matcher(withoutDates).find();
    }
}
