package com.factguard.infrastructure.citation;

import com.factguard.domain.validation.model.Citation;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts URLs from a response and checks each one concurrently.
 * <p>
 * A citation is valid when the URL answers HTTP 200. Content match compares the page text
 * with the sentence that cites it. Invalid citations become high-severity violations.
 * </p>
 */
@Slf4j
@Component
public class CitationVerifier {

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+");
    private static final String TRAILING_PUNCTUATION = ".,;:!?)";
    private static final int MAX_BODY_BYTES = 512 * 1024;
    private static final double CONTENT_MATCH_THRESHOLD = 0.3;
    private static final Pattern HTML_TAGS = Pattern.compile("<[^>]*>");

    private final RestClient restClient;
    private final SentenceSplitter sentenceSplitter;
    private final ExecutorService executor;

    @Value("${factguard.citations.enabled:true}")
    private boolean enabled;

    @Value("${factguard.citations.timeout:6s}")
    private Duration timeout;

    public CitationVerifier(RestClient restClient,
                            SentenceSplitter sentenceSplitter,
                            @Qualifier("verificationExecutor") ExecutorService executor) {
        this.restClient = restClient;
        this.sentenceSplitter = sentenceSplitter;
        this.executor = executor;
    }

    public CitationOutcome verify(String responseText) {
        if (!enabled) {
            return CitationOutcome.empty();
        }
        List<String> urls = extractUrls(responseText);
        if (urls.isEmpty()) {
            return CitationOutcome.empty();
        }

        List<String> sentences = sentenceSplitter.split(responseText);
        List<Callable<Citation>> tasks = urls.stream()
                .<Callable<Citation>>map(url -> () -> check(url, citingSentence(url, sentences)))
                .toList();

        List<Citation> citations = new ArrayList<>();
        try {
            List<Future<Citation>> futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                citations.add(resolve(urls.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Citation checks interrupted");
            for (int i = citations.size(); i < urls.size(); i++) {
                citations.add(new Citation(urls.get(i), false, false, null, "Interrupted"));
            }
        }

        List<Violation> violations = citations.stream()
                .filter(c -> !c.valid())
                .map(this::toViolation)
                .toList();

        log.info("Citation check: {} urls, {} valid", citations.size(), citations.size() - violations.size());
        return new CitationOutcome(citations, violations);
    }

    /**
     * URLs in order of first appearance with trailing punctuation removed.
     */
    public List<String> extractUrls(String text) {
        Set<String> urls = new LinkedHashSet<>();
        if (text == null) {
            return List.of();
        }
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String url = stripTrailing(matcher.group());
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }
        return List.copyOf(urls);
    }

    Citation check(String url, String citingSentence) {
        URI uri;
        try {
            uri = new URI(url);
            if (uri.getHost() == null) {
                return new Citation(url, false, false, null, "Invalid URL format");
            }
        } catch (URISyntaxException e) {
            return new Citation(url, false, false, null, "Invalid URL format");
        }

        try {
            return restClient.get()
                    .uri(uri)
                    .header(HttpHeaders.USER_AGENT, "FactGuard/0.1 (citation check)")
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status != 200) {
                            return new Citation(url, false, false, status, "HTTP " + status);
                        }
                        byte[] body = response.getBody().readNBytes(MAX_BODY_BYTES);
                        String pageText = HTML_TAGS.matcher(new String(body, StandardCharsets.UTF_8)).replaceAll(" ");
                        return new Citation(url, true, contentMatches(citingSentence, url, pageText), status, null);
                    });
        } catch (ResourceAccessException e) {
            String message = e.getCause() instanceof InterruptedIOException ? "Request timeout" : "Request error: " + e.getMessage();
            return new Citation(url, false, false, null, message);
        } catch (RestClientException e) {
            return new Citation(url, false, false, null, "Request error: " + e.getMessage());
        }
    }

    private Citation resolve(String url, Future<Citation> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return new Citation(url, false, false, null, "Request timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Citation(url, false, false, null, "Interrupted");
        } catch (ExecutionException e) {
            log.warn("Citation check failed for {}", url, e.getCause());
            return new Citation(url, false, false, null, "Validation error: " + e.getCause().getMessage());
        }
    }

    private boolean contentMatches(String citingSentence, String url, String pageText) {
        Set<String> claimed = TextTokens.contentWords(citingSentence.replace(url, " "), 3);
        Set<String> page = TextTokens.contentWords(pageText, 3);
        return TextTokens.coverage(claimed, page) >= CONTENT_MATCH_THRESHOLD;
    }

    private String citingSentence(String url, List<String> sentences) {
        return sentences.stream()
                .filter(s -> s.contains(url))
                .findFirst()
                .orElse("");
    }

    private Violation toViolation(Citation citation) {
        return new Violation(
                ViolationType.CITATION,
                Severity.HIGH,
                "Invalid citation " + citation.url() + ": " + citation.errorMessage(),
                ViolationOrigin.citation(citation.url()),
                citation.url(),
                null);
    }

    private static String stripTrailing(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
