package com.factguard.infrastructure.knowledge;

import com.factguard.domain.verification.service.KnowledgeSource;
import com.factguard.domain.verification.service.SourceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shared HTTP plumbing for JSON knowledge sources.
 * Maps transport failures to {@link SourceUnavailableException} so callers can degrade the source.
 */
public abstract class AbstractHttpKnowledgeSource implements KnowledgeSource {

    protected static final String USER_AGENT = "FactGuard/0.1 (response validation; contact: ops@factguard.local)";

    private static final Pattern HTML_TAGS = Pattern.compile("<[^>]*>");

    protected final RestClient restClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpKnowledgeSource(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * GET a JSON document.
     *
     * @return the parsed body, or empty on HTTP 404
     * @throws SourceUnavailableException on timeouts, network errors, HTTP 429 and other non-2xx statuses
     */
    protected Optional<JsonNode> getJson(URI uri, Map<String, String> headers) {
        try {
            return restClient.get()
                    .uri(uri)
                    .headers(h -> {
                        h.set(HttpHeaders.USER_AGENT, USER_AGENT);
                        headers.forEach(h::set);
                    })
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status == 404) {
                            return Optional.<JsonNode>empty();
                        }
                        if (status == 429) {
                            throw new SourceUnavailableException(name() + " rate limited (HTTP 429)");
                        }
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new SourceUnavailableException(name() + " returned HTTP " + status);
                        }
                        return Optional.of(objectMapper.readTree(response.getBody()));
                    });
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof InterruptedIOException;
            throw new SourceUnavailableException(name() + " unreachable: " + e.getMessage(), timeout, e);
        } catch (RestClientException e) {
            throw new SourceUnavailableException(name() + " request failed: " + e.getMessage(), false, e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText().strip() : "";
    }

    protected static String stripTags(String html) {
        return html == null ? "" : HTML_TAGS.matcher(html).replaceAll("").strip();
    }
}
