package com.factguard.infrastructure.knowledge;

import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.domain.verification.model.SourceTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Encyclopedic source: Wikipedia REST page summary, falling back to full-text search
 * when the term is not an exact title or resolves to a disambiguation page.
 */
@Slf4j
@Component
public class WikipediaKnowledgeSource extends AbstractHttpKnowledgeSource {

    private final String baseUrl;
    private final boolean enabled;
    private final int searchLimit;

    public WikipediaKnowledgeSource(RestClient restClient,
                                    ObjectMapper objectMapper,
                                    @Value("${factguard.sources.wikipedia.base-url:https://en.wikipedia.org}") String baseUrl,
                                    @Value("${factguard.sources.wikipedia.enabled:true}") boolean enabled,
                                    @Value("${factguard.sources.wikipedia.search-limit:5}") int searchLimit) {
        super(restClient, objectMapper);
        this.baseUrl = baseUrl;
        this.enabled = enabled;
        this.searchLimit = searchLimit;
    }

    @Override
    public String name() {
        return "wikipedia";
    }

    @Override
    public SourceTier tier() {
        return SourceTier.ENCYCLOPEDIC;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public List<KnowledgeDocument> lookup(String searchTerm) {
        Optional<KnowledgeDocument> summary = summary(searchTerm);
        if (summary.isPresent()) {
            return List.of(summary.get());
        }
        log.debug("[wikipedia] No direct summary for '{}', searching", searchTerm);
        return search(searchTerm);
    }

    private Optional<KnowledgeDocument> summary(String title) {
        String path = encode(title.replace(' ', '_')).replace("+", "%20");
        URI uri = URI.create(baseUrl + "/api/rest_v1/page/summary/" + path);

        return getJson(uri, Map.of())
                .filter(json -> !"disambiguation".equals(text(json, "type")))
                .filter(json -> !text(json, "extract").isEmpty())
                .map(json -> new KnowledgeDocument(
                        text(json, "title"),
                        joinDescription(text(json, "description"), text(json, "extract")),
                        json.path("content_urls").path("desktop").path("page").asText(null),
                        "summary"));
    }

    private List<KnowledgeDocument> search(String term) {
        URI uri = URI.create(baseUrl + "/w/rest.php/v1/search/page?q=" + encode(term) + "&limit=" + searchLimit);

        List<KnowledgeDocument> documents = new ArrayList<>();
        getJson(uri, Map.of()).ifPresent(json -> {
            for (JsonNode page : json.path("pages")) {
                String title = text(page, "title");
                String excerpt = stripTags(text(page, "excerpt"));
                String key = text(page, "key");
                if (title.isEmpty()) {
                    continue;
                }
                documents.add(new KnowledgeDocument(
                        title,
                        joinDescription(text(page, "description"), excerpt),
                        key.isEmpty() ? null : baseUrl + "/wiki/" + key,
                        "search"));
            }
        });
        return documents;
    }

    private static String joinDescription(String description, String body) {
        return description.isEmpty() ? body : description + ". " + body;
    }
}
