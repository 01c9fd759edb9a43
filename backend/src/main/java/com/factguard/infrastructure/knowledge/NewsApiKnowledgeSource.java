package com.factguard.infrastructure.knowledge;

import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.domain.verification.model.SourceTier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * News source: NewsAPI "everything" search. Available only with an API key.
 */
@Component
public class NewsApiKnowledgeSource extends AbstractHttpKnowledgeSource {

    private final String endpoint;
    private final String apiKey;
    private final int pageSize;

    public NewsApiKnowledgeSource(RestClient restClient,
                                  ObjectMapper objectMapper,
                                  @Value("${factguard.sources.newsapi.endpoint:https://newsapi.org/v2/everything}") String endpoint,
                                  @Value("${factguard.sources.newsapi.api-key:}") String apiKey,
                                  @Value("${factguard.sources.newsapi.page-size:3}") int pageSize) {
        super(restClient, objectMapper);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.pageSize = pageSize;
    }

    @Override
    public String name() {
        return "newsapi";
    }

    @Override
    public SourceTier tier() {
        return SourceTier.NEWS;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<KnowledgeDocument> lookup(String searchTerm) {
        URI uri = URI.create(endpoint + "?q=" + encode(searchTerm)
                + "&sortBy=relevancy&pageSize=" + pageSize + "&language=en");

        List<KnowledgeDocument> documents = new ArrayList<>();
        getJson(uri, Map.of("X-Api-Key", apiKey)).ifPresent(json -> {
            for (JsonNode article : json.path("articles")) {
                String title = text(article, "title");
                String description = text(article, "description");
                if (title.isEmpty() && description.isEmpty()) {
                    continue;
                }
                String url = text(article, "url");
                documents.add(new KnowledgeDocument(title, description, url.isEmpty() ? null : url, "news"));
            }
        });
        return documents;
    }
}
