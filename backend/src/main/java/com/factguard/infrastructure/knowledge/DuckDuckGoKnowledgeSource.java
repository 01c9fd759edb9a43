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
 * Instant-answer source: DuckDuckGo abstract, direct answer and related topics.
 */
@Component
public class DuckDuckGoKnowledgeSource extends AbstractHttpKnowledgeSource {

    private static final int MAX_RELATED_TOPICS = 3;

    private final String endpoint;
    private final boolean enabled;

    public DuckDuckGoKnowledgeSource(RestClient restClient,
                                     ObjectMapper objectMapper,
                                     @Value("${factguard.sources.duckduckgo.endpoint:https://api.duckduckgo.com/}") String endpoint,
                                     @Value("${factguard.sources.duckduckgo.enabled:true}") boolean enabled) {
        super(restClient, objectMapper);
        this.endpoint = endpoint;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public SourceTier tier() {
        return SourceTier.INSTANT_ANSWER;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public List<KnowledgeDocument> lookup(String searchTerm) {
        URI uri = URI.create(endpoint + "?q=" + encode(searchTerm) + "&format=json&no_html=1&skip_disambig=1");

        List<KnowledgeDocument> documents = new ArrayList<>();
        getJson(uri, Map.of()).ifPresent(json -> {
            String heading = text(json, "Heading");
            String title = heading.isEmpty() ? searchTerm : heading;

            String abstractText = text(json, "AbstractText");
            if (!abstractText.isEmpty()) {
                documents.add(new KnowledgeDocument(title, abstractText, emptyToNull(text(json, "AbstractURL")), "instant-answer"));
            }

            String answer = text(json, "Answer");
            if (!answer.isEmpty()) {
                documents.add(new KnowledgeDocument(title, answer, null, "instant-answer"));
            }

            for (JsonNode topic : json.path("RelatedTopics")) {
                if (documents.size() >= MAX_RELATED_TOPICS + 2) {
                    break;
                }
                String topicText = text(topic, "Text");
                if (topicText.isEmpty()) {
                    continue;
                }
                int dash = topicText.indexOf(" - ");
                String topicTitle = dash > 0 ? topicText.substring(0, dash) : title;
                documents.add(new KnowledgeDocument(topicTitle, topicText, emptyToNull(text(topic, "FirstURL")), "instant-answer"));
            }
        });
        return documents;
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
