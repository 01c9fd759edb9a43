package com.factguard.infrastructure.verification;

import com.factguard.infrastructure.preprocessing.TextTokens;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword-count topic detection.
 */
@Component
public class TopicClassifier {

    /**
     * Keyword hits per topic. Topics without hits are absent from the map.
     */
    public Map<Topic, Integer> hits(String text) {
        Map<Topic, Integer> hits = new EnumMap<>(Topic.class);
        if (text == null || text.isBlank()) {
            return hits;
        }
        for (Topic topic : Topic.values()) {
            int count = 0;
            for (String keyword : topic.keywords()) {
                if (TextTokens.containsPhrase(text, keyword)) {
                    count++;
                }
            }
            if (count > 0) {
                hits.put(topic, count);
            }
        }
        return hits;
    }

    /**
     * The topic with the most keyword hits; empty when no topic matches or the top two tie.
     */
    public Optional<Topic> dominant(String text) {
        Map<Topic, Integer> hits = hits(text);
        Topic best = null;
        int bestCount = 0;
        boolean tie = false;
        for (Map.Entry<Topic, Integer> entry : hits.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
                tie = false;
            } else if (entry.getValue() == bestCount) {
                tie = true;
            }
        }
        return tie ? Optional.empty() : Optional.ofNullable(best);
    }

    /**
     * Topic of the verification context: the query's topic, or the claim's own topic
     * when the query is silent.
     */
    public Optional<Topic> contextTopic(String queryContext, String claimText) {
        Optional<Topic> fromQuery = dominant(queryContext);
        return fromQuery.isPresent() ? fromQuery : dominant(claimText);
    }
}
