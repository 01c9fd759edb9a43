package com.factguard.domain.verification.model;

/**
 * A document returned by a knowledge source lookup.
 *
 * @param title   document title
 * @param summary plain-text summary or snippet
 * @param url     canonical link (nullable)
 * @param method  lookup path that produced it: "summary", "search", "instant-answer" or "news"
 */
public record KnowledgeDocument(
        String title,
        String summary,
        String url,
        String method
) {

    public String fullText() {
        return (title != null ? title : "") + " " + (summary != null ? summary : "");
    }
}
