package com.phillippitts.callcopilot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Knowledge-base article suggested to the agent.
 *
 * @param id         article id, unique within a tenant
 * @param title      article title
 * @param snippet    short excerpt
 * @param url        link to the full article, may be empty
 * @param tags       free-form tags
 * @param source     adapter that produced the article
 * @param confidence relevance score in [0.0, 1.0]
 */
public record KbArticle(String id, String title, String snippet, String url, List<String> tags,
                        String source, double confidence) {

    public KbArticle {
        Objects.requireNonNull(id, "Article id must not be null");
        title = title == null ? "" : title;
        snippet = snippet == null ? "" : snippet;
        url = url == null ? "" : url;
        tags = tags == null ? List.of() : List.copyOf(tags);
        source = source == null ? "" : source;
        confidence = Math.min(1.0, Math.max(0.0, confidence));
    }
}
