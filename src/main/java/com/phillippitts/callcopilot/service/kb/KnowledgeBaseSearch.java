package com.phillippitts.callcopilot.service.kb;

import com.phillippitts.callcopilot.domain.KbArticle;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Knowledge-base lookup keyed on a detected intent and the statement that produced it.
 */
public interface KnowledgeBaseSearch {

    /**
     * @param intent     normalized intent label
     * @param text       original statement
     * @param tenantId   tenant whose articles to search
     * @param maxResults upper bound on returned articles
     * @return articles ordered by descending relevance, possibly empty
     */
    CompletableFuture<List<KbArticle>> search(String intent, String text, String tenantId, int maxResults);
}
