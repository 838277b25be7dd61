package com.phillippitts.callcopilot.service.kb;

import com.phillippitts.callcopilot.domain.KbArticle;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Used when no knowledge base is configured; never finds anything.
 */
public class DisabledKnowledgeBaseSearch implements KnowledgeBaseSearch {

    @Override
    public CompletableFuture<List<KbArticle>> search(String intent, String text, String tenantId, int maxResults) {
        return CompletableFuture.completedFuture(List.of());
    }
}
