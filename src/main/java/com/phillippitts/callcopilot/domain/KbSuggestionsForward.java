package com.phillippitts.callcopilot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Knowledge-base articles suggested for the current intent.
 */
public record KbSuggestionsForward(String callId, String tenantId, String intent, List<KbArticle> articles) {

    public KbSuggestionsForward {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        articles = List.copyOf(Objects.requireNonNull(articles, "articles must not be null"));
    }
}
