package com.phillippitts.callcopilot.service.kb;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.domain.KbArticle;
import com.phillippitts.callcopilot.service.http.JsonHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Searches the frontend's KB endpoint: {@code GET /api/kb/search?q=&tenantId=&limit=},
 * answering {@code {ok, results: [{id, title, snippet, url, tags, score}]}}.
 *
 * <p>Runs one query for the intent label and one for the expanded terms, merges them by
 * article id keeping the higher score, and returns the best {@code maxResults}.
 */
public class ApiKnowledgeBaseSearch implements KnowledgeBaseSearch {

    private static final Logger LOG = LogManager.getLogger(ApiKnowledgeBaseSearch.class);

    static final String SOURCE = "api";

    private final JsonHttpClient http;
    private final FrontendProperties properties;

    public ApiKnowledgeBaseSearch(JsonHttpClient http, FrontendProperties properties) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public CompletableFuture<List<KbArticle>> search(String intent, String text, String tenantId, int maxResults) {
        String expanded = String.join(" ", SearchTermExpander.expand(intent, text));
        LOG.debug("KB search (intent={}, terms='{}')", intent, expanded);
        CompletableFuture<List<KbArticle>> byIntent = query(intent, tenantId, maxResults);
        CompletableFuture<List<KbArticle>> byTerms = query(expanded, tenantId, maxResults);
        return byIntent.thenCombine(byTerms, (a, b) -> merge(a, b, maxResults));
    }

    private CompletableFuture<List<KbArticle>> query(String q, String tenantId, int limit) {
        String url = properties.getBaseUrl().replaceAll("/+$", "") + properties.getKbSearchPath()
                + "?q=" + URLEncoder.encode(q, StandardCharsets.UTF_8)
                + "&tenantId=" + URLEncoder.encode(tenantId, StandardCharsets.UTF_8)
                + "&limit=" + limit;
        return http.get("kb", URI.create(url), Map.of()).thenApply(ApiKnowledgeBaseSearch::parseResults);
    }

    static List<KbArticle> parseResults(JSONObject response) {
        if (!response.optBoolean("ok", false)) {
            return List.of();
        }
        JSONArray results = response.optJSONArray("results");
        if (results == null) {
            return List.of();
        }
        List<KbArticle> articles = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            JSONObject item = results.optJSONObject(i);
            if (item == null || item.optString("id", "").isEmpty()) {
                continue;
            }
            List<String> tags = new ArrayList<>();
            JSONArray rawTags = item.optJSONArray("tags");
            if (rawTags != null) {
                for (int t = 0; t < rawTags.length(); t++) {
                    tags.add(rawTags.optString(t, ""));
                }
            }
            articles.add(new KbArticle(item.getString("id"), item.optString("title", ""),
                    item.optString("snippet", ""), item.optString("url", ""), tags, SOURCE,
                    item.optDouble("score", 0.0)));
        }
        return articles;
    }

    static List<KbArticle> merge(List<KbArticle> first, List<KbArticle> second, int maxResults) {
        Map<String, KbArticle> byId = new LinkedHashMap<>();
        for (List<KbArticle> list : List.of(first, second)) {
            for (KbArticle article : list) {
                byId.merge(article.id(), article, (a, b) -> a.confidence() >= b.confidence() ? a : b);
            }
        }
        return byId.values().stream()
                .sorted(Comparator.comparingDouble(KbArticle::confidence).reversed())
                .limit(maxResults)
                .toList();
    }
}
