package com.phillippitts.callcopilot.service.casemanagement;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.domain.Disposition;
import com.phillippitts.callcopilot.domain.DispositionForward;
import com.phillippitts.callcopilot.domain.DispositionSummary;
import com.phillippitts.callcopilot.domain.IntentForward;
import com.phillippitts.callcopilot.domain.KbArticle;
import com.phillippitts.callcopilot.domain.KbSuggestionsForward;
import com.phillippitts.callcopilot.domain.TranscriptForward;
import com.phillippitts.callcopilot.service.http.JsonHttpClient;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Posts transcripts, intents, KB suggestions and call notes to the frontend API.
 */
public class HttpCaseManagementClient implements CaseManagementClient {

    static final String DESTINATION = "frontend";

    private final JsonHttpClient http;
    private final FrontendProperties properties;

    public HttpCaseManagementClient(JsonHttpClient http, FrontendProperties properties) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public CompletableFuture<Void> forwardTranscript(TranscriptForward transcript) {
        return post(properties.getTranscriptPath(), toJson(transcript));
    }

    @Override
    public CompletableFuture<Void> forwardIntent(IntentForward intent) {
        return post(properties.getIntentPath(), toJson(intent));
    }

    @Override
    public CompletableFuture<Void> forwardKbSuggestions(KbSuggestionsForward suggestions) {
        return post(properties.getKbSuggestionsPath(), toJson(suggestions));
    }

    @Override
    public CompletableFuture<Void> forwardDisposition(DispositionForward disposition) {
        return post(properties.getDispositionPath(), toJson(disposition));
    }

    private CompletableFuture<Void> post(String path, JSONObject body) {
        URI uri = URI.create(stripTrailingSlash(properties.getBaseUrl()) + path);
        return http.post(DESTINATION, uri, body, Map.of()).thenApply(response -> null);
    }

    static JSONObject toJson(TranscriptForward t) {
        return new JSONObject()
                .put("callId", t.callId())
                .put("text", t.text())
                .put("seq", t.seq())
                .put("type", t.type().wireValue())
                .put("tenantId", t.tenantId());
    }

    static JSONObject toJson(IntentForward i) {
        return new JSONObject()
                .put("callId", i.callId())
                .put("intent", i.intent())
                .put("confidence", i.confidence())
                .put("tenantId", i.tenantId());
    }

    static JSONObject toJson(KbSuggestionsForward s) {
        JSONArray articles = new JSONArray();
        for (KbArticle a : s.articles()) {
            articles.put(new JSONObject()
                    .put("id", a.id())
                    .put("title", a.title())
                    .put("snippet", a.snippet())
                    .put("url", a.url())
                    .put("tags", new JSONArray(a.tags()))
                    .put("source", a.source())
                    .put("confidence", a.confidence()));
        }
        return new JSONObject()
                .put("callId", s.callId())
                .put("tenantId", s.tenantId())
                .put("intent", s.intent())
                .put("articles", articles);
    }

    static JSONObject toJson(DispositionForward d) {
        DispositionSummary summary = d.summary();
        JSONArray dispositions = new JSONArray();
        for (Disposition disp : summary.dispositions()) {
            dispositions.put(new JSONObject()
                    .put("code", disp.code())
                    .put("title", disp.title())
                    .put("score", disp.score())
                    .put("subDisposition", disp.subDisposition() == null ? JSONObject.NULL : disp.subDisposition()));
        }
        return new JSONObject()
                .put("callId", d.callId())
                .put("tenantId", d.tenantId())
                .put("notes", summary.notes())
                .put("dispositions", dispositions)
                .put("confidence", summary.confidence())
                .put("author", d.author());
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
