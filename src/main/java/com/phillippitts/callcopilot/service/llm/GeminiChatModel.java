package com.phillippitts.callcopilot.service.llm;

import com.phillippitts.callcopilot.exception.UpstreamExceptionBuilder;
import com.phillippitts.callcopilot.service.http.JsonHttpClient;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Google Gemini {@code generateContent} with a JSON response type.
 */
public class GeminiChatModel implements ChatModel {

    private final JsonHttpClient http;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final double temperature;

    public GeminiChatModel(JsonHttpClient http, String baseUrl, String model, String apiKey, double temperature) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.temperature = temperature;
    }

    @Override
    public CompletableFuture<String> complete(String systemPrompt, String userPrompt) {
        JSONObject body = new JSONObject()
                .put("systemInstruction", new JSONObject().put("parts",
                        new JSONArray().put(new JSONObject().put("text", systemPrompt))))
                .put("contents", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("parts", new JSONArray().put(new JSONObject().put("text", userPrompt)))))
                .put("generationConfig", new JSONObject()
                        .put("temperature", temperature)
                        .put("responseMimeType", "application/json"));
        URI uri = URI.create(baseUrl + "/models/" + model + ":generateContent");
        return http.post("llm", uri, body, Map.of("x-goog-api-key", apiKey))
                .thenApply(GeminiChatModel::extractText);
    }

    static String extractText(JSONObject response) {
        JSONArray candidates = response.optJSONArray("candidates");
        if (candidates != null && !candidates.isEmpty()) {
            JSONObject content = candidates.getJSONObject(0).optJSONObject("content");
            JSONArray parts = content == null ? null : content.optJSONArray("parts");
            if (parts != null && !parts.isEmpty()) {
                String text = parts.getJSONObject(0).optString("text", "");
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        throw UpstreamExceptionBuilder.create("Gemini response has no text")
                .destination("llm").retryable(false).build();
    }

    @Override
    public String describe() {
        return "gemini/" + model;
    }
}
