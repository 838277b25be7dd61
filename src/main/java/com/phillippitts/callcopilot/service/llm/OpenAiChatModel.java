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
 * OpenAI chat completions in JSON-object mode.
 */
public class OpenAiChatModel implements ChatModel {

    private final JsonHttpClient http;
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final double temperature;

    public OpenAiChatModel(JsonHttpClient http, String baseUrl, String model, String apiKey, double temperature) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.temperature = temperature;
    }

    @Override
    public CompletableFuture<String> complete(String systemPrompt, String userPrompt) {
        JSONObject body = new JSONObject()
                .put("model", model)
                .put("temperature", temperature)
                .put("response_format", new JSONObject().put("type", "json_object"))
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                        .put(new JSONObject().put("role", "user").put("content", userPrompt)));
        return http.post("llm", URI.create(baseUrl + "/chat/completions"), body,
                        Map.of("Authorization", "Bearer " + apiKey))
                .thenApply(OpenAiChatModel::extractText);
    }

    static String extractText(JSONObject response) {
        JSONArray choices = response.optJSONArray("choices");
        if (choices != null && !choices.isEmpty()) {
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            String text = message == null ? "" : message.optString("content", "");
            if (!text.isBlank()) {
                return text;
            }
        }
        throw UpstreamExceptionBuilder.create("OpenAI response has no content")
                .destination("llm").retryable(false).build();
    }

    @Override
    public String describe() {
        return "openai/" + model;
    }
}
