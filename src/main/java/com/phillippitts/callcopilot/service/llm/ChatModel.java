package com.phillippitts.callcopilot.service.llm;

import java.util.concurrent.CompletableFuture;

/**
 * Single-turn chat completion that asks the model for a JSON object.
 *
 * <p>Implementations make one request per call and fail the future with an
 * {@link com.phillippitts.callcopilot.exception.UpstreamException} on any error.
 */
public interface ChatModel {

    /**
     * @param systemPrompt instructions
     * @param userPrompt content to analyze
     * @return raw text of the model's reply
     */
    CompletableFuture<String> complete(String systemPrompt, String userPrompt);

    /** Provider and model, for logs. */
    String describe();
}
