package com.phillippitts.callcopilot.service.llm;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Extracts the JSON object from a model reply, tolerating markdown code fences and
 * surrounding prose.
 */
public final class LlmJson {

    private LlmJson() {
        // Utility class - prevent instantiation
    }

    public static Optional<JSONObject> extractObject(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        int open = reply.indexOf('{');
        int close = reply.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(reply.substring(open, close + 1)));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }
}
