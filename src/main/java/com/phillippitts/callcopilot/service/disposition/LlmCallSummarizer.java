package com.phillippitts.callcopilot.service.disposition;

import com.phillippitts.callcopilot.domain.Disposition;
import com.phillippitts.callcopilot.domain.DispositionSummary;
import com.phillippitts.callcopilot.exception.UpstreamExceptionBuilder;
import com.phillippitts.callcopilot.service.intent.IntentNormalizer;
import com.phillippitts.callcopilot.service.llm.ChatModel;
import com.phillippitts.callcopilot.service.llm.LlmJson;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Call summaries through a {@link ChatModel}.
 *
 * <p>Expected reply: {@code {issue, resolution, next_steps, dispositions: [{label, score,
 * subDisposition}], confidence}}. A reply that is not JSON fails the future; the caller
 * substitutes the fallback summary.
 */
public class LlmCallSummarizer implements CallSummarizer {

    static final String SYSTEM_PROMPT = "You summarize customer support calls for the agent's case notes. "
            + "Given the full call transcript, respond ONLY with JSON: "
            + "{\"issue\": \"...\", \"resolution\": \"...\", \"next_steps\": \"...\", "
            + "\"dispositions\": [{\"label\": \"snake_case_code\", \"score\": 0.0, \"subDisposition\": null}], "
            + "\"confidence\": 0.0}";

    private final ChatModel model;

    public LlmCallSummarizer(ChatModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public CompletableFuture<DispositionSummary> summarize(String transcript) {
        return model.complete(SYSTEM_PROMPT, "Transcript:\n" + transcript).thenApply(LlmCallSummarizer::parse);
    }

    static DispositionSummary parse(String reply) {
        JSONObject json = LlmJson.extractObject(reply).orElseThrow(() ->
                UpstreamExceptionBuilder.create("Summary reply is not JSON")
                        .destination("llm")
                        .retryable(false)
                        .metadata("reply", LogSanitizer.truncate(reply, 120))
                        .build());
        List<Disposition> dispositions = new ArrayList<>();
        JSONArray raw = json.optJSONArray("dispositions");
        if (raw != null) {
            for (int i = 0; i < raw.length(); i++) {
                JSONObject item = raw.optJSONObject(i);
                if (item == null) {
                    continue;
                }
                String label = IntentNormalizer.normalize(item.optString("label", item.optString("code", "")));
                String sub = item.isNull("subDisposition") ? null : item.optString("subDisposition", null);
                dispositions.add(new Disposition(label, item.optDouble("score", 0.0), sub));
            }
        }
        return new DispositionSummary(
                json.optString("issue", ""),
                json.optString("resolution", ""),
                json.optString("next_steps", ""),
                dispositions,
                json.optDouble("confidence", 0.0));
    }
}
