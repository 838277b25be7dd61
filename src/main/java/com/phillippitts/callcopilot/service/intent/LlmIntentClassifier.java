package com.phillippitts.callcopilot.service.intent;

import com.phillippitts.callcopilot.domain.IntentResult;
import com.phillippitts.callcopilot.service.llm.ChatModel;
import com.phillippitts.callcopilot.service.llm.LlmJson;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Intent classification through a {@link ChatModel}.
 */
public class LlmIntentClassifier implements IntentClassifier {

    private static final Logger LOG = LogManager.getLogger(LlmIntentClassifier.class);

    static final String SYSTEM_PROMPT = "You are a customer support intent classifier for banking calls. "
            + "Identify the caller's PRIMARY intent and be specific about card and account types "
            + "(for example credit_card_block, credit_card_fraud, credit_card_replacement, debit_card_block, "
            + "debit_card_fraud, account_balance). Use \"unknown\" if no intent is clear. "
            + "Respond ONLY with JSON: {\"intent\": \"intent_label\", \"confidence\": 0.0}";

    private final ChatModel model;

    public LlmIntentClassifier(ChatModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public CompletableFuture<IntentResult> classify(String text, List<String> context) {
        return model.complete(SYSTEM_PROMPT, buildPrompt(text, context)).thenApply(LlmIntentClassifier::parse);
    }

    static String buildPrompt(String text, List<String> context) {
        StringBuilder sb = new StringBuilder();
        if (context != null && !context.isEmpty()) {
            sb.append("Recent conversation:\n");
            for (String line : context) {
                sb.append("- ").append(line).append('\n');
            }
            sb.append('\n');
        }
        sb.append("Latest statement: ").append(text);
        return sb.toString();
    }

    static IntentResult parse(String reply) {
        Optional<JSONObject> json = LlmJson.extractObject(reply);
        if (json.isEmpty()) {
            LOG.warn("Intent reply is not JSON: {}", LogSanitizer.truncate(reply, 200));
            return IntentResult.unknown();
        }
        String intent = IntentNormalizer.normalize(json.get().optString("intent", null));
        double confidence = IntentNormalizer.clampConfidence(json.get().optDouble("confidence", 0.0));
        if (IntentResult.UNKNOWN_INTENT.equals(intent)) {
            return IntentResult.unknown();
        }
        return new IntentResult(intent, confidence);
    }
}
