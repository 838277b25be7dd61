package com.phillippitts.callcopilot.service.intent;

import com.phillippitts.callcopilot.domain.IntentResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Offline classifier matching keyword rules against the latest statement. Used when no LLM
 * is configured.
 */
public class KeywordIntentClassifier implements IntentClassifier {

    private static final double CONFIDENCE = 0.6;

    private static final Map<String, String[]> RULES = new LinkedHashMap<>();

    static {
        RULES.put("credit_card_fraud", new String[] {"credit card", "fraud"});
        RULES.put("debit_card_fraud", new String[] {"debit card", "fraud"});
        RULES.put("credit_card_block", new String[] {"credit card", "block"});
        RULES.put("debit_card_block", new String[] {"debit card", "block"});
        RULES.put("credit_card_replacement", new String[] {"credit card", "replace"});
        RULES.put("account_balance", new String[] {"balance"});
    }

    @Override
    public CompletableFuture<IntentResult> classify(String text, List<String> context) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String[]> rule : RULES.entrySet()) {
            if (containsAll(lower, rule.getValue())) {
                return CompletableFuture.completedFuture(new IntentResult(rule.getKey(), CONFIDENCE));
            }
        }
        return CompletableFuture.completedFuture(IntentResult.unknown());
    }

    private static boolean containsAll(String text, String[] keywords) {
        for (String keyword : keywords) {
            if (!text.contains(keyword)) {
                return false;
            }
        }
        return true;
    }
}
