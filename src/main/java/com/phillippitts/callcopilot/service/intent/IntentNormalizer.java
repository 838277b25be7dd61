package com.phillippitts.callcopilot.service.intent;

import com.phillippitts.callcopilot.domain.IntentResult;

import java.util.Locale;
import java.util.Map;

/**
 * Canonical intent labels: lower-case, underscores for spaces, common aliases folded.
 */
public final class IntentNormalizer {

    private static final Map<String, String> ALIASES = Map.of(
            "creditcard", "credit_card",
            "debitcard", "debit_card",
            "credit_card_blocking", "credit_card_block",
            "debit_card_blocking", "debit_card_block",
            // ambiguous card requests default to credit card
            "card_block", "credit_card_block");

    private IntentNormalizer() {
    }

    public static String normalize(String intent) {
        if (intent == null || intent.isBlank()) {
            return IntentResult.UNKNOWN_INTENT;
        }
        String label = intent.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
        return ALIASES.getOrDefault(label, label);
    }

    public static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, confidence));
    }
}
