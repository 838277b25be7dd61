package com.phillippitts.callcopilot.domain;

import java.util.Objects;

/**
 * Detected customer intent for a stretch of conversation.
 *
 * @param intent     normalized intent label, e.g. {@code credit_card_block}; {@link #UNKNOWN_INTENT} when none
 * @param confidence confidence in [0.0, 1.0]
 */
public record IntentResult(String intent, double confidence) {

    public static final String UNKNOWN_INTENT = "unknown";

    private static final IntentResult UNKNOWN = new IntentResult(UNKNOWN_INTENT, 0.0);

    public IntentResult {
        Objects.requireNonNull(intent, "Intent must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static IntentResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return UNKNOWN_INTENT.equals(intent);
    }
}
