package com.phillippitts.callcopilot.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * One disposition code assigned to a call.
 *
 * @param code           taxonomy code, e.g. {@code credit_card_block}
 * @param score          score in [0.0, 1.0]
 * @param subDisposition optional finer-grained code, may be null
 */
public record Disposition(String code, double score, String subDisposition) {

    public static final String GENERAL_INQUIRY = "general_inquiry";

    public Disposition {
        Objects.requireNonNull(code, "Disposition code must not be null");
        score = Math.min(1.0, Math.max(0.0, score));
    }

    /**
     * Human-readable title: underscores become spaces and each word is capitalized,
     * so {@code credit_card_block} becomes {@code Credit Card Block}.
     */
    public String title() {
        String[] words = code.replace('_', ' ').trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
