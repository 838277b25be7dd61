package com.phillippitts.callcopilot.service.kb;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Expands an intent label and its source statement into KB search terms.
 */
final class SearchTermExpander {

    private static final int MIN_TERM_LENGTH = 3;

    private SearchTermExpander() {
    }

    static Set<String> expand(String intent, String text) {
        Set<String> terms = new LinkedHashSet<>();
        terms.add(intent);
        for (String word : intent.split("_")) {
            if (word.length() >= MIN_TERM_LENGTH) {
                terms.add(word);
            }
        }
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (lower.contains("credit") && lower.contains("card")) {
            addAll(terms, "credit", "card", "credit card");
        }
        if (lower.contains("debit") && lower.contains("card")) {
            addAll(terms, "debit", "card", "debit card");
        }
        if (lower.contains("account")) {
            terms.add("account");
            if (lower.contains("balance")) {
                addAll(terms, "balance", "account balance");
            }
            if (lower.contains("savings")) {
                addAll(terms, "savings", "savings account");
            }
            if (lower.contains("salary")) {
                addAll(terms, "salary", "salary account");
            }
        }
        if (lower.contains("fraud")) {
            addAll(terms, "fraud", "fraudulent");
        }
        if (lower.contains("block")) {
            addAll(terms, "block", "blocked");
        }
        return terms;
    }

    private static void addAll(Set<String> terms, String... values) {
        for (String value : values) {
            terms.add(value);
        }
    }
}
