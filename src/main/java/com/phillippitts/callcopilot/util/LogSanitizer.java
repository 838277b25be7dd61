package com.phillippitts.callcopilot.util;

/** Privacy-safe previews of caller data for logs. */
public final class LogSanitizer {

    private static final int VISIBLE_DIGITS = 4;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Masks a phone number, keeping only the last four digits: {@code +9198xxxx1234} becomes
     * {@code ***1234}. Returns "" for null or blank input.
     */
    public static String maskPhone(String number) {
        if (number == null || number.isBlank()) {
            return "";
        }
        String digits = number.replaceAll("[^0-9]", "");
        if (digits.length() <= VISIBLE_DIGITS) {
            return "***";
        }
        return "***" + digits.substring(digits.length() - VISIBLE_DIGITS);
    }
}
