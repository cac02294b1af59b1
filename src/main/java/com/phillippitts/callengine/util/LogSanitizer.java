package com.phillippitts.callengine.util;

/** Utility for privacy-safe logging of caller data and payload previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks all but the last four characters of a phone number, keeping a leading '+'.
     * Returns "unknown" for null or blank input.
     */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return "unknown";
        }
        String trimmed = phone.trim();
        if (trimmed.length() <= 4) {
            return "*".repeat(trimmed.length());
        }
        int keepFrom = trimmed.length() - 4;
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < keepFrom; i++) {
            char c = trimmed.charAt(i);
            sb.append(i == 0 && c == '+' ? '+' : '*');
        }
        return sb.append(trimmed, keepFrom, trimmed.length()).toString();
    }
}
