package com.phillippitts.voiceinput.util;

/** Utility for privacy-safe logging of text previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /** Length of {@code s}, 0 for null. Used for INFO logs that must not carry text. */
    public static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
