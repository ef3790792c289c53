package com.phillippitts.fstintent.util;

/** Utility for privacy-safe logging of sentence previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

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
     * Single-line, quoted preview of user text for log messages. Line breaks and tabs are
     * flattened to spaces so one sentence cannot forge extra log lines; text longer than
     * {@code max} characters is cut and marked with an ellipsis.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "<null>";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ");
        String cut = truncate(flat, max);
        return "'" + cut + (cut.length() < flat.length() ? ELLIPSIS : "") + "'";
    }
}
