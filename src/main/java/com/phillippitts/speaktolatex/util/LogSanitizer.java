package com.phillippitts.speaktolatex.util;

/** Privacy-safe previews of user text for log lines. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {
    }

    /**
     * Collapses whitespace and truncates to at most {@code max} characters, marking a cut with
     * an ellipsis. Returns "" for null input or a non-positive limit.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String collapsed = s.strip().replaceAll("\\s+", " ");
        if (collapsed.length() <= max) {
            return collapsed;
        }
        return collapsed.substring(0, max) + ELLIPSIS;
    }
}
