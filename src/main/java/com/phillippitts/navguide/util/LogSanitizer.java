package com.phillippitts.navguide.util;

/** Utility for privacy-safe logging of text previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Collapses whitespace and truncates to at most {@code max} characters, marking a cut
     * with a trailing ellipsis. Returns "" for null or non-positive max.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String collapsed = s.strip().replaceAll("\\s+", " ");
        if (collapsed.length() <= max) {
            return collapsed;
        }
        if (max <= 3) {
            return collapsed.substring(0, max);
        }
        return collapsed.substring(0, max - 3) + "...";
    }
}
