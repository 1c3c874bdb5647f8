package com.phillippitts.voiceorders.util;

/** Privacy-safe rendering of caller text for logs. */
public final class LogSanitizer {

    /** Default number of characters kept by {@link #preview(String)}. */
    public static final int PREVIEW_LENGTH = 60;

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

    /**
     * Single-line preview: line breaks become spaces, and text longer than
     * {@link #PREVIEW_LENGTH} is cut and marked with an ellipsis.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        if (flat.length() <= PREVIEW_LENGTH) {
            return flat;
        }
        return truncate(flat, PREVIEW_LENGTH) + "...";
    }
}
