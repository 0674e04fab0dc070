package com.phillippitts.transcriptionagent.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Default preview length for transcript text in INFO logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 120;

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
     * Single-line preview of user text: line breaks collapsed to spaces, truncated to
     * {@link #DEFAULT_PREVIEW_CHARS} with a trailing ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ");
        return flat.length() <= DEFAULT_PREVIEW_CHARS
                ? flat
                : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
