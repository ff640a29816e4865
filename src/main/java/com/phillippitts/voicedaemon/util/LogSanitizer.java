package com.phillippitts.voicedaemon.util;

/** Utility for privacy-safe logging of user text (transcripts, refinement input). */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 24;

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
     * Short preview with the total length, e.g. {@code "hello wor…" (42 chars)}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "<null>";
        }
        String head = truncate(s, DEFAULT_PREVIEW_CHARS).replaceAll("\\s+", " ");
        String ellipsis = s.length() > DEFAULT_PREVIEW_CHARS ? "…" : "";
        return "\"" + head + ellipsis + "\" (" + s.length() + " chars)";
    }
}
