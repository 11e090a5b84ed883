package com.phillippitts.funnel.util;

/** Utility for privacy-safe logging of transcript and frame previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Single-line preview of free text: newlines flattened, truncated with an ellipsis marker
     * and the original length, e.g. {@code "hello wor…(57 chars)"}.
     */
    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW_CHARS);
    }

    public static String preview(String s, int max) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ");
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "…(" + s.length() + " chars)";
    }
}
