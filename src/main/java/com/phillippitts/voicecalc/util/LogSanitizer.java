package com.phillippitts.voicecalc.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Preview length used when no explicit limit is given. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

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
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }

    public static String truncate(String s) {
        return truncate(s, DEFAULT_PREVIEW_CHARS);
    }
}
