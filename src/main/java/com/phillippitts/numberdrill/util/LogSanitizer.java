package com.phillippitts.numberdrill.util;

/** Utility for privacy-safe logging of learner answers. */
public final class LogSanitizer {

    /** Default preview length for transcripts in log lines. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        if (s.length() <= max) {
            return s;
        }
        int end = max;
        if (Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Preview of a transcript for log lines: at most {@link #DEFAULT_PREVIEW} characters,
     * with an ellipsis and the full length when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        if (s.length() <= DEFAULT_PREVIEW) {
            return s;
        }
        return truncate(s, DEFAULT_PREVIEW) + "…(" + s.length() + " chars)";
    }
}
