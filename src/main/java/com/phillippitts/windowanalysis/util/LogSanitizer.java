package com.phillippitts.windowanalysis.util;

/** Utility for privacy-safe logging of provider responses and credentials. */
public final class LogSanitizer {

    private static final int VISIBLE_SECRET_CHARS = 4;

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
     * Collapses line breaks so a multi-line provider response stays on one log line, then truncates.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.replaceAll("\\s+", " ").trim(), max);
    }

    /**
     * Masks a secret for logging: the first few characters followed by {@code ***}.
     * Short secrets are fully masked.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= VISIBLE_SECRET_CHARS * 2) {
            return "***";
        }
        return secret.substring(0, VISIBLE_SECRET_CHARS) + "***";
    }
}
