package com.phillippitts.petpal.util;

/** Utility for privacy-safe logging of user-supplied text (prompts, speech text). */
public final class LogSanitizer {

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters and flatten line breaks;
     * returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ");
        return flat.length() <= max ? flat : flat.substring(0, max) + "…";
    }
}
