package com.hunt.jobtracker.ingest.util;

import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    public static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Case-insensitive {@link String#indexOf(String)} that keeps indices aligned with the
     * original text, which lower-casing the whole string does not guarantee.
     */
    public static int indexOfIgnoreCase(String text, String needle, int fromIndex) {
        if (text == null || needle == null) {
            return -1;
        }
        int last = text.length() - needle.length();
        for (int i = Math.max(0, fromIndex); i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    public static int indexOfIgnoreCase(String text, String needle) {
        return indexOfIgnoreCase(text, needle, 0);
    }

    public static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, Math.max(0, max - 3)) + "...";
    }
}
