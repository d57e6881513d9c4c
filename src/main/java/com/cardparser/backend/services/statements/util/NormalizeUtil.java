package com.cardparser.backend.services.statements.util;

import java.util.Locale;

public final class NormalizeUtil {

    private NormalizeUtil() {
    }

    /**
     * Lower-cases with the root locale so keyword tests do not depend on the JVM default
     * (e.g. Turkish dotless i). Whitespace is left untouched.
     */
    public static String lower(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive test against several keywords; {@code lowerText} must already be lower-cased.
     */
    public static boolean containsAny(String lowerText, Iterable<String> lowerKeywords) {
        if (lowerText == null || lowerText.isEmpty()) return false;
        for (String keyword : lowerKeywords) {
            if (!keyword.isEmpty() && lowerText.contains(keyword)) return true;
        }
        return false;
    }

    public static String preview(String text, int maxChars) {
        if (text == null) return "";
        int limit = Math.max(0, maxChars);
        return text.length() > limit ? text.substring(0, limit) : text;
    }
}
