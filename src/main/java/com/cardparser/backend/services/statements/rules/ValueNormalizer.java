package com.cardparser.backend.services.statements.rules;

/**
 * Turns raw captures into the canonical strings stored in a parsed statement.
 * Values are only trimmed (and amounts prefixed); nothing is parsed or reformatted.
 */
public final class ValueNormalizer {

    public static final String CURRENCY_SYMBOL = "\u20B9";
    public static final String RANGE_SEPARATOR = " - ";

    private ValueNormalizer() {
    }

    public static String normalize(FieldName field, String rawCapture) {
        String value = rawCapture == null ? "" : rawCapture.trim();
        return switch (field.kind()) {
            case AMOUNT -> CURRENCY_SYMBOL + value;
            case DATE, TOKEN -> value;
        };
    }

    public static String normalizeRange(String start, String end) {
        return safeTrim(start) + RANGE_SEPARATOR + safeTrim(end);
    }

    public static String normalize(FieldName field, Capture capture) {
        if (capture.isRange()) {
            return normalizeRange(capture.value(), capture.end());
        }
        return normalize(field, capture.value());
    }

    private static String safeTrim(String s) {
        return s == null ? "" : s.trim();
    }
}
