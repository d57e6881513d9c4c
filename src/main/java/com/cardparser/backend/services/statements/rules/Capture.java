package com.cardparser.backend.services.statements.rules;

/**
 * Raw text selected by a rule's group policy. {@code end} is only set for two-endpoint ranges.
 */
public record Capture(String value, String end) {

    public static Capture of(String value) {
        return new Capture(value, null);
    }

    public static Capture range(String start, String end) {
        return new Capture(start, end);
    }

    public boolean isRange() {
        return end != null;
    }
}
