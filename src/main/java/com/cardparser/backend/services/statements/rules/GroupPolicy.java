package com.cardparser.backend.services.statements.rules;

import java.util.regex.MatchResult;

/**
 * How a successful match is turned into a {@link Capture}.
 * A policy returns {@code null} when the match does not carry a usable value.
 */
public enum GroupPolicy {

    /** Uses group 1. */
    SINGLE(1) {
        @Override
        Capture select(MatchResult match) {
            String value = match.group(1);
            return isBlank(value) ? null : Capture.of(value);
        }
    },

    /**
     * Uses the last group, for bare full card numbers ("1234 5678 9012 3456").
     * Every group must be present and numeric.
     */
    LAST_OF_GROUPS(2) {
        @Override
        Capture select(MatchResult match) {
            int count = match.groupCount();
            for (int i = 1; i <= count; i++) {
                String group = match.group(i);
                if (group == null || !group.matches("\\d+")) return null;
            }
            return Capture.of(match.group(count));
        }
    },

    /** Joins group 1 and group 2 as an explicit from/to range. Both must be present. */
    JOINED_PAIR(2) {
        @Override
        Capture select(MatchResult match) {
            String start = match.group(1);
            String end = match.group(2);
            if (isBlank(start) || isBlank(end)) return null;
            return Capture.range(start, end);
        }
    };

    private final int minGroups;

    GroupPolicy(int minGroups) {
        this.minGroups = minGroups;
    }

    abstract Capture select(MatchResult match);

    void checkGroupCount(int groupCount, String label) {
        boolean ok = this == JOINED_PAIR ? groupCount == 2 : groupCount >= minGroups;
        if (!ok) {
            throw new IllegalArgumentException(
                    "Rule '" + label + "' has " + groupCount + " capture group(s), incompatible with " + name());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
