package com.cardparser.backend.services.statements.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of a fallback chain: a case-insensitive expression plus the policy that picks its capture.
 * Patterns are compiled once here and shared read-only.
 */
public final class PatternRule {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String label;
    private final Pattern pattern;
    private final GroupPolicy policy;

    private PatternRule(String label, String regex, GroupPolicy policy) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Rule label is required");
        }
        this.label = label;
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"), FLAGS);
        this.policy = Objects.requireNonNull(policy, "policy");
        policy.checkGroupCount(pattern.matcher("").groupCount(), label);
    }

    public static PatternRule single(String label, String regex) {
        return new PatternRule(label, regex, GroupPolicy.SINGLE);
    }

    public static PatternRule lastOfGroups(String label, String regex) {
        return new PatternRule(label, regex, GroupPolicy.LAST_OF_GROUPS);
    }

    public static PatternRule joinedPair(String label, String regex) {
        return new PatternRule(label, regex, GroupPolicy.JOINED_PAIR);
    }

    /**
     * Looks for the first occurrence anywhere in the text.
     * Empty when there is no match or the policy rejects it.
     */
    public Optional<Capture> apply(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        return Optional.ofNullable(policy.select(m));
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return "PatternRule{" + label + ", " + policy + "}";
    }
}
