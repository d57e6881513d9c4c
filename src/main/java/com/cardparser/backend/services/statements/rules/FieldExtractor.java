package com.cardparser.backend.services.statements.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fallback chain for one field. Rules run in declared order and the first usable capture wins;
 * later (looser) rules are never consulted once an earlier one matched.
 */
public final class FieldExtractor {

    private final FieldName field;
    private final List<PatternRule> rules;

    public FieldExtractor(FieldName field, List<PatternRule> rules) {
        this.field = Objects.requireNonNull(field, "field");
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one rule is required for " + field.key());
        }
        this.rules = List.copyOf(rules);
    }

    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (PatternRule rule : rules) {
            Optional<Capture> capture = rule.apply(text);
            if (capture.isPresent()) {
                return Optional.of(ValueNormalizer.normalize(field, capture.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluates every rule, not only up to the winner. Used to debug layouts that resolve to the wrong value.
     */
    public FieldTrace trace(String text) {
        List<RuleTrace> traces = new ArrayList<>(rules.size());
        String resolved = null;
        String resolvedBy = null;

        for (PatternRule rule : rules) {
            Optional<Capture> capture = rule.apply(text);
            String value = capture.map(c -> ValueNormalizer.normalize(field, c)).orElse(null);
            traces.add(new RuleTrace(rule.label(), capture.isPresent(), value));
            if (resolved == null && value != null) {
                resolved = value;
                resolvedBy = rule.label();
            }
        }

        return new FieldTrace(field, resolved, resolvedBy, List.copyOf(traces));
    }
}
