package com.cardparser.backend.services.statements.rules;

import java.util.List;

/**
 * Every rule of one field evaluated against the same text, plus the value the fallback chain resolves to.
 */
public record FieldTrace(
        FieldName field,
        String resolvedValue,
        String resolvedBy,
        List<RuleTrace> rules
) {
}
