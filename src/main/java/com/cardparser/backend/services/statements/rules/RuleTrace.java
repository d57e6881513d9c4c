package com.cardparser.backend.services.statements.rules;

public record RuleTrace(
        String label,
        boolean matched,
        String value
) {
}
