package com.cardparser.backend.services.statements;

import java.util.List;

import com.cardparser.backend.services.statements.rules.FieldTrace;

/**
 * Debug view of one text: what was detected and how every rule of the chosen profile behaved.
 * {@code fields} is empty when no issuer was detected.
 */
public record StatementDiagnostics(
        int textLength,
        String textPreview,
        String detectedIssuer,
        List<String> matchingIssuers,
        List<FieldTrace> fields
) {
}
