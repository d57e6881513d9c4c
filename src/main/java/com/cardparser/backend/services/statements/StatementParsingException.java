package com.cardparser.backend.services.statements;

/**
 * Thrown when a statement document cannot be opened or read (corrupt PDF, wrong or missing password).
 */
public class StatementParsingException extends IllegalArgumentException {

    public StatementParsingException(String message) {
        super(message);
    }

    public StatementParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
