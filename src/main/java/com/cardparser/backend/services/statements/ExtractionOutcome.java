package com.cardparser.backend.services.statements;

import java.util.List;

/**
 * Result of one extraction call: either a parsed statement or a failure, never both.
 */
public interface ExtractionOutcome {

    boolean isParsed();

    record Parsed(ParsedStatement statement) implements ExtractionOutcome {

        public Parsed {
            if (statement == null) {
                throw new IllegalArgumentException("statement is required");
            }
        }

        @Override
        public boolean isParsed() {
            return true;
        }
    }

    record Failed(FailureKind kind, String message, List<String> supportedIssuers) implements ExtractionOutcome {

        public Failed {
            if (kind == null) {
                throw new IllegalArgumentException("kind is required");
            }
            supportedIssuers = supportedIssuers == null ? List.of() : List.copyOf(supportedIssuers);
        }

        @Override
        public boolean isParsed() {
            return false;
        }
    }

    enum FailureKind {
        NO_TEXT,
        BANK_NOT_DETECTED
    }
}
