package com.cardparser.backend.services.statements.rules;

/**
 * Canonical fields extracted from every statement, in output order.
 */
public enum FieldName {
    CARD_HOLDER("card_holder", ValueKind.TOKEN),
    LAST_4_DIGITS("last_4_digits", ValueKind.TOKEN),
    BILLING_CYCLE("billing_cycle", ValueKind.DATE),
    PAYMENT_DUE_DATE("payment_due_date", ValueKind.DATE),
    TOTAL_AMOUNT_DUE("total_amount_due", ValueKind.AMOUNT);

    private final String key;
    private final ValueKind kind;

    FieldName(String key, ValueKind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public ValueKind kind() {
        return kind;
    }

    public enum ValueKind {
        TOKEN,
        DATE,
        AMOUNT
    }
}
