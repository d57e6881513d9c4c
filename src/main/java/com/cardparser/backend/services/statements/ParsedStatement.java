package com.cardparser.backend.services.statements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical fields of one statement. Any field other than {@code issuer} may be {@code null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ParsedStatement(
        @JsonProperty("issuer") String issuer,
        @JsonProperty("card_holder") String cardHolder,
        @JsonProperty("last_4_digits") String last4Digits,
        @JsonProperty("billing_cycle") String billingCycle,
        @JsonProperty("payment_due_date") String paymentDueDate,
        @JsonProperty("total_amount_due") String totalAmountDue
) {

    public static ParsedStatement of(String issuer, Map<FieldName, String> fields) {
        return new ParsedStatement(
                issuer,
                fields.get(FieldName.CARD_HOLDER),
                fields.get(FieldName.LAST_4_DIGITS),
                fields.get(FieldName.BILLING_CYCLE),
                fields.get(FieldName.PAYMENT_DUE_DATE),
                fields.get(FieldName.TOTAL_AMOUNT_DUE)
        );
    }

    public String get(FieldName field) {
        return switch (field) {
            case CARD_HOLDER -> cardHolder;
            case LAST_4_DIGITS -> last4Digits;
            case BILLING_CYCLE -> billingCycle;
            case PAYMENT_DUE_DATE -> paymentDueDate;
            case TOTAL_AMOUNT_DUE -> totalAmountDue;
        };
    }

    /**
     * Flat mapping with {@code issuer} first and every field key present.
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("issuer", issuer);
        for (FieldName field : FieldName.values()) {
            map.put(field.key(), get(field));
        }
        return map;
    }

    @JsonIgnore
    public List<FieldName> missingFields() {
        List<FieldName> missing = new ArrayList<>();
        for (FieldName field : FieldName.values()) {
            if (get(field) == null) missing.add(field);
        }
        return missing;
    }

    @JsonIgnore
    public boolean isComplete() {
        return missingFields().isEmpty();
    }
}
