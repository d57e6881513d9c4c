package com.cardparser.backend.services.statements.profiles;

import static com.cardparser.backend.services.statements.rules.RulePatterns.LAST4;
import static com.cardparser.backend.services.statements.rules.RulePatterns.MASK;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NAME;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NOT_MINIMUM;
import static com.cardparser.backend.services.statements.rules.RulePatterns.SEP;
import static com.cardparser.backend.services.statements.rules.RulePatterns.SHORT_TEXT_DATE;
import static com.cardparser.backend.services.statements.rules.RulePatterns.amountAfterCurrency;
import static com.cardparser.backend.services.statements.rules.RulePatterns.bareTextDateRange;
import static com.cardparser.backend.services.statements.rules.RulePatterns.shortTextDateRange;

import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.PatternRule;

/**
 * American Express (India) statements. Card numbers are 15 digits, so the masked run is 11 characters.
 */
public class AmericanExpressInstitutionProfile extends KeywordInstitutionProfile {

    public static final String ISSUER = "American Express";

    static final List<String> KEYWORDS = List.of(
            "American Express",
            "amex",
            "www.americanexpress.com"
    );

    static final List<PatternRule> CARD_HOLDER = List.of(
            PatternRule.single("Card Member/Holder", "Card\\s+(?:Member|Holder)" + SEP + NAME + "(?:\\n|\\bCard\\b)"),
            PatternRule.single("Dear", "Dear\\s+" + NAME + "(?:,|\\n)"),
            PatternRule.single("Account Holder", "Account\\s+Holder" + SEP + NAME + "\\n")
    );

    static final List<PatternRule> LAST_4_DIGITS = List.of(
            PatternRule.single("Card Number", "Card\\s+(?:Number|No\\.?)" + SEP + "(?:X+\\s*)*+" + LAST4),
            PatternRule.single("Masked run", MASK + "{11}" + LAST4),
            PatternRule.single("Account ending", "Account\\s+ending" + SEP + LAST4)
    );

    static final List<PatternRule> BILLING_CYCLE = List.of(
            PatternRule.single("Statement Period", "Statement\\s+Period" + SEP + shortTextDateRange()),
            PatternRule.single("Bare date range", bareTextDateRange(SHORT_TEXT_DATE))
    );

    static final List<PatternRule> PAYMENT_DUE_DATE = List.of(
            PatternRule.single("Payment Due", "Payment\\s+Due" + SEP + "(" + SHORT_TEXT_DATE + ")"),
            PatternRule.single("Due Date", "Due\\s+Date" + SEP + "(" + SHORT_TEXT_DATE + ")")
    );

    static final List<PatternRule> TOTAL_AMOUNT_DUE = List.of(
            PatternRule.single("Total (Amount) Due", amountAfterCurrency("Total\\s+(?:Amount\\s+)?Due")),
            PatternRule.single("Amount Due", amountAfterCurrency(NOT_MINIMUM + "Amount\\s+Due"))
    );

    public AmericanExpressInstitutionProfile() {
        super(ISSUER, KEYWORDS, Map.of(
                FieldName.CARD_HOLDER, CARD_HOLDER,
                FieldName.LAST_4_DIGITS, LAST_4_DIGITS,
                FieldName.BILLING_CYCLE, BILLING_CYCLE,
                FieldName.PAYMENT_DUE_DATE, PAYMENT_DUE_DATE,
                FieldName.TOTAL_AMOUNT_DUE, TOTAL_AMOUNT_DUE
        ));
    }
}
