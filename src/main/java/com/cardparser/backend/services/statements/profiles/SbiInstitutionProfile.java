package com.cardparser.backend.services.statements.profiles;

import static com.cardparser.backend.services.statements.rules.RulePatterns.AMOUNT;
import static com.cardparser.backend.services.statements.rules.RulePatterns.CURRENCY;
import static com.cardparser.backend.services.statements.rules.RulePatterns.LAST4;
import static com.cardparser.backend.services.statements.rules.RulePatterns.MASK;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NAME;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NOT_MINIMUM;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NUMERIC_DATE;
import static com.cardparser.backend.services.statements.rules.RulePatterns.SEP;
import static com.cardparser.backend.services.statements.rules.RulePatterns.TEXT_DATE;
import static com.cardparser.backend.services.statements.rules.RulePatterns.amountAfter;
import static com.cardparser.backend.services.statements.rules.RulePatterns.bareTextDateRange;
import static com.cardparser.backend.services.statements.rules.RulePatterns.textDateRange;

import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.PatternRule;

/**
 * SBI Card statements: "Card Holder", "Billing Cycle" and a bare "Due Date".
 */
public class SbiInstitutionProfile extends KeywordInstitutionProfile {

    public static final String ISSUER = "SBI Card";

    static final List<String> KEYWORDS = List.of(
            "SBI Card",
            "SBI Credit Card",
            "www.sbicard.com"
    );

    private static final String NAME_END = "(?:\\n|\\bCard\\b|\\bNumber\\b|\\d)";

    static final List<PatternRule> CARD_HOLDER = List.of(
            PatternRule.single("Card Holder", "Card\\s*Holder(?:\\s+Name)?" + SEP + NAME + NAME_END),
            PatternRule.single("Name", "\\bName" + SEP + NAME + NAME_END),
            PatternRule.single("Dear", "Dear\\s+" + NAME + "(?:,|\\n)"),
            PatternRule.single("Mr.", "\\bMr\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Ms.", "\\bMs\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Mrs.", "\\bMrs\\.?\\s+" + NAME + "(?:\\n|,)")
    );

    static final List<PatternRule> LAST_4_DIGITS = List.of(
            PatternRule.single("Card Number", "Card\\s+(?:Number|No\\.?)" + SEP + "(?:X+\\s*)*+" + LAST4),
            PatternRule.single("Masked groups", "(?:" + MASK + "{4}\\s*){3}" + LAST4),
            PatternRule.single("ending", "ending\\s+(?:with\\s+|in\\s+)?" + LAST4),
            PatternRule.lastOfGroups("Full card number", "(\\d{4})\\s+(\\d{4})\\s+(\\d{4})\\s+(\\d{4})")
    );

    static final List<PatternRule> BILLING_CYCLE = List.of(
            PatternRule.single("Billing Cycle", "Billing\\s+Cycle" + SEP + textDateRange()),
            PatternRule.single("Statement Period", "Statement\\s+Period" + SEP + textDateRange()),
            PatternRule.joinedPair("From/To",
                    "From" + SEP + "(" + NUMERIC_DATE + ")\\s+To" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Bare date range", bareTextDateRange(TEXT_DATE))
    );

    static final List<PatternRule> PAYMENT_DUE_DATE = List.of(
            PatternRule.single("Payment Due Date", "Payment\\s+Due\\s+Date" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Due Date", "Due\\s+Date" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Due Date (numeric)", "Due\\s+Date" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Pay by", "Pay\\s+by" + SEP + "(" + TEXT_DATE + ")")
    );

    static final List<PatternRule> TOTAL_AMOUNT_DUE = List.of(
            PatternRule.single("Total Amount Due", amountAfter("Total\\s+Amount\\s+Due")),
            PatternRule.single("Total Outstanding", amountAfter("Total\\s+Outstanding")),
            PatternRule.single("Amount Due", amountAfter(NOT_MINIMUM + "Amount\\s+Due")),
            PatternRule.single("Amount before Total",
                    CURRENCY + "\\s*" + AMOUNT + "\\s+Total")
    );

    public SbiInstitutionProfile() {
        super(ISSUER, KEYWORDS, Map.of(
                FieldName.CARD_HOLDER, CARD_HOLDER,
                FieldName.LAST_4_DIGITS, LAST_4_DIGITS,
                FieldName.BILLING_CYCLE, BILLING_CYCLE,
                FieldName.PAYMENT_DUE_DATE, PAYMENT_DUE_DATE,
                FieldName.TOTAL_AMOUNT_DUE, TOTAL_AMOUNT_DUE
        ));
    }
}
