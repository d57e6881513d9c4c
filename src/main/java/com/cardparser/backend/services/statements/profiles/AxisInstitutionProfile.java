package com.cardparser.backend.services.statements.profiles;

import static com.cardparser.backend.services.statements.rules.RulePatterns.AMOUNT;
import static com.cardparser.backend.services.statements.rules.RulePatterns.CURRENCY;
import static com.cardparser.backend.services.statements.rules.RulePatterns.LAST4;
import static com.cardparser.backend.services.statements.rules.RulePatterns.MASK;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NAME;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NOT_MINIMUM;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NUMERIC_DATE;
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
 * Axis Bank statements. Dates use three-letter months and amounts always carry a currency marker.
 */
public class AxisInstitutionProfile extends KeywordInstitutionProfile {

    public static final String ISSUER = "Axis Bank";

    static final List<String> KEYWORDS = List.of(
            "Axis Bank",
            "Axis Credit Card",
            "www.axisbank.com"
    );

    private static final String NAME_END = "(?:\\n|\\bCard\\b)";

    static final List<PatternRule> CARD_HOLDER = List.of(
            PatternRule.single("Card Holder/Member", "Card\\s+(?:Holder|Member)" + SEP + NAME + NAME_END),
            PatternRule.single("Customer Name", "Customer\\s+Name" + SEP + NAME + "\\n"),
            PatternRule.single("Name", "Name" + SEP + NAME + NAME_END),
            PatternRule.single("Dear", "Dear\\s+" + NAME + "(?:,|\\n)"),
            PatternRule.single("Mr.", "\\bMr\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Ms.", "\\bMs\\.?\\s+" + NAME + "(?:\\n|,)")
    );

    static final List<PatternRule> LAST_4_DIGITS = List.of(
            PatternRule.single("Card Number", "Card\\s+(?:Number|No\\.?)" + SEP + "(?:X+\\s*)*+" + LAST4),
            PatternRule.single("XXXX XXXX XXXX 1234", "(?:X{4}\\s+){3}" + LAST4),
            PatternRule.single("ending with", "ending\\s+(?:with\\s+)?" + LAST4),
            PatternRule.single("Masked run", MASK + "{12}" + LAST4),
            PatternRule.single("Card ending", "Card\\s+ending" + SEP + LAST4)
    );

    static final List<PatternRule> BILLING_CYCLE = List.of(
            PatternRule.single("Statement Period", "Statement\\s+Period" + SEP + shortTextDateRange()),
            PatternRule.single("Billing Cycle/Period", "Billing\\s+(?:Cycle|Period)" + SEP + shortTextDateRange()),
            PatternRule.single("Bare date range", bareTextDateRange(SHORT_TEXT_DATE)),
            PatternRule.joinedPair("From/To",
                    "From" + SEP + "(" + NUMERIC_DATE + ")\\s+To" + SEP + "(" + NUMERIC_DATE + ")")
    );

    static final List<PatternRule> PAYMENT_DUE_DATE = List.of(
            PatternRule.single("Payment Due Date", "Payment\\s+Due\\s+Date" + SEP + "(" + SHORT_TEXT_DATE + ")"),
            PatternRule.single("Due Date", "Due\\s+Date" + SEP + "(" + SHORT_TEXT_DATE + ")"),
            PatternRule.single("Pay by", "Pay\\s+by" + SEP + "(" + SHORT_TEXT_DATE + ")"),
            PatternRule.single("Payment Due (numeric)", "Payment\\s+Due" + SEP + "(" + NUMERIC_DATE + ")")
    );

    static final List<PatternRule> TOTAL_AMOUNT_DUE = List.of(
            PatternRule.single("Total Amount Due", amountAfterCurrency("Total\\s+Amount\\s+Due")),
            PatternRule.single("Total Due", amountAfterCurrency("Total\\s+Due")),
            PatternRule.single("Amount Due", amountAfterCurrency(NOT_MINIMUM + "Amount\\s+Due")),
            PatternRule.single("Outstanding Amount", amountAfterCurrency("Outstanding\\s+Amount")),
            PatternRule.single("Amount before Total", CURRENCY + "\\s*" + AMOUNT + "\\s+Total")
    );

    public AxisInstitutionProfile() {
        super(ISSUER, KEYWORDS, Map.of(
                FieldName.CARD_HOLDER, CARD_HOLDER,
                FieldName.LAST_4_DIGITS, LAST_4_DIGITS,
                FieldName.BILLING_CYCLE, BILLING_CYCLE,
                FieldName.PAYMENT_DUE_DATE, PAYMENT_DUE_DATE,
                FieldName.TOTAL_AMOUNT_DUE, TOTAL_AMOUNT_DUE
        ));
    }
}
