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
 * HDFC Bank statements. Covers both the "Name on Card / Statement Period" layout and the newer
 * "Card holder Name / Opening/Closing Date / New Balance" one.
 */
public class HdfcInstitutionProfile extends KeywordInstitutionProfile {

    public static final String ISSUER = "HDFC Bank";

    static final List<String> KEYWORDS = List.of(
            "HDFC Bank",
            "HDFC Credit Card",
            "www.hdfcbank.com"
    );

    private static final String NAME_END = "(?:\\n|\\bCard\\b|\\bNumber\\b|\\d)";

    static final List<PatternRule> CARD_HOLDER = List.of(
            PatternRule.single("Card holder Name",
                    "Card\\s+holder\\s+Name\\s*:\\s*([A-Z][A-Za-z\\s]+?)(?:\\n|Name:|Address:|For|$)"),
            PatternRule.single("Name on Card", "Name\\s+on\\s+Card" + SEP + NAME + NAME_END),
            PatternRule.single("Card Holder", "Card\\s*Holder" + SEP + NAME + NAME_END),
            PatternRule.single("Primary Member", "Primary\\s+Member" + SEP + NAME + NAME_END),
            PatternRule.single("Customer Name", "Customer\\s+Name" + SEP + NAME + NAME_END),
            PatternRule.single("Account Holder", "Account\\s+Holder" + SEP + NAME + NAME_END),
            PatternRule.single("Dear", "Dear\\s+" + NAME + "(?:,|\\n)"),
            PatternRule.single("Mr.", "\\bMr\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Ms.", "\\bMs\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Mrs.", "\\bMrs\\.?\\s+" + NAME + "(?:\\n|,)")
    );

    static final List<PatternRule> LAST_4_DIGITS = List.of(
            PatternRule.lastOfGroups("Full card number", "(\\d{4})\\s+(\\d{4})\\s+(\\d{4})\\s+(\\d{4})"),
            PatternRule.single("Card Number/ending/No",
                    "Card\\s+(?:Number|ending|No\\.?)" + SEP + "(?:X+\\s*)*+" + LAST4),
            PatternRule.single("Card No masked", "Card\\s+No\\.?[:\\s]*+" + MASK + "+" + LAST4),
            PatternRule.single("XXXX XXXX XXXX 1234", "(?:X{4}\\s+){3}" + LAST4),
            PatternRule.single("**** **** **** 1234", "(?:\\*{4}\\s+){3}" + LAST4),
            PatternRule.single("ending with", "ending\\s+(?:with\\s+)?" + LAST4),
            PatternRule.single("Card ending in", "Card\\s+ending\\s+in\\s+" + LAST4),
            PatternRule.single("Masked groups",
                    "(?:XXXX|\\*{4})\\s*(?:XXXX|\\*{4})\\s*(?:XXXX|\\*{4})\\s*" + LAST4),
            PatternRule.single("Card: masked", "Card:\\s*" + MASK + "+" + LAST4),
            PatternRule.single("Card masked", "Card\\s+" + MASK + "{4,}\\s*" + LAST4)
    );

    static final List<PatternRule> BILLING_CYCLE = List.of(
            PatternRule.joinedPair("Opening/Closing Date",
                    "Opening/Closing\\s+Date\\s+(\\d{1,2}/\\d{1,2}/[A-Z]{2})\\s*[-\u2013]\\s*(\\d{1,2}/\\d{1,2}/[A-Z]{2})"),
            PatternRule.single("Statement Period", "Statement\\s+Period" + SEP + textDateRange()),
            PatternRule.single("Billing Cycle", "Billing\\s+Cycle" + SEP + textDateRange()),
            PatternRule.single("Statement Date range", "Statement\\s+Date" + SEP + textDateRange()),
            PatternRule.single("Period", "Period" + SEP + textDateRange()),
            PatternRule.single("Bare date range", bareTextDateRange(TEXT_DATE)),
            PatternRule.joinedPair("From/To",
                    "From" + SEP + "(" + NUMERIC_DATE + ")\\s+To" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.joinedPair("Numeric range",
                    "(" + NUMERIC_DATE + ")\\s+(?:to|-)\\s+(" + NUMERIC_DATE + ")")
    );

    static final List<PatternRule> PAYMENT_DUE_DATE = List.of(
            PatternRule.single("Payment due date (dd/mm/yyyy)",
                    "Payment\\s+due\\s+date\\s*:\\s*(\\d{1,2}/\\d{1,2}/\\d{4})"),
            PatternRule.single("Payment Due Date", "Payment\\s+Due\\s+Date" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Due Date", "Due\\s+Date" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Pay by", "Pay\\s+by" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Payment Due", "Payment\\s+Due" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Due on", "Due\\s+on" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Payment Due Date (numeric)", "Payment\\s+Due\\s+Date" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Due Date (numeric)", "Due\\s+Date" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Pay by (numeric)", "Pay\\s+by" + SEP + "(" + NUMERIC_DATE + ")")
    );

    static final List<PatternRule> TOTAL_AMOUNT_DUE = List.of(
            PatternRule.single("New Balance", "New\\s+Balance\\s+" + CURRENCY + "?\\s*" + AMOUNT),
            PatternRule.single("Total balance", "Total\\s+balance\\s*:\\s*" + CURRENCY + "?\\s*" + AMOUNT),
            PatternRule.single("Total Amount Due", amountAfter("Total\\s+Amount\\s+Due")),
            PatternRule.single("Total Due", amountAfter("Total\\s+Due")),
            PatternRule.single("Amount Due", amountAfter(NOT_MINIMUM + "Amount\\s+Due")),
            PatternRule.single("Total Outstanding", amountAfter("Total\\s+Outstanding")),
            PatternRule.single("Outstanding Amount", amountAfter("Outstanding\\s+Amount")),
            PatternRule.single("Amount Payable", amountAfter("Amount\\s+Payable")),
            PatternRule.single("Payable", amountAfter("Payable")),
            PatternRule.single("Amount before Total Due",
                    CURRENCY + "\\s*" + AMOUNT + "\\s+Total\\s+(?:Amount\\s+)?Due"),
            PatternRule.single("Amount before Total",
                    CURRENCY + "\\s*" + AMOUNT + "\\s+(?:is\\s+)?(?:the\\s+)?Total")
    );

    public HdfcInstitutionProfile() {
        super(ISSUER, KEYWORDS, Map.of(
                FieldName.CARD_HOLDER, CARD_HOLDER,
                FieldName.LAST_4_DIGITS, LAST_4_DIGITS,
                FieldName.BILLING_CYCLE, BILLING_CYCLE,
                FieldName.PAYMENT_DUE_DATE, PAYMENT_DUE_DATE,
                FieldName.TOTAL_AMOUNT_DUE, TOTAL_AMOUNT_DUE
        ));
    }
}
