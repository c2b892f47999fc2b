package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.FieldValue;
import com.salesBoard.biAgent.resilience.model.IssueKind;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Monetary and plain numeric fields.
 * 
 * Accepts currency symbols and codes, thousands separators, surrounding whitespace and the
 * accounting convention of parentheses for negative amounts. Produces an exact decimal.
 */
public class CurrencyNormalizer implements FieldNormalizer<BigDecimal> {

    private static final Pattern CURRENCY_MARKERS = Pattern.compile("(?i)[$€£¥₹]|\\b(usd|eur|gbp|inr|cad|aud)\\b");
    private static final Pattern SEPARATORS = Pattern.compile("[,\\s\\u00A0_']");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");

    @Override
    public FieldValue<BigDecimal> normalize(Object rawValue) {
        if (rawValue instanceof BigDecimal) {
            return FieldValue.valid(rawValue, (BigDecimal) rawValue);
        }
        if (rawValue instanceof Number) {
            return fromNumber(rawValue, (Number) rawValue);
        }

        String text = RawValues.presentText(rawValue);
        if (text == null) {
            return FieldValue.invalid(rawValue, IssueKind.MISSING_FIELD, "no value");
        }

        boolean negative = false;
        String cleaned = CURRENCY_MARKERS.matcher(text).replaceAll("");
        cleaned = SEPARATORS.matcher(cleaned).replaceAll("");
        if (cleaned.startsWith("(") && cleaned.endsWith(")") && cleaned.length() > 2) {
            negative = true;
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }

        if (!PLAIN_DECIMAL.matcher(cleaned).matches()) {
            return FieldValue.invalid(rawValue, IssueKind.INVALID_FORMAT, "not a number: '" + text + "'");
        }
        if (negative && (cleaned.startsWith("-") || cleaned.startsWith("+"))) {
            return FieldValue.invalid(rawValue, IssueKind.INVALID_FORMAT, "conflicting signs: '" + text + "'");
        }

        BigDecimal amount = new BigDecimal(cleaned.startsWith("+") ? cleaned.substring(1) : cleaned);
        return FieldValue.valid(rawValue, negative ? amount.negate() : amount);
    }

    private FieldValue<BigDecimal> fromNumber(Object rawValue, Number number) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return FieldValue.invalid(rawValue, IssueKind.INVALID_FORMAT, "not a finite number");
            }
            return FieldValue.valid(rawValue, BigDecimal.valueOf(value));
        }
        return FieldValue.valid(rawValue, new BigDecimal(number.toString()));
    }
}
