package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.FieldValue;
import com.salesBoard.biAgent.resilience.model.IssueKind;

/**
 * Free-text fields such as item names and owners.
 */
public class TextNormalizer implements FieldNormalizer<String> {

    @Override
    public FieldValue<String> normalize(Object rawValue) {
        String text = RawValues.presentText(rawValue);
        if (text == null) {
            return FieldValue.invalid(rawValue, IssueKind.MISSING_FIELD, "no value");
        }
        return FieldValue.valid(rawValue, text);
    }
}
