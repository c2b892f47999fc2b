package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import com.salesBoard.biAgent.resilience.model.FieldValue;
import com.salesBoard.biAgent.resilience.model.IssueKind;

/**
 * Maps sector, stage and status labels onto a {@link Vocabulary}.
 * 
 * Values that match nothing stay usable: they are bucketed as Unknown and flagged
 * {@link IssueKind#UNMAPPED_CATEGORY} rather than rejected.
 */
public class CategoryNormalizer implements FieldNormalizer<CategoryMatch> {

    private final Vocabulary vocabulary;

    public CategoryNormalizer(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public FieldValue<CategoryMatch> normalize(Object rawValue) {
        if (rawValue instanceof CategoryMatch) {
            return normalizeMatch(rawValue, (CategoryMatch) rawValue);
        }

        String text = RawValues.presentText(rawValue);
        if (text == null) {
            return FieldValue.invalid(rawValue, IssueKind.MISSING_FIELD, "no value");
        }

        return vocabulary.lookup(text)
                .map(canonical -> FieldValue.valid(rawValue, CategoryMatch.mapped(canonical)))
                .orElseGet(() -> FieldValue.flagged(rawValue, CategoryMatch.unmapped(text),
                        IssueKind.UNMAPPED_CATEGORY, "'" + text + "' is not a known " + vocabulary.getName()));
    }

    private FieldValue<CategoryMatch> normalizeMatch(Object rawValue, CategoryMatch match) {
        if (match.isMapped()) {
            return FieldValue.valid(rawValue, match);
        }
        return FieldValue.flagged(rawValue, match, IssueKind.UNMAPPED_CATEGORY,
                "'" + match.getUnmappedText() + "' is not a known " + vocabulary.getName());
    }
}
