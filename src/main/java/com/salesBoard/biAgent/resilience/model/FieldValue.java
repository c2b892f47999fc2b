package com.salesBoard.biAgent.resilience.model;

import lombok.Value;

/**
 * Outcome of normalizing one raw field value.
 * 
 * A failed normalization never carries a normalized value; the raw value is always kept.
 *
 * @param <T> canonical type of the field
 */
@Value
public class FieldValue<T> {

    Object rawValue;
    T normalizedValue;
    boolean valid;
    IssueKind issueKind;
    String detail;

    public static <T> FieldValue<T> valid(Object rawValue, T normalizedValue) {
        return new FieldValue<>(rawValue, normalizedValue, true, null, null);
    }

    /**
     * Usable value that still deserves a warning, e.g. an unmapped category.
     */
    public static <T> FieldValue<T> flagged(Object rawValue, T normalizedValue, IssueKind issueKind, String detail) {
        return new FieldValue<>(rawValue, normalizedValue, true, issueKind, detail);
    }

    public static <T> FieldValue<T> invalid(Object rawValue, IssueKind issueKind, String detail) {
        return new FieldValue<>(rawValue, null, false, issueKind, detail);
    }

    public boolean hasIssue() {
        return issueKind != null;
    }
}
