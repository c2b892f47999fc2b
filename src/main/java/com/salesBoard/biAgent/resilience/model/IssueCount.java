package com.salesBoard.biAgent.resilience.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Number of issues of one kind on one field across a batch.
 */
@Value
public class IssueCount {

    /**
     * Descending count, then field name, then issue kind.
     */
    public static final Comparator<IssueCount> WARNING_ORDER = Comparator
            .comparingLong(IssueCount::getCount).reversed()
            .thenComparing(IssueCount::getFieldName)
            .thenComparing(IssueCount::getIssueKind);

    String fieldName;
    IssueKind issueKind;
    long count;

    /**
     * Human-readable warning, e.g. {@code 22 records missing 'amount' field}.
     */
    public String render() {
        String records = count == 1 ? "record" : "records";
        return switch (issueKind) {
            case MISSING_FIELD -> String.format("%d %s missing '%s' field", count, records, fieldName);
            case INVALID_FORMAT -> ValidationIssue.RECORD_FIELD.equals(fieldName)
                    ? String.format("%d %s could not be read", count, records)
                    : String.format("%d %s with invalid '%s' format", count, records, fieldName);
            case OUT_OF_RANGE -> String.format("%d %s with out-of-range '%s' value", count, records, fieldName);
            case UNMAPPED_CATEGORY -> String.format("%d %s with unrecognized '%s' value (counted as Unknown)",
                    count, records, fieldName);
        };
    }
}
