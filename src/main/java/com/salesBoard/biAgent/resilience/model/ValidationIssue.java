package com.salesBoard.biAgent.resilience.model;

import lombok.Value;

/**
 * A single field-level problem found while validating a record.
 */
@Value
public class ValidationIssue {

    /**
     * Field name used for issues about the record as a whole (unreadable item).
     */
    public static final String RECORD_FIELD = "record";

    String recordId;
    String fieldName;
    IssueKind issueKind;
    String detail;
}
