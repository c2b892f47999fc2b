package com.salesBoard.biAgent.resilience.model;

/**
 * Kind of problem found while normalizing a single field.
 */
public enum IssueKind {
    MISSING_FIELD,
    INVALID_FORMAT,
    OUT_OF_RANGE,
    UNMAPPED_CATEGORY
}
