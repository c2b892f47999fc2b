package com.salesBoard.biAgent.resilience.model;

/**
 * Semantic type of a tracked board column. Selects the normalizer applied to it.
 */
public enum FieldType {
    TEXT,
    CURRENCY,
    DATE,
    SECTOR,
    STAGE,
    STATUS
}
