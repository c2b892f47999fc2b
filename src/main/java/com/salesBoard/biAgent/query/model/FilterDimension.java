package com.salesBoard.biAgent.query.model;

/**
 * Dimensions a question can narrow the data by.
 */
public enum FilterDimension {
    SECTOR,
    STAGE,
    STATUS
}
