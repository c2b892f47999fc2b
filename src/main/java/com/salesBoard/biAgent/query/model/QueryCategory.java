package com.salesBoard.biAgent.query.model;

/**
 * Classified purpose of a question.
 */
public enum QueryCategory {
    PIPELINE_OVERVIEW,
    REVENUE_FORECAST,
    EXECUTION_STATUS,
    LEADERSHIP_UPDATE,
    UNKNOWN
}
