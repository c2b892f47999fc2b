package com.salesBoard.biAgent.query.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Relative time ranges a question can ask about.
 */
@Getter
@RequiredArgsConstructor
public enum TimeRange {
    THIS_MONTH("This Month"),
    LAST_30_DAYS("Last 30 Days"),
    LAST_90_DAYS("Last 90 Days"),
    THIS_QUARTER("This Quarter"),
    NEXT_QUARTER("Next Quarter"),
    LAST_QUARTER("Last Quarter"),
    THIS_YEAR("This Year"),
    LAST_YEAR("Last Year"),
    ALL_TIME("All Time");

    private final String label;
}
