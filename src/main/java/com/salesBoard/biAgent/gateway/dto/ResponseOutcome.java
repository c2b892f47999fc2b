package com.salesBoard.biAgent.gateway.dto;

/**
 * How a question was answered.
 */
public enum ResponseOutcome {
    ANSWERED,
    NO_DATA_AVAILABLE,
    UNINTELLIGIBLE_QUERY
}
