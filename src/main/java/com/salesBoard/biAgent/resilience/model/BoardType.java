package com.salesBoard.biAgent.resilience.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two boards the agent reads from.
 */
@Getter
@RequiredArgsConstructor
public enum BoardType {
    DEALS("Deals"),
    WORK_ORDERS("Work Orders");

    private final String displayName;
}
