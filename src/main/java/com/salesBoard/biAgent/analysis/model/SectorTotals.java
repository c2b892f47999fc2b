package com.salesBoard.biAgent.analysis.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Record count and summed value of one sector.
 */
@Value
public class SectorTotals {

    long count;
    BigDecimal value;
}
