package com.salesBoard.biAgent.analysis.model;

import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Normalized content of both boards as of a single date.
 */
@Value
public class BoardSnapshot {

    List<NormalizedRecord> deals;
    List<NormalizedRecord> workOrders;
    LocalDate asOf;

    public BoardSnapshot(List<NormalizedRecord> deals, List<NormalizedRecord> workOrders, LocalDate asOf) {
        this.deals = deals == null ? List.of() : List.copyOf(deals);
        this.workOrders = workOrders == null ? List.of() : List.copyOf(workOrders);
        this.asOf = asOf;
    }
}
