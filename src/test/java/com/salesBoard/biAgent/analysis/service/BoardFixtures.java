package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.FieldRequirements;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.resilience.service.RecordValidator;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds normalized board records the way the validator produces them.
 */
final class BoardFixtures {

    static final LocalDate AS_OF = LocalDate.of(2026, 10, 17);

    private static final RecordValidator VALIDATOR = new RecordValidator();

    private static final FieldRequirements ALL_DEAL_FIELDS = FieldRequirements.of(BoardType.DEALS,
            Set.of(), Set.copyOf(BoardField.forBoard(BoardType.DEALS)));

    private static final FieldRequirements ALL_WORK_ORDER_FIELDS = FieldRequirements.of(BoardType.WORK_ORDERS,
            Set.of(), Set.copyOf(BoardField.forBoard(BoardType.WORK_ORDERS)));

    private BoardFixtures() {
    }

    static NormalizedRecord deal(String id, String amount, String stage, String sector, String closeDate) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("Item Name", "Deal " + id);
        columns.put("Amount", amount);
        columns.put("Stage", stage);
        columns.put("Sector", sector);
        columns.put("Close Date", closeDate);
        return normalize(RawRecord.of(id, BoardType.DEALS, columns), ALL_DEAL_FIELDS);
    }

    static NormalizedRecord workOrder(String id, String revenue, String status, String sector, String startDate,
                                      String endDate) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("Item Name", "Work order " + id);
        columns.put("Revenue", revenue);
        columns.put("Status", status);
        columns.put("Sector", sector);
        columns.put("Start Date", startDate);
        columns.put("End Date", endDate);
        return normalize(RawRecord.of(id, BoardType.WORK_ORDERS, columns), ALL_WORK_ORDER_FIELDS);
    }

    static BoardSnapshot snapshot(List<NormalizedRecord> deals, List<NormalizedRecord> workOrders) {
        return new BoardSnapshot(deals, workOrders, AS_OF);
    }

    static QueryIntent intent(QueryCategory category) {
        return QueryIntent.builder()
                .originalQuery(category.name())
                .category(category)
                .confidence(1.0)
                .build();
    }

    static QueryIntent intent(QueryCategory category, TimeRange timeRange, FilterDimension dimension, String... values) {
        Map<FilterDimension, Set<String>> filters = dimension == null
                ? Map.of()
                : Map.of(dimension, new LinkedHashSet<>(List.of(values)));
        return QueryIntent.builder()
                .originalQuery(category.name())
                .category(category)
                .timeRange(timeRange)
                .filters(filters)
                .confidence(1.0)
                .build();
    }

    private static NormalizedRecord normalize(RawRecord raw, FieldRequirements requirements) {
        return VALIDATOR.validate(List.of(raw), requirements).getRecords().get(0);
    }
}
