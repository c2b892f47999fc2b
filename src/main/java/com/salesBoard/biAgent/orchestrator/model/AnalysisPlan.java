package com.salesBoard.biAgent.orchestrator.model;

import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.FieldRequirements;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Boards an analysis reads and the fields it needs from each.
 * 
 * Required fields decide whether a record counts as valid for the data-quality score;
 * optional fields are still normalized and reported but never lower the score. A field the
 * question filters on is required, since records without it drop out of the analysis.
 */
@Value
public class AnalysisPlan {

    private static final FieldRequirements PIPELINE_DEALS = FieldRequirements.of(BoardType.DEALS,
            Set.of(BoardField.DEAL_AMOUNT, BoardField.DEAL_STAGE),
            Set.of(BoardField.DEAL_SECTOR, BoardField.DEAL_CLOSE_DATE, BoardField.DEAL_NAME, BoardField.DEAL_OWNER));

    private static final FieldRequirements REVENUE_WORK_ORDERS = FieldRequirements.of(BoardType.WORK_ORDERS,
            Set.of(BoardField.WORK_ORDER_REVENUE, BoardField.WORK_ORDER_STATUS),
            Set.of(BoardField.WORK_ORDER_SECTOR, BoardField.WORK_ORDER_START_DATE, BoardField.WORK_ORDER_END_DATE));

    private static final FieldRequirements EXECUTION_WORK_ORDERS = FieldRequirements.of(BoardType.WORK_ORDERS,
            Set.of(BoardField.WORK_ORDER_STATUS),
            Set.of(BoardField.WORK_ORDER_REVENUE, BoardField.WORK_ORDER_SECTOR, BoardField.WORK_ORDER_START_DATE,
                    BoardField.WORK_ORDER_END_DATE, BoardField.WORK_ORDER_NAME, BoardField.WORK_ORDER_PROJECT_MANAGER));

    QueryCategory category;
    Map<BoardType, FieldRequirements> requirements;

    public static AnalysisPlan forIntent(QueryIntent intent) {
        Map<BoardType, FieldRequirements> requirements = new EnumMap<>(BoardType.class);
        forCategory(intent.getCategory()).getRequirements()
                .forEach((board, fields) -> requirements.put(board, narrowedBy(fields, intent)));
        return new AnalysisPlan(intent.getCategory(), Collections.unmodifiableMap(requirements));
    }

    private static FieldRequirements narrowedBy(FieldRequirements fields, QueryIntent intent) {
        FieldRequirements narrowed = fields;
        if (intent.getTimeRange() != TimeRange.ALL_TIME) {
            narrowed = narrowed.requiring(BoardField.DEAL_CLOSE_DATE, BoardField.WORK_ORDER_END_DATE);
        }
        if (intent.hasFilter(FilterDimension.SECTOR)) {
            narrowed = narrowed.requiring(BoardField.DEAL_SECTOR, BoardField.WORK_ORDER_SECTOR);
        }
        // leadership updates ignore stage and status filters
        if (intent.getCategory() != QueryCategory.LEADERSHIP_UPDATE) {
            if (intent.hasFilter(FilterDimension.STAGE)) {
                narrowed = narrowed.requiring(BoardField.DEAL_STAGE);
            }
            if (intent.hasFilter(FilterDimension.STATUS)) {
                narrowed = narrowed.requiring(BoardField.WORK_ORDER_STATUS);
            }
        }
        return narrowed;
    }

    private static AnalysisPlan forCategory(QueryCategory category) {
        Map<BoardType, FieldRequirements> requirements = new EnumMap<>(BoardType.class);
        switch (category) {
            case PIPELINE_OVERVIEW -> requirements.put(BoardType.DEALS, PIPELINE_DEALS);
            case REVENUE_FORECAST, LEADERSHIP_UPDATE -> {
                requirements.put(BoardType.DEALS, PIPELINE_DEALS);
                requirements.put(BoardType.WORK_ORDERS, REVENUE_WORK_ORDERS);
            }
            case EXECUTION_STATUS -> requirements.put(BoardType.WORK_ORDERS, EXECUTION_WORK_ORDERS);
            default -> throw new IllegalArgumentException("No analysis plan for category " + category);
        }
        return new AnalysisPlan(category, Collections.unmodifiableMap(requirements));
    }

    public Set<BoardType> getBoards() {
        return requirements.keySet();
    }
}
