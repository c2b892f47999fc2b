package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.query.model.DateWindow;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.util.TimeRangeResolver;
import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows a snapshot to the records a question is about.
 * 
 * Sector filters apply to both boards, stage filters to deals and status filters to work
 * orders. The time window is checked against the deal close date and the work-order end
 * date, falling back to the start date. While a filter is active, records whose field for
 * that filter is not valid are left out.
 */
public final class RecordFilter {

    private RecordFilter() {
    }

    public static List<NormalizedRecord> deals(BoardSnapshot snapshot, QueryIntent intent) {
        DateWindow window = TimeRangeResolver.resolve(intent.getTimeRange(), snapshot.getAsOf());
        return snapshot.getDeals().stream()
                .filter(deal -> matchesCategory(deal.category(BoardField.DEAL_SECTOR), intent.filterValues(FilterDimension.SECTOR)))
                .filter(deal -> matchesCategory(deal.category(BoardField.DEAL_STAGE), intent.filterValues(FilterDimension.STAGE)))
                .filter(deal -> inWindow(deal.date(BoardField.DEAL_CLOSE_DATE), window))
                .collect(Collectors.toList());
    }

    public static List<NormalizedRecord> workOrders(BoardSnapshot snapshot, QueryIntent intent) {
        DateWindow window = TimeRangeResolver.resolve(intent.getTimeRange(), snapshot.getAsOf());
        return snapshot.getWorkOrders().stream()
                .filter(order -> matchesCategory(order.category(BoardField.WORK_ORDER_SECTOR), intent.filterValues(FilterDimension.SECTOR)))
                .filter(order -> matchesCategory(order.category(BoardField.WORK_ORDER_STATUS), intent.filterValues(FilterDimension.STATUS)))
                .filter(order -> inWindow(workOrderDate(order), window))
                .collect(Collectors.toList());
    }

    /**
     * Date a work order is placed on in time: its end date, or its start date when the end
     * date is not valid.
     */
    public static Optional<LocalDate> workOrderDate(NormalizedRecord order) {
        Optional<LocalDate> end = order.date(BoardField.WORK_ORDER_END_DATE);
        return end.isPresent() ? end : order.date(BoardField.WORK_ORDER_START_DATE);
    }

    private static boolean matchesCategory(Optional<CategoryMatch> value, Set<String> accepted) {
        if (accepted.isEmpty()) {
            return true;
        }
        return value.map(match -> accepted.stream().anyMatch(match::is)).orElse(false);
    }

    private static boolean inWindow(Optional<LocalDate> date, DateWindow window) {
        if (window.isUnbounded()) {
            return true;
        }
        return date.map(window::contains).orElse(false);
    }
}
