package com.salesBoard.biAgent.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivery figures over a filtered set of work orders.
 */
@Value
@Builder
public class ExecutionMetrics {

    long totalWorkOrders;
    long workOrdersWithStatus;
    Map<String, CategoryShare> statusDistribution;
    long completedOrders;
    long inProgressOrders;
    long onHoldOrders;
    Double completionRate;
    BigDecimal backlogValue;
    BigDecimal onHoldBacklogValue;
    /** On-hold share of the backlog value; null when the backlog is empty. */
    Double onHoldRatio;
    BigDecimal deliveredRevenue;
    Map<String, Long> ordersBySector;
    Double averageCompletionDays;
    long overdueOrders;

    public Map<String, Object> toKeyMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_work_orders", totalWorkOrders);
        metrics.put("completed_orders", completedOrders);
        metrics.put("in_progress_orders", inProgressOrders);
        metrics.put("on_hold_orders", onHoldOrders);
        metrics.put("completion_rate", Metrics.ratio(completionRate));
        metrics.put("backlog_value", Metrics.money(backlogValue));
        metrics.put("on_hold_backlog_value", Metrics.money(onHoldBacklogValue));
        metrics.put("on_hold_ratio", Metrics.ratio(onHoldRatio));
        metrics.put("delivered_revenue", Metrics.money(deliveredRevenue));
        metrics.put("average_completion_days", averageCompletionDays == null
                ? null : BigDecimal.valueOf(averageCompletionDays).setScale(1, RoundingMode.HALF_UP));
        metrics.put("overdue_orders", overdueOrders);
        metrics.put("status_distribution", Metrics.shareMap(statusDistribution));
        metrics.put("orders_by_sector", new LinkedHashMap<>(ordersBySector));
        return metrics;
    }
}
