package com.salesBoard.biAgent.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recognized, forecasted and committed revenue over filtered deals and work orders.
 */
@Value
@Builder
public class RevenueMetrics {

    BigDecimal recognizedRevenue;
    BigDecimal wonDealRevenue;
    BigDecimal completedWorkOrderRevenue;
    BigDecimal forecastedRevenue;
    BigDecimal committedBacklog;
    BigDecimal totalOutlook;
    Map<String, SectorRevenue> sectorBreakdown;
    /** Completed work-order revenue keyed by {@code yyyy-MM} of the end date, ascending. */
    Map<String, BigDecimal> recognizedByMonth;
    BigDecimal yearToDateRecognized;
    long recordsAnalyzed;

    public Map<String, Object> toKeyMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("recognized_revenue", Metrics.money(recognizedRevenue));
        metrics.put("won_deal_revenue", Metrics.money(wonDealRevenue));
        metrics.put("completed_work_order_revenue", Metrics.money(completedWorkOrderRevenue));
        metrics.put("forecasted_revenue", Metrics.money(forecastedRevenue));
        metrics.put("committed_backlog", Metrics.money(committedBacklog));
        metrics.put("total_outlook", Metrics.money(totalOutlook));
        metrics.put("year_to_date_recognized", Metrics.money(yearToDateRecognized));
        metrics.put("recognized_by_month", Metrics.moneyMap(recognizedByMonth));
        Map<String, Object> sectors = new LinkedHashMap<>();
        sectorBreakdown.forEach((sector, revenue) -> sectors.put(sector, revenue.toMap()));
        metrics.put("sector_breakdown", sectors);
        return metrics;
    }

    @Value
    public static class SectorRevenue {

        BigDecimal recognized;
        BigDecimal forecasted;
        BigDecimal backlog;

        public static SectorRevenue zero() {
            return new SectorRevenue(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        }

        public SectorRevenue plus(BigDecimal recognized, BigDecimal forecasted, BigDecimal backlog) {
            return new SectorRevenue(this.recognized.add(recognized), this.forecasted.add(forecasted),
                    this.backlog.add(backlog));
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("recognized", Metrics.money(recognized));
            map.put("forecasted", Metrics.money(forecasted));
            map.put("backlog", Metrics.money(backlog));
            return map;
        }
    }
}
