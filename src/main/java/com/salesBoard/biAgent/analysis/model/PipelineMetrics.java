package com.salesBoard.biAgent.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sales pipeline figures over a filtered set of deals.
 * 
 * Money values are exact sums of valid amounts. Rates are ratios in [0, 1] and are
 * {@code null} when their denominator is zero.
 */
@Value
@Builder
public class PipelineMetrics {

    long totalDeals;
    long dealsWithAmount;
    BigDecimal totalValue;
    BigDecimal weightedValue;
    /** Null when no deal has a valid amount. */
    BigDecimal averageDealSize;
    Map<String, CategoryShare> stageDistribution;
    Map<String, BigDecimal> valueByStage;
    long wonDeals;
    long lostDeals;
    Double winRate;
    Double conversionRate;
    Map<String, SectorTotals> sectorBreakdown;
    long lateStageCount;
    BigDecimal lateStageValue;
    long unknownStageCount;

    public Map<String, Object> toKeyMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_deals", totalDeals);
        metrics.put("total_pipeline_value", Metrics.money(totalValue));
        metrics.put("weighted_pipeline_value", Metrics.money(weightedValue));
        metrics.put("average_deal_size", Metrics.money(averageDealSize));
        metrics.put("win_rate", Metrics.ratio(winRate));
        metrics.put("conversion_rate", Metrics.ratio(conversionRate));
        metrics.put("won_deals", wonDeals);
        metrics.put("lost_deals", lostDeals);
        metrics.put("late_stage_deals", lateStageCount);
        metrics.put("late_stage_value", Metrics.money(lateStageValue));
        metrics.put("stage_distribution", Metrics.shareMap(stageDistribution));
        metrics.put("value_by_stage", Metrics.moneyMap(valueByStage));
        metrics.put("sector_breakdown", Metrics.sectorMap(sectorBreakdown));
        return metrics;
    }
}
