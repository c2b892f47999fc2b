package com.salesBoard.biAgent.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-board view for leadership: the three domain metric sets plus the health verdict
 * and the sentences derived from them.
 */
@Value
@Builder
public class LeadershipSummary {

    String period;
    PipelineHealth health;
    List<String> highlights;
    List<String> risks;
    List<String> opportunities;
    PipelineMetrics pipeline;
    RevenueMetrics revenue;
    ExecutionMetrics execution;

    public long getRecordsAnalyzed() {
        return pipeline.getTotalDeals() + execution.getTotalWorkOrders();
    }

    public Map<String, Object> toKeyMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("period", period);
        metrics.put("pipeline_health", health.getLabel());
        metrics.put("highlights", highlights);
        metrics.put("risks", risks);
        metrics.put("opportunities", opportunities);
        metrics.put("pipeline", pipeline.toKeyMetrics());
        metrics.put("revenue", revenue.toKeyMetrics());
        metrics.put("execution", execution.toKeyMetrics());
        return metrics;
    }
}
