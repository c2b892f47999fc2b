package com.salesBoard.biAgent.gateway.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.resilience.model.DataQualityReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a business question.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BiResponse {
    
    private ResponseOutcome outcome;
    private String executiveSummary;
    
    /**
     * Metric name to value; nested maps for distributions and breakdowns. Empty unless the
     * question was answered.
     */
    private Map<String, Object> keyMetrics;
    private DataQualityReport dataQuality;
    private List<String> implications;
    private QueryIntent intent;
    private String correlationId;
}
