package com.salesBoard.biAgent.analysis.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Narrative and metrics one analyzer contributes to a response.
 */
@Value
public class AnalysisFragment {

    String executiveSummary;
    Map<String, Object> keyMetrics;
    List<String> implications;
    long recordsAnalyzed;
}
