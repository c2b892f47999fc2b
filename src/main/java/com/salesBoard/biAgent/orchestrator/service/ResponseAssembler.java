package com.salesBoard.biAgent.orchestrator.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.dto.ResponseOutcome;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.model.DataQualityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns analyzer output, the data-quality report and the interpreted question into the
 * response returned to the caller.
 * 
 * Three shapes are produced: an answer, an explicit "no data available" response when no
 * record survives filtering, and an explanation with suggested topics when the question
 * could not be understood.
 */
@Slf4j
@Service
public class ResponseAssembler {

    static final int MAX_WARNINGS = 3;
    static final int MAX_LEADERSHIP_WARNINGS = 5;

    /**
     * Confidence below which the summary says how many records the figures rest on.
     */
    static final double LOW_CONFIDENCE = 80.0;

    static final List<String> SUGGESTED_TOPICS = List.of(
            "Pipeline overview, e.g. \"How's our pipeline looking this quarter?\"",
            "Revenue forecast, e.g. \"What revenue can we expect from Energy deals?\"",
            "Execution status, e.g. \"How many work orders are on hold?\"",
            "Leadership update, e.g. \"Prepare a leadership update for this quarter\"");

    public BiResponse assemble(QueryIntent intent, AnalysisFragment analysis, DataQualityReport dataQuality) {
        if (analysis.getRecordsAnalyzed() == 0) {
            return noData(intent, dataQuality);
        }
        String summary = analysis.getExecutiveSummary();
        if (dataQuality.getTotalRecords() > 0 && dataQuality.getConfidenceScore() < LOW_CONFIDENCE) {
            summary += String.format(Locale.US, " Figures rest on %d of %d records (%.0f%% confidence); see data quality warnings.",
                    dataQuality.getValidRecords(), dataQuality.getTotalRecords(), dataQuality.getConfidenceScore());
        }
        return BiResponse.builder()
                .outcome(ResponseOutcome.ANSWERED)
                .executiveSummary(summary)
                .keyMetrics(analysis.getKeyMetrics())
                .dataQuality(dataQuality.limitWarnings(warningLimit(intent)))
                .implications(List.copyOf(analysis.getImplications()))
                .intent(intent)
                .build();
    }

    public BiResponse noData(QueryIntent intent, DataQualityReport dataQuality) {
        log.debug("No records left after filtering - category: {}, timeRange: {}", intent.getCategory(), intent.getTimeRange());
        List<String> implications = new ArrayList<>();
        if (!intent.getFilters().isEmpty()) {
            implications.add("Remove or broaden the " + describeFilters(intent) + " filter to include more records");
        }
        if (intent.getTimeRange() != TimeRange.ALL_TIME) {
            implications.add("Try a wider time range than " + intent.getTimeRange().getLabel().toLowerCase(Locale.ROOT));
        }
        if (implications.isEmpty()) {
            implications.add("Check that the boards contain items for this question");
        }
        return BiResponse.builder()
                .outcome(ResponseOutcome.NO_DATA_AVAILABLE)
                .executiveSummary("No data available for this query: no " + subject(intent.getCategory())
                        + " match the requested scope.")
                .keyMetrics(new LinkedHashMap<>())
                .dataQuality(dataQuality.limitWarnings(warningLimit(intent)))
                .implications(implications)
                .intent(intent)
                .build();
    }

    public BiResponse unintelligible(QueryIntent intent) {
        return BiResponse.builder()
                .outcome(ResponseOutcome.UNINTELLIGIBLE_QUERY)
                .executiveSummary("I could not match this question to a topic I can analyze. "
                        + "Try asking about one of the suggested topics.")
                .keyMetrics(new LinkedHashMap<>())
                .dataQuality(DataQualityReport.empty())
                .implications(SUGGESTED_TOPICS)
                .intent(intent)
                .build();
    }

    private static int warningLimit(QueryIntent intent) {
        return intent.getCategory() == QueryCategory.LEADERSHIP_UPDATE ? MAX_LEADERSHIP_WARNINGS : MAX_WARNINGS;
    }

    private static String subject(QueryCategory category) {
        return switch (category) {
            case PIPELINE_OVERVIEW -> "deals";
            case EXECUTION_STATUS -> "work orders";
            default -> "deals or work orders";
        };
    }

    private static String describeFilters(QueryIntent intent) {
        List<String> parts = new ArrayList<>();
        for (FilterDimension dimension : FilterDimension.values()) {
            Set<String> values = intent.filterValues(dimension);
            if (!values.isEmpty()) {
                parts.add(String.join("/", values) + " " + dimension.name().toLowerCase(Locale.ROOT));
            }
        }
        return String.join(" and ", parts);
    }
}
