package com.salesBoard.biAgent.orchestrator.model;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.model.RequestContext;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.DataQualityReport;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.resilience.model.ValidationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration state - holds the intermediate results of one question as it moves
 * through the workflow.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {
    
    /**
     * Original request context.
     */
    private RequestContext requestContext;
    
    /**
     * Interpreted question.
     */
    private QueryIntent intent;
    
    /**
     * Boards and fields the analysis needs.
     */
    private AnalysisPlan plan;
    
    /**
     * Raw items per fetched board.
     */
    @Builder.Default
    private Map<BoardType, List<RawRecord>> fetchedRecords = new EnumMap<>(BoardType.class);
    
    /**
     * Validation result per fetched board.
     */
    @Builder.Default
    private Map<BoardType, ValidationOutcome> validated = new EnumMap<>(BoardType.class);
    
    /**
     * Quality of all fetched records taken together.
     */
    private DataQualityReport dataQuality;
    
    private AnalysisFragment analysis;
    
    /**
     * Final response, set once the workflow is done.
     */
    private BiResponse response;
}
