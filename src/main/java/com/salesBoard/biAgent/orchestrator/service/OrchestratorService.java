package com.salesBoard.biAgent.orchestrator.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.analysis.service.DomainAnalyzer;
import com.salesBoard.biAgent.board.BoardDataSource;
import com.salesBoard.biAgent.board.BoardUnavailableException;
import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.model.RequestContext;
import com.salesBoard.biAgent.orchestrator.model.AnalysisPlan;
import com.salesBoard.biAgent.orchestrator.model.OrchestrationState;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.service.QueryInterpreter;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.DataQualityReport;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.resilience.model.ValidationOutcome;
import com.salesBoard.biAgent.resilience.service.RecordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrator service - workflow owner and coordinator.
 * 
 * Workflow steps:
 * INTERPRET -> (IF UNKNOWN -> EXPLAIN -> END)
 * -> PLAN -> FETCH -> VALIDATE -> ANALYZE -> ASSEMBLE
 * 
 * Data problems never abort the workflow; they end up in the data-quality report. Only a
 * board that cannot be fetched at all stops it, with {@link BoardUnavailableException}.
 */
@Slf4j
@Service
public class OrchestratorService {
    
    private final QueryInterpreter queryInterpreter;
    private final BoardDataSource boardDataSource;
    private final RecordValidator recordValidator;
    private final ResponseAssembler responseAssembler;
    private final Clock clock;
    private final Map<QueryCategory, DomainAnalyzer> analyzers = new EnumMap<>(QueryCategory.class);
    
    public OrchestratorService(QueryInterpreter queryInterpreter,
                               BoardDataSource boardDataSource,
                               RecordValidator recordValidator,
                               ResponseAssembler responseAssembler,
                               List<DomainAnalyzer> domainAnalyzers,
                               Clock clock) {
        this.queryInterpreter = queryInterpreter;
        this.boardDataSource = boardDataSource;
        this.recordValidator = recordValidator;
        this.responseAssembler = responseAssembler;
        this.clock = clock;
        for (DomainAnalyzer analyzer : domainAnalyzers) {
            DomainAnalyzer previous = analyzers.put(analyzer.getCategory(), analyzer);
            if (previous != null) {
                throw new IllegalStateException("Two analyzers registered for " + analyzer.getCategory());
            }
        }
    }
    
    /**
     * Answers a free-text question.
     * 
     * @param requestContext Request context with the question and correlationId
     * @return Response with answer, no-data notice or topic suggestions
     * @throws BoardUnavailableException if a board the answer needs cannot be fetched
     */
    public BiResponse orchestrate(RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();
        log.info("Starting orchestration - correlationId: {}", correlationId);
        
        OrchestrationState state = OrchestrationState.builder()
                .requestContext(requestContext)
                .build();
        
        // Step 1: INTERPRET
        state = interpret(state, requestContext);
        return run(state, requestContext);
    }
    
    /**
     * Produces a leadership update. The question text, when given, only narrows the time
     * range and sectors.
     * 
     * @param requestContext Request context; queryText may be blank
     * @return Leadership response
     */
    public BiResponse leadershipUpdate(RequestContext requestContext) {
        log.info("Starting leadership update - correlationId: {}", requestContext.getCorrelationId());
        String text = requestContext.getQueryText() == null ? "" : requestContext.getQueryText();
        QueryIntent intent = queryInterpreter.interpret(text).withCategory(QueryCategory.LEADERSHIP_UPDATE);
        
        OrchestrationState state = OrchestrationState.builder()
                .requestContext(requestContext)
                .intent(intent)
                .build();
        return run(state, requestContext);
    }
    
    private BiResponse run(OrchestrationState state, RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();
        
        if (state.getIntent().getCategory() == QueryCategory.UNKNOWN) {
            log.info("Question not understood - taking suggestion path - correlationId: {}", correlationId);
            BiResponse response = responseAssembler.unintelligible(state.getIntent());
            response.setCorrelationId(correlationId);
            return response;
        }
        
        // Step 2: PLAN
        state.setPlan(AnalysisPlan.forIntent(state.getIntent()));
        
        // Step 3: FETCH
        state = fetch(state, requestContext);
        
        // Step 4: VALIDATE
        state = validate(state, requestContext);
        
        // Step 5: ANALYZE
        state = analyze(state, requestContext);
        
        // Step 6: ASSEMBLE
        state.setResponse(responseAssembler.assemble(state.getIntent(), state.getAnalysis(), state.getDataQuality()));
        state.getResponse().setCorrelationId(correlationId);
        
        log.info("Orchestration completed - correlationId: {}, category: {}, outcome: {}, records: {}, confidence: {}",
                correlationId, state.getIntent().getCategory(), state.getResponse().getOutcome(),
                state.getAnalysis().getRecordsAnalyzed(), state.getDataQuality().getConfidenceScore());
        return state.getResponse();
    }
    
    private OrchestrationState interpret(OrchestrationState state, RequestContext requestContext) {
        log.debug("Step INTERPRET - correlationId: {}", requestContext.getCorrelationId());
        QueryIntent intent = queryInterpreter.interpret(requestContext.getQueryText());
        log.debug("Intent resolved - correlationId: {}, category: {}, confidence: {}, timeRange: {}, filters: {}",
                requestContext.getCorrelationId(), intent.getCategory(), intent.getConfidence(),
                intent.getTimeRange(), intent.getFilters());
        state.setIntent(intent);
        return state;
    }
    
    private OrchestrationState fetch(OrchestrationState state, RequestContext requestContext) {
        log.debug("Step FETCH - correlationId: {}, boards: {}", requestContext.getCorrelationId(), state.getPlan().getBoards());
        for (BoardType board : state.getPlan().getBoards()) {
            try {
                state.getFetchedRecords().put(board, boardDataSource.fetch(board));
            } catch (BoardUnavailableException e) {
                log.error("Board fetch failed - correlationId: {}, board: {}", requestContext.getCorrelationId(), board);
                throw e;
            }
        }
        return state;
    }
    
    private OrchestrationState validate(OrchestrationState state, RequestContext requestContext) {
        log.debug("Step VALIDATE - correlationId: {}", requestContext.getCorrelationId());
        List<DataQualityReport> reports = new ArrayList<>();
        state.getPlan().getRequirements().forEach((board, requirements) -> {
            List<RawRecord> raw = state.getFetchedRecords().getOrDefault(board, List.of());
            ValidationOutcome outcome = recordValidator.validate(raw, requirements);
            state.getValidated().put(board, outcome);
            reports.add(outcome.getReport());
        });
        DataQualityReport merged = DataQualityReport.merge(reports);
        if (merged.getTotalRecords() > 0 && merged.getConfidenceScore() < ResponseAssembler.LOW_CONFIDENCE) {
            log.warn("Low data confidence - correlationId: {}, confidence: {}, valid: {}/{}",
                    requestContext.getCorrelationId(), merged.getConfidenceScore(),
                    merged.getValidRecords(), merged.getTotalRecords());
        }
        state.setDataQuality(merged);
        return state;
    }
    
    private OrchestrationState analyze(OrchestrationState state, RequestContext requestContext) {
        log.debug("Step ANALYZE - correlationId: {}", requestContext.getCorrelationId());
        BoardSnapshot snapshot = new BoardSnapshot(
                recordsOf(state, BoardType.DEALS),
                recordsOf(state, BoardType.WORK_ORDERS),
                LocalDate.now(clock));
        
        DomainAnalyzer analyzer = analyzers.get(state.getIntent().getCategory());
        if (analyzer == null) {
            throw new IllegalStateException("No analyzer registered for " + state.getIntent().getCategory());
        }
        AnalysisFragment analysis = analyzer.analyze(snapshot, state.getIntent());
        state.setAnalysis(analysis);
        return state;
    }
    
    private static List<NormalizedRecord> recordsOf(OrchestrationState state, BoardType board) {
        ValidationOutcome outcome = state.getValidated().get(board);
        return outcome == null ? List.of() : outcome.getRecords();
    }
}
