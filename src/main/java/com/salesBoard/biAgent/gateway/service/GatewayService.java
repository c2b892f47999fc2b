package com.salesBoard.biAgent.gateway.service;

import com.salesBoard.biAgent.board.BoardDataSource;
import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.dto.QueryRequest;
import com.salesBoard.biAgent.gateway.model.RequestContext;
import com.salesBoard.biAgent.orchestrator.service.OrchestratorService;
import com.salesBoard.biAgent.resilience.model.BoardType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway service - handles the business logic behind the HTTP endpoints.
 * 
 * Responsibilities:
 * - Assign the correlationId
 * - Build the request context
 * - Forward to the orchestrator
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {
    
    private final CorrelationIdService correlationIdService;
    private final OrchestratorService orchestratorService;
    private final BoardDataSource boardDataSource;
    
    /**
     * Answers a business question.
     * 
     * @param request Query request containing the question text
     * @param suppliedCorrelationId Caller's correlation ID, may be null
     * @return Structured answer
     */
    public BiResponse processQuery(QueryRequest request, String suppliedCorrelationId) {
        RequestContext context = createRequestContext(request.getQuery(), suppliedCorrelationId);
        log.info("Query received - correlationId: {}, length: {}", context.getCorrelationId(), request.getQuery().length());
        return orchestratorService.orchestrate(context);
    }
    
    /**
     * Produces a leadership update, optionally narrowed by a question.
     * 
     * @param request Optional request; its query may narrow time range and sectors
     * @param suppliedCorrelationId Caller's correlation ID, may be null
     * @return Leadership update
     */
    public BiResponse leadershipUpdate(QueryRequest request, String suppliedCorrelationId) {
        String text = request == null ? null : request.getQuery();
        RequestContext context = createRequestContext(text, suppliedCorrelationId);
        log.info("Leadership update requested - correlationId: {}", context.getCorrelationId());
        return orchestratorService.leadershipUpdate(context);
    }
    
    /**
     * Describes where boards are read from. Holds no credentials.
     */
    public Map<String, Object> describeConfiguration() {
        Map<String, Object> boards = new LinkedHashMap<>();
        boardDataSource.describeSources().forEach((board, source) -> boards.put(board.getDisplayName(), source));
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("boards", boards);
        configuration.put("board_count", BoardType.values().length);
        return configuration;
    }
    
    private RequestContext createRequestContext(String queryText, String suppliedCorrelationId) {
        return RequestContext.builder()
                .correlationId(correlationIdService.resolve(suppliedCorrelationId))
                .queryText(queryText)
                .receivedAt(Instant.now())
                .build();
    }
}
