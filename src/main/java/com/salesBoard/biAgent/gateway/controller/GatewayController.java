package com.salesBoard.biAgent.gateway.controller;

import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.dto.QueryRequest;
import com.salesBoard.biAgent.gateway.service.CorrelationIdService;
import com.salesBoard.biAgent.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer for business questions.
 * 
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Validate request bodies
 * - Delegate business logic to GatewayService
 */
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {
    
    private final GatewayService gatewayService;
    
    /**
     * Query endpoint - answers a free-text business question.
     * 
     * @param request Query request containing the question
     * @param correlationId Optional caller correlation ID
     * @return Structured answer
     */
    @PostMapping("/query")
    public ResponseEntity<BiResponse> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = CorrelationIdService.HEADER, required = false) String correlationId) {
        return respond(gatewayService.processQuery(request, correlationId));
    }
    
    /**
     * Leadership update endpoint. The body is optional; a query in it narrows the update.
     */
    @PostMapping("/leadership-update")
    public ResponseEntity<BiResponse> leadershipUpdate(
            @RequestBody(required = false) QueryRequest request,
            @RequestHeader(value = CorrelationIdService.HEADER, required = false) String correlationId) {
        return respond(gatewayService.leadershipUpdate(request, correlationId));
    }
    
    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        return ResponseEntity.ok(gatewayService.describeConfiguration());
    }
    
    private static ResponseEntity<BiResponse> respond(BiResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        if (response.getCorrelationId() != null) {
            builder.header(CorrelationIdService.HEADER, response.getCorrelationId());
        }
        return builder.body(response);
    }
}
