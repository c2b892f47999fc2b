package com.salesBoard.biAgent.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the system.
 * Carries the question and the correlationId used to tie log lines together.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {
    
    /**
     * Correlation ID for request tracking.
     */
    private String correlationId;
    
    /**
     * Question text as received.
     */
    private String queryText;
    
    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}
