package com.salesBoard.biAgent.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a business question.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    
    @NotBlank(message = "query cannot be blank")
    @Size(max = 1000, message = "query must be at most 1000 characters")
    private String query;
}
