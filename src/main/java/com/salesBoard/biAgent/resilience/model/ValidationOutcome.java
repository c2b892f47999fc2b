package com.salesBoard.biAgent.resilience.model;

import lombok.Value;

import java.util.List;

/**
 * Normalized records of one batch together with its quality report and raw issues.
 */
@Value
public class ValidationOutcome {

    List<NormalizedRecord> records;
    DataQualityReport report;
    List<ValidationIssue> issues;
}
