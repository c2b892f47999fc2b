package com.salesBoard.biAgent.resilience.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Data quality of one batch, computed fresh for every query.
 * 
 * Warnings are rendered from the grouped issue counts so that reports of several boards
 * can be merged and still come out in a deterministic order.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataQualityReport {

    double confidenceScore;
    int totalRecords;
    int validRecords;
    List<String> warnings;

    @JsonIgnore
    List<IssueCount> issueCounts;

    public static DataQualityReport empty() {
        return of(0, 0, List.of());
    }

    public static DataQualityReport of(int totalRecords, int validRecords, List<IssueCount> issueCounts) {
        if (validRecords < 0 || validRecords > totalRecords) {
            throw new IllegalArgumentException(
                    "validRecords must be within [0, " + totalRecords + "] but was " + validRecords);
        }
        List<IssueCount> ordered = issueCounts.stream()
                .sorted(IssueCount.WARNING_ORDER)
                .collect(Collectors.toUnmodifiableList());
        List<String> warnings = ordered.stream()
                .map(IssueCount::render)
                .collect(Collectors.toUnmodifiableList());
        return new DataQualityReport(confidence(totalRecords, validRecords), totalRecords, validRecords,
                warnings, ordered);
    }

    /**
     * Combines the reports of several boards into one.
     */
    public static DataQualityReport merge(List<DataQualityReport> reports) {
        int total = 0;
        int valid = 0;
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, IssueCount> prototypes = new LinkedHashMap<>();
        for (DataQualityReport report : reports) {
            total += report.totalRecords;
            valid += report.validRecords;
            for (IssueCount issueCount : report.issueCounts) {
                String key = issueCount.getFieldName() + "|" + issueCount.getIssueKind();
                counts.merge(key, issueCount.getCount(), Long::sum);
                prototypes.putIfAbsent(key, issueCount);
            }
        }
        List<IssueCount> merged = new ArrayList<>();
        counts.forEach((key, count) -> {
            IssueCount prototype = prototypes.get(key);
            merged.add(new IssueCount(prototype.getFieldName(), prototype.getIssueKind(), count));
        });
        return of(total, valid, merged);
    }

    /**
     * Copy that keeps only the first {@code limit} warnings.
     */
    public DataQualityReport limitWarnings(int limit) {
        if (warnings.size() <= limit) {
            return this;
        }
        return new DataQualityReport(confidenceScore, totalRecords, validRecords,
                List.copyOf(warnings.subList(0, limit)), issueCounts);
    }

    @JsonIgnore
    public int getInvalidRecords() {
        return totalRecords - validRecords;
    }

    /**
     * No data is not bad data: an empty batch scores 100.
     */
    private static double confidence(int totalRecords, int validRecords) {
        if (totalRecords == 0) {
            return 100.0;
        }
        return 100.0 * validRecords / totalRecords;
    }
}
