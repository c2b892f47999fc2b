package com.salesBoard.biAgent.resilience.service;

import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.DataQualityReport;
import com.salesBoard.biAgent.resilience.model.FieldRequirements;
import com.salesBoard.biAgent.resilience.model.FieldValue;
import com.salesBoard.biAgent.resilience.model.IssueCount;
import com.salesBoard.biAgent.resilience.model.IssueKind;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.resilience.model.ValidationIssue;
import com.salesBoard.biAgent.resilience.model.ValidationOutcome;
import com.salesBoard.biAgent.resilience.normalizer.FieldNormalizers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the field normalizers across a batch of raw board items.
 * 
 * Produces one normalized record per raw record and a quality report for the batch.
 * Problems with a field or a whole record are recorded as issues; they never abort the batch.
 */
@Slf4j
@Service
public class RecordValidator {

    /**
     * Normalizes and validates a batch against the fields the pending analysis needs.
     * 
     * @param rawRecords Raw items of one board, in fetch order
     * @param requirements Required and optional fields of that board
     * @return Normalized records (same order), quality report and individual issues
     */
    public ValidationOutcome validate(List<RawRecord> rawRecords, FieldRequirements requirements) {
        List<NormalizedRecord> records = new ArrayList<>(rawRecords.size());
        List<ValidationIssue> issues = new ArrayList<>();
        int validRecords = 0;

        for (RawRecord rawRecord : rawRecords) {
            NormalizedRecord record = validateRecord(rawRecord, requirements, issues);
            records.add(record);
            if (record.isValid()) {
                validRecords++;
            }
        }

        DataQualityReport report = DataQualityReport.of(rawRecords.size(), validRecords, countIssues(issues));
        log.debug("Validated {} board - total: {}, valid: {}, issues: {}",
                requirements.getBoard().getDisplayName(), rawRecords.size(), validRecords, issues.size());

        return new ValidationOutcome(List.copyOf(records), report, List.copyOf(issues));
    }

    /**
     * Normalizes one record. An unreadable record, or one whose normalization fails
     * unexpectedly, is kept with no valid fields and a record-level issue.
     */
    private NormalizedRecord validateRecord(RawRecord rawRecord, FieldRequirements requirements,
                                            List<ValidationIssue> issues) {
        if (!rawRecord.isReadable()) {
            issues.add(recordIssue(rawRecord, rawRecord.getUnreadableReason()));
            return new NormalizedRecord(rawRecord.getId(), requirements.getBoard(), Map.of(), false);
        }

        try {
            Map<BoardField, FieldValue<?>> fields = new EnumMap<>(BoardField.class);
            List<ValidationIssue> recordIssues = new ArrayList<>();
            boolean valid = true;

            for (BoardField field : requirements.tracked()) {
                Object rawValue = rawRecord.column(field.getColumnTitle());
                FieldValue<?> value = FieldNormalizers.forType(field.getType()).normalize(rawValue);
                fields.put(field, value);

                if (value.hasIssue()) {
                    recordIssues.add(new ValidationIssue(rawRecord.getId(), field.getKey(),
                            value.getIssueKind(), value.getDetail()));
                }
                if (!value.isValid() && requirements.getRequired().contains(field)) {
                    valid = false;
                }
            }

            issues.addAll(recordIssues);
            return new NormalizedRecord(rawRecord.getId(), requirements.getBoard(), fields, valid);
        } catch (RuntimeException e) {
            log.warn("Record {} on {} board could not be normalized: {}",
                    rawRecord.getId(), requirements.getBoard().getDisplayName(), e.toString());
            issues.add(recordIssue(rawRecord, "normalization failed: " + e.getMessage()));
            return new NormalizedRecord(rawRecord.getId(), requirements.getBoard(), Map.of(), false);
        }
    }

    private ValidationIssue recordIssue(RawRecord rawRecord, String detail) {
        return new ValidationIssue(rawRecord.getId(), ValidationIssue.RECORD_FIELD, IssueKind.INVALID_FORMAT, detail);
    }

    private List<IssueCount> countIssues(List<ValidationIssue> issues) {
        Map<String, IssueCount> counts = new LinkedHashMap<>();
        for (ValidationIssue issue : issues) {
            String key = issue.getFieldName() + "|" + issue.getIssueKind();
            counts.merge(key, new IssueCount(issue.getFieldName(), issue.getIssueKind(), 1),
                    (a, b) -> new IssueCount(a.getFieldName(), a.getIssueKind(), a.getCount() + b.getCount()));
        }
        return new ArrayList<>(counts.values());
    }
}
