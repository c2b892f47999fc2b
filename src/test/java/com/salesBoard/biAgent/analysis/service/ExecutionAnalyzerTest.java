package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.ExecutionMetrics;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.salesBoard.biAgent.analysis.service.BoardFixtures.intent;
import static com.salesBoard.biAgent.analysis.service.BoardFixtures.snapshot;
import static com.salesBoard.biAgent.analysis.service.BoardFixtures.workOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExecutionAnalyzerTest {

    private static final List<NormalizedRecord> WORK_ORDERS = List.of(
            workOrder("w1", "3000", "Completed", "Energy", "2025-12-01", "2025-12-11"),
            workOrder("w2", "5000", "done", "Technology", "2026-06-01", "2026-06-21"),
            workOrder("w3", "6000", "In Progress", "Energy", "2026-09-01", "2026-12-31"),
            workOrder("w4", "4000", "paused", "Finance", "2026-05-01", "2026-09-30"),
            workOrder("w5", "7000", "Cancelled", "Finance", "2026-01-01", "2026-02-01"),
            workOrder("w6", null, "Planning", "Energy", "2026-10-01", "2026-11-30"),
            workOrder("w7", "900", "Awaiting parts", "Retail", null, null),
            workOrder("w8", "1200", null, "Retail", "2026-02-01", "2026-03-01"));

    private final ExecutionAnalyzer analyzer = new ExecutionAnalyzer(new AnalysisSettings());

    @Test
    void completionRateCountsEveryWorkOrder() {
        ExecutionMetrics metrics = analyzer.computeMetrics(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(metrics.getTotalWorkOrders()).isEqualTo(8);
        assertThat(metrics.getWorkOrdersWithStatus()).isEqualTo(7);
        assertThat(metrics.getCompletedOrders()).isEqualTo(2);
        assertThat(metrics.getCompletionRate()).isEqualTo(0.25);
        assertThat(metrics.getDeliveredRevenue()).isEqualByComparingTo("8000");
    }

    @Test
    void backlogExcludesCompletedAndCancelledOrders() {
        ExecutionMetrics metrics = analyzer.computeMetrics(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(metrics.getBacklogValue()).isEqualByComparingTo("10000");
        assertThat(metrics.getOnHoldBacklogValue()).isEqualByComparingTo("4000");
        assertThat(metrics.getOnHoldRatio()).isCloseTo(0.4, within(1e-9));
        assertThat(metrics.getOverdueOrders()).isEqualTo(1);
    }

    @Test
    void averageCompletionTimeCountsDatedCompletions() {
        ExecutionMetrics metrics = analyzer.computeMetrics(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(metrics.getAverageCompletionDays()).isEqualTo(15.0);
    }

    @Test
    void statusDistributionKeepsUnknownBucket() {
        ExecutionMetrics metrics = analyzer.computeMetrics(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(metrics.getStatusDistribution()).containsKeys("Planning", "In Progress", "On Hold", "Completed",
                "Cancelled", "Unknown");
        assertThat(metrics.getStatusDistribution().get("Unknown").getCount()).isEqualTo(1);
        assertThat(metrics.getOrdersBySector()).containsEntry("Energy", 3L).containsEntry("Retail", 2L);
    }

    @Test
    void onHoldRatioIsAbsentWithoutBacklog() {
        ExecutionMetrics metrics = analyzer.computeMetrics(snapshot(List.of(),
                        List.of(workOrder("c1", "100", "Completed", "Energy", "2026-01-01", "2026-01-05"))),
                intent(QueryCategory.EXECUTION_STATUS));

        assertThat(metrics.getOnHoldRatio()).isNull();
        assertThat(metrics.getCompletionRate()).isEqualTo(1.0);
    }

    @Test
    void implicationsFlagHoldsAndOverdueWork() {
        AnalysisFragment fragment = analyzer.analyze(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(fragment.getExecutiveSummary()).startsWith(
                "Execution covers 8 work orders: 2 completed, 1 in progress and 1 on hold.");
        assertThat(fragment.getImplications()).contains(
                "40.0% of backlog value ($4,000) is on hold - clear the blockers",
                "1 work order is past the planned end date");
    }

    @Test
    void statusFilterNarrowsWorkOrders() {
        AnalysisFragment fragment = analyzer.analyze(snapshot(List.of(), WORK_ORDERS),
                intent(QueryCategory.EXECUTION_STATUS, TimeRange.ALL_TIME, FilterDimension.STATUS, "On Hold"));

        assertThat(fragment.getRecordsAnalyzed()).isEqualTo(1);
        assertThat(fragment.getKeyMetrics()).containsEntry("on_hold_orders", 1L);
    }

    @Test
    void recordOrderDoesNotChangeTheResult() {
        List<NormalizedRecord> workOrders = new ArrayList<>(WORK_ORDERS);
        Collections.shuffle(workOrders, new Random(3));

        ExecutionMetrics original = analyzer.computeMetrics(snapshot(List.of(), WORK_ORDERS), intent(QueryCategory.EXECUTION_STATUS));
        ExecutionMetrics reordered = analyzer.computeMetrics(snapshot(List.of(), workOrders), intent(QueryCategory.EXECUTION_STATUS));

        assertThat(reordered).isEqualTo(original);
    }
}
