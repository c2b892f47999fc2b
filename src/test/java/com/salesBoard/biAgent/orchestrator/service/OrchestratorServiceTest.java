package com.salesBoard.biAgent.orchestrator.service;

import com.salesBoard.biAgent.analysis.service.AnalysisSettings;
import com.salesBoard.biAgent.analysis.service.ExecutionAnalyzer;
import com.salesBoard.biAgent.analysis.service.LeadershipAnalyzer;
import com.salesBoard.biAgent.analysis.service.PipelineAnalyzer;
import com.salesBoard.biAgent.analysis.service.RevenueAnalyzer;
import com.salesBoard.biAgent.board.BoardDataSource;
import com.salesBoard.biAgent.board.BoardUnavailableException;
import com.salesBoard.biAgent.gateway.dto.BiResponse;
import com.salesBoard.biAgent.gateway.dto.ResponseOutcome;
import com.salesBoard.biAgent.gateway.model.RequestContext;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.service.QueryInterpreter;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.resilience.service.RecordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T09:00:00Z"), ZoneOffset.UTC);

    private StubBoards boards;
    private OrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        boards = new StubBoards();
        boards.put(BoardType.DEALS, List.of(
                deal("1", "120000", "Proposal", "Energy", "2026-11-15"),
                deal("2", "N/A", "Negotiation", "Technology", "2026-12-01"),
                deal("3", "80000", "Closed Won", "Energy", "2026-09-30")));
        boards.put(BoardType.WORK_ORDERS, List.of(
                workOrder("10", "50000", "In Progress", "Energy", "2026-09-01", "2026-12-15"),
                workOrder("11", "30000", "Completed", "Technology", "2026-03-01", "2026-04-15")));

        AnalysisSettings settings = new AnalysisSettings();
        PipelineAnalyzer pipeline = new PipelineAnalyzer(settings);
        RevenueAnalyzer revenue = new RevenueAnalyzer(settings);
        ExecutionAnalyzer execution = new ExecutionAnalyzer(settings);
        orchestrator = new OrchestratorService(new QueryInterpreter(), boards, new RecordValidator(),
                new ResponseAssembler(),
                List.of(pipeline, revenue, execution, new LeadershipAnalyzer(pipeline, revenue, execution, settings)),
                CLOCK);
    }

    @Test
    void pipelineQuestionOnlyReadsDeals() {
        BiResponse response = orchestrator.orchestrate(context("How's our pipeline looking?"));

        assertThat(response.getOutcome()).isEqualTo(ResponseOutcome.ANSWERED);
        assertThat(response.getCorrelationId()).isEqualTo("corr-1");
        assertThat(response.getKeyMetrics()).containsEntry("total_deals", 3L);
        assertThat(boards.fetched).containsExactly(BoardType.DEALS);
    }

    @Test
    void lowConfidenceIsDisclosedInTheSummary() {
        BiResponse response = orchestrator.orchestrate(context("How's our pipeline looking?"));

        assertThat(response.getDataQuality().getConfidenceScore()).isLessThan(80.0);
        assertThat(response.getDataQuality().getWarnings()).contains("1 record missing 'amount' field");
        assertThat(response.getExecutiveSummary()).contains("Figures rest on 2 of 3 records (67% confidence)");
    }

    @Test
    void recordsDroppedByAFilterLowerTheConfidence() {
        List<RawRecord> deals = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            boolean dated = i <= 5;
            deals.add(deal(String.valueOf(i), "10000", "Proposal", dated ? "Energy" : null, dated ? "2026-11-0" + i : null));
        }
        boards.put(BoardType.DEALS, deals);

        BiResponse response = orchestrator.orchestrate(context("How's our energy pipeline looking this quarter?"));

        assertThat(response.getKeyMetrics()).containsEntry("total_deals", 5L);
        assertThat(response.getDataQuality().getValidRecords()).isEqualTo(5);
        assertThat(response.getDataQuality().getConfidenceScore()).isEqualTo(50.0);
        assertThat(response.getExecutiveSummary()).contains("Figures rest on 5 of 10 records (50% confidence)");
    }

    @Test
    void unfilteredQuestionKeepsOptionalFieldsOptional() {
        boards.put(BoardType.DEALS, List.of(
                deal("1", "10000", "Proposal", null, null),
                deal("2", "20000", "Lead", "Energy", "2026-11-01")));

        BiResponse response = orchestrator.orchestrate(context("How's our pipeline looking?"));

        assertThat(response.getDataQuality().getConfidenceScore()).isEqualTo(100.0);
        assertThat(response.getKeyMetrics()).containsEntry("total_deals", 2L);
    }

    @Test
    void sectorWithoutDealsReturnsNoData() {
        BiResponse response = orchestrator.orchestrate(context("How's the healthcare pipeline looking?"));

        assertThat(response.getOutcome()).isEqualTo(ResponseOutcome.NO_DATA_AVAILABLE);
        assertThat(response.getKeyMetrics()).isEmpty();
        assertThat(response.getExecutiveSummary())
                .isEqualTo("No data available for this query: no deals match the requested scope.");
        assertThat(response.getImplications())
                .contains("Remove or broaden the Healthcare sector filter to include more records");
    }

    @Test
    void unintelligibleQuestionDoesNotTouchTheBoards() {
        BiResponse response = orchestrator.orchestrate(context("asdf qwerty zzz"));

        assertThat(response.getOutcome()).isEqualTo(ResponseOutcome.UNINTELLIGIBLE_QUERY);
        assertThat(response.getImplications()).hasSize(4);
        assertThat(response.getCorrelationId()).isEqualTo("corr-1");
        assertThat(boards.fetched).isEmpty();
    }

    @Test
    void unavailableBoardStopsTheWorkflow() {
        boards.failing.add(BoardType.WORK_ORDERS);

        assertThatThrownBy(() -> orchestrator.orchestrate(context("How many work orders are on hold?")))
                .isInstanceOf(BoardUnavailableException.class)
                .hasMessageContaining("Work Orders");
    }

    @Test
    void leadershipUpdateReadsBothBoards() {
        BiResponse response = orchestrator.leadershipUpdate(context(null));

        assertThat(response.getOutcome()).isEqualTo(ResponseOutcome.ANSWERED);
        assertThat(response.getIntent().getCategory()).isEqualTo(QueryCategory.LEADERSHIP_UPDATE);
        assertThat(response.getKeyMetrics()).containsKeys("pipeline_health", "pipeline", "revenue", "execution");
        assertThat(boards.fetched).containsExactlyInAnyOrder(BoardType.DEALS, BoardType.WORK_ORDERS);
    }

    @Test
    void executionQuestionUsesTheClockForOverdueChecks() {
        boards.put(BoardType.WORK_ORDERS, List.of(
                workOrder("20", "1000", "In Progress", "Energy", "2026-09-01", "2026-10-16"),
                workOrder("21", "1000", "In Progress", "Energy", "2026-09-01", "2026-10-17")));

        BiResponse response = orchestrator.orchestrate(context("Show execution status"));

        assertThat(response.getKeyMetrics()).containsEntry("overdue_orders", 1L);
    }

    private static RequestContext context(String text) {
        return RequestContext.builder()
                .correlationId("corr-1")
                .queryText(text)
                .receivedAt(Instant.now(CLOCK))
                .build();
    }

    private static RawRecord deal(String id, String amount, String stage, String sector, String closeDate) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("Item Name", "Deal " + id);
        columns.put("Amount", amount);
        columns.put("Stage", stage);
        columns.put("Sector", sector);
        columns.put("Close Date", closeDate);
        return RawRecord.of(id, BoardType.DEALS, columns);
    }

    private static RawRecord workOrder(String id, String revenue, String status, String sector, String start, String end) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("Item Name", "Work order " + id);
        columns.put("Revenue", revenue);
        columns.put("Status", status);
        columns.put("Sector", sector);
        columns.put("Start Date", start);
        columns.put("End Date", end);
        return RawRecord.of(id, BoardType.WORK_ORDERS, columns);
    }

    private static class StubBoards implements BoardDataSource {

        private final Map<BoardType, List<RawRecord>> items = new EnumMap<>(BoardType.class);
        private final List<BoardType> fetched = new ArrayList<>();
        private final Set<BoardType> failing = EnumSet.noneOf(BoardType.class);

        void put(BoardType board, List<RawRecord> records) {
            items.put(board, records);
        }

        @Override
        public List<RawRecord> fetch(BoardType board) {
            fetched.add(board);
            if (failing.contains(board)) {
                throw new BoardUnavailableException(board, board.getDisplayName() + " board could not be read", null);
            }
            return items.getOrDefault(board, List.of());
        }

        @Override
        public Map<BoardType, String> describeSources() {
            return Map.of(BoardType.DEALS, "stub", BoardType.WORK_ORDERS, "stub");
        }
    }
}
