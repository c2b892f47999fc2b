package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.LeadershipSummary;
import com.salesBoard.biAgent.analysis.model.PipelineHealth;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.salesBoard.biAgent.analysis.service.BoardFixtures.deal;
import static com.salesBoard.biAgent.analysis.service.BoardFixtures.intent;
import static com.salesBoard.biAgent.analysis.service.BoardFixtures.snapshot;
import static com.salesBoard.biAgent.analysis.service.BoardFixtures.workOrder;
import static org.assertj.core.api.Assertions.assertThat;

class LeadershipAnalyzerTest {

    private final AnalysisSettings settings = new AnalysisSettings();

    private final LeadershipAnalyzer analyzer = new LeadershipAnalyzer(new PipelineAnalyzer(settings),
            new RevenueAnalyzer(settings), new ExecutionAnalyzer(settings), settings);

    @Test
    void strongWinRateAndLargeWeightedPipelineIsStrong() {
        LeadershipSummary summary = analyzer.summarize(snapshot(List.of(
                deal("a", "600000", "Closed Won", "Energy", null),
                deal("b", "20000", "Proposal", "Technology", null)), List.of(
                workOrder("w", "5000", "Completed", "Energy", "2026-01-01", "2026-01-11"))),
                intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(summary.getHealth()).isEqualTo(PipelineHealth.STRONG);
        assertThat(summary.getOpportunities()).contains("Energy sector leads the pipeline at $600,000");
        assertThat(summary.getHighlights()).hasSize(LeadershipAnalyzer.MAX_HIGHLIGHTS);
    }

    @Test
    void lowWinRateNeedsAttention() {
        LeadershipSummary summary = analyzer.summarize(snapshot(List.of(
                deal("won", "1000", "Closed Won", "Energy", null),
                deal("l1", "1000", "Closed Lost", "Energy", null),
                deal("l2", "1000", "Closed Lost", "Energy", null),
                deal("l3", "1000", "Closed Lost", "Energy", null),
                deal("l4", "1000", "Closed Lost", "Energy", null),
                deal("l5", "1000", "Closed Lost", "Energy", null)), List.of()),
                intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(summary.getHealth()).isEqualTo(PipelineHealth.NEEDS_ATTENTION);
        assertThat(summary.getRisks()).first()
                .isEqualTo("Win rate of 16.7% is below 20.0% - review deal qualification and competitive positioning");
    }

    @Test
    void stalledBacklogNeedsAttentionEvenWithGoodWinRate() {
        LeadershipSummary summary = analyzer.summarize(snapshot(List.of(
                deal("won", "1000", "Closed Won", "Energy", null),
                deal("lost", "1000", "Closed Lost", "Energy", null)), List.of(
                workOrder("h", "5000", "On Hold", "Energy", "2026-09-01", "2026-12-01"),
                workOrder("p", "5000", "In Progress", "Energy", "2026-09-01", "2026-12-01"))),
                intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(summary.getHealth()).isEqualTo(PipelineHealth.NEEDS_ATTENTION);
        assertThat(summary.getRisks()).contains("50.0% of backlog value ($5,000) is on hold");
        assertThat(summary.getOpportunities()).contains("$10,000 in committed backlog secures near-term revenue");
    }

    @Test
    void moderateWinRateIsHealthy() {
        LeadershipSummary summary = analyzer.summarize(snapshot(List.of(
                deal("won", "1000", "Closed Won", "Energy", null),
                deal("l1", "1000", "Closed Lost", "Finance", null),
                deal("l2", "1000", "Closed Lost", "Finance", null)), List.of()),
                intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(summary.getHealth()).isEqualTo(PipelineHealth.HEALTHY);
    }

    @Test
    void emptyScopeHasNoDataAndNoFindings() {
        AnalysisFragment fragment = analyzer.analyze(snapshot(List.of(), List.of()), intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(fragment.getRecordsAnalyzed()).isZero();
        assertThat(fragment.getExecutiveSummary()).isEqualTo("Leadership update (All Time): no deals or work orders in scope.");
        assertThat(fragment.getImplications()).containsExactly("No significant risks or opportunities identified");
        assertThat(fragment.getKeyMetrics()).containsEntry("pipeline_health", "No Data");
    }

    @Test
    void strongestSectorTieGoesToFirstAlphabetically() {
        LeadershipSummary summary = analyzer.summarize(snapshot(List.of(
                deal("t", "5000", "Lead", "Technology", null),
                deal("e", "5000", "Lead", "Energy", null)), List.of()),
                intent(QueryCategory.LEADERSHIP_UPDATE));

        assertThat(summary.getOpportunities()).first().isEqualTo("Energy sector leads the pipeline at $5,000");
    }

    @Test
    void stageAndStatusFiltersDoNotNarrowTheUpdate() {
        List<NormalizedRecord> deals = List.of(
                deal("won", "1000", "Closed Won", "Energy", null),
                deal("open", "1000", "Lead", "Energy", null));

        LeadershipSummary summary = analyzer.summarize(snapshot(deals, List.of()),
                intent(QueryCategory.LEADERSHIP_UPDATE, TimeRange.ALL_TIME, FilterDimension.STAGE, "Closed Won"));

        assertThat(summary.getPipeline().getTotalDeals()).isEqualTo(2);
    }

    @Test
    void implicationsArePrefixedWithTheirKind() {
        AnalysisFragment fragment = analyzer.analyze(snapshot(List.of(
                deal("won", "1000", "Closed Won", "Energy", "2026-10-05"),
                deal("lost", "1000", "Closed Lost", "Energy", "2026-11-20")), List.of()),
                intent(QueryCategory.LEADERSHIP_UPDATE, TimeRange.THIS_QUARTER, null));

        assertThat(fragment.getExecutiveSummary()).startsWith("Leadership update (This Quarter): pipeline health is");
        assertThat(fragment.getImplications()).isNotEmpty().allMatch(line -> line.startsWith("Risk: ") || line.startsWith("Opportunity: "));
    }
}
