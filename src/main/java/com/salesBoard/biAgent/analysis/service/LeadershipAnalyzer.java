package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.analysis.model.ExecutionMetrics;
import com.salesBoard.biAgent.analysis.model.LeadershipSummary;
import com.salesBoard.biAgent.analysis.model.PipelineHealth;
import com.salesBoard.biAgent.analysis.model.PipelineMetrics;
import com.salesBoard.biAgent.analysis.model.RevenueMetrics;
import com.salesBoard.biAgent.analysis.model.SectorTotals;
import com.salesBoard.biAgent.analysis.rule.Rule;
import com.salesBoard.biAgent.analysis.rule.RuleSet;
import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Leadership update across both boards.
 * 
 * Runs the pipeline, revenue and execution analyses over the records selected by the
 * question's time range and sector, ignoring stage and status filters, then classifies
 * pipeline health and derives risks and opportunities from ordered rule lists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadershipAnalyzer implements DomainAnalyzer {

    static final int MAX_HIGHLIGHTS = 3;

    private static final RuleSet<Facts, PipelineHealth> HEALTH_RULES = RuleSet.of(
            Rule.constant("no records", Facts::isEmpty, PipelineHealth.NO_DATA),
            Rule.constant("strong win rate and pipeline", facts -> facts.winRateAtLeast(facts.settings.getStrongWinRate())
                    && facts.pipeline.getWeightedValue().compareTo(facts.settings.getWeightedPipelineFloor()) > 0,
                    PipelineHealth.STRONG),
            Rule.constant("weak win rate or stalled backlog", facts -> facts.winRateBelow(facts.settings.getWeakWinRate())
                    || facts.onHoldRatioAbove(facts.settings.getOnHoldRatioCeiling()),
                    PipelineHealth.NEEDS_ATTENTION),
            Rule.constant("otherwise", facts -> true, PipelineHealth.HEALTHY));

    private static final RuleSet<Facts, String> RISK_RULES = RuleSet.of(
            Rule.when("low win rate", facts -> facts.winRateBelow(facts.settings.getWeakWinRate()),
                    facts -> "Win rate of " + Narratives.percent(facts.pipeline.getWinRate()) + " is below "
                            + Narratives.percent(facts.settings.getWeakWinRate())
                            + " - review deal qualification and competitive positioning"),
            Rule.when("high on-hold backlog", facts -> facts.onHoldRatioAbove(facts.settings.getOnHoldRatioCeiling()),
                    facts -> Narratives.percent(facts.execution.getOnHoldRatio()) + " of backlog value ("
                            + Narratives.money(facts.execution.getOnHoldBacklogValue()) + ") is on hold"),
            Rule.when("thin weighted pipeline", facts -> facts.pipeline.getTotalDeals() > 0
                            && facts.pipeline.getWeightedValue().compareTo(facts.settings.getWeightedPipelineFloor()) < 0,
                    facts -> "Weighted pipeline of " + Narratives.money(facts.pipeline.getWeightedValue())
                            + " is below the " + Narratives.money(facts.settings.getWeightedPipelineFloor()) + " target"),
            Rule.when("overdue work", facts -> facts.execution.getOverdueOrders() > 0,
                    facts -> Narratives.plural(facts.execution.getOverdueOrders(), "work order is", "work orders are")
                            + " past the planned end date"));

    private static final RuleSet<Facts, String> OPPORTUNITY_RULES = RuleSet.of(
            Rule.when("strongest sector", facts -> facts.strongestSector().isPresent(),
                    facts -> {
                        Map.Entry<String, SectorTotals> sector = facts.strongestSector().get();
                        return sector.getKey() + " sector leads the pipeline at " + Narratives.money(sector.getValue().getValue());
                    }),
            Rule.when("late-stage deals", facts -> facts.pipeline.getLateStageCount() >= facts.settings.getLateStageDealCount(),
                    facts -> facts.pipeline.getLateStageCount() + " deals worth "
                            + Narratives.money(facts.pipeline.getLateStageValue()) + " are in Proposal or Negotiation"),
            Rule.when("committed backlog", facts -> facts.revenue.getCommittedBacklog().signum() > 0,
                    facts -> Narratives.money(facts.revenue.getCommittedBacklog())
                            + " in committed backlog secures near-term revenue"),
            Rule.when("high win rate", facts -> facts.winRateAtLeast(facts.settings.getStrongWinRate()),
                    facts -> "Win rate of " + Narratives.percent(facts.pipeline.getWinRate())
                            + " supports investing in more pipeline generation"));

    private final PipelineAnalyzer pipelineAnalyzer;
    private final RevenueAnalyzer revenueAnalyzer;
    private final ExecutionAnalyzer executionAnalyzer;
    private final AnalysisSettings settings;

    @Override
    public QueryCategory getCategory() {
        return QueryCategory.LEADERSHIP_UPDATE;
    }

    @Override
    public AnalysisFragment analyze(BoardSnapshot snapshot, QueryIntent intent) {
        LeadershipSummary summary = summarize(snapshot, intent);
        List<String> implications = new ArrayList<>();
        summary.getRisks().forEach(risk -> implications.add("Risk: " + risk));
        summary.getOpportunities().forEach(opportunity -> implications.add("Opportunity: " + opportunity));
        if (implications.isEmpty()) {
            implications.add("No significant risks or opportunities identified");
        }
        return new AnalysisFragment(executiveSummary(summary), summary.toKeyMetrics(), implications,
                summary.getRecordsAnalyzed());
    }

    public LeadershipSummary summarize(BoardSnapshot snapshot, QueryIntent intent) {
        QueryIntent scope = intent.withoutFilters(FilterDimension.STAGE, FilterDimension.STATUS);
        Facts facts = new Facts(
                pipelineAnalyzer.computeMetrics(snapshot, scope),
                revenueAnalyzer.computeMetrics(snapshot, scope),
                executionAnalyzer.computeMetrics(snapshot, scope),
                settings);

        PipelineHealth health = HEALTH_RULES.firstMatch(facts)
                .orElseThrow(() -> new IllegalStateException("Health rules must end with a catch-all"));
        log.debug("Leadership health classified - health: {}, deals: {}, workOrders: {}",
                health, facts.pipeline.getTotalDeals(), facts.execution.getTotalWorkOrders());

        return LeadershipSummary.builder()
                .period(periodLabel(intent))
                .health(health)
                .highlights(highlights(facts))
                .risks(health == PipelineHealth.NO_DATA ? List.of() : RISK_RULES.allMatches(facts))
                .opportunities(health == PipelineHealth.NO_DATA ? List.of() : OPPORTUNITY_RULES.allMatches(facts))
                .pipeline(facts.pipeline)
                .revenue(facts.revenue)
                .execution(facts.execution)
                .build();
    }

    private static String periodLabel(QueryIntent intent) {
        return intent.getTimeRange().getLabel();
    }

    private static List<String> highlights(Facts facts) {
        List<String> highlights = new ArrayList<>();
        PipelineMetrics pipeline = facts.pipeline;
        ExecutionMetrics execution = facts.execution;
        if (pipeline.getTotalDeals() > 0) {
            highlights.add("Pipeline holds " + Narratives.plural(pipeline.getTotalDeals(), "deal", "deals") + " worth "
                    + Narratives.money(pipeline.getTotalValue()) + " (" + Narratives.money(pipeline.getWeightedValue())
                    + " weighted)");
        }
        if (pipeline.getWinRate() != null) {
            highlights.add("Win rate of " + Narratives.percent(pipeline.getWinRate()) + " indicates "
                    + performance(facts) + " sales performance");
        }
        if (execution.getCompletionRate() != null) {
            highlights.add(Narratives.percent(execution.getCompletionRate()) + " of work orders are completed ("
                    + Narratives.money(execution.getDeliveredRevenue()) + " delivered)");
        }
        if (facts.revenue.getRecognizedRevenue().signum() > 0) {
            highlights.add("Recognized revenue stands at " + Narratives.money(facts.revenue.getRecognizedRevenue()));
        }
        return highlights.size() > MAX_HIGHLIGHTS ? List.copyOf(highlights.subList(0, MAX_HIGHLIGHTS)) : highlights;
    }

    private static String performance(Facts facts) {
        if (facts.winRateAtLeast(facts.settings.getStrongWinRate())) {
            return "strong";
        }
        return facts.winRateBelow(facts.settings.getWeakWinRate()) ? "challenging" : "moderate";
    }

    private static String executiveSummary(LeadershipSummary summary) {
        if (summary.getHealth() == PipelineHealth.NO_DATA) {
            return "Leadership update (" + summary.getPeriod() + "): no deals or work orders in scope.";
        }
        StringBuilder text = new StringBuilder("Leadership update (" + summary.getPeriod() + "): pipeline health is "
                + summary.getHealth().getLabel() + ".");
        for (String highlight : summary.getHighlights()) {
            text.append(' ').append(highlight).append('.');
        }
        return text.toString();
    }

    @Value
    static class Facts {
        PipelineMetrics pipeline;
        RevenueMetrics revenue;
        ExecutionMetrics execution;
        AnalysisSettings settings;

        boolean isEmpty() {
            return pipeline.getTotalDeals() == 0 && execution.getTotalWorkOrders() == 0;
        }

        boolean winRateAtLeast(double threshold) {
            return pipeline.getWinRate() != null && pipeline.getWinRate() >= threshold;
        }

        boolean winRateBelow(double threshold) {
            return pipeline.getWinRate() != null && pipeline.getWinRate() < threshold;
        }

        boolean onHoldRatioAbove(double ceiling) {
            return execution.getOnHoldRatio() != null && execution.getOnHoldRatio() > ceiling;
        }

        Optional<Map.Entry<String, SectorTotals>> strongestSector() {
            return pipeline.getSectorBreakdown().entrySet().stream()
                    .filter(entry -> !CategoryMatch.UNKNOWN.equals(entry.getKey()))
                    .filter(entry -> entry.getValue().getValue().signum() > 0)
                    .max(Comparator.<Map.Entry<String, SectorTotals>, BigDecimal>comparing(entry -> entry.getValue().getValue())
                            .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()));
        }
    }
}
