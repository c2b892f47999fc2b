package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.analysis.model.CategoryShare;
import com.salesBoard.biAgent.analysis.model.PipelineMetrics;
import com.salesBoard.biAgent.analysis.model.SectorTotals;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import com.salesBoard.biAgent.resilience.model.NormalizedRecord;
import com.salesBoard.biAgent.resilience.normalizer.Vocabularies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pipeline overview: deal counts, value, stage-weighted value, win and conversion rates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineAnalyzer implements DomainAnalyzer {

    static final Set<String> LATE_STAGES = Set.of(Vocabularies.PROPOSAL, Vocabularies.NEGOTIATION);

    private static final Set<String> QUALIFIED_OR_LATER = Set.of(
            Vocabularies.QUALIFIED, Vocabularies.PROPOSAL, Vocabularies.NEGOTIATION, Vocabularies.CLOSED_WON);

    private final AnalysisSettings settings;

    @Override
    public QueryCategory getCategory() {
        return QueryCategory.PIPELINE_OVERVIEW;
    }

    @Override
    public AnalysisFragment analyze(BoardSnapshot snapshot, QueryIntent intent) {
        PipelineMetrics metrics = computeMetrics(snapshot, intent);
        log.debug("Pipeline analyzed - deals: {}, weighted: {}", metrics.getTotalDeals(), metrics.getWeightedValue());
        return new AnalysisFragment(summarize(metrics, intent), metrics.toKeyMetrics(),
                implications(metrics), metrics.getTotalDeals());
    }

    public PipelineMetrics computeMetrics(BoardSnapshot snapshot, QueryIntent intent) {
        return compute(RecordFilter.deals(snapshot, intent));
    }

    PipelineMetrics compute(List<NormalizedRecord> deals) {
        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal weightedValue = BigDecimal.ZERO;
        BigDecimal lateStageValue = BigDecimal.ZERO;
        long dealsWithAmount = 0;
        long won = 0;
        long lost = 0;
        long qualifiedOrLater = 0;
        long lateStage = 0;
        long unknownStage = 0;
        Map<String, Long> stageCounts = new LinkedHashMap<>();
        Map<String, BigDecimal> valueByStage = new LinkedHashMap<>();
        Map<String, long[]> sectorCounts = new TreeMap<>();
        Map<String, BigDecimal> sectorValues = new TreeMap<>();
        for (String stage : Vocabularies.DEAL_STAGES.getCanonicalTerms()) {
            stageCounts.put(stage, 0L);
            valueByStage.put(stage, BigDecimal.ZERO);
        }

        for (NormalizedRecord deal : deals) {
            Optional<BigDecimal> amount = deal.decimal(BoardField.DEAL_AMOUNT);
            Optional<CategoryMatch> stage = deal.category(BoardField.DEAL_STAGE);
            Optional<CategoryMatch> sector = deal.category(BoardField.DEAL_SECTOR);

            if (amount.isPresent()) {
                dealsWithAmount++;
                totalValue = totalValue.add(amount.get());
            }
            if (stage.isPresent()) {
                String label = stage.get().label();
                stageCounts.merge(label, 1L, Long::sum);
                if (amount.isPresent()) {
                    valueByStage.merge(label, amount.get(), BigDecimal::add);
                    weightedValue = weightedValue.add(amount.get().multiply(settings.weightFor(stage.get())));
                }
                if (!stage.get().isMapped()) {
                    unknownStage++;
                } else if (stage.get().is(Vocabularies.CLOSED_WON)) {
                    won++;
                } else if (stage.get().is(Vocabularies.CLOSED_LOST)) {
                    lost++;
                }
                if (stage.get().isMapped() && QUALIFIED_OR_LATER.contains(label)) {
                    qualifiedOrLater++;
                }
                if (stage.get().isMapped() && LATE_STAGES.contains(label)) {
                    lateStage++;
                    lateStageValue = lateStageValue.add(amount.orElse(BigDecimal.ZERO));
                }
            }
            if (sector.isPresent()) {
                String label = sector.get().label();
                sectorCounts.computeIfAbsent(label, key -> new long[1])[0]++;
                sectorValues.merge(label, amount.orElse(BigDecimal.ZERO), BigDecimal::add);
            }
        }

        long staged = stageCounts.values().stream().mapToLong(Long::longValue).sum();
        Map<String, CategoryShare> distribution = new LinkedHashMap<>();
        stageCounts.forEach((stage, count) -> distribution.put(stage, CategoryShare.of(count, staged)));
        Map<String, SectorTotals> sectors = new LinkedHashMap<>();
        sectorCounts.forEach((sector, count) -> sectors.put(sector, new SectorTotals(count[0], sectorValues.get(sector))));

        return PipelineMetrics.builder()
                .totalDeals(deals.size())
                .dealsWithAmount(dealsWithAmount)
                .totalValue(totalValue)
                .weightedValue(weightedValue)
                .averageDealSize(dealsWithAmount == 0 ? null
                        : totalValue.divide(BigDecimal.valueOf(dealsWithAmount), 2, RoundingMode.HALF_UP))
                .stageDistribution(distribution)
                .valueByStage(valueByStage)
                .wonDeals(won)
                .lostDeals(lost)
                .winRate(won + lost == 0 ? null : (double) won / (won + lost))
                .conversionRate(qualifiedOrLater == 0 ? null : (double) won / qualifiedOrLater)
                .sectorBreakdown(sectors)
                .lateStageCount(lateStage)
                .lateStageValue(lateStageValue)
                .unknownStageCount(unknownStage)
                .build();
    }

    private String summarize(PipelineMetrics metrics, QueryIntent intent) {
        StringBuilder summary = new StringBuilder();
        summary.append(Narratives.capitalize(Narratives.sectorPrefix(intent) + "pipeline"))
                .append(Narratives.periodSuffix(intent))
                .append(" contains ")
                .append(Narratives.plural(metrics.getTotalDeals(), "deal", "deals"))
                .append(" worth ").append(Narratives.money(metrics.getTotalValue()))
                .append(" (weighted ").append(Narratives.money(metrics.getWeightedValue())).append(").");
        if (metrics.getWinRate() != null) {
            summary.append(" Current win rate is ").append(Narratives.percent(metrics.getWinRate())).append('.');
        }
        return summary.toString();
    }

    private List<String> implications(PipelineMetrics metrics) {
        List<String> implications = new ArrayList<>();
        if (metrics.getWinRate() != null && metrics.getWinRate() < settings.getWeakWinRate()) {
            implications.add("Low win rate suggests a need for better deal qualification");
        }
        if (metrics.getTotalValue().signum() > 0
                && metrics.getWeightedValue().compareTo(metrics.getTotalValue().multiply(new BigDecimal("0.30"))) < 0) {
            implications.add("Most pipeline value sits in early stages - focus on advancing opportunities");
        }
        if (metrics.getLateStageCount() >= settings.getLateStageDealCount()) {
            implications.add(metrics.getLateStageCount() + " deals worth " + Narratives.money(metrics.getLateStageValue())
                    + " are in Proposal or Negotiation and need closing attention");
        }
        if (metrics.getUnknownStageCount() > 0) {
            implications.add(Narratives.plural(metrics.getUnknownStageCount(), "deal has", "deals have")
                    + " an unrecognized stage and no forecast weight");
        }
        if (implications.isEmpty()) {
            implications.add("Pipeline is progressing well - maintain current sales activities");
        }
        return implications;
    }
}
