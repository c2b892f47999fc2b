package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.analysis.model.RevenueMetrics;
import com.salesBoard.biAgent.analysis.model.RevenueMetrics.SectorRevenue;
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
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Revenue forecast: what has been recognized, what the open pipeline is expected to bring
 * and what is already committed in delivery backlog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevenueAnalyzer implements DomainAnalyzer {

    static final Set<String> OPEN_STAGES = Set.of(
            Vocabularies.LEAD, Vocabularies.QUALIFIED, Vocabularies.PROPOSAL, Vocabularies.NEGOTIATION);

    static final Set<String> BACKLOG_STATUSES = Set.of(
            Vocabularies.PLANNING, Vocabularies.IN_PROGRESS, Vocabularies.ON_HOLD);

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private final AnalysisSettings settings;

    @Override
    public QueryCategory getCategory() {
        return QueryCategory.REVENUE_FORECAST;
    }

    @Override
    public AnalysisFragment analyze(BoardSnapshot snapshot, QueryIntent intent) {
        RevenueMetrics metrics = computeMetrics(snapshot, intent);
        log.debug("Revenue analyzed - records: {}, outlook: {}", metrics.getRecordsAnalyzed(), metrics.getTotalOutlook());
        return new AnalysisFragment(summarize(metrics, intent), metrics.toKeyMetrics(),
                implications(metrics), metrics.getRecordsAnalyzed());
    }

    public RevenueMetrics computeMetrics(BoardSnapshot snapshot, QueryIntent intent) {
        return compute(RecordFilter.deals(snapshot, intent), RecordFilter.workOrders(snapshot, intent), snapshot.getAsOf());
    }

    RevenueMetrics compute(List<NormalizedRecord> deals, List<NormalizedRecord> workOrders, LocalDate asOf) {
        BigDecimal wonRevenue = BigDecimal.ZERO;
        BigDecimal completedRevenue = BigDecimal.ZERO;
        BigDecimal forecast = BigDecimal.ZERO;
        BigDecimal backlog = BigDecimal.ZERO;
        BigDecimal yearToDate = BigDecimal.ZERO;
        Map<String, SectorRevenue> sectors = new TreeMap<>();
        Map<String, BigDecimal> byMonth = new TreeMap<>();

        for (NormalizedRecord deal : deals) {
            Optional<BigDecimal> amount = deal.decimal(BoardField.DEAL_AMOUNT);
            Optional<CategoryMatch> stage = deal.category(BoardField.DEAL_STAGE);
            if (amount.isEmpty() || stage.isEmpty()) {
                continue;
            }
            BigDecimal recognized = BigDecimal.ZERO;
            BigDecimal forecasted = BigDecimal.ZERO;
            if (stage.get().is(Vocabularies.CLOSED_WON)) {
                recognized = amount.get();
                wonRevenue = wonRevenue.add(recognized);
            } else if (stage.get().isMapped() && OPEN_STAGES.contains(stage.get().label())) {
                forecasted = amount.get().multiply(settings.weightFor(stage.get()));
                forecast = forecast.add(forecasted);
            }
            addToSector(sectors, deal.category(BoardField.DEAL_SECTOR), recognized, forecasted, BigDecimal.ZERO);
        }

        for (NormalizedRecord order : workOrders) {
            Optional<BigDecimal> revenue = order.decimal(BoardField.WORK_ORDER_REVENUE);
            Optional<CategoryMatch> status = order.category(BoardField.WORK_ORDER_STATUS);
            if (revenue.isEmpty() || status.isEmpty()) {
                continue;
            }
            BigDecimal recognized = BigDecimal.ZERO;
            BigDecimal committed = BigDecimal.ZERO;
            if (status.get().is(Vocabularies.COMPLETED)) {
                recognized = revenue.get();
                completedRevenue = completedRevenue.add(recognized);
                Optional<LocalDate> date = RecordFilter.workOrderDate(order);
                if (date.isPresent()) {
                    byMonth.merge(date.get().format(MONTH), recognized, BigDecimal::add);
                    if (date.get().getYear() == asOf.getYear() && !date.get().isAfter(asOf)) {
                        yearToDate = yearToDate.add(recognized);
                    }
                }
            } else if (status.get().isMapped() && BACKLOG_STATUSES.contains(status.get().label())) {
                committed = revenue.get();
                backlog = backlog.add(committed);
            }
            addToSector(sectors, order.category(BoardField.WORK_ORDER_SECTOR), recognized, BigDecimal.ZERO, committed);
        }

        return RevenueMetrics.builder()
                .recognizedRevenue(wonRevenue.add(completedRevenue))
                .wonDealRevenue(wonRevenue)
                .completedWorkOrderRevenue(completedRevenue)
                .forecastedRevenue(forecast)
                .committedBacklog(backlog)
                .totalOutlook(forecast.add(backlog))
                .sectorBreakdown(new LinkedHashMap<>(sectors))
                .recognizedByMonth(new LinkedHashMap<>(byMonth))
                .yearToDateRecognized(yearToDate)
                .recordsAnalyzed(deals.size() + workOrders.size())
                .build();
    }

    private static void addToSector(Map<String, SectorRevenue> sectors, Optional<CategoryMatch> sector,
                                    BigDecimal recognized, BigDecimal forecasted, BigDecimal backlog) {
        if (sector.isEmpty()) {
            return;
        }
        sectors.merge(sector.get().label(), SectorRevenue.zero().plus(recognized, forecasted, backlog),
                (current, added) -> current.plus(added.getRecognized(), added.getForecasted(), added.getBacklog()));
    }

    private String summarize(RevenueMetrics metrics, QueryIntent intent) {
        String scope = Narratives.sectorPrefix(intent);
        return Narratives.capitalize(scope + "recognized revenue") + Narratives.periodSuffix(intent)
                + " is " + Narratives.money(metrics.getRecognizedRevenue())
                + ". Open deals forecast " + Narratives.money(metrics.getForecastedRevenue())
                + " weighted, and " + Narratives.money(metrics.getCommittedBacklog())
                + " is committed in work-order backlog, for a total outlook of "
                + Narratives.money(metrics.getTotalOutlook()) + ".";
    }

    private List<String> implications(RevenueMetrics metrics) {
        List<String> implications = new ArrayList<>();
        if (metrics.getRecognizedRevenue().signum() == 0) {
            implications.add("No revenue has been recognized yet in this scope");
        }
        if (metrics.getCommittedBacklog().compareTo(metrics.getForecastedRevenue()) > 0) {
            implications.add("Committed backlog outweighs the open forecast - delivery capacity drives near-term revenue");
        }
        if (metrics.getForecastedRevenue().signum() > 0
                && metrics.getForecastedRevenue().compareTo(settings.getWeightedPipelineFloor()) < 0) {
            implications.add("Weighted forecast of " + Narratives.money(metrics.getForecastedRevenue())
                    + " is below the " + Narratives.money(settings.getWeightedPipelineFloor()) + " target");
        }
        if (implications.isEmpty()) {
            implications.add("Revenue outlook is balanced between closed business and open pipeline");
        }
        return implications;
    }
}
