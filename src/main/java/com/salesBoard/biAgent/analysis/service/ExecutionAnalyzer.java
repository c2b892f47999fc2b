package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.analysis.model.AnalysisFragment;
import com.salesBoard.biAgent.analysis.model.BoardSnapshot;
import com.salesBoard.biAgent.analysis.model.CategoryShare;
import com.salesBoard.biAgent.analysis.model.ExecutionMetrics;
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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Execution status of work orders: delivery progress, backlog and schedule slippage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionAnalyzer implements DomainAnalyzer {

    private final AnalysisSettings settings;

    @Override
    public QueryCategory getCategory() {
        return QueryCategory.EXECUTION_STATUS;
    }

    @Override
    public AnalysisFragment analyze(BoardSnapshot snapshot, QueryIntent intent) {
        ExecutionMetrics metrics = computeMetrics(snapshot, intent);
        log.debug("Execution analyzed - work orders: {}, backlog: {}", metrics.getTotalWorkOrders(), metrics.getBacklogValue());
        return new AnalysisFragment(summarize(metrics, intent), metrics.toKeyMetrics(),
                implications(metrics), metrics.getTotalWorkOrders());
    }

    public ExecutionMetrics computeMetrics(BoardSnapshot snapshot, QueryIntent intent) {
        return compute(RecordFilter.workOrders(snapshot, intent), snapshot.getAsOf());
    }

    ExecutionMetrics compute(List<NormalizedRecord> workOrders, LocalDate asOf) {
        Map<String, Long> statusCounts = new LinkedHashMap<>();
        for (String status : Vocabularies.WORK_ORDER_STATUSES.getCanonicalTerms()) {
            statusCounts.put(status, 0L);
        }
        Map<String, Long> bySector = new TreeMap<>();
        BigDecimal backlog = BigDecimal.ZERO;
        BigDecimal onHoldBacklog = BigDecimal.ZERO;
        BigDecimal delivered = BigDecimal.ZERO;
        long withStatus = 0;
        long completionDays = 0;
        long timedCompletions = 0;
        long overdue = 0;

        for (NormalizedRecord order : workOrders) {
            order.category(BoardField.WORK_ORDER_SECTOR)
                    .ifPresent(sector -> bySector.merge(sector.label(), 1L, Long::sum));
            Optional<CategoryMatch> status = order.category(BoardField.WORK_ORDER_STATUS);
            if (status.isEmpty()) {
                continue;
            }
            withStatus++;
            statusCounts.merge(status.get().label(), 1L, Long::sum);
            if (!status.get().isMapped()) {
                continue;
            }
            BigDecimal revenue = order.decimal(BoardField.WORK_ORDER_REVENUE).orElse(BigDecimal.ZERO);
            Optional<LocalDate> start = order.date(BoardField.WORK_ORDER_START_DATE);
            Optional<LocalDate> end = order.date(BoardField.WORK_ORDER_END_DATE);

            if (status.get().is(Vocabularies.COMPLETED)) {
                delivered = delivered.add(revenue);
                if (start.isPresent() && end.isPresent() && !end.get().isBefore(start.get())) {
                    completionDays += ChronoUnit.DAYS.between(start.get(), end.get());
                    timedCompletions++;
                }
                continue;
            }
            if (status.get().is(Vocabularies.CANCELLED)) {
                continue;
            }
            backlog = backlog.add(revenue);
            if (status.get().is(Vocabularies.ON_HOLD)) {
                onHoldBacklog = onHoldBacklog.add(revenue);
            }
            if (end.isPresent() && end.get().isBefore(asOf)) {
                overdue++;
            }
        }

        long completed = statusCounts.get(Vocabularies.COMPLETED);
        long statusTotal = withStatus;
        Map<String, CategoryShare> distribution = new LinkedHashMap<>();
        statusCounts.forEach((status, count) -> distribution.put(status, CategoryShare.of(count, statusTotal)));

        return ExecutionMetrics.builder()
                .totalWorkOrders(workOrders.size())
                .workOrdersWithStatus(withStatus)
                .statusDistribution(distribution)
                .completedOrders(completed)
                .inProgressOrders(statusCounts.get(Vocabularies.IN_PROGRESS))
                .onHoldOrders(statusCounts.get(Vocabularies.ON_HOLD))
                .completionRate(workOrders.isEmpty() ? null : (double) completed / workOrders.size())
                .backlogValue(backlog)
                .onHoldBacklogValue(onHoldBacklog)
                .onHoldRatio(backlog.signum() == 0 ? null : onHoldBacklog.doubleValue() / backlog.doubleValue())
                .deliveredRevenue(delivered)
                .ordersBySector(new LinkedHashMap<>(bySector))
                .averageCompletionDays(timedCompletions == 0 ? null : (double) completionDays / timedCompletions)
                .overdueOrders(overdue)
                .build();
    }

    private String summarize(ExecutionMetrics metrics, QueryIntent intent) {
        StringBuilder summary = new StringBuilder();
        summary.append(Narratives.capitalize(Narratives.sectorPrefix(intent) + "execution"))
                .append(Narratives.periodSuffix(intent))
                .append(" covers ")
                .append(Narratives.plural(metrics.getTotalWorkOrders(), "work order", "work orders"))
                .append(": ").append(metrics.getCompletedOrders()).append(" completed, ")
                .append(metrics.getInProgressOrders()).append(" in progress and ")
                .append(metrics.getOnHoldOrders()).append(" on hold.");
        if (metrics.getCompletionRate() != null) {
            summary.append(" Completion rate is ").append(Narratives.percent(metrics.getCompletionRate()))
                    .append(" with ").append(Narratives.money(metrics.getDeliveredRevenue())).append(" delivered.");
        }
        return summary.toString();
    }

    private List<String> implications(ExecutionMetrics metrics) {
        List<String> implications = new ArrayList<>();
        if (metrics.getOnHoldRatio() != null && metrics.getOnHoldRatio() > settings.getOnHoldRatioCeiling()) {
            implications.add(Narratives.percent(metrics.getOnHoldRatio()) + " of backlog value ("
                    + Narratives.money(metrics.getOnHoldBacklogValue()) + ") is on hold - clear the blockers");
        }
        if (metrics.getOverdueOrders() > 0) {
            implications.add(Narratives.plural(metrics.getOverdueOrders(), "work order is", "work orders are")
                    + " past the planned end date");
        }
        if (metrics.getCompletionRate() != null && metrics.getCompletionRate() < 0.5) {
            implications.add("Fewer than half of the work orders are completed - monitor delivery capacity");
        }
        if (implications.isEmpty()) {
            implications.add("Execution is on track - keep the current delivery cadence");
        }
        return implications;
    }
}
