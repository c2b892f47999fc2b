package com.salesBoard.biAgent.query.service;

import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryCategory;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;
import com.salesBoard.biAgent.resilience.normalizer.Vocabularies;
import com.salesBoard.biAgent.resilience.normalizer.Vocabulary;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based reading of free-text business questions.
 * 
 * Handles:
 * - Category scoring against weighted keyword vocabularies
 * - Time range detection by phrase matching
 * - Sector, stage and status filter extraction from the shared vocabularies
 * 
 * Identical text always yields an identical intent; no external calls are made.
 */
@Slf4j
@Service
public class QueryInterpreter {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    /**
     * Number of heaviest terms whose combined weight counts as full confidence.
     */
    private static final int SATURATION_TERMS = 3;

    /**
     * Tie-break order: leadership questions are usually broader supersets of the others.
     */
    private static final List<QueryCategory> PRIORITY = List.of(
            QueryCategory.LEADERSHIP_UPDATE,
            QueryCategory.PIPELINE_OVERVIEW,
            QueryCategory.REVENUE_FORECAST,
            QueryCategory.EXECUTION_STATUS);

    private static final Map<QueryCategory, List<KeywordTerm>> CATEGORY_TERMS = new EnumMap<>(QueryCategory.class);

    static {
        CATEGORY_TERMS.put(QueryCategory.PIPELINE_OVERVIEW, List.of(
                term("pipeline", 3), term("win rate", 3), term("funnel", 2), term("conversion", 2),
                term("deals", 2), term("deal", 2), term("opportunities", 2), term("opportunity", 2),
                term("closed won", 2), term("closed lost", 2), term("prospects", 1), term("leads", 1),
                term("sales", 1), term("stage", 1), term("stages", 1), term("forecast", 1)));
        CATEGORY_TERMS.put(QueryCategory.REVENUE_FORECAST, List.of(
                term("revenue", 3), term("revenue forecast", 2), term("income", 2), term("earnings", 2),
                term("bookings", 2), term("recognized", 2), term("booked", 1), term("billing", 1),
                term("billed", 1), term("money", 1), term("financial", 1), term("worth", 1), term("value", 1),
                term("amount", 1), term("forecasted", 1), term("projected", 1), term("cash", 1)));
        CATEGORY_TERMS.put(QueryCategory.EXECUTION_STATUS, List.of(
                term("work order", 3), term("work orders", 3), term("execution", 3), term("delivery", 2),
                term("deliveries", 2), term("completion", 2), term("backlog", 2), term("on hold", 2),
                term("overdue", 2), term("delivered", 1), term("project", 1), term("projects", 1),
                term("operational", 1), term("operations", 1), term("progress", 1), term("implementation", 1)));
        CATEGORY_TERMS.put(QueryCategory.LEADERSHIP_UPDATE, List.of(
                term("leadership", 3), term("executive", 3), term("kpi", 2), term("kpis", 2), term("health", 2),
                term("big picture", 2), term("briefing", 2), term("ceo", 2), term("update", 1), term("summary", 1),
                term("overview", 1), term("report", 1), term("status", 1), term("metrics", 1),
                term("highlights", 1), term("risks", 1)));
    }

    /**
     * Checked in order; the first phrase found decides the range.
     */
    private static final Map<String, TimeRange> TIME_PHRASES = new LinkedHashMap<>();

    static {
        timePhrases(TimeRange.LAST_30_DAYS, "last 30 days", "past 30 days", "last month", "past month");
        timePhrases(TimeRange.LAST_90_DAYS, "last 90 days", "past 90 days", "last 3 months", "last three months");
        timePhrases(TimeRange.LAST_QUARTER, "last quarter", "previous quarter", "past quarter");
        timePhrases(TimeRange.NEXT_QUARTER, "next quarter", "upcoming quarter", "coming quarter");
        timePhrases(TimeRange.THIS_QUARTER, "this quarter", "current quarter", "quarter to date", "qtd");
        timePhrases(TimeRange.LAST_YEAR, "last year", "previous year", "past year");
        timePhrases(TimeRange.THIS_YEAR, "this year", "current year", "year to date", "ytd");
        timePhrases(TimeRange.THIS_MONTH, "this month", "current month", "mtd");
    }

    private static final Map<FilterDimension, Vocabulary> FILTER_VOCABULARIES = Map.of(
            FilterDimension.SECTOR, Vocabularies.SECTORS,
            FilterDimension.STAGE, Vocabularies.DEAL_STAGES,
            FilterDimension.STATUS, Vocabularies.WORK_ORDER_STATUSES);

    /**
     * Interprets a question.
     * 
     * @param query Free-text question as typed by the user
     * @return Intent with category, time range, filters and confidence
     */
    public QueryIntent interpret(String query) {
        String text = query == null ? "" : query;
        String tokens = tokenize(text);

        QueryCategory bestCategory = QueryCategory.UNKNOWN;
        double bestScore = 0.0;
        List<String> bestTerms = List.of();

        for (QueryCategory category : PRIORITY) {
            List<String> matched = new ArrayList<>();
            double score = 0.0;
            for (KeywordTerm keyword : CATEGORY_TERMS.get(category)) {
                if (containsPhrase(tokens, keyword.getPhrase())) {
                    matched.add(keyword.getPhrase());
                    score += keyword.getWeight();
                }
            }
            // strictly greater keeps the higher-priority category on ties
            if (score > bestScore) {
                bestCategory = category;
                bestScore = score;
                bestTerms = matched;
            }
        }

        double confidence = bestCategory == QueryCategory.UNKNOWN
                ? 0.0
                : Math.min(1.0, bestScore / saturation(bestCategory));

        QueryIntent intent = QueryIntent.builder()
                .originalQuery(text)
                .category(bestCategory)
                .timeRange(detectTimeRange(tokens))
                .filters(detectFilters(tokens))
                .confidence(confidence)
                .matchedTerms(bestTerms)
                .build();

        log.debug("Interpreted query - category: {}, confidence: {}, timeRange: {}, filters: {}, terms: {}",
                intent.getCategory(), String.format(Locale.ROOT, "%.2f", confidence), intent.getTimeRange(),
                intent.getFilters(), bestTerms);
        return intent;
    }

    private TimeRange detectTimeRange(String tokens) {
        for (Map.Entry<String, TimeRange> entry : TIME_PHRASES.entrySet()) {
            if (containsPhrase(tokens, entry.getKey())) {
                return entry.getValue();
            }
        }
        return TimeRange.ALL_TIME;
    }

    private Map<FilterDimension, Set<String>> detectFilters(String tokens) {
        Map<FilterDimension, Set<String>> filters = new EnumMap<>(FilterDimension.class);
        for (FilterDimension dimension : FilterDimension.values()) {
            Set<String> values = new LinkedHashSet<>();
            for (Map.Entry<String, String> entry : FILTER_VOCABULARIES.get(dimension).freeTextTerms().entrySet()) {
                if (containsPhrase(tokens, entry.getKey())) {
                    values.add(entry.getValue());
                }
            }
            if (!values.isEmpty()) {
                filters.put(dimension, Collections.unmodifiableSet(values));
            }
        }
        return Collections.unmodifiableMap(filters);
    }

    private static double saturation(QueryCategory category) {
        return CATEGORY_TERMS.get(category).stream()
                .map(KeywordTerm::getWeight)
                .sorted(Collections.reverseOrder())
                .limit(SATURATION_TERMS)
                .mapToDouble(Double::doubleValue)
                .sum();
    }

    /**
     * Lowercases and splits on anything that is not a letter or digit; the result is padded
     * with spaces so phrases can be matched on token boundaries.
     */
    static String tokenize(String text) {
        String joined = Arrays.stream(NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.joining(" "));
        return " " + joined + " ";
    }

    private static boolean containsPhrase(String tokens, String phrase) {
        return tokens.contains(tokenize(phrase));
    }

    private static KeywordTerm term(String phrase, double weight) {
        return new KeywordTerm(phrase, weight);
    }

    private static void timePhrases(TimeRange range, String... phrases) {
        for (String phrase : phrases) {
            TIME_PHRASES.put(phrase, range);
        }
    }

    @Value
    private static class KeywordTerm {
        String phrase;
        double weight;
    }
}
