package com.salesBoard.biAgent.query.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured reading of a free-text question.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryIntent {

    String originalQuery;

    QueryCategory category;

    @Builder.Default
    TimeRange timeRange = TimeRange.ALL_TIME;

    /**
     * Dimension to the set of canonical values mentioned in the question.
     */
    @Builder.Default
    Map<FilterDimension, Set<String>> filters = Map.of();

    /**
     * Between 0 and 1; 0 for {@link QueryCategory#UNKNOWN}.
     */
    double confidence;

    /**
     * Vocabulary terms that decided the category, in match order.
     */
    @Singular
    List<String> matchedTerms;

    public static QueryIntent unknown(String originalQuery) {
        return QueryIntent.builder()
                .originalQuery(originalQuery)
                .category(QueryCategory.UNKNOWN)
                .confidence(0.0)
                .build();
    }

    public Set<String> filterValues(FilterDimension dimension) {
        return filters.getOrDefault(dimension, Collections.emptySet());
    }

    public boolean hasFilter(FilterDimension dimension) {
        return !filterValues(dimension).isEmpty();
    }

    /**
     * Copy answering a different category; terms, filters and time range are kept.
     */
    public QueryIntent withCategory(QueryCategory newCategory) {
        return QueryIntent.builder()
                .originalQuery(originalQuery)
                .category(newCategory)
                .timeRange(timeRange)
                .filters(filters)
                .confidence(confidence)
                .matchedTerms(matchedTerms)
                .build();
    }

    /**
     * Copy without the given filter dimensions; everything else is kept.
     */
    public QueryIntent withoutFilters(FilterDimension... dimensions) {
        Map<FilterDimension, Set<String>> remaining = new EnumMap<>(FilterDimension.class);
        remaining.putAll(filters);
        for (FilterDimension dimension : dimensions) {
            remaining.remove(dimension);
        }
        return QueryIntent.builder()
                .originalQuery(originalQuery)
                .category(category)
                .timeRange(timeRange)
                .filters(Collections.unmodifiableMap(remaining))
                .confidence(confidence)
                .matchedTerms(matchedTerms)
                .build();
    }
}
