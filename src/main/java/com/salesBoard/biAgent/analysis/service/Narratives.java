package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.query.model.FilterDimension;
import com.salesBoard.biAgent.query.model.QueryIntent;
import com.salesBoard.biAgent.query.model.TimeRange;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Formatting of amounts, rates and query scope inside narrative sentences.
 */
final class Narratives {

    private Narratives() {
    }

    static String money(BigDecimal amount) {
        return String.format(Locale.US, "$%,.0f", amount == null ? BigDecimal.ZERO : amount);
    }

    static String percent(double ratio) {
        return String.format(Locale.US, "%.1f%%", ratio * 100);
    }

    static String plural(long count, String singular, String plural) {
        return count + " " + (count == 1 ? singular : plural);
    }

    /**
     * Prefix naming the sectors a question was narrowed to, e.g. "Energy and Mining sector ";
     * empty when unfiltered.
     */
    static String sectorPrefix(QueryIntent intent) {
        Set<String> sectors = intent.filterValues(FilterDimension.SECTOR);
        if (sectors.isEmpty()) {
            return "";
        }
        return joinWithAnd(new ArrayList<>(sectors)) + " sector ";
    }

    /**
     * Suffix naming the time range, e.g. " for this quarter"; empty for all time.
     */
    static String periodSuffix(QueryIntent intent) {
        TimeRange range = intent.getTimeRange();
        if (range == null || range == TimeRange.ALL_TIME) {
            return "";
        }
        return " for " + range.getLabel().toLowerCase(Locale.ROOT);
    }

    static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    static String joinWithAnd(List<String> items) {
        if (items.size() <= 1) {
            return String.join("", items);
        }
        return String.join(", ", items.subList(0, items.size() - 1)) + " and " + items.get(items.size() - 1);
    }
}
