package com.salesBoard.biAgent.query.util;

import com.salesBoard.biAgent.query.model.DateWindow;
import com.salesBoard.biAgent.query.model.TimeRange;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

/**
 * Utility class for resolving relative time ranges to absolute, inclusive date windows.
 * 
 * Quarters are calendar quarters. Rolling ranges end on the reference date and include it.
 */
public class TimeRangeResolver {

    private TimeRangeResolver() {}

    /**
     * Resolves a time range against a reference date.
     * 
     * @param timeRange Time range extracted from the question
     * @param today Reference date (the as-of date of the data)
     * @return Inclusive window; unbounded for {@link TimeRange#ALL_TIME}
     */
    public static DateWindow resolve(TimeRange timeRange, LocalDate today) {
        return switch (timeRange) {
            case THIS_MONTH -> DateWindow.between(today.withDayOfMonth(1), today.withDayOfMonth(today.lengthOfMonth()));
            case LAST_30_DAYS -> DateWindow.between(today.minusDays(29), today);
            case LAST_90_DAYS -> DateWindow.between(today.minusDays(89), today);
            case THIS_QUARTER -> quarterOf(today);
            case NEXT_QUARTER -> quarterOf(today.plusMonths(3));
            case LAST_QUARTER -> quarterOf(today.minusMonths(3));
            case THIS_YEAR -> DateWindow.between(today.withDayOfYear(1), today.withDayOfYear(today.lengthOfYear()));
            case LAST_YEAR -> {
                LocalDate lastYearStart = today.minusYears(1).withDayOfYear(1);
                yield DateWindow.between(lastYearStart, lastYearStart.withDayOfYear(lastYearStart.lengthOfYear()));
            }
            case ALL_TIME -> DateWindow.unbounded();
        };
    }

    /**
     * Calendar quarter containing the given date.
     */
    private static DateWindow quarterOf(LocalDate date) {
        int quarter = date.get(IsoFields.QUARTER_OF_YEAR);
        LocalDate start = LocalDate.of(date.getYear(), (quarter - 1) * 3 + 1, 1);
        LocalDate end = start.plusMonths(3).minusDays(1);
        return DateWindow.between(start, end);
    }
}
