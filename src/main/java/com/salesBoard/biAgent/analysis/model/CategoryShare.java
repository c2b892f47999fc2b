package com.salesBoard.biAgent.analysis.model;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Count of records in one bucket and its share of the total, in percent with one decimal.
 */
@Value
public class CategoryShare {

    long count;
    BigDecimal percentage;

    public static CategoryShare of(long count, long total) {
        BigDecimal percentage = total == 0
                ? BigDecimal.ZERO.setScale(1)
                : BigDecimal.valueOf(count * 100L).divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP);
        return new CategoryShare(count, percentage);
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("count", count);
        map.put("percentage", percentage);
        return map;
    }
}
