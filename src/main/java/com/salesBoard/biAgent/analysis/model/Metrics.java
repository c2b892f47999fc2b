package com.salesBoard.biAgent.analysis.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rendering helpers shared by the metric types when they are flattened into key metrics.
 */
final class Metrics {

    private Metrics() {
    }

    static BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal ratio(Double value) {
        return value == null ? null : BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    static Map<String, Object> moneyMap(Map<String, BigDecimal> values) {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((key, value) -> map.put(key, money(value)));
        return map;
    }

    static Map<String, Object> shareMap(Map<String, CategoryShare> shares) {
        Map<String, Object> map = new LinkedHashMap<>();
        shares.forEach((key, share) -> map.put(key, share.toMap()));
        return map;
    }

    static Map<String, Object> sectorMap(Map<String, SectorTotals> sectors) {
        Map<String, Object> map = new LinkedHashMap<>();
        sectors.forEach((key, totals) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("count", totals.getCount());
            entry.put("value", money(totals.getValue()));
            map.put(key, entry);
        });
        return map;
    }
}
