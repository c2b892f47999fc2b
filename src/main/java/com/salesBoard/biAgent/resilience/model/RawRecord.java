package com.salesBoard.biAgent.resilience.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One board item as fetched from the board service.
 * 
 * Column values are kept untyped (String, Number or null). A record whose column data
 * could not be read at all carries no columns and an {@code unreadableReason} instead.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RawRecord {

    private final String id;
    private final BoardType board;
    private final Map<String, Object> columns;
    private final String unreadableReason;

    private RawRecord(String id, BoardType board, Map<String, Object> columns, String unreadableReason) {
        this.id = id;
        this.board = board;
        this.columns = columns;
        this.unreadableReason = unreadableReason;
    }

    public static RawRecord of(String id, BoardType board, Map<String, ?> columns) {
        if (columns == null) {
            return unreadable(id, board, "item has no column data");
        }
        // LinkedHashMap keeps column order and tolerates null values
        return new RawRecord(id, board, Collections.unmodifiableMap(new LinkedHashMap<>(columns)), null);
    }

    public static RawRecord unreadable(String id, BoardType board, String reason) {
        return new RawRecord(id, board, null, reason);
    }

    public boolean isReadable() {
        return columns != null;
    }

    /**
     * Looks up a column value by title, ignoring case.
     */
    public Object column(String title) {
        if (columns == null) {
            return null;
        }
        if (columns.containsKey(title)) {
            return columns.get(title);
        }
        for (Map.Entry<String, Object> entry : columns.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(title)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
