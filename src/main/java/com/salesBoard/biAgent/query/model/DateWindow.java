package com.salesBoard.biAgent.query.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date window; a null bound is open.
 */
@Value
public class DateWindow {

    private static final DateWindow UNBOUNDED = new DateWindow(null, null);

    LocalDate from;
    LocalDate to;

    public static DateWindow unbounded() {
        return UNBOUNDED;
    }

    public static DateWindow between(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
        return new DateWindow(from, to);
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }

    public boolean contains(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
