package com.salesBoard.biAgent.resilience.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A board item after field normalization.
 * 
 * Derived from exactly one {@link RawRecord} and never mutated afterwards. Invalid fields are
 * kept; the typed accessors only expose values whose field was marked valid.
 */
@Getter
@ToString
public final class NormalizedRecord {

    private final String recordId;
    private final BoardType board;
    private final Map<BoardField, FieldValue<?>> fields;
    private final boolean valid;

    public NormalizedRecord(String recordId, BoardType board, Map<BoardField, FieldValue<?>> fields, boolean valid) {
        this.recordId = recordId;
        this.board = board;
        Map<BoardField, FieldValue<?>> copy = new EnumMap<>(BoardField.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
        this.valid = valid;
    }

    public FieldValue<?> field(BoardField field) {
        return fields.get(field);
    }

    public boolean isFieldValid(BoardField field) {
        FieldValue<?> value = fields.get(field);
        return value != null && value.isValid();
    }

    public Optional<BigDecimal> decimal(BoardField field) {
        return validValue(field, BigDecimal.class);
    }

    public Optional<LocalDate> date(BoardField field) {
        return validValue(field, LocalDate.class);
    }

    public Optional<CategoryMatch> category(BoardField field) {
        return validValue(field, CategoryMatch.class);
    }

    public Optional<String> text(BoardField field) {
        return validValue(field, String.class);
    }

    private <T> Optional<T> validValue(BoardField field, Class<T> type) {
        FieldValue<?> value = fields.get(field);
        if (value == null || !value.isValid() || !type.isInstance(value.getNormalizedValue())) {
            return Optional.empty();
        }
        return Optional.of(type.cast(value.getNormalizedValue()));
    }
}
