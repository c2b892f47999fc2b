package com.salesBoard.biAgent.resilience.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fields an analysis needs from one board.
 * 
 * Required fields decide whether a record counts as valid; optional fields are normalized
 * and reported on but never make a record invalid.
 */
@Value
public class FieldRequirements {

    BoardType board;
    Set<BoardField> required;
    Set<BoardField> optional;

    public static FieldRequirements of(BoardType board, Set<BoardField> required, Set<BoardField> optional) {
        for (BoardField field : required) {
            checkBoard(board, field);
        }
        for (BoardField field : optional) {
            checkBoard(board, field);
        }
        Set<BoardField> requiredCopy = required.isEmpty() ? EnumSet.noneOf(BoardField.class) : EnumSet.copyOf(required);
        Set<BoardField> optionalCopy = EnumSet.allOf(BoardField.class);
        optionalCopy.retainAll(optional);
        optionalCopy.removeAll(requiredCopy);
        return new FieldRequirements(board, Collections.unmodifiableSet(requiredCopy),
                Collections.unmodifiableSet(optionalCopy));
    }

    /**
     * Copy in which the given fields of this board are required. Fields of other boards
     * are skipped.
     */
    public FieldRequirements requiring(BoardField... fields) {
        Set<BoardField> promoted = EnumSet.noneOf(BoardField.class);
        promoted.addAll(required);
        for (BoardField field : fields) {
            if (field.getBoard() == board) {
                promoted.add(field);
            }
        }
        if (promoted.size() == required.size()) {
            return this;
        }
        Set<BoardField> remaining = EnumSet.noneOf(BoardField.class);
        remaining.addAll(optional);
        return of(board, promoted, remaining);
    }

    /**
     * Required fields first, then optional ones, each in declaration order.
     */
    public Set<BoardField> tracked() {
        Set<BoardField> tracked = new LinkedHashSet<>(required);
        tracked.addAll(optional);
        return tracked;
    }

    private static void checkBoard(BoardType board, BoardField field) {
        if (field.getBoard() != board) {
            throw new IllegalArgumentException(field + " does not belong to board " + board);
        }
    }
}
