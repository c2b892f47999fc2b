package com.salesBoard.biAgent.board;

import com.salesBoard.biAgent.resilience.model.BoardType;

/**
 * Exception thrown when a board cannot be fetched from its source.
 */
public class BoardUnavailableException extends RuntimeException {

    private final BoardType board;

    public BoardUnavailableException(BoardType board, String message, Throwable cause) {
        super(message, cause);
        this.board = board;
    }

    public BoardType getBoard() {
        return board;
    }
}
