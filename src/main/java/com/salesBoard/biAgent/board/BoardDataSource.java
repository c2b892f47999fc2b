package com.salesBoard.biAgent.board;

import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.RawRecord;

import java.util.List;
import java.util.Map;

/**
 * Source of raw board items.
 */
public interface BoardDataSource {

    /**
     * Fetches every item of a board.
     *
     * @param board Board to read
     * @return Raw records in source order; never null
     * @throws BoardUnavailableException if the board cannot be read
     */
    List<RawRecord> fetch(BoardType board);

    /**
     * Non-secret description of where each board is read from.
     */
    Map<BoardType, String> describeSources();
}
