package com.salesBoard.biAgent.resilience.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tracked columns of each board.
 * 
 * The column title is what the board service exposes; the key is the snake_case
 * name used in validation issues and quality warnings.
 */
@Getter
@RequiredArgsConstructor
public enum BoardField {
    DEAL_NAME(BoardType.DEALS, "Item Name", "item_name", FieldType.TEXT),
    DEAL_AMOUNT(BoardType.DEALS, "Amount", "amount", FieldType.CURRENCY),
    DEAL_STAGE(BoardType.DEALS, "Stage", "stage", FieldType.STAGE),
    DEAL_SECTOR(BoardType.DEALS, "Sector", "sector", FieldType.SECTOR),
    DEAL_CLOSE_DATE(BoardType.DEALS, "Close Date", "close_date", FieldType.DATE),
    DEAL_OWNER(BoardType.DEALS, "Owner", "owner", FieldType.TEXT),

    WORK_ORDER_NAME(BoardType.WORK_ORDERS, "Item Name", "item_name", FieldType.TEXT),
    WORK_ORDER_REVENUE(BoardType.WORK_ORDERS, "Revenue", "revenue", FieldType.CURRENCY),
    WORK_ORDER_STATUS(BoardType.WORK_ORDERS, "Status", "status", FieldType.STATUS),
    WORK_ORDER_SECTOR(BoardType.WORK_ORDERS, "Sector", "sector", FieldType.SECTOR),
    WORK_ORDER_START_DATE(BoardType.WORK_ORDERS, "Start Date", "start_date", FieldType.DATE),
    WORK_ORDER_END_DATE(BoardType.WORK_ORDERS, "End Date", "end_date", FieldType.DATE),
    WORK_ORDER_PROJECT_MANAGER(BoardType.WORK_ORDERS, "Project Manager", "project_manager", FieldType.TEXT);

    private final BoardType board;
    private final String columnTitle;
    private final String key;
    private final FieldType type;

    /**
     * Tracked fields of a board, in declaration order.
     */
    public static List<BoardField> forBoard(BoardType board) {
        return Arrays.stream(values())
                .filter(field -> field.board == board)
                .collect(Collectors.toUnmodifiableList());
    }
}
