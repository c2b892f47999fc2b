package com.salesBoard.biAgent.board;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesBoard.biAgent.resilience.model.BoardField;
import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads board item exports from classpath JSON files.
 * 
 * Each file holds an array of items (or an object with an {@code items} array) in the shape
 * of a Monday.com item export:
 * {@code {"id": "...", "name": "...", "column_values": [{"column": {"title": "Amount"}, "text": "...", "value": "..."}]}}.
 * The item name becomes the {@code Item Name} column. A column's {@code text} wins over its
 * {@code value}; JSON object values are unwrapped to their {@code text} or {@code label}.
 * Items that are not shaped like items are returned as unreadable records instead of failing
 * the whole board.
 */
@Slf4j
@Component
public class ClasspathBoardDataSource implements BoardDataSource {

    private static final String ITEM_NAME_COLUMN = BoardField.DEAL_NAME.getColumnTitle();

    @Value("${bi.board.deals-resource:boards/deals.json}")
    private String dealsResource = "boards/deals.json";

    @Value("${bi.board.work-orders-resource:boards/work-orders.json}")
    private String workOrdersResource = "boards/work-orders.json";

    public ClasspathBoardDataSource() {
    }

    ClasspathBoardDataSource(String dealsResource, String workOrdersResource) {
        this.dealsResource = dealsResource;
        this.workOrdersResource = workOrdersResource;
    }

    @Override
    public List<RawRecord> fetch(BoardType board) {
        String resource = resourceFor(board);
        JsonNode root;
        try {
            root = JsonFileLoader.loadAsJsonNode(resource);
        } catch (IOException e) {
            log.error("Failed to load board export - board: {}, resource: {}", board, resource, e);
            throw new BoardUnavailableException(board, board.getDisplayName() + " board could not be loaded", e);
        }

        JsonNode items = root.isArray() ? root : root.path("items");
        if (!items.isArray()) {
            log.error("Board export has no items array - board: {}, resource: {}", board, resource);
            throw new BoardUnavailableException(board, board.getDisplayName() + " board export has no items", null);
        }

        List<RawRecord> records = new ArrayList<>(items.size());
        int position = 0;
        for (JsonNode item : items) {
            position++;
            records.add(toRawRecord(board, item, position));
        }
        log.info("Board loaded - board: {}, resource: {}, items: {}", board, resource, records.size());
        return records;
    }

    @Override
    public Map<BoardType, String> describeSources() {
        Map<BoardType, String> sources = new EnumMap<>(BoardType.class);
        for (BoardType board : BoardType.values()) {
            sources.put(board, "classpath:" + resourceFor(board));
        }
        return sources;
    }

    private String resourceFor(BoardType board) {
        return switch (board) {
            case DEALS -> dealsResource;
            case WORK_ORDERS -> workOrdersResource;
        };
    }

    private RawRecord toRawRecord(BoardType board, JsonNode item, int position) {
        String id = item.hasNonNull("id") ? item.get("id").asText() : board.name().toLowerCase(Locale.ROOT) + "-" + position;
        if (!item.isObject()) {
            return RawRecord.unreadable(id, board, "item is not a JSON object");
        }
        JsonNode columnValues = item.path("column_values");
        if (!columnValues.isMissingNode() && !columnValues.isNull() && !columnValues.isArray()) {
            return RawRecord.unreadable(id, board, "column_values is not a list");
        }

        Map<String, Object> columns = new LinkedHashMap<>();
        if (item.hasNonNull("name")) {
            columns.put(ITEM_NAME_COLUMN, item.get("name").asText());
        }
        for (JsonNode column : columnValues) {
            String title = column.path("column").path("title").asText("").trim();
            if (title.isEmpty()) {
                continue;
            }
            columns.put(title, columnValue(column));
        }
        return RawRecord.of(id, board, columns);
    }

    static Object columnValue(JsonNode column) {
        JsonNode text = column.get("text");
        JsonNode chosen = text != null && text.isTextual() && !text.asText().isEmpty() ? text : column.get("value");
        if (chosen == null || chosen.isNull()) {
            return null;
        }
        if (chosen.isNumber()) {
            return chosen.numberValue();
        }
        if (chosen.isObject()) {
            return unwrap(chosen, chosen.toString());
        }
        String raw = chosen.asText();
        if (raw.startsWith("{")) {
            try {
                return unwrap(JsonFileLoader.parse(raw), raw);
            } catch (IOException e) {
                log.trace("Column value is not JSON, keeping text: {}", raw);
            }
        }
        return raw;
    }

    private static Object unwrap(JsonNode value, String fallback) {
        if (value.hasNonNull("text")) {
            return value.get("text").asText();
        }
        if (value.hasNonNull("label")) {
            return value.get("label").asText();
        }
        return fallback;
    }
}
