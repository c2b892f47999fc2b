package com.salesBoard.biAgent.board;

import com.salesBoard.biAgent.resilience.model.BoardType;
import com.salesBoard.biAgent.resilience.model.RawRecord;
import com.salesBoard.biAgent.util.JsonFileLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathBoardDataSourceTest {

    private final ClasspathBoardDataSource dataSource = new ClasspathBoardDataSource(
            "board-fixtures/deals.json", "board-fixtures/work-orders-wrapped.json");

    @Test
    void readsItemsInSourceOrder() {
        List<RawRecord> records = dataSource.fetch(BoardType.DEALS);

        assertThat(records).extracting(RawRecord::getId).containsExactly("501", "deals-2", "deals-3", "504", "505");
        assertThat(records).allMatch(record -> record.getBoard() == BoardType.DEALS);
    }

    @Test
    void columnTextWinsAndLabelsAreUnwrapped() {
        RawRecord deal = dataSource.fetch(BoardType.DEALS).get(0);

        assertThat(deal.column("Item Name")).isEqualTo("Solar farm retrofit");
        assertThat(deal.column("Amount")).isEqualTo("125000");
        assertThat(deal.column("Stage")).isEqualTo("Negotiation");
        assertThat(deal.column("Sector")).isEqualTo("Oil & Gas");
        assertThat(deal.column("Close Date")).isEqualTo("2026-11-30");
    }

    @Test
    void numbersAndTrimmedTitlesAreKept() {
        RawRecord deal = dataSource.fetch(BoardType.DEALS).get(1);

        assertThat(deal.isReadable()).isTrue();
        assertThat(deal.column("Amount")).isEqualTo(4200.5);
        assertThat(deal.column("Stage")).isEqualTo("Lead");
    }

    @Test
    void malformedItemsBecomeUnreadableRecords() {
        List<RawRecord> records = dataSource.fetch(BoardType.DEALS);

        assertThat(records.get(2).isReadable()).isFalse();
        assertThat(records.get(2).getUnreadableReason()).isEqualTo("item is not a JSON object");
        assertThat(records.get(3).isReadable()).isFalse();
        assertThat(records.get(3).getUnreadableReason()).isEqualTo("column_values is not a list");
    }

    @Test
    void textThatOnlyLooksLikeJsonIsKept() {
        RawRecord deal = dataSource.fetch(BoardType.DEALS).get(4);

        assertThat(deal.column("Stage")).isEqualTo("{not json");
        assertThat(deal.column("Item Name")).isNull();
    }

    @Test
    void acceptsItemsWrappedInAnObject() {
        List<RawRecord> records = dataSource.fetch(BoardType.WORK_ORDERS);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getId()).isEqualTo("WO-1");
        assertThat(records.get(0).column("Revenue")).isEqualTo("$48,000");
    }

    @Test
    void missingResourceMakesTheBoardUnavailable() {
        ClasspathBoardDataSource missing = new ClasspathBoardDataSource("board-fixtures/absent.json", "board-fixtures/absent.json");

        assertThatThrownBy(() -> missing.fetch(BoardType.DEALS))
                .isInstanceOf(BoardUnavailableException.class)
                .hasMessage("Deals board could not be loaded")
                .satisfies(e -> assertThat(((BoardUnavailableException) e).getBoard()).isEqualTo(BoardType.DEALS));
    }

    @Test
    void invalidJsonMakesTheBoardUnavailable() {
        ClasspathBoardDataSource truncated = new ClasspathBoardDataSource("board-fixtures/truncated.json", "board-fixtures/truncated.json");

        assertThatThrownBy(() -> truncated.fetch(BoardType.WORK_ORDERS))
                .isInstanceOf(BoardUnavailableException.class)
                .hasMessage("Work Orders board could not be loaded");
    }

    @Test
    void exportWithoutItemsMakesTheBoardUnavailable() {
        ClasspathBoardDataSource noItems = new ClasspathBoardDataSource("board-fixtures/no-items.json", "board-fixtures/no-items.json");

        assertThatThrownBy(() -> noItems.fetch(BoardType.DEALS))
                .isInstanceOf(BoardUnavailableException.class)
                .hasMessage("Deals board export has no items");
    }

    @Test
    void shippedBoardsLoad() throws Exception {
        ClasspathBoardDataSource shipped = new ClasspathBoardDataSource();

        assertThat(shipped.fetch(BoardType.DEALS)).hasSize(12);
        assertThat(shipped.fetch(BoardType.WORK_ORDERS)).hasSize(10);
        assertThat(shipped.describeSources()).containsEntry(BoardType.DEALS, "classpath:boards/deals.json");
        assertThat(JsonFileLoader.loadAsString("boards/deals.json")).startsWith("[");
    }
}
