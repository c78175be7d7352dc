package com.di.ecomflow.transform;

import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderMetricAggregator Tests")
class OrderMetricAggregatorTest {

    private final OrderMetricAggregator aggregator = new OrderMetricAggregator();

    // ============================================================================
    // Aggregation
    // ============================================================================

    @Test
    @DisplayName("Order with two items sums price and freight")
    void testAggregate_TwoItems() {
        DataTable items = DataTable.builder()
                .column("order_id", ColumnType.STRING, "1", "1")
                .column("order_item_id", ColumnType.LONG, 1L, 2L)
                .column("product_id", ColumnType.STRING, "p1", "p2")
                .column("price", ColumnType.DOUBLE, 10.0, 20.0)
                .column("freight_value", ColumnType.DOUBLE, 5.0, 5.0)
                .build();

        DataTable metrics = aggregator.aggregate(items);

        assertEquals(1, metrics.rowCount());
        assertEquals(30.0, metrics.value(0, OrderMetricAggregator.TOTAL_PRICE));
        assertEquals(10.0, metrics.value(0, OrderMetricAggregator.TOTAL_FREIGHT));
        assertEquals(40.0, metrics.value(0, OrderMetricAggregator.TOTAL_VALUE));
        assertEquals(2L, metrics.value(0, OrderMetricAggregator.ITEMS_COUNT));
        assertEquals(2L, metrics.value(0, OrderMetricAggregator.MAX_ITEM_ID));
    }

    @Test
    @DisplayName("One row per order in first-seen order")
    void testAggregate_OneRowPerOrder() {
        DataTable metrics = aggregator.aggregate(OlistFixtures.orderItems());

        assertEquals(List.of("o1", "o2"), metrics.column(OrderMetricAggregator.ORDER_ID).values());
        assertEquals(29.0, metrics.value(1, OrderMetricAggregator.TOTAL_VALUE));
        assertEquals(3L, metrics.value(1, OrderMetricAggregator.ITEMS_COUNT));
    }

    @Test
    @DisplayName("Missing prices count as zero and items without product are not counted")
    void testAggregate_MissingValues() {
        DataTable items = DataTable.builder()
                .column("order_id", ColumnType.STRING, "o1", "o1", null)
                .column("product_id", ColumnType.STRING, "p1", null, "p2")
                .column("price", ColumnType.DOUBLE, null, 7.5, 3.0)
                .column("freight_value", ColumnType.DOUBLE, 1.0, null, 1.0)
                .build();

        DataTable metrics = aggregator.aggregate(items);

        assertEquals(1, metrics.rowCount());
        assertEquals(7.5, metrics.value(0, OrderMetricAggregator.TOTAL_PRICE));
        assertEquals(8.5, metrics.value(0, OrderMetricAggregator.TOTAL_VALUE));
        assertEquals(1L, metrics.value(0, OrderMetricAggregator.ITEMS_COUNT));
        assertFalse(metrics.hasColumn(OrderMetricAggregator.MAX_ITEM_ID));
    }

    @Test
    @DisplayName("Empty items give an empty metrics table")
    void testAggregate_NoItems() {
        DataTable items = DataTable.builder()
                .column("order_id", ColumnType.STRING)
                .column("price", ColumnType.DOUBLE)
                .column("freight_value", ColumnType.DOUBLE)
                .build();

        DataTable metrics = aggregator.aggregate(items);

        assertEquals(0, metrics.rowCount());
        assertTrue(metrics.hasColumn(OrderMetricAggregator.TOTAL_VALUE));
    }

    @Test
    @DisplayName("Missing price column fails the stage")
    void testAggregate_MissingPriceColumn() {
        DataTable items = DataTable.builder()
                .column("order_id", ColumnType.STRING, "o1")
                .column("freight_value", ColumnType.DOUBLE, 1.0)
                .build();

        TransformException e = assertThrows(TransformException.class, () -> aggregator.aggregate(items));
        assertEquals("order_metrics", e.getStage());
        assertTrue(e.getMessage().contains("price"));
    }
}
