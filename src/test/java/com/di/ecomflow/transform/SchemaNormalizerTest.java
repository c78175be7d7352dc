package com.di.ecomflow.transform;

import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaNormalizer Tests")
class SchemaNormalizerTest {

    private final SchemaNormalizer normalizer = new SchemaNormalizer();

    // ============================================================================
    // Column names
    // ============================================================================

    @Test
    @DisplayName("Names are trimmed, lower-cased and whitespace runs become underscores")
    void testStandardName() {
        assertEquals("order_id", SchemaNormalizer.standardName("  Order ID "));
        assertEquals("customer_zip_code", SchemaNormalizer.standardName("Customer  Zip\tCode"));
        assertEquals("price", SchemaNormalizer.standardName("price"));
    }

    @Test
    @DisplayName("standardizeColumns renames every column and keeps values")
    void testStandardizeColumns() {
        DataTable table = DataTable.builder()
                .column(" Seller ID", ColumnType.STRING, "s1")
                .column("Seller State", ColumnType.STRING, "SP")
                .build();

        DataTable renamed = normalizer.standardizeColumns(table, DatasetNames.SELLERS);

        assertEquals(List.of("seller_id", "seller_state"), renamed.columnNames());
        assertEquals("SP", renamed.value(0, "seller_state"));
    }

    @Test
    @DisplayName("Names that standardise to the same column fail with the stage and table")
    void testStandardizeColumns_CollidingNames() {
        DataTable table = DataTable.builder()
                .column("Price", ColumnType.DOUBLE, 1.0)
                .column("price ", ColumnType.DOUBLE, 2.0)
                .build();

        TransformException e = assertThrows(TransformException.class,
                () -> normalizer.standardizeColumns(table, DatasetNames.ORDER_ITEMS));

        assertEquals(SchemaNormalizer.STANDARDIZE_STAGE, e.getStage());
        assertEquals(DatasetNames.ORDER_ITEMS, e.getTable());
        assertTrue(e.getMessage().contains("'price'"));
    }

    // ============================================================================
    // Missing values
    // ============================================================================

    @Test
    @DisplayName("Products: missing category becomes unknown, numeric columns stay null")
    void testHandleMissingValues_Products() {
        DataTable products = normalizer.handleMissingValues(OlistFixtures.products(), DatasetNames.PRODUCTS);

        assertEquals(SchemaNormalizer.UNKNOWN, products.value(2, "product_category_name"));
        assertNull(products.value(1, "product_weight_g"));
    }

    @Test
    @DisplayName("Reviews: missing comment fields become the empty string")
    void testHandleMissingValues_Reviews() {
        DataTable reviews = normalizer.handleMissingValues(OlistFixtures.orderReviews(), DatasetNames.ORDER_REVIEWS);

        assertEquals("", reviews.value(0, "review_comment_title"));
        assertEquals("", reviews.value(0, "review_comment_message"));
        assertEquals("chegou antes do prazo", reviews.value(1, "review_comment_message"));
    }

    @Test
    @DisplayName("Orders: delivery dates stay null, other text becomes unknown")
    void testHandleMissingValues_OrdersKeepDates() {
        DataTable orders = DataTable.builder()
                .column("order_id", ColumnType.STRING, "o1")
                .column("order_status", ColumnType.STRING, (Object) null)
                .column("order_delivered_customer_date", ColumnType.STRING, (Object) null)
                .build();

        DataTable handled = normalizer.handleMissingValues(orders, DatasetNames.ORDERS);

        assertEquals(SchemaNormalizer.UNKNOWN, handled.value(0, "order_status"));
        assertNull(handled.value(0, "order_delivered_customer_date"));
    }

    @Test
    @DisplayName("Review dates are never filled")
    void testHandleMissingValues_ReviewDates() {
        DataTable reviews = normalizer.handleMissingValues(OlistFixtures.orderReviews(), DatasetNames.ORDER_REVIEWS);

        assertNull(reviews.value(2, "review_answer_timestamp"));
    }

    @Test
    @DisplayName("Unregistered datasets only get the generic text rule")
    void testHandleMissingValues_UnknownDataset() {
        DataTable table = DataTable.builder()
                .column("label", ColumnType.STRING, "a", null)
                .column("amount", ColumnType.DOUBLE, 1.0, null)
                .build();

        DataTable handled = normalizer.handleMissingValues(table, "something_else");

        assertEquals(SchemaNormalizer.UNKNOWN, handled.value(1, "label"));
        assertNull(handled.value(1, "amount"));
    }

    @Test
    @DisplayName("A table without missing values is returned unchanged")
    void testHandleMissingValues_NothingToFill() {
        DataTable sellers = OlistFixtures.sellers();

        assertSame(sellers, normalizer.handleMissingValues(sellers, DatasetNames.SELLERS));
    }

    @Test
    @DisplayName("normalize standardises names before filling")
    void testNormalize() {
        DataTable table = DataTable.builder()
                .column("Product Category Name", ColumnType.STRING, (Object) null)
                .build();

        DataTable normalized = normalizer.normalize(table, DatasetNames.PRODUCTS);

        assertEquals(SchemaNormalizer.UNKNOWN, normalized.value(0, "product_category_name"));
    }
}
