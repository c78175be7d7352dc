package com.di.ecomflow.transform;

import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FactTableBuilder Tests")
class FactTableBuilderTest {

    private FactTableBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FactTableBuilder(new OrderMetricAggregator(), new DeliveryMetricCalculator(new DateConverter()));
    }

    // ============================================================================
    // Full build
    // ============================================================================

    @Test
    @DisplayName("One row per distinct order with all measure groups")
    void testBuild_AllSources() {
        DataTable fact = builder.build(OlistFixtures.allDatasets());

        assertEquals(List.of("o1", "o2", "o3"), fact.column(FactTableBuilder.ORDER_ID).values());
        assertEquals(40.0, fact.value(0, OrderMetricAggregator.TOTAL_VALUE));
        assertEquals(40.0, fact.value(0, FactTableBuilder.TOTAL_PAYMENT_VALUE));
        assertEquals(3L, fact.value(0, FactTableBuilder.MAX_INSTALLMENTS));
        assertEquals(5.0, fact.value(0, FactTableBuilder.AVG_REVIEW_SCORE));
        assertEquals(3.5, fact.value(1, FactTableBuilder.AVG_REVIEW_SCORE));
        assertEquals(true, fact.value(1, FactTableBuilder.HAS_REVIEW_COMMENT));
        assertEquals("u1", fact.value(1, "customer_unique_id"));
        assertEquals("RJ", fact.value(2, "customer_state"));
        assertEquals(7L, fact.value(0, DeliveryMetricCalculator.DELIVERY_TIME_DAYS));
    }

    @Test
    @DisplayName("Payment types are distinct, first-seen and comma separated")
    void testBuild_PaymentTypes() {
        DataTable fact = builder.build(OlistFixtures.allDatasets());

        assertEquals("credit_card, voucher", fact.value(0, FactTableBuilder.PAYMENT_TYPES));
        assertEquals("boleto", fact.value(1, FactTableBuilder.PAYMENT_TYPES));
    }

    @Test
    @DisplayName("Orders without items, payments or reviews keep null measures")
    void testBuild_OrderWithoutChildren() {
        DataTable fact = builder.build(OlistFixtures.allDatasets());

        assertNull(fact.value(2, OrderMetricAggregator.TOTAL_VALUE));
        assertNull(fact.value(2, FactTableBuilder.TOTAL_PAYMENT_VALUE));
        assertNull(fact.value(2, FactTableBuilder.AVG_REVIEW_SCORE));
        assertNull(fact.value(2, FactTableBuilder.MAIN_PRODUCT_ID));
    }

    // ============================================================================
    // Attribution
    // ============================================================================

    @Test
    @DisplayName("Evenly split sellers resolve to the first item's seller")
    void testBuild_SellerTieBreak() {
        DataTable fact = builder.build(OlistFixtures.allDatasets());

        assertEquals("s1", fact.value(0, FactTableBuilder.MAIN_SELLER_ID));
        assertEquals(2L, fact.value(0, FactTableBuilder.UNIQUE_SELLERS_COUNT));
        assertEquals("s2", fact.value(1, FactTableBuilder.MAIN_SELLER_ID));
        assertEquals(1L, fact.value(1, FactTableBuilder.UNIQUE_SELLERS_COUNT));
    }

    @Test
    @DisplayName("Main product and category are the most frequent among items")
    void testBuild_MainProductAndCategory() {
        DataTable fact = builder.build(OlistFixtures.allDatasets());

        assertEquals("p1", fact.value(0, FactTableBuilder.MAIN_PRODUCT_ID));
        assertEquals("beleza_saude", fact.value(0, FactTableBuilder.MAIN_PRODUCT_CATEGORY));
        assertEquals("p3", fact.value(1, FactTableBuilder.MAIN_PRODUCT_ID));
        assertEquals(SchemaNormalizer.UNKNOWN, fact.value(1, FactTableBuilder.MAIN_PRODUCT_CATEGORY));
    }

    @Test
    @DisplayName("Translated category is preferred when products are enriched")
    void testBuild_EnglishCategory() {
        Map<String, DataTable> datasets = OlistFixtures.allDatasets();
        datasets.put(DatasetNames.PRODUCTS, new CategoryEnricher()
                .enrich(OlistFixtures.products(), OlistFixtures.categoryTranslation()));

        DataTable fact = builder.build(datasets);

        assertEquals("health_beauty", fact.value(0, FactTableBuilder.MAIN_PRODUCT_CATEGORY));
    }

    // ============================================================================
    // Cardinality and degradation
    // ============================================================================

    @Test
    @DisplayName("Duplicate orders and customers do not multiply fact rows")
    void testBuild_Cardinality() {
        Map<String, DataTable> datasets = OlistFixtures.allDatasets();
        datasets.put(DatasetNames.ORDERS, DataTable.builder()
                .column("order_id", ColumnType.STRING, "o1", "o1", "o2")
                .column("customer_id", ColumnType.STRING, "c1", "c1", "c2")
                .build());
        datasets.put(DatasetNames.CUSTOMERS, DataTable.builder()
                .column("customer_id", ColumnType.STRING, "c1", "c1", "c2")
                .column("customer_unique_id", ColumnType.STRING, "u1", "u1", "u1")
                .column("customer_state", ColumnType.STRING, "SP", "SP", "SP")
                .build());

        DataTable fact = builder.build(datasets);

        assertEquals(2, fact.rowCount());
    }

    @Test
    @DisplayName("Only orders available: delivery measures only")
    void testBuild_OrdersOnly() {
        Map<String, DataTable> datasets = new LinkedHashMap<>();
        datasets.put(DatasetNames.ORDERS, OlistFixtures.orders());

        DataTable fact = builder.build(datasets);

        assertEquals(3, fact.rowCount());
        assertTrue(fact.hasColumn(DeliveryMetricCalculator.DELIVERY_DELAY_DAYS));
        assertFalse(fact.hasColumn(OrderMetricAggregator.TOTAL_VALUE));
        assertFalse(fact.hasColumn(FactTableBuilder.PAYMENT_TYPES));
        assertFalse(fact.hasColumn(FactTableBuilder.MAIN_SELLER_ID));
    }

    @Test
    @DisplayName("A source without order_id leaves its columns out")
    void testBuild_SourceWithoutOrderId() {
        Map<String, DataTable> datasets = OlistFixtures.allDatasets();
        datasets.put(DatasetNames.ORDER_PAYMENTS, OlistFixtures.orderPayments().withoutColumns("order_id"));

        DataTable fact = builder.build(datasets);

        assertFalse(fact.hasColumn(FactTableBuilder.TOTAL_PAYMENT_VALUE));
        assertTrue(fact.hasColumn(FactTableBuilder.AVG_REVIEW_SCORE));
    }

    @Test
    @DisplayName("Missing orders fails the build")
    void testBuild_NoOrders() {
        Map<String, DataTable> datasets = OlistFixtures.allDatasets();
        datasets.remove(DatasetNames.ORDERS);

        TransformException e = assertThrows(TransformException.class, () -> builder.build(datasets));
        assertEquals("fact_orders", e.getStage());
        assertEquals(DatasetNames.ORDERS, e.getTable());
    }

    // ============================================================================
    // Review aggregation
    // ============================================================================

    @Test
    @DisplayName("An empty comment message still counts as a comment")
    void testAggregateReviews_EmptyMessageIsPresent() {
        DataTable reviews = DataTable.builder()
                .column("review_id", ColumnType.STRING, "r1", "r2")
                .column("order_id", ColumnType.STRING, "o1", "o2")
                .column("review_score", ColumnType.LONG, 4L, 2L)
                .column("review_comment_message", ColumnType.STRING, "", null)
                .build();

        DataTable aggregated = builder.aggregateReviews(reviews);

        assertEquals(List.of(true, false), aggregated.column(FactTableBuilder.HAS_REVIEW_COMMENT).values());
        assertEquals(4.0, aggregated.value(0, FactTableBuilder.AVG_REVIEW_SCORE));
    }
}
