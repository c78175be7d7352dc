package com.di.ecomflow.transform;

import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.table.TableOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@code fact_orders}: one row per distinct {@code order_id} of
 * {@code orders}, with item, delivery, payment and review measures, customer
 * attributes and main product, category and seller attribution left-joined in.
 *
 * <p>Only {@code orders} is mandatory. Each other source that is missing, or
 * lacks its {@code order_id}, leaves its columns out of the result instead of
 * failing the build.
 *
 * <p>Main product, category and seller are the most frequent value among an
 * order's items; ties go to the value met first in item row order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FactTableBuilder {

    public static final String ORDER_ID = "order_id";

    public static final String TOTAL_PAYMENT_VALUE = "total_payment_value";
    public static final String PAYMENT_TYPES = "payment_types";
    public static final String MAX_INSTALLMENTS = "max_installments";
    public static final String AVG_REVIEW_SCORE = "avg_review_score";
    public static final String HAS_REVIEW_COMMENT = "has_review_comment";
    public static final String MAIN_PRODUCT_ID = "main_product_id";
    public static final String MAIN_PRODUCT_CATEGORY = "main_product_category";
    public static final String MAIN_SELLER_ID = "main_seller_id";
    public static final String UNIQUE_SELLERS_COUNT = "unique_sellers_count";

    static final String PAYMENT_TYPE_SEPARATOR = ", ";
    static final List<String> CUSTOMER_ATTRIBUTES =
            List.of("customer_id", "customer_unique_id", "customer_state", "customer_city");

    private static final String STAGE = "fact_orders";

    private final OrderMetricAggregator orderMetricAggregator;
    private final DeliveryMetricCalculator deliveryMetricCalculator;

    public DataTable build(Map<String, DataTable> datasets) {
        DataTable orders = datasets.get(DatasetNames.ORDERS);
        if (orders == null) {
            throw new TransformException(STAGE, DatasetNames.ORDERS, "table is required to build the fact table");
        }
        TransformException.requireColumns(STAGE, DatasetNames.ORDERS, orders, ORDER_ID);
        log.info("Building consolidated fact table...");

        DataTable items = withOrderId(datasets, DatasetNames.ORDER_ITEMS);
        DataTable payments = withOrderId(datasets, DatasetNames.ORDER_PAYMENTS);
        DataTable reviews = withOrderId(datasets, DatasetNames.ORDER_REVIEWS);
        DataTable customers = datasets.get(DatasetNames.CUSTOMERS);
        DataTable products = datasets.get(DatasetNames.PRODUCTS);

        DataTable fact = TableOperations.distinctBy(deliveryMetricCalculator.calculate(orders), ORDER_ID);
        int distinctOrders = fact.rowCount();

        if (items != null) {
            fact = TableOperations.leftJoin(fact, orderMetricAggregator.aggregate(items), ORDER_ID);
        }
        if (payments != null) {
            fact = TableOperations.leftJoin(fact, aggregatePayments(payments), ORDER_ID);
        }
        if (reviews != null) {
            fact = TableOperations.leftJoin(fact, aggregateReviews(reviews), ORDER_ID);
        }
        if (customers != null && customers.hasColumn("customer_id") && fact.hasColumn("customer_id")) {
            fact = TableOperations.leftJoin(fact, customerAttributes(customers), "customer_id");
        }
        if (items != null) {
            fact = TableOperations.leftJoin(fact, attributeItems(items, products), ORDER_ID);
        }

        if (fact.rowCount() != distinctOrders) {
            throw new TransformException(STAGE, DatasetNames.FACT_ORDERS,
                    "expected " + distinctOrders + " rows, joins produced " + fact.rowCount());
        }
        log.info("Fact table created: {} orders, {} columns", fact.rowCount(), fact.columnCount());
        return fact;
    }

    // ------------------------------------------------------------------ //
    // Payments and reviews                                                //
    // ------------------------------------------------------------------ //

    /**
     * Per order: summed payment value, distinct payment types in first-seen
     * order joined by {@value #PAYMENT_TYPE_SEPARATOR}, and the highest
     * installment count. Measures whose source column is absent are omitted.
     */
    DataTable aggregatePayments(DataTable payments) {
        Map<Object, List<Integer>> groups = TableOperations.groupRows(payments, ORDER_ID);
        Column value = payments.findColumn("payment_value").orElse(null);
        Column type = payments.findColumn("payment_type").orElse(null);
        Column installments = payments.findColumn("payment_installments").orElse(null);

        List<Double> totals = new ArrayList<>();
        List<String> types = new ArrayList<>();
        List<Long> maxInstallments = new ArrayList<>();
        for (List<Integer> rows : groups.values()) {
            if (value != null) {
                totals.add(OrderMetricAggregator.sum(value, rows));
            }
            if (type != null) {
                types.add(joinDistinct(type, rows));
            }
            if (installments != null) {
                maxInstallments.add(OrderMetricAggregator.max(installments, rows));
            }
        }

        DataTable.Builder result = DataTable.builder()
                .column(ORDER_ID, payments.column(ORDER_ID).type(), new ArrayList<>(groups.keySet()));
        if (value != null) {
            result.column(TOTAL_PAYMENT_VALUE, ColumnType.DOUBLE, totals);
        }
        if (type != null) {
            result.column(PAYMENT_TYPES, ColumnType.STRING, types);
        }
        if (installments != null) {
            result.column(MAX_INSTALLMENTS, ColumnType.LONG, maxInstallments);
        }
        return result.build();
    }

    /**
     * Per order: mean review score and whether any review has a comment message
     * at all. Normalisation turns missing messages into the empty string, which
     * still counts as present.
     */
    DataTable aggregateReviews(DataTable reviews) {
        Map<Object, List<Integer>> groups = TableOperations.groupRows(reviews, ORDER_ID);
        Column score = reviews.findColumn("review_score").orElse(null);
        Column message = reviews.findColumn("review_comment_message").orElse(null);

        List<Double> averages = new ArrayList<>();
        List<Boolean> commented = new ArrayList<>();
        for (List<Integer> rows : groups.values()) {
            if (score != null) {
                averages.add(mean(score, rows));
            }
            if (message != null) {
                commented.add(anyPresent(message, rows));
            }
        }

        DataTable.Builder result = DataTable.builder()
                .column(ORDER_ID, reviews.column(ORDER_ID).type(), new ArrayList<>(groups.keySet()));
        if (score != null) {
            result.column(AVG_REVIEW_SCORE, ColumnType.DOUBLE, averages);
        }
        if (message != null) {
            result.column(HAS_REVIEW_COMMENT, ColumnType.BOOLEAN, commented);
        }
        return result.build();
    }

    // ------------------------------------------------------------------ //
    // Customers and item attribution                                      //
    // ------------------------------------------------------------------ //

    private DataTable customerAttributes(DataTable customers) {
        List<String> present = new ArrayList<>();
        for (String name : CUSTOMER_ATTRIBUTES) {
            if (customers.hasColumn(name)) {
                present.add(name);
            }
        }
        return TableOperations.distinctBy(customers.select(present), "customer_id");
    }

    /**
     * Main product, main category, main seller and distinct seller count per
     * order. Categories come from the products' translated category, falling
     * back to the original category and then to {@value SchemaNormalizer#UNKNOWN}.
     */
    DataTable attributeItems(DataTable items, DataTable products) {
        Map<Object, List<Integer>> groups = TableOperations.groupRows(items, ORDER_ID);
        Column product = items.findColumn("product_id").orElse(null);
        Column seller = items.findColumn("seller_id").orElse(null);
        Map<Object, String> categoryByProduct = categoryLookup(products);

        List<Object> mainProducts = new ArrayList<>();
        List<String> mainCategories = new ArrayList<>();
        List<Object> mainSellers = new ArrayList<>();
        List<Long> sellerCounts = new ArrayList<>();
        for (List<Integer> rows : groups.values()) {
            if (product != null) {
                List<Object> productIds = valuesAt(product, rows);
                mainProducts.add(ModeResolver.mode(productIds));
                if (categoryByProduct != null) {
                    List<String> categories = new ArrayList<>(productIds.size());
                    for (Object productId : productIds) {
                        String category = productId == null ? null : categoryByProduct.get(productId);
                        categories.add(category != null ? category : SchemaNormalizer.UNKNOWN);
                    }
                    mainCategories.add((String) ModeResolver.mode(categories));
                }
            }
            if (seller != null) {
                List<Object> sellerIds = valuesAt(seller, rows);
                mainSellers.add(ModeResolver.mode(sellerIds));
                sellerCounts.add(sellerIds.stream().filter(id -> id != null).distinct().count());
            }
        }

        DataTable.Builder result = DataTable.builder()
                .column(ORDER_ID, items.column(ORDER_ID).type(), new ArrayList<>(groups.keySet()));
        if (product != null) {
            result.column(MAIN_PRODUCT_ID, product.type(), mainProducts);
            if (categoryByProduct != null) {
                result.column(MAIN_PRODUCT_CATEGORY, ColumnType.STRING, mainCategories);
            }
        }
        if (seller != null) {
            result.column(MAIN_SELLER_ID, seller.type(), mainSellers);
            result.column(UNIQUE_SELLERS_COUNT, ColumnType.LONG, sellerCounts);
        }
        return result.build();
    }

    /** product_id to category name, or null when products cannot supply one. */
    private static Map<Object, String> categoryLookup(DataTable products) {
        if (products == null || !products.hasColumn("product_id")) {
            return null;
        }
        String categoryColumn = products.hasColumn(CategoryEnricher.ENGLISH_CATEGORY)
                ? CategoryEnricher.ENGLISH_CATEGORY
                : CategoryEnricher.CATEGORY;
        if (!products.hasColumn(categoryColumn)) {
            return null;
        }
        Column productId = products.column("product_id");
        Column category = products.column(categoryColumn);
        Map<Object, String> lookup = new HashMap<>();
        for (int row = 0; row < products.rowCount(); row++) {
            if (productId.get(row) != null) {
                lookup.putIfAbsent(productId.get(row), category.getString(row));
            }
        }
        return lookup;
    }

    // ------------------------------------------------------------------ //
    // Helpers                                                             //
    // ------------------------------------------------------------------ //

    private static DataTable withOrderId(Map<String, DataTable> datasets, String name) {
        DataTable table = datasets.get(name);
        if (table == null) {
            log.warn("{} not available; its fact columns are omitted", name);
            return null;
        }
        if (!table.hasColumn(ORDER_ID)) {
            log.warn("{} has no {} column; its fact columns are omitted", name, ORDER_ID);
            return null;
        }
        return table;
    }

    private static List<Object> valuesAt(Column column, List<Integer> rows) {
        List<Object> values = new ArrayList<>(rows.size());
        for (int row : rows) {
            values.add(column.get(row));
        }
        return values;
    }

    private static String joinDistinct(Column column, List<Integer> rows) {
        Set<String> distinct = new LinkedHashSet<>();
        for (int row : rows) {
            String value = column.getString(row);
            if (value != null) {
                distinct.add(value);
            }
        }
        return distinct.isEmpty() ? null : String.join(PAYMENT_TYPE_SEPARATOR, distinct);
    }

    private static Double mean(Column column, List<Integer> rows) {
        double total = 0.0;
        int count = 0;
        for (int row : rows) {
            Double value = column.getDouble(row);
            if (value != null) {
                total += value;
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private static boolean anyPresent(Column column, List<Integer> rows) {
        for (int row : rows) {
            if (column.getString(row) != null) {
                return true;
            }
        }
        return false;
    }
}
