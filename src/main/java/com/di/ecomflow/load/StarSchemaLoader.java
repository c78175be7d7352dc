package com.di.ecomflow.load;

import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.table.Column;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.transform.DatasetNames;
import com.di.ecomflow.transform.DateConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the transformed datasets into the {@code analytics} star schema.
 *
 * <p>Dimensions are written first, then {@code fact_orders}, whose surrogate keys
 * are resolved in bulk from the dimension tables. All writes are idempotent:
 * {@code dim_time} and {@code dim_geography} insert only missing rows, the other
 * dimensions and the fact table upsert on their natural key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class StarSchemaLoader {

    public static final String DIM_TIME = "analytics.dim_time";
    public static final String DIM_CUSTOMERS = "analytics.dim_customers";
    public static final String DIM_PRODUCTS = "analytics.dim_products";
    public static final String DIM_SELLERS = "analytics.dim_sellers";
    public static final String DIM_GEOGRAPHY = "analytics.dim_geography";
    public static final String FACT_ORDERS = "analytics.fact_orders";

    static final String INSERT_TIME = """
            INSERT INTO analytics.dim_time
              (order_date, order_year, order_month, order_quarter, order_day_of_week, order_day_name)
            VALUES (?,?,?,?,?,?)
            ON CONFLICT (order_date) DO NOTHING
            """;

    static final String UPSERT_CUSTOMER = """
            INSERT INTO analytics.dim_customers
              (customer_id, customer_unique_id, customer_state, customer_city,
               is_recurring_customer, total_orders)
            VALUES (?,?,?,?,?,?)
            ON CONFLICT (customer_id) DO UPDATE SET
              customer_unique_id    = EXCLUDED.customer_unique_id,
              customer_state        = EXCLUDED.customer_state,
              customer_city         = EXCLUDED.customer_city,
              is_recurring_customer = EXCLUDED.is_recurring_customer,
              total_orders          = EXCLUDED.total_orders,
              updated_at            = CURRENT_TIMESTAMP
            """;

    static final String UPSERT_PRODUCT = """
            INSERT INTO analytics.dim_products
              (product_id, product_category_name, product_category_name_english,
               product_weight_g, product_length_cm, product_height_cm, product_width_cm)
            VALUES (?,?,?,?,?,?,?)
            ON CONFLICT (product_id) DO UPDATE SET
              product_category_name         = EXCLUDED.product_category_name,
              product_category_name_english = EXCLUDED.product_category_name_english,
              product_weight_g              = EXCLUDED.product_weight_g,
              product_length_cm             = EXCLUDED.product_length_cm,
              product_height_cm             = EXCLUDED.product_height_cm,
              product_width_cm              = EXCLUDED.product_width_cm,
              updated_at                    = CURRENT_TIMESTAMP
            """;

    static final String UPSERT_SELLER = """
            INSERT INTO analytics.dim_sellers (seller_id, seller_state, seller_city)
            VALUES (?,?,?)
            ON CONFLICT (seller_id) DO UPDATE SET
              seller_state = EXCLUDED.seller_state,
              seller_city  = EXCLUDED.seller_city,
              updated_at   = CURRENT_TIMESTAMP
            """;

    static final String INSERT_GEOGRAPHY = """
            INSERT INTO analytics.dim_geography (state, city, zip_code_prefix)
            VALUES (?,?,?)
            ON CONFLICT (state, city, zip_code_prefix) DO NOTHING
            """;

    static final String UPSERT_FACT = """
            INSERT INTO analytics.fact_orders
              (order_id, time_id, customer_key, product_key, seller_key, geography_key, order_status,
               order_items_count, order_total_value, order_items_total_price, order_items_total_freight,
               delivery_time_days, delivery_delay_days, total_payment_value, payment_types, max_installments,
               avg_review_score, has_review_comment)
            VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT (order_id) DO UPDATE SET
              time_id                   = EXCLUDED.time_id,
              customer_key              = EXCLUDED.customer_key,
              product_key               = EXCLUDED.product_key,
              seller_key                = EXCLUDED.seller_key,
              geography_key             = EXCLUDED.geography_key,
              order_status              = EXCLUDED.order_status,
              order_items_count         = EXCLUDED.order_items_count,
              order_total_value         = EXCLUDED.order_total_value,
              order_items_total_price   = EXCLUDED.order_items_total_price,
              order_items_total_freight = EXCLUDED.order_items_total_freight,
              delivery_time_days        = EXCLUDED.delivery_time_days,
              delivery_delay_days       = EXCLUDED.delivery_delay_days,
              total_payment_value       = EXCLUDED.total_payment_value,
              payment_types             = EXCLUDED.payment_types,
              max_installments          = EXCLUDED.max_installments,
              avg_review_score          = EXCLUDED.avg_review_score,
              has_review_comment        = EXCLUDED.has_review_comment,
              updated_at                = CURRENT_TIMESTAMP
            """;

    // Natural key -> surrogate key, aliased so one handler reads every dimension
    static final String TIME_KEYS =
            "SELECT CAST(order_date AS VARCHAR) AS natural_key, time_id AS surrogate_key FROM analytics.dim_time";
    static final String CUSTOMER_KEYS =
            "SELECT customer_id AS natural_key, customer_key AS surrogate_key FROM analytics.dim_customers";
    static final String PRODUCT_KEYS =
            "SELECT product_id AS natural_key, product_key AS surrogate_key FROM analytics.dim_products";
    static final String SELLER_KEYS =
            "SELECT seller_id AS natural_key, seller_key AS surrogate_key FROM analytics.dim_sellers";
    static final String GEOGRAPHY_KEYS = """
            SELECT state || '|' || city AS natural_key, MIN(geography_key) AS surrogate_key
            FROM analytics.dim_geography
            WHERE city IS NOT NULL
            GROUP BY state, city
            """;

    /** Fact measures copied as they are, after the six key columns. */
    static final List<String> FACT_MEASURES = List.of(
            "order_status", "order_items_count", "order_total_value",
            "order_items_total_price", "order_items_total_freight",
            "delivery_time_days", "delivery_delay_days",
            "total_payment_value", "payment_types", "max_installments",
            "avg_review_score", "has_review_comment");

    private static final String PURCHASE = "order_purchase_timestamp";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final PipelineProperties properties;

    /**
     * @return rows written per analytics table
     */
    public Map<String, Integer> load(Map<String, DataTable> transformed) {
        log.info("[LOAD] Loading star schema...");
        Map<String, Integer> written = new LinkedHashMap<>();
        DataTable orders = transformed.get(DatasetNames.ORDERS);
        DataTable customers = transformed.get(DatasetNames.CUSTOMERS);
        DataTable products = transformed.get(DatasetNames.PRODUCTS);
        DataTable sellers = transformed.get(DatasetNames.SELLERS);
        DataTable fact = transformed.get(DatasetNames.FACT_ORDERS);

        if (orders != null) {
            written.put(DIM_TIME, write(DIM_TIME, INSERT_TIME, timeRows(orders)));
        }
        if (customers != null) {
            written.put(DIM_CUSTOMERS, write(DIM_CUSTOMERS, UPSERT_CUSTOMER, customerRows(customers)));
        }
        if (products != null) {
            written.put(DIM_PRODUCTS, write(DIM_PRODUCTS, UPSERT_PRODUCT, naturalKeyRows(products, List.of(
                    "product_id", "product_category_name", "product_category_name_english",
                    "product_weight_g", "product_length_cm", "product_height_cm", "product_width_cm"))));
        }
        if (sellers != null) {
            written.put(DIM_SELLERS, write(DIM_SELLERS, UPSERT_SELLER,
                    naturalKeyRows(sellers, List.of("seller_id", "seller_state", "seller_city"))));
        }
        if (customers != null && sellers != null) {
            written.put(DIM_GEOGRAPHY, write(DIM_GEOGRAPHY, INSERT_GEOGRAPHY, geographyRows(customers, sellers)));
        }
        if (fact != null) {
            written.put(FACT_ORDERS, write(FACT_ORDERS, UPSERT_FACT, factRows(fact)));
        }
        log.info("[LOAD] Star schema loaded: {}", written);
        return written;
    }

    // ------------------------------------------------------------------ //
    // Dimensions                                                          //
    // ------------------------------------------------------------------ //

    /** One row per distinct purchase date; day of week counts from Monday = 0. */
    static List<Object[]> timeRows(DataTable orders) {
        List<Object[]> rows = new ArrayList<>();
        if (!orders.hasColumn(PURCHASE)) {
            log.warn("[LOAD] {} not found; {} not loaded", PURCHASE, DIM_TIME);
            return rows;
        }
        Set<LocalDate> dates = new LinkedHashSet<>();
        for (Object value : orders.column(PURCHASE).values()) {
            LocalDateTime purchase = DateConverter.parse(value);
            if (purchase != null) {
                dates.add(purchase.toLocalDate());
            }
        }
        for (LocalDate date : dates) {
            rows.add(new Object[]{
                    Date.valueOf(date),
                    date.getYear(),
                    date.getMonthValue(),
                    (date.getMonthValue() - 1) / 3 + 1,
                    date.getDayOfWeek().getValue() - 1,
                    date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH)});
        }
        return rows;
    }

    static List<Object[]> customerRows(DataTable customers) {
        List<Object[]> rows = naturalKeyRows(customers, List.of(
                "customer_id", "customer_unique_id", "customer_state", "customer_city",
                "is_recurring_customer", "total_orders"));
        for (Object[] row : rows) {
            if (row[4] == null) {
                row[4] = Boolean.FALSE;
            }
            if (row[5] == null) {
                row[5] = 0L;
            }
        }
        return rows;
    }

    /** Distinct (state, city, zip prefix) of customers then sellers; a missing zip prefix becomes 0. */
    static List<Object[]> geographyRows(DataTable customers, DataTable sellers) {
        Set<List<Object>> places = new LinkedHashSet<>();
        collectPlaces(customers, "customer", places);
        collectPlaces(sellers, "seller", places);
        List<Object[]> rows = new ArrayList<>(places.size());
        for (List<Object> place : places) {
            rows.add(place.toArray());
        }
        return rows;
    }

    private static void collectPlaces(DataTable table, String prefix, Set<List<Object>> places) {
        Column state = table.findColumn(prefix + "_state").orElse(null);
        if (state == null) {
            log.warn("[LOAD] {}_state not found; no geography taken from it", prefix);
            return;
        }
        Column city = table.findColumn(prefix + "_city").orElse(null);
        Column zip = table.findColumn(prefix + "_zip_code_prefix").orElse(null);
        for (int row = 0; row < table.rowCount(); row++) {
            if (state.isNull(row)) {
                continue;
            }
            Long zipPrefix = zip == null ? null : zip.getLong(row);
            places.add(Arrays.asList(
                    state.getString(row),
                    city == null ? null : city.getString(row),
                    zipPrefix == null ? 0L : zipPrefix));
        }
    }

    /**
     * Rows of {@code columns}, the first being the natural key. Rows without a key are
     * dropped; a repeated key keeps its last row.
     */
    static List<Object[]> naturalKeyRows(DataTable table, List<String> columns) {
        String key = columns.get(0);
        if (!table.hasColumn(key)) {
            log.warn("[LOAD] {} not found; dimension not loaded", key);
            return new ArrayList<>();
        }
        Map<Object, Object[]> byKey = new LinkedHashMap<>();
        for (Object[] row : SqlValues.rows(table, columns)) {
            if (row[0] != null) {
                byKey.put(row[0], row);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    // ------------------------------------------------------------------ //
    // Fact table                                                          //
    // ------------------------------------------------------------------ //

    List<Object[]> factRows(DataTable fact) {
        Map<String, Long> timeKeys = lookup(TIME_KEYS);
        Map<String, Long> customerKeys = fact.hasColumn("customer_id") ? lookup(CUSTOMER_KEYS) : Map.of();
        Map<String, Long> productKeys = fact.hasColumn("main_product_id") ? lookup(PRODUCT_KEYS) : Map.of();
        Map<String, Long> sellerKeys = fact.hasColumn("main_seller_id") ? lookup(SELLER_KEYS) : Map.of();
        Map<String, Long> geographyKeys = fact.hasColumn("customer_state") && fact.hasColumn("customer_city")
                ? lookup(GEOGRAPHY_KEYS) : Map.of();

        List<Object[]> rows = new ArrayList<>(fact.rowCount());
        int unresolved = 0;
        for (int row = 0; row < fact.rowCount(); row++) {
            Object orderId = fact.value(row, "order_id");
            if (orderId == null) {
                continue;
            }
            Object[] params = new Object[6 + FACT_MEASURES.size()];
            params[0] = orderId;
            params[1] = resolve(timeKeys, purchaseDate(fact, row));
            params[2] = resolve(customerKeys, text(fact, row, "customer_id"));
            params[3] = resolve(productKeys, text(fact, row, "main_product_id"));
            params[4] = resolve(sellerKeys, text(fact, row, "main_seller_id"));
            params[5] = resolve(geographyKeys, place(fact, row));
            for (int i = 0; i < FACT_MEASURES.size(); i++) {
                String measure = FACT_MEASURES.get(i);
                params[6 + i] = fact.hasColumn(measure) ? SqlValues.toSql(fact.value(row, measure)) : null;
            }
            if (params[1] == null || params[2] == null) {
                unresolved++;
            }
            rows.add(params);
        }
        if (unresolved > 0) {
            log.warn("[LOAD] {} orders without a time or customer key", unresolved);
        }
        return rows;
    }

    private Map<String, Long> lookup(String sql) {
        Map<String, Long> keys = new HashMap<>();
        try {
            jdbc.query(sql, (RowCallbackHandler) rs -> keys.put(rs.getString("natural_key"), rs.getLong("surrogate_key")));
        } catch (DataAccessException e) {
            throw new LoadException(FACT_ORDERS, "dimension key lookup failed", e);
        }
        return keys;
    }

    private static Long resolve(Map<String, Long> keys, String naturalKey) {
        return naturalKey == null ? null : keys.get(naturalKey);
    }

    private static String purchaseDate(DataTable fact, int row) {
        if (!fact.hasColumn(PURCHASE)) {
            return null;
        }
        LocalDateTime purchase = DateConverter.parse(fact.value(row, PURCHASE));
        return purchase == null ? null : purchase.toLocalDate().toString();
    }

    private static String place(DataTable fact, int row) {
        String state = text(fact, row, "customer_state");
        String city = text(fact, row, "customer_city");
        return state == null || city == null || state.isEmpty() || city.isEmpty() ? null : state + "|" + city;
    }

    private static String text(DataTable fact, int row, String column) {
        return fact.hasColumn(column) ? fact.column(column).getString(row) : null;
    }

    // ------------------------------------------------------------------ //
    // Writes                                                              //
    // ------------------------------------------------------------------ //

    private int write(String table, String sql, List<Object[]> rows) {
        if (rows.isEmpty()) {
            log.warn("[LOAD] {}: nothing to write", table);
            return 0;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (List<Object[]> chunk : SqlValues.chunks(rows, properties.getBatchSize())) {
                    jdbc.batchUpdate(sql, chunk);
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new LoadException(table, e.getMessage(), e);
        }
        log.info("[LOAD] {}: {} rows processed", table, String.format("%,d", rows.size()));
        return rows.size();
    }
}
