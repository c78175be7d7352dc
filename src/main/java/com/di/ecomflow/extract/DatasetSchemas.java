package com.di.ecomflow.extract;

import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.transform.DatasetNames;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.di.ecomflow.table.ColumnType.DOUBLE;
import static com.di.ecomflow.table.ColumnType.LONG;
import static com.di.ecomflow.table.ColumnType.STRING;

/**
 * Registered raw datasets of the Olist public e-commerce export.
 * Date and timestamp columns are read as strings; the transform converts them.
 */
public final class DatasetSchemas {

    private static final Map<String, DatasetSchema> SCHEMAS = new LinkedHashMap<>();

    static {
        register(DatasetNames.CUSTOMERS, "olist_customers_dataset.csv", columns(
                "customer_id", STRING,
                "customer_unique_id", STRING,
                "customer_zip_code_prefix", LONG,
                "customer_city", STRING,
                "customer_state", STRING));
        register(DatasetNames.GEOLOCATION, "olist_geolocation_dataset.csv", columns(
                "geolocation_zip_code_prefix", LONG,
                "geolocation_lat", DOUBLE,
                "geolocation_lng", DOUBLE,
                "geolocation_city", STRING,
                "geolocation_state", STRING));
        register(DatasetNames.ORDER_ITEMS, "olist_order_items_dataset.csv", columns(
                "order_id", STRING,
                "order_item_id", LONG,
                "product_id", STRING,
                "seller_id", STRING,
                "shipping_limit_date", STRING,
                "price", DOUBLE,
                "freight_value", DOUBLE));
        register(DatasetNames.ORDER_PAYMENTS, "olist_order_payments_dataset.csv", columns(
                "order_id", STRING,
                "payment_sequential", LONG,
                "payment_type", STRING,
                "payment_installments", LONG,
                "payment_value", DOUBLE));
        register(DatasetNames.ORDER_REVIEWS, "olist_order_reviews_dataset.csv", columns(
                "review_id", STRING,
                "order_id", STRING,
                "review_score", LONG,
                "review_comment_title", STRING,
                "review_comment_message", STRING,
                "review_creation_date", STRING,
                "review_answer_timestamp", STRING));
        register(DatasetNames.ORDERS, "olist_orders_dataset.csv", columns(
                "order_id", STRING,
                "customer_id", STRING,
                "order_status", STRING,
                "order_purchase_timestamp", STRING,
                "order_approved_at", STRING,
                "order_delivered_carrier_date", STRING,
                "order_delivered_customer_date", STRING,
                "order_estimated_delivery_date", STRING));
        // "lenght" is the spelling used by the source files
        register(DatasetNames.PRODUCTS, "olist_products_dataset.csv", columns(
                "product_id", STRING,
                "product_category_name", STRING,
                "product_name_lenght", DOUBLE,
                "product_description_lenght", DOUBLE,
                "product_photos_qty", DOUBLE,
                "product_weight_g", DOUBLE,
                "product_length_cm", DOUBLE,
                "product_height_cm", DOUBLE,
                "product_width_cm", DOUBLE));
        register(DatasetNames.SELLERS, "olist_sellers_dataset.csv", columns(
                "seller_id", STRING,
                "seller_zip_code_prefix", LONG,
                "seller_city", STRING,
                "seller_state", STRING));
        register(DatasetNames.CATEGORY_TRANSLATION, "product_category_name_translation.csv", columns(
                "product_category_name", STRING,
                "product_category_name_english", STRING));
    }

    private DatasetSchemas() {
    }

    public static Optional<DatasetSchema> find(String datasetName) {
        return Optional.ofNullable(SCHEMAS.get(datasetName));
    }

    /** Dataset name to default CSV file name, in extraction order. */
    public static Map<String, String> defaultFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        SCHEMAS.forEach((name, schema) -> files.put(name, schema.fileName()));
        return files;
    }

    private static void register(String name, String fileName, Map<String, ColumnType> columns) {
        SCHEMAS.put(name, new DatasetSchema(name, fileName, columns));
    }

    private static Map<String, ColumnType> columns(Object... namesAndTypes) {
        Map<String, ColumnType> columns = new LinkedHashMap<>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            columns.put((String) namesAndTypes[i], (ColumnType) namesAndTypes[i + 1]);
        }
        return columns;
    }
}
