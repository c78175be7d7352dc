package com.di.ecomflow.load;

import com.di.ecomflow.transform.DatasetNames;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Staging table layout for one entity dataset: the raw columns it keeps and its
 * primary key. Every staging table also carries {@code source} and {@code load_timestamp}.
 */
public record StagingTableSpec(String table, List<String> columns, List<String> primaryKey) {

    public static final String SCHEMA = "staging";

    private static final Map<String, StagingTableSpec> CATALOG = Map.of(
            DatasetNames.CUSTOMERS, new StagingTableSpec("customers",
                    List.of("customer_id", "customer_unique_id", "customer_zip_code_prefix",
                            "customer_city", "customer_state"),
                    List.of("customer_id")),
            DatasetNames.GEOLOCATION, new StagingTableSpec("geolocation",
                    List.of("geolocation_zip_code_prefix", "geolocation_lat", "geolocation_lng",
                            "geolocation_city", "geolocation_state"),
                    List.of("geolocation_zip_code_prefix", "geolocation_lat", "geolocation_lng")),
            DatasetNames.ORDER_ITEMS, new StagingTableSpec("order_items",
                    List.of("order_id", "order_item_id", "product_id", "seller_id",
                            "shipping_limit_date", "price", "freight_value"),
                    List.of("order_id", "order_item_id")),
            DatasetNames.ORDER_PAYMENTS, new StagingTableSpec("order_payments",
                    List.of("order_id", "payment_sequential", "payment_type",
                            "payment_installments", "payment_value"),
                    List.of("order_id", "payment_sequential")),
            DatasetNames.ORDER_REVIEWS, new StagingTableSpec("order_reviews",
                    List.of("review_id", "order_id", "review_score", "review_comment_title",
                            "review_comment_message", "review_creation_date", "review_answer_timestamp"),
                    List.of("review_id")),
            DatasetNames.ORDERS, new StagingTableSpec("orders",
                    List.of("order_id", "customer_id", "order_status", "order_purchase_timestamp",
                            "order_approved_at", "order_delivered_carrier_date",
                            "order_delivered_customer_date", "order_estimated_delivery_date"),
                    List.of("order_id")),
            DatasetNames.PRODUCTS, new StagingTableSpec("products",
                    List.of("product_id", "product_category_name", "product_category_name_english",
                            "product_name_lenght", "product_description_lenght", "product_photos_qty",
                            "product_weight_g", "product_length_cm", "product_height_cm", "product_width_cm"),
                    List.of("product_id")),
            DatasetNames.SELLERS, new StagingTableSpec("sellers",
                    List.of("seller_id", "seller_zip_code_prefix", "seller_city", "seller_state"),
                    List.of("seller_id"))
    );

    public static Optional<StagingTableSpec> forDataset(String datasetName) {
        return Optional.ofNullable(CATALOG.get(datasetName));
    }

    public String qualifiedName() {
        return SCHEMA + "." + table;
    }
}
