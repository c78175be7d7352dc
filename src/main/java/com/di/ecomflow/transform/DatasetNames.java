package com.di.ecomflow.transform;

import java.util.List;

/**
 * Canonical dataset names shared by extract, transform and load.
 */
public final class DatasetNames {

    public static final String CUSTOMERS = "customers";
    public static final String GEOLOCATION = "geolocation";
    public static final String ORDER_ITEMS = "order_items";
    public static final String ORDER_PAYMENTS = "order_payments";
    public static final String ORDER_REVIEWS = "order_reviews";
    public static final String ORDERS = "orders";
    public static final String PRODUCTS = "products";
    public static final String SELLERS = "sellers";
    public static final String CATEGORY_TRANSLATION = "category_translation";

    // derived
    public static final String ORDER_METRICS = "order_metrics";
    public static final String FACT_ORDERS = "fact_orders";

    /** Source datasets, in extraction order. */
    public static final List<String> SOURCES = List.of(
            CUSTOMERS, GEOLOCATION, ORDER_ITEMS, ORDER_PAYMENTS, ORDER_REVIEWS,
            ORDERS, PRODUCTS, SELLERS, CATEGORY_TRANSLATION);

    /** Datasets that must all be present before the fact table is built. */
    public static final List<String> FACT_REQUIRED = List.of(
            ORDERS, ORDER_ITEMS, ORDER_PAYMENTS, ORDER_REVIEWS, CUSTOMERS, PRODUCTS, SELLERS);

    private DatasetNames() {
    }
}
