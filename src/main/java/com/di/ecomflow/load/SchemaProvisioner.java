package com.di.ecomflow.load;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the {@code staging} and {@code analytics} schemas with their tables and
 * indexes. Every statement is {@code IF NOT EXISTS}, so provisioning is repeatable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class SchemaProvisioner {

    static final List<String> SCHEMAS = List.of(
            "CREATE SCHEMA IF NOT EXISTS staging",
            "CREATE SCHEMA IF NOT EXISTS analytics");

    static final List<String> STAGING_TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS staging.customers (
                customer_id              VARCHAR(255) PRIMARY KEY,
                customer_unique_id       VARCHAR(255),
                customer_zip_code_prefix INTEGER,
                customer_city            VARCHAR(255),
                customer_state           VARCHAR(2),
                source                   VARCHAR(255),
                load_timestamp           TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.geolocation (
                geolocation_zip_code_prefix INTEGER,
                geolocation_lat             DOUBLE PRECISION,
                geolocation_lng             DOUBLE PRECISION,
                geolocation_city            VARCHAR(255),
                geolocation_state           VARCHAR(2),
                source                      VARCHAR(255),
                load_timestamp              TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (geolocation_zip_code_prefix, geolocation_lat, geolocation_lng)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.order_items (
                order_id            VARCHAR(255),
                order_item_id       INTEGER,
                product_id          VARCHAR(255),
                seller_id           VARCHAR(255),
                shipping_limit_date TIMESTAMP,
                price               DOUBLE PRECISION,
                freight_value       DOUBLE PRECISION,
                source              VARCHAR(255),
                load_timestamp      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (order_id, order_item_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.order_payments (
                order_id             VARCHAR(255),
                payment_sequential   INTEGER,
                payment_type         VARCHAR(50),
                payment_installments INTEGER,
                payment_value        DOUBLE PRECISION,
                source               VARCHAR(255),
                load_timestamp       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (order_id, payment_sequential)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.order_reviews (
                review_id               VARCHAR(255) PRIMARY KEY,
                order_id                VARCHAR(255),
                review_score            INTEGER,
                review_comment_title    TEXT,
                review_comment_message  TEXT,
                review_creation_date    TIMESTAMP,
                review_answer_timestamp TIMESTAMP,
                source                  VARCHAR(255),
                load_timestamp          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.orders (
                order_id                      VARCHAR(255) PRIMARY KEY,
                customer_id                   VARCHAR(255),
                order_status                  VARCHAR(50),
                order_purchase_timestamp      TIMESTAMP,
                order_approved_at             TIMESTAMP,
                order_delivered_carrier_date  TIMESTAMP,
                order_delivered_customer_date TIMESTAMP,
                order_estimated_delivery_date TIMESTAMP,
                source                        VARCHAR(255),
                load_timestamp                TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.products (
                product_id                    VARCHAR(255) PRIMARY KEY,
                product_category_name         VARCHAR(255),
                product_category_name_english VARCHAR(255),
                product_name_lenght           DOUBLE PRECISION,
                product_description_lenght    DOUBLE PRECISION,
                product_photos_qty            DOUBLE PRECISION,
                product_weight_g              DOUBLE PRECISION,
                product_length_cm             DOUBLE PRECISION,
                product_height_cm             DOUBLE PRECISION,
                product_width_cm              DOUBLE PRECISION,
                source                        VARCHAR(255),
                load_timestamp                TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS staging.sellers (
                seller_id              VARCHAR(255) PRIMARY KEY,
                seller_zip_code_prefix INTEGER,
                seller_city            VARCHAR(255),
                seller_state           VARCHAR(2),
                source                 VARCHAR(255),
                load_timestamp         TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """);

    static final List<String> STAR_SCHEMA_TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS analytics.dim_time (
                time_id           SERIAL PRIMARY KEY,
                order_date        DATE NOT NULL,
                order_year        INTEGER,
                order_month       INTEGER,
                order_quarter     INTEGER,
                order_day_of_week INTEGER,
                order_day_name    VARCHAR(20),
                UNIQUE (order_date)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS analytics.dim_customers (
                customer_key          SERIAL PRIMARY KEY,
                customer_id           VARCHAR(255) UNIQUE NOT NULL,
                customer_unique_id    VARCHAR(255),
                customer_state        VARCHAR(2),
                customer_city         VARCHAR(255),
                is_recurring_customer BOOLEAN DEFAULT FALSE,
                total_orders          INTEGER DEFAULT 0,
                created_at            TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at            TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS analytics.dim_products (
                product_key                   SERIAL PRIMARY KEY,
                product_id                    VARCHAR(255) UNIQUE NOT NULL,
                product_category_name         VARCHAR(255),
                product_category_name_english VARCHAR(255),
                product_weight_g              DOUBLE PRECISION,
                product_length_cm             DOUBLE PRECISION,
                product_height_cm             DOUBLE PRECISION,
                product_width_cm              DOUBLE PRECISION,
                created_at                    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at                    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS analytics.dim_sellers (
                seller_key   SERIAL PRIMARY KEY,
                seller_id    VARCHAR(255) UNIQUE NOT NULL,
                seller_state VARCHAR(2),
                seller_city  VARCHAR(255),
                created_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS analytics.dim_geography (
                geography_key   SERIAL PRIMARY KEY,
                state           VARCHAR(2) NOT NULL,
                city            VARCHAR(255),
                zip_code_prefix INTEGER,
                UNIQUE (state, city, zip_code_prefix)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS analytics.fact_orders (
                order_id                  VARCHAR(255) PRIMARY KEY,
                time_id                   INTEGER REFERENCES analytics.dim_time (time_id),
                customer_key              INTEGER REFERENCES analytics.dim_customers (customer_key),
                product_key               INTEGER,
                seller_key                INTEGER,
                geography_key             INTEGER REFERENCES analytics.dim_geography (geography_key),
                order_status              VARCHAR(50),
                order_items_count         INTEGER,
                order_total_value         DOUBLE PRECISION,
                order_items_total_price   DOUBLE PRECISION,
                order_items_total_freight DOUBLE PRECISION,
                delivery_time_days        INTEGER,
                delivery_delay_days       INTEGER,
                total_payment_value       DOUBLE PRECISION,
                payment_types             VARCHAR(255),
                max_installments          INTEGER,
                avg_review_score          DOUBLE PRECISION,
                has_review_comment        BOOLEAN,
                created_at                TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at                TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """);

    static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_fact_orders_time ON analytics.fact_orders (time_id)",
            "CREATE INDEX IF NOT EXISTS idx_fact_orders_customer ON analytics.fact_orders (customer_key)",
            "CREATE INDEX IF NOT EXISTS idx_fact_orders_geography ON analytics.fact_orders (geography_key)",
            "CREATE INDEX IF NOT EXISTS idx_fact_orders_status ON analytics.fact_orders (order_status)",
            "CREATE INDEX IF NOT EXISTS idx_dim_time_date ON analytics.dim_time (order_date)",
            "CREATE INDEX IF NOT EXISTS idx_dim_customers_id ON analytics.dim_customers (customer_id)",
            "CREATE INDEX IF NOT EXISTS idx_dim_products_id ON analytics.dim_products (product_id)",
            "CREATE INDEX IF NOT EXISTS idx_dim_sellers_id ON analytics.dim_sellers (seller_id)");

    private final JdbcTemplate jdbc;

    public void provision() {
        run("schemas", SCHEMAS);
        run("staging tables", STAGING_TABLES);
        run("star schema tables", STAR_SCHEMA_TABLES);
        run("indexes", INDEXES);
    }

    private void run(String what, List<String> statements) {
        log.info("[LOAD] Creating {}...", what);
        try {
            for (String ddl : statements) {
                jdbc.execute(ddl);
            }
        } catch (DataAccessException e) {
            throw new LoadException(what, "DDL failed", e);
        }
        log.info("[LOAD] {} {} ready", statements.size(), what);
    }
}
