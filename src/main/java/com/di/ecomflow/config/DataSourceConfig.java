package com.di.ecomflow.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Warehouse connection pool, created only when loading to the database is enabled.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(DatabaseProperties database) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(database.jdbcUrl());
        hikariConfig.setUsername(database.getUser());
        hikariConfig.setPassword(database.getPassword());
        hikariConfig.setDriverClassName("org.postgresql.Driver");
        hikariConfig.setMaximumPoolSize(database.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setPoolName("HikariPool-ecomflow-" + database.getName());
        hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        // connect lazily so the API still starts while the database is down
        hikariConfig.setInitializationFailTimeout(-1);

        log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}",
                database.jdbcUrl(), database.getUser(), database.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
