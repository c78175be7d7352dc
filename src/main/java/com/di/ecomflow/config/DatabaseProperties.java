package com.di.ecomflow.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * PostgreSQL connection settings bound from {@code ecomflow.database.*}.
 * Only used when {@code ecomflow.pipeline.load-to-db} is true.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ecomflow.database")
public class DatabaseProperties {

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 5432;

    @NotBlank
    private String name = "ecommerce_olist";

    @NotBlank
    private String user = "postgres";

    @ToString.Exclude
    private String password = "postgres";

    @Min(1)
    private int maximumPoolSize = 5;

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }
}
