package com.di.ecomflow.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline settings bound from {@code ecomflow.pipeline.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ecomflow.pipeline")
public class PipelineProperties {

    // ------------------------------------------------------------------ //
    // Source                                                              //
    // ------------------------------------------------------------------ //

    /** Directory holding the raw CSV files. */
    @NotBlank
    private String dataDir = "dataset/raw";

    /**
     * Dataset name to CSV file name, in extraction order. Keys are the canonical
     * dataset names (orders, order_items, ...).
     */
    private Map<String, String> datasets = new LinkedHashMap<>();

    // ------------------------------------------------------------------ //
    // Execution                                                           //
    // ------------------------------------------------------------------ //

    /** Run the pipeline once when the application starts. */
    private boolean runOnStartup = true;

    /** Load the transformed data into PostgreSQL. Without it no DataSource is created. */
    private boolean loadToDb = false;

    /** Value written to the {@code source} column of staging rows; reloading a source replaces its rows. */
    @NotBlank
    private String sourceTag = "csv";

    /** Rows per JDBC batch. */
    @Min(1)
    private int batchSize = 1000;

    /** Verify fact table foreign keys after loading. */
    private boolean enableValidation = true;

    public Path getDataPath() {
        return Path.of(dataDir);
    }
}
