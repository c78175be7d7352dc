package com.di.ecomflow.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Pipeline metrics: stage durations, run outcomes and dataset volumes.
 */
@Slf4j
@Component
public class MetricsCollector {

    public static final String STAGE_DURATION = "ecomflow.stage.duration";
    public static final String PIPELINE_RUNS = "ecomflow.pipeline.runs";
    public static final String DATASET_ROWS = "ecomflow.dataset.rows";
    public static final String LOAD_FAILURES = "ecomflow.load.failures";

    private final MeterRegistry meterRegistry;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ============================================================================
    // Stages
    // ============================================================================

    /**
     * Records how long one pipeline stage took.
     *
     * @param stage      extract, transform or load
     * @param durationMs elapsed milliseconds
     */
    public void recordStage(String stage, long durationMs) {
        Timer.builder(STAGE_DURATION)
                .description("Time taken by a pipeline stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded stage duration: stage={}, durationMs={}", stage, durationMs);
    }

    // ============================================================================
    // Runs
    // ============================================================================

    public void recordRun(String status) {
        Counter.builder(PIPELINE_RUNS)
                .description("Pipeline runs by final status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordLoadFailure(String table) {
        Counter.builder(LOAD_FAILURES)
                .description("Warehouse load failures by table")
                .tag("table", table != null ? table : "unknown")
                .register(meterRegistry)
                .increment();
    }

    // ============================================================================
    // Volumes
    // ============================================================================

    public void recordDatasetRows(String dataset, long rows) {
        DistributionSummary.builder(DATASET_ROWS)
                .description("Rows per extracted or transformed dataset")
                .baseUnit("rows")
                .tag("dataset", dataset)
                .register(meterRegistry)
                .record(rows);
    }
}
