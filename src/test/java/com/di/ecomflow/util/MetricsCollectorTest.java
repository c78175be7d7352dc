package com.di.ecomflow.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsCollector Tests")
class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MetricsCollector(registry);
    }

    @Test
    @DisplayName("Stage durations are timed per stage")
    void testRecordStage() {
        collector.recordStage("extract", 1500);
        collector.recordStage("extract", 500);
        collector.recordStage("transform", 100);

        assertEquals(2, registry.get(MetricsCollector.STAGE_DURATION).tag("stage", "extract").timer().count());
        assertEquals(2000.0, registry.get(MetricsCollector.STAGE_DURATION).tag("stage", "extract").timer()
                .totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get(MetricsCollector.STAGE_DURATION).tag("stage", "transform").timer().count());
    }

    @Test
    @DisplayName("Runs are counted per status")
    void testRecordRun() {
        collector.recordRun("SUCCESS");
        collector.recordRun("SUCCESS");
        collector.recordRun("FAILED");

        assertEquals(2.0, registry.get(MetricsCollector.PIPELINE_RUNS).tag("status", "SUCCESS").counter().count());
        assertEquals(1.0, registry.get(MetricsCollector.PIPELINE_RUNS).tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("Load failures without a table are tagged unknown")
    void testRecordLoadFailure() {
        collector.recordLoadFailure("staging.orders");
        collector.recordLoadFailure(null);

        assertEquals(1.0, registry.get(MetricsCollector.LOAD_FAILURES).tag("table", "staging.orders").counter().count());
        assertEquals(1.0, registry.get(MetricsCollector.LOAD_FAILURES).tag("table", "unknown").counter().count());
    }

    @Test
    @DisplayName("Dataset volumes are summarised per dataset")
    void testRecordDatasetRows() {
        collector.recordDatasetRows("orders", 99441);

        assertEquals(99441.0, registry.get(MetricsCollector.DATASET_ROWS).tag("dataset", "orders").summary().totalAmount());
    }
}
