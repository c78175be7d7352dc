package com.di.ecomflow.runner;

import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.extract.CsvDatasetExtractor;
import com.di.ecomflow.load.IntegrityCheckResult;
import com.di.ecomflow.load.LoadException;
import com.di.ecomflow.load.WarehouseLoadResult;
import com.di.ecomflow.load.WarehouseLoader;
import com.di.ecomflow.runner.PipelineRunResult.LoadStatus;
import com.di.ecomflow.runner.PipelineRunResult.RunStatus;
import com.di.ecomflow.table.ColumnType;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.transform.DatasetNames;
import com.di.ecomflow.transform.OlistFixtures;
import com.di.ecomflow.transform.TransformException;
import com.di.ecomflow.transform.TransformOrchestrator;
import com.di.ecomflow.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EtlPipelineService Tests")
class EtlPipelineServiceTest {

    @Mock
    private CsvDatasetExtractor extractor;

    @Mock
    private TransformOrchestrator transformOrchestrator;

    @Mock
    private ObjectProvider<WarehouseLoader> warehouseLoaderProvider;

    @Mock
    private WarehouseLoader warehouseLoader;

    private PipelineProperties properties;
    private SimpleMeterRegistry registry;
    private EtlPipelineService service;

    private Map<String, DataTable> extracted;
    private Map<String, DataTable> transformed;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setLoadToDb(false);
        registry = new SimpleMeterRegistry();
        service = new EtlPipelineService(extractor, transformOrchestrator, warehouseLoaderProvider,
                properties, new MetricsCollector(registry));

        extracted = OlistFixtures.allDatasets();
        transformed = new LinkedHashMap<>();
        transformed.put(DatasetNames.FACT_ORDERS, DataTable.builder()
                .column("order_id", ColumnType.STRING, "o1", "o2", "o3")
                .build());
        transformed.putAll(extracted);
    }

    private double runs(String status) {
        return registry.get(MetricsCollector.PIPELINE_RUNS).tag("status", status).counter().count();
    }

    // ============================================================================
    // Extract and transform
    // ============================================================================

    @Test
    @DisplayName("Successful run without loading")
    void testRunPipeline_Success() {
        when(extractor.extractAll(properties.getDataPath())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted)).thenReturn(transformed);

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.SUCCESS, result.getStatus());
        assertEquals(LoadStatus.SKIPPED, result.getLoadStatus());
        assertTrue(result.getJobId().startsWith("run-"));
        assertEquals(3, result.getFactRowCount());
        assertEquals(9, result.getDatasetRowCounts().size());
        assertEquals(3, result.getDatasetRowCounts().get(DatasetNames.ORDERS));
        assertEquals(10, result.getTransformedRowCounts().size());
        assertNull(result.getErrorMessage());
        assertSame(result, service.latestRun().orElseThrow());
        assertNull(MDC.get("jobId"));
        assertEquals(1.0, runs("SUCCESS"));
        verifyNoInteractions(warehouseLoaderProvider);
    }

    @Test
    @DisplayName("Nothing extracted fails the run before transforming")
    void testRunPipeline_NothingExtracted() {
        when(extractor.extractAll(any())).thenReturn(Map.of());

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertTrue(result.getErrorMessage().startsWith("No datasets extracted from"));
        verifyNoInteractions(transformOrchestrator);
        assertEquals(1.0, runs("FAILED"));
    }

    @Test
    @DisplayName("Structural transform error fails the run")
    void testRunPipeline_TransformFailure() {
        when(extractor.extractAll(any())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted))
                .thenThrow(new TransformException("enrich_products", DatasetNames.PRODUCTS, "required column missing"));

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertTrue(result.getErrorMessage().contains("enrich_products"));
        assertNull(result.getFactRowCount());
    }

    @Test
    @DisplayName("No fact table leaves the fact row count empty")
    void testRunPipeline_NoFactTable() {
        when(extractor.extractAll(any())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted)).thenReturn(extracted);

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.SUCCESS, result.getStatus());
        assertNull(result.getFactRowCount());
    }

    // ============================================================================
    // Load
    // ============================================================================

    @Test
    @DisplayName("Loaded row counts merge staging and analytics")
    void testRunPipeline_LoadSuccess() {
        properties.setLoadToDb(true);
        when(extractor.extractAll(any())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted)).thenReturn(transformed);
        when(warehouseLoaderProvider.getIfAvailable()).thenReturn(warehouseLoader);
        when(warehouseLoader.loadAll(transformed)).thenReturn(WarehouseLoadResult.builder()
                .stagingRows(Map.of("staging.orders", 3))
                .analyticsRows(Map.of("analytics.fact_orders", 3))
                .integrityChecks(List.of(IntegrityCheckResult.builder().foreignKey("time_id").passed(true).build()))
                .build());

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.SUCCESS, result.getStatus());
        assertEquals(LoadStatus.SUCCESS, result.getLoadStatus());
        assertEquals(Map.of("staging.orders", 3, "analytics.fact_orders", 3), result.getLoadedRowCounts());
        assertEquals(1, result.getIntegrityChecks().size());
    }

    @Test
    @DisplayName("Load failure makes the run partial")
    void testRunPipeline_LoadFailure() {
        properties.setLoadToDb(true);
        when(extractor.extractAll(any())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted)).thenReturn(transformed);
        when(warehouseLoaderProvider.getIfAvailable()).thenReturn(warehouseLoader);
        when(warehouseLoader.loadAll(transformed))
                .thenThrow(new LoadException("staging.orders", "connection refused", null));

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.PARTIAL, result.getStatus());
        assertEquals(LoadStatus.FAILED, result.getLoadStatus());
        assertEquals(3, result.getFactRowCount());
        assertTrue(result.getErrorMessage().contains("staging.orders"));
        assertEquals(1.0, registry.get(MetricsCollector.LOAD_FAILURES).tag("table", "staging.orders").counter().count());
        assertEquals(1.0, runs("PARTIAL"));
    }

    @Test
    @DisplayName("Loading enabled without a loader skips the load")
    void testRunPipeline_NoLoaderAvailable() {
        properties.setLoadToDb(true);
        when(extractor.extractAll(any())).thenReturn(extracted);
        when(transformOrchestrator.transformAll(extracted)).thenReturn(transformed);
        when(warehouseLoaderProvider.getIfAvailable()).thenReturn(null);

        PipelineRunResult result = service.runPipeline();

        assertEquals(RunStatus.SUCCESS, result.getStatus());
        assertEquals(LoadStatus.SKIPPED, result.getLoadStatus());
    }

    // ============================================================================
    // Run bookkeeping
    // ============================================================================

    @Test
    @DisplayName("No latest run before the first run")
    void testLatestRun_Empty() {
        assertTrue(service.latestRun().isEmpty());
    }

    @Test
    @DisplayName("A second run while one is in progress is rejected")
    void testRunPipeline_ConcurrentRunRejected() {
        AtomicReference<Throwable> rejected = new AtomicReference<>();
        when(extractor.extractAll(any())).thenAnswer(invocation -> {
            Thread other = new Thread(() -> {
                try {
                    service.runPipeline();
                } catch (IllegalStateException e) {
                    rejected.set(e);
                }
            });
            other.start();
            other.join();
            return Map.of();
        });

        service.runPipeline();

        assertInstanceOf(IllegalStateException.class, rejected.get());
        assertEquals("A pipeline run is already in progress", rejected.get().getMessage());
    }
}
