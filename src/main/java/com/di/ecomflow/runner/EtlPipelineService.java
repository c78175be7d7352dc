package com.di.ecomflow.runner;

import com.di.ecomflow.aspect.ErrorCategory;
import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.extract.CsvDatasetExtractor;
import com.di.ecomflow.load.LoadException;
import com.di.ecomflow.load.WarehouseLoadResult;
import com.di.ecomflow.load.WarehouseLoader;
import com.di.ecomflow.runner.PipelineRunResult.LoadStatus;
import com.di.ecomflow.runner.PipelineRunResult.RunStatus;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.transform.DatasetNames;
import com.di.ecomflow.transform.TransformException;
import com.di.ecomflow.transform.TransformOrchestrator;
import com.di.ecomflow.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs extract, transform and the optional warehouse load as one job.
 *
 * <p>A run with no extracted dataset, or whose transform fails, is FAILED. A failed
 * load leaves the run PARTIAL: extract and transform results are still reported.
 * Only one run executes at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlPipelineService {

    static final String JOB_ID = "jobId";

    private final CsvDatasetExtractor extractor;
    private final TransformOrchestrator transformOrchestrator;
    private final ObjectProvider<WarehouseLoader> warehouseLoader;
    private final PipelineProperties properties;
    private final MetricsCollector metricsCollector;

    private final AtomicReference<PipelineRunResult> latestRun = new AtomicReference<>();
    private final ReentrantLock runLock = new ReentrantLock();

    /**
     * @throws IllegalStateException when another run is in progress
     */
    public PipelineRunResult runPipeline() {
        if (!runLock.tryLock()) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        String jobId = "run-" + UUID.randomUUID();
        MDC.put(JOB_ID, jobId);
        long start = System.currentTimeMillis();
        PipelineRunResult result = PipelineRunResult.builder()
                .jobId(jobId)
                .startedAt(Instant.now())
                .loadStatus(LoadStatus.SKIPPED)
                .build();
        try {
            log.info("[RUNNER] Pipeline {} started (dataDir={}, loadToDb={})",
                    jobId, properties.getDataDir(), properties.isLoadToDb());
            execute(result);
        } finally {
            result.setElapsedMs(System.currentTimeMillis() - start);
            latestRun.set(result);
            metricsCollector.recordRun(result.getStatus().name());
            log.info("[RUNNER] Pipeline {} finished: status={} load={} in {} s",
                    jobId, result.getStatus(), result.getLoadStatus(),
                    String.format("%.2f", result.getElapsedMs() / 1000.0));
            MDC.remove(JOB_ID);
            runLock.unlock();
        }
        return result;
    }

    public Optional<PipelineRunResult> latestRun() {
        return Optional.ofNullable(latestRun.get());
    }

    private void execute(PipelineRunResult result) {
        // FAILED until the transform completes
        result.setStatus(RunStatus.FAILED);

        Path dataDir = properties.getDataPath();
        long stageStart = System.currentTimeMillis();
        Map<String, DataTable> datasets = extractor.extractAll(dataDir);
        metricsCollector.recordStage("extract", System.currentTimeMillis() - stageStart);
        if (datasets.isEmpty()) {
            result.setErrorMessage("No datasets extracted from " + dataDir);
            log.error("[RUNNER] {}", result.getErrorMessage());
            return;
        }
        result.setDatasetRowCounts(rowCounts(datasets));
        datasets.forEach((name, table) -> metricsCollector.recordDatasetRows(name, table.rowCount()));

        Map<String, DataTable> transformed;
        stageStart = System.currentTimeMillis();
        try {
            transformed = transformOrchestrator.transformAll(datasets);
        } catch (TransformException e) {
            result.setErrorMessage(e.getMessage());
            log.error("[RUNNER] Transform failed at {} on {} [{}]: {}",
                    e.getStage(), e.getTable(), ErrorCategory.categorize(e).getName(), e.getMessage(), e);
            return;
        } finally {
            metricsCollector.recordStage("transform", System.currentTimeMillis() - stageStart);
        }
        result.setTransformedRowCounts(rowCounts(transformed));
        DataTable fact = transformed.get(DatasetNames.FACT_ORDERS);
        result.setFactRowCount(fact == null ? null : fact.rowCount());
        result.setStatus(RunStatus.SUCCESS);

        if (properties.isLoadToDb()) {
            load(transformed, result);
        }
    }

    private void load(Map<String, DataTable> transformed, PipelineRunResult result) {
        WarehouseLoader loader = warehouseLoader.getIfAvailable();
        if (loader == null) {
            log.warn("[RUNNER] Loading is enabled but no warehouse loader is configured; load skipped");
            return;
        }
        long stageStart = System.currentTimeMillis();
        try {
            WarehouseLoadResult loaded = loader.loadAll(transformed);
            Map<String, Integer> written = new LinkedHashMap<>(loaded.getStagingRows());
            written.putAll(loaded.getAnalyticsRows());
            result.setLoadedRowCounts(written);
            result.setIntegrityChecks(loaded.getIntegrityChecks());
            result.setLoadStatus(LoadStatus.SUCCESS);
            if (!loaded.isIntegrityPassed()) {
                log.warn("[RUNNER] Load completed with failing integrity checks");
            }
        } catch (LoadException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.error("[RUNNER] Load failed on {} [{}]: {}", e.getTable(), category.getName(), e.getMessage(), e);
            metricsCollector.recordLoadFailure(e.getTable());
            result.setLoadStatus(LoadStatus.FAILED);
            result.setStatus(RunStatus.PARTIAL);
            result.setErrorMessage(e.getMessage());
        } finally {
            metricsCollector.recordStage("load", System.currentTimeMillis() - stageStart);
        }
    }

    private static Map<String, Integer> rowCounts(Map<String, DataTable> tables) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        tables.forEach((name, table) -> counts.put(name, table.rowCount()));
        return counts;
    }
}
