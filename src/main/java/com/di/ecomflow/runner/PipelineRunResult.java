package com.di.ecomflow.runner;

import com.di.ecomflow.load.IntegrityCheckResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResult {

    public enum RunStatus {
        /** Extracted, transformed and, when enabled, loaded. */
        SUCCESS,
        /** Transformed, but the warehouse load failed. */
        PARTIAL,
        /** Nothing extracted, or the transform failed. */
        FAILED
    }

    public enum LoadStatus {
        SKIPPED,
        SUCCESS,
        FAILED
    }

    private String     jobId;
    private RunStatus  status;
    private LoadStatus loadStatus;
    private Instant    startedAt;
    private long       elapsedMs;

    /** Rows per extracted dataset. */
    @Builder.Default
    private Map<String, Integer> datasetRowCounts = new LinkedHashMap<>();

    /** Rows per transformed dataset, derived tables included. */
    @Builder.Default
    private Map<String, Integer> transformedRowCounts = new LinkedHashMap<>();

    /** Null when the fact table was not built. */
    private Integer factRowCount;

    @Builder.Default
    private Map<String, Integer> loadedRowCounts = new LinkedHashMap<>();

    @Builder.Default
    private List<IntegrityCheckResult> integrityChecks = new ArrayList<>();

    private String errorMessage;
}
