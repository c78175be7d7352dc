package com.di.ecomflow.load;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one warehouse load wrote.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarehouseLoadResult {

    /** Rows inserted per {@code staging.*} table. */
    @Builder.Default
    private Map<String, Integer> stagingRows = new LinkedHashMap<>();

    /** Rows written per {@code analytics.*} table. */
    @Builder.Default
    private Map<String, Integer> analyticsRows = new LinkedHashMap<>();

    /** Empty when verification is disabled. */
    @Builder.Default
    private List<IntegrityCheckResult> integrityChecks = new ArrayList<>();

    public boolean isIntegrityPassed() {
        return integrityChecks.stream().allMatch(IntegrityCheckResult::isPassed);
    }
}
