package com.di.ecomflow.load;

import com.di.ecomflow.aspect.LogTransaction;
import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.table.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Loads a transformed dataset mapping into PostgreSQL: provision the schemas,
 * fill staging, fill the star schema, then optionally verify the fact table's
 * foreign keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class WarehouseLoader {

    private final SchemaProvisioner schemaProvisioner;
    private final StagingTableLoader stagingTableLoader;
    private final StarSchemaLoader starSchemaLoader;
    private final IntegrityVerifier integrityVerifier;
    private final PipelineProperties properties;

    /**
     * @throws LoadException naming the table whose write failed
     */
    @LogTransaction(eventType = "LOAD", transactionContext = "warehouse_load")
    public WarehouseLoadResult loadAll(Map<String, DataTable> transformed) {
        log.info("[LOAD] Starting warehouse load of {} datasets", transformed.size());
        long start = System.currentTimeMillis();
        try {
            schemaProvisioner.provision();
            Map<String, Integer> staged = stagingTableLoader.load(transformed, properties.getSourceTag());
            Map<String, Integer> analytics = starSchemaLoader.load(transformed);
            List<IntegrityCheckResult> checks = properties.isEnableValidation()
                    ? integrityVerifier.verify()
                    : List.of();

            log.info("[LOAD] Completed in {} s", String.format("%.2f", (System.currentTimeMillis() - start) / 1000.0));
            return WarehouseLoadResult.builder()
                    .stagingRows(staged)
                    .analyticsRows(analytics)
                    .integrityChecks(checks)
                    .build();
        } catch (DataAccessException e) {
            throw new LoadException("warehouse", e.getMessage(), e);
        }
    }
}
