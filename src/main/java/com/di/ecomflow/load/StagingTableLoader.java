package com.di.ecomflow.load;

import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.table.DataTable;
import com.di.ecomflow.table.TableOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads entity datasets into their {@code staging.*} tables.
 *
 * <p>Per table, in one transaction: keep the known columns, de-duplicate on the
 * primary key (the last row wins, at the position of the first), delete the rows
 * previously loaded from the same {@code source}, then batch insert. Reloading the
 * same source therefore replaces rather than appends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ecomflow.pipeline", name = "load-to-db", havingValue = "true")
public class StagingTableLoader {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final PipelineProperties properties;

    /**
     * @return rows inserted per staging table
     */
    public Map<String, Integer> load(Map<String, DataTable> datasets, String source) {
        log.info("[LOAD] Loading {} datasets into staging (source={})", datasets.size(), source);
        Timestamp loadTimestamp = Timestamp.valueOf(LocalDateTime.now());
        Map<String, Integer> inserted = new LinkedHashMap<>();

        datasets.forEach((name, table) -> StagingTableSpec.forDataset(name).ifPresent(spec -> {
            int rows = loadTable(spec, table, source, loadTimestamp);
            if (rows > 0) {
                inserted.put(spec.qualifiedName(), rows);
            }
        }));
        return inserted;
    }

    int loadTable(StagingTableSpec spec, DataTable table, String source, Timestamp loadTimestamp) {
        List<String> columns = present(spec.columns(), table);
        if (columns.isEmpty()) {
            log.warn("[LOAD] {}: none of the expected columns found; skipped", spec.qualifiedName());
            return 0;
        }
        DataTable staged = table.select(columns);
        List<String> keys = present(spec.primaryKey(), staged);
        if (!keys.isEmpty()) {
            int before = staged.rowCount();
            staged = TableOperations.distinctBy(staged, keys, true);
            if (staged.rowCount() < before) {
                log.info("[LOAD] {}: removed {} duplicate keys", spec.qualifiedName(), before - staged.rowCount());
            }
        }
        if (staged.rowCount() == 0) {
            log.warn("[LOAD] {}: dataset empty after processing; skipped", spec.qualifiedName());
            return 0;
        }

        List<String> insertColumns = new ArrayList<>(columns);
        insertColumns.add("source");
        insertColumns.add("load_timestamp");
        String insertSql = "INSERT INTO " + spec.qualifiedName()
                + " (" + String.join(", ", insertColumns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(insertColumns.size(), "?")) + ")";
        List<Object[]> rows = SqlValues.rows(staged, columns, source, loadTimestamp);

        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbc.update("DELETE FROM " + spec.qualifiedName() + " WHERE source = ?", source);
                for (List<Object[]> chunk : SqlValues.chunks(rows, properties.getBatchSize())) {
                    jdbc.batchUpdate(insertSql, chunk);
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new LoadException(spec.qualifiedName(), e.getMessage(), e);
        }
        log.info("[LOAD] {}: {} rows inserted", spec.qualifiedName(), String.format("%,d", rows.size()));
        return rows.size();
    }

    private static List<String> present(List<String> wanted, DataTable table) {
        List<String> present = new ArrayList<>();
        for (String column : wanted) {
            if (table.hasColumn(column)) {
                present.add(column);
            }
        }
        return present;
    }
}
