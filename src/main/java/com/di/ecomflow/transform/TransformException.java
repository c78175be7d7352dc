package com.di.ecomflow.transform;

import com.di.ecomflow.table.DataTable;
import lombok.Getter;

/**
 * Raised for structural problems only, such as a join key column missing from
 * a table a stage cannot run without. Data-quality problems never raise.
 */
@Getter
public class TransformException extends RuntimeException {

    private final String stage;
    private final String table;

    public TransformException(String stage, String table, String message) {
        super("[" + stage + "] " + table + ": " + message);
        this.stage = stage;
        this.table = table;
    }

    /** Fails unless {@code table} has every one of {@code columns}. */
    static void requireColumns(String stage, String tableName, DataTable table,
                               String... columns) {
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                throw new TransformException(stage, tableName, "required column '" + column + "' is missing");
            }
        }
    }
}
