package com.di.ecomflow.transform;

import com.di.ecomflow.table.DataTable;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One guarded stage of the transform: it runs only when every table in
 * {@code requiredTables} is available in the working dataset mapping.
 */
public record TransformStep(String name, List<String> requiredTables, Consumer<Map<String, DataTable>> action) {

    public boolean isRunnable(Map<String, DataTable> available) {
        return available.keySet().containsAll(requiredTables);
    }
}
