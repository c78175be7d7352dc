package com.di.ecomflow.extract;

import com.di.ecomflow.table.ColumnType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expected columns of one raw dataset, in file order, with the type each is read as.
 */
public record DatasetSchema(String name, String fileName, Map<String, ColumnType> columns) {

    public DatasetSchema {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /** Expected columns absent from {@code actual}. */
    public List<String> missingFrom(Collection<String> actual) {
        List<String> missing = new ArrayList<>();
        for (String expected : columns.keySet()) {
            if (!actual.contains(expected)) {
                missing.add(expected);
            }
        }
        return missing;
    }

    /** Columns of {@code actual} this schema does not know. */
    public List<String> extraIn(Collection<String> actual) {
        List<String> extra = new ArrayList<>();
        for (String name : actual) {
            if (!columns.containsKey(name)) {
                extra.add(name);
            }
        }
        return extra;
    }

    /** Declared type of the column, STRING for columns the schema does not know. */
    public ColumnType typeOf(String column) {
        return columns.getOrDefault(column, ColumnType.STRING);
    }
}
