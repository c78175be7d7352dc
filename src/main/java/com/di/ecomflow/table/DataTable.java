package com.di.ecomflow.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Ordered, named, typed tabular value. All columns have the same length
 * (the row count). Instances are immutable: every "modifying" operation
 * returns a new table and leaves the receiver untouched.
 *
 * <pre>
 * DataTable items = DataTable.builder()
 *         .column("order_id", ColumnType.STRING, "1", "1")
 *         .column("price", ColumnType.DOUBLE, 10.0, 20.0)
 *         .build();
 * </pre>
 */
public final class DataTable {

    private static final DataTable EMPTY = new DataTable(List.of());

    private final Map<String, Column> columns;
    private final int rowCount;

    private DataTable(List<Column> columnList) {
        Map<String, Column> byName = new LinkedHashMap<>();
        int rows = -1;
        for (Column column : columnList) {
            if (byName.putIfAbsent(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
            if (rows >= 0 && column.size() != rows) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " rows, expected " + rows);
            }
            rows = column.size();
        }
        this.columns = Collections.unmodifiableMap(byName);
        this.rowCount = Math.max(rows, 0);
    }

    public static DataTable of(List<Column> columns) {
        return columns.isEmpty() ? EMPTY : new DataTable(columns);
    }

    public static DataTable of(Column... columns) {
        return of(List.of(columns));
    }

    public static DataTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------ //
    // Accessors                                                           //
    // ------------------------------------------------------------------ //

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<Column> columns() {
        return List.copyOf(columns.values());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public boolean hasColumns(Collection<String> names) {
        return columns.keySet().containsAll(names);
    }

    public Optional<Column> findColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    /**
     * @throws IllegalArgumentException if the table has no such column
     */
    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("No column '" + name + "' in " + columnNames());
        }
        return column;
    }

    public Object value(int row, String columnName) {
        return column(columnName).get(row);
    }

    /** One row as an ordered column name to value map. */
    public Map<String, Object> row(int row) {
        Map<String, Object> values = new LinkedHashMap<>();
        columns.forEach((name, column) -> values.put(name, column.get(row)));
        return values;
    }

    public long missingValueCount() {
        return columns.values().stream().mapToLong(Column::nullCount).sum();
    }

    // ------------------------------------------------------------------ //
    // Derivations (each returns a new table)                              //
    // ------------------------------------------------------------------ //

    /**
     * Replaces the column of the same name in place, or appends it.
     */
    public DataTable withColumn(Column column) {
        if (!columns.isEmpty() && column.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                    + " rows, table has " + rowCount);
        }
        List<Column> next = new ArrayList<>(columns.size() + 1);
        boolean replaced = false;
        for (Column existing : columns.values()) {
            if (existing.name().equals(column.name())) {
                next.add(column);
                replaced = true;
            } else {
                next.add(existing);
            }
        }
        if (!replaced) {
            next.add(column);
        }
        return new DataTable(next);
    }

    /** Drops the named columns; names that are not present are ignored. */
    public DataTable withoutColumns(Collection<String> names) {
        Set<String> drop = new HashSet<>(names);
        List<Column> next = new ArrayList<>();
        for (Column column : columns.values()) {
            if (!drop.contains(column.name())) {
                next.add(column);
            }
        }
        return next.size() == columns.size() ? this : of(next);
    }

    public DataTable withoutColumns(String... names) {
        return withoutColumns(List.of(names));
    }

    /**
     * Projects the table onto the given columns, in the given order.
     *
     * @throws IllegalArgumentException if any column is absent
     */
    public DataTable select(List<String> names) {
        List<Column> next = new ArrayList<>(names.size());
        for (String name : names) {
            next.add(column(name));
        }
        return of(next);
    }

    public DataTable renameColumns(UnaryOperator<String> renamer) {
        List<Column> next = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            next.add(column.rename(renamer.apply(column.name())));
        }
        return new DataTable(next);
    }

    /** Picks rows by index; a negative index produces an all-null row. */
    public DataTable takeRows(int[] rows) {
        List<Column> next = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            next.add(column.take(rows));
        }
        return of(next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTable)) return false;
        DataTable other = (DataTable) o;
        return rowCount == other.rowCount && columns.equals(other.columns)
                && columnNames().equals(other.columnNames());
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "DataTable[rows=" + rowCount + ", columns=" + columnNames() + "]";
    }

    /**
     * Column-at-a-time builder.
     */
    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();

        private Builder() {
        }

        public Builder column(Column column) {
            columns.add(column);
            return this;
        }

        public Builder column(String name, ColumnType type, List<?> values) {
            return column(Column.of(name, type, values));
        }

        public Builder column(String name, ColumnType type, Object... values) {
            return column(Column.of(name, type, values));
        }

        public DataTable build() {
            return of(columns);
        }
    }
}
