package com.di.ecomflow.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Relational helpers over {@link DataTable}: grouping, left join and
 * de-duplication. All operations are stable with respect to input row order.
 */
public final class TableOperations {

    private TableOperations() {
    }

    /**
     * Groups row indices by the value of {@code keyColumn}. Groups appear in
     * first-seen order and indices inside a group keep input order. Rows with
     * a null key belong to no group.
     */
    public static Map<Object, List<Integer>> groupRows(DataTable table, String keyColumn) {
        Column key = table.column(keyColumn);
        Map<Object, List<Integer>> groups = new LinkedHashMap<>();
        for (int row = 0; row < key.size(); row++) {
            Object value = key.get(row);
            if (value != null) {
                groups.computeIfAbsent(value, k -> new ArrayList<>()).add(row);
            }
        }
        return groups;
    }

    /**
     * Left outer join on a column both tables share. Every left row is kept in
     * order; a left row matching several right rows is repeated once per match
     * (right order), a left row matching nothing gets nulls in the right-hand
     * columns. Null keys never match.
     *
     * @throws IllegalArgumentException if either side lacks the key or the
     *         tables share a non-key column name
     */
    public static DataTable leftJoin(DataTable left, DataTable right, String key) {
        if (!left.hasColumn(key) || !right.hasColumn(key)) {
            throw new IllegalArgumentException("Join key '" + key + "' missing: left=" + left.columnNames()
                    + " right=" + right.columnNames());
        }
        List<String> rightColumns = new ArrayList<>(right.columnNames());
        rightColumns.remove(key);
        for (String name : rightColumns) {
            if (left.hasColumn(name)) {
                throw new IllegalArgumentException("Column '" + name + "' present on both sides of join on '" + key + "'");
            }
        }

        Map<Object, List<Integer>> index = groupRows(right, key);
        Column leftKey = left.column(key);
        List<Integer> leftRows = new ArrayList<>(left.rowCount());
        List<Integer> rightRows = new ArrayList<>(left.rowCount());
        for (int row = 0; row < left.rowCount(); row++) {
            Object value = leftKey.get(row);
            List<Integer> matches = value == null ? null : index.get(value);
            if (matches == null) {
                leftRows.add(row);
                rightRows.add(-1);
            } else {
                for (Integer match : matches) {
                    leftRows.add(row);
                    rightRows.add(match);
                }
            }
        }

        DataTable joined = left.takeRows(toArray(leftRows));
        if (left.columnCount() == 0) {
            return joined;
        }
        int[] picks = toArray(rightRows);
        for (String name : rightColumns) {
            joined = joined.withColumn(right.column(name).take(picks));
        }
        return joined;
    }

    /**
     * Keeps one row per distinct combination of {@code keyColumns}, at the
     * position of that key's first occurrence. With {@code keepLast} the kept
     * values are those of the last occurrence (last write wins), otherwise of
     * the first.
     */
    public static DataTable distinctBy(DataTable table, List<String> keyColumns, boolean keepLast) {
        List<Column> keys = new ArrayList<>(keyColumns.size());
        for (String name : keyColumns) {
            keys.add(table.column(name));
        }
        Map<List<Object>, Integer> chosen = new LinkedHashMap<>();
        for (int row = 0; row < table.rowCount(); row++) {
            List<Object> key = new ArrayList<>(keys.size());
            for (Column column : keys) {
                key.add(column.get(row));
            }
            if (keepLast) {
                chosen.put(key, row);
            } else {
                chosen.putIfAbsent(key, row);
            }
        }
        if (chosen.size() == table.rowCount()) {
            return table;
        }
        return table.takeRows(toArray(chosen.values()));
    }

    public static DataTable distinctBy(DataTable table, String keyColumn) {
        return distinctBy(table, List.of(keyColumn), false);
    }

    /** Distinct non-null values of a column in first-seen order. */
    public static List<Object> distinctValues(Column column) {
        Set<Object> seen = new HashSet<>();
        List<Object> distinct = new ArrayList<>();
        for (Object value : column.values()) {
            if (value != null && seen.add(value)) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    private static int[] toArray(Collection<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
