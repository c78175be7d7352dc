package com.di.ecomflow.load;

import com.di.ecomflow.table.DataTable;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Table values to JDBC parameters.
 */
final class SqlValues {

    private SqlValues() {
    }

    /** Temporal values become their java.sql type; NaN and infinities become null. */
    static Object toSql(Object value) {
        if (value instanceof LocalDateTime) {
            return Timestamp.valueOf((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return Date.valueOf((LocalDate) value);
        }
        if (value instanceof Double) {
            double d = (Double) value;
            return Double.isNaN(d) || Double.isInfinite(d) ? null : value;
        }
        return value;
    }

    /**
     * One parameter array per row, holding {@code columns} in order; a column the
     * table lacks yields null. {@code extra} values are appended to every row.
     */
    static List<Object[]> rows(DataTable table, List<String> columns, Object... extra) {
        List<Object[]> rows = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            Object[] params = new Object[columns.size() + extra.length];
            for (int i = 0; i < columns.size(); i++) {
                params[i] = table.hasColumn(columns.get(i)) ? toSql(table.value(row, columns.get(i))) : null;
            }
            System.arraycopy(extra, 0, params, columns.size(), extra.length);
            rows.add(params);
        }
        return rows;
    }

    /** Splits {@code rows} into consecutive chunks of at most {@code size}. */
    static <T> List<List<T>> chunks(List<T> rows, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += size) {
            chunks.add(rows.subList(from, Math.min(from + size, rows.size())));
        }
        return chunks;
    }
}
