package com.di.ecomflow.table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed, immutable sequence of nullable values.
 */
public final class Column {

    private final String name;
    private final ColumnType type;
    private final List<Object> values;

    private Column(String name, ColumnType type, List<?> values) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        List<Object> copy = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!type.accepts(value)) {
                throw new IllegalArgumentException("Column '" + name + "' of type " + type
                        + " cannot hold " + value.getClass().getSimpleName() + " at row " + i);
            }
            copy.add(value);
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public static Column of(String name, ColumnType type, List<?> values) {
        return new Column(name, type, Objects.requireNonNull(values, "values"));
    }

    public static Column of(String name, ColumnType type, Object... values) {
        return new Column(name, type, Arrays.asList(values));
    }

    /** Column of {@code size} nulls. */
    public static Column nulls(String name, ColumnType type, int size) {
        return new Column(name, type, Collections.nCopies(size, null));
    }

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    public int size() {
        return values.size();
    }

    public List<Object> values() {
        return values;
    }

    public Object get(int row) {
        return values.get(row);
    }

    public boolean isNull(int row) {
        return values.get(row) == null;
    }

    public long nullCount() {
        return values.stream().filter(Objects::isNull).count();
    }

    public String getString(int row) {
        Object value = values.get(row);
        return value == null ? null : value.toString();
    }

    /**
     * Numeric value as a long. Text holding a number is parsed; anything else,
     * including text that does not parse, is treated as no value.
     */
    public Long getLong(int row) {
        Double value = getDouble(row);
        if (value == null) {
            return null;
        }
        Object raw = values.get(row);
        return raw instanceof Long ? (Long) raw : Long.valueOf(value.longValue());
    }

    /** Numeric value widened to double; {@code null} for no value. */
    public Double getDouble(int row) {
        Object value = values.get(row);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Boolean getBoolean(int row) {
        return (Boolean) values.get(row);
    }

    public LocalDateTime getDateTime(int row) {
        return (LocalDateTime) values.get(row);
    }

    public Column rename(String newName) {
        return newName.equals(name) ? this : new Column(newName, type, values);
    }

    /**
     * Picks values by row index. A negative index yields a null, which is how
     * unmatched rows of an outer join are filled.
     */
    public Column take(int[] rows) {
        List<Object> picked = new ArrayList<>(rows.length);
        for (int row : rows) {
            picked.add(row < 0 ? null : values.get(row));
        }
        return new Column(name, type, picked);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column)) return false;
        Column other = (Column) o;
        return name.equals(other.name) && type == other.type && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, values);
    }

    @Override
    public String toString() {
        return name + ":" + type + "[" + values.size() + "]";
    }
}
