package com.di.ecomflow.table;

import java.time.LocalDateTime;

/**
 * Scalar types a {@link Column} can hold. Every value of a column is either
 * {@code null} or an instance of the type's Java class.
 */
public enum ColumnType {

    STRING(String.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class),
    DATETIME(LocalDateTime.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }
}
