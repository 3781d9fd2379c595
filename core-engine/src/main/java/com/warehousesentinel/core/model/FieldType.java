package com.warehousesentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Logical type of an entity dimension or metric, with its BigQuery column
 * type.
 *
 * @since 1.0.0
 */
public enum FieldType {

    STRING("STRING"),
    NUMBER("FLOAT64"),
    INTEGER("INT64"),
    DATE("DATE"),
    TIMESTAMP("TIMESTAMP"),
    BOOLEAN("BOOL");

    private final String sqlType;

    FieldType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }

    /**
     * Parse a type name as written in definitions ({@code "string"},
     * {@code "number"}, {@code "date"}, ...).
     *
     * @param name type name; must not be {@code null}
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FieldType fromString(String name) {
        Objects.requireNonNull(name, "Field type must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> STRING;
            case "number", "float", "float64", "numeric" -> NUMBER;
            case "integer", "int", "int64" -> INTEGER;
            case "date" -> DATE;
            case "timestamp" -> TIMESTAMP;
            case "boolean", "bool" -> BOOLEAN;
            default -> throw new IllegalArgumentException(
                    "Unknown field type: '" + name
                            + "'. Supported types: string, number, integer, date, timestamp, boolean");
        };
    }
}
