package com.warehousesentinel.core.warehouse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of nullable columns of a warehouse table.
 *
 * @since 1.0.0
 */
public final class TableSchema {

    private final Map<String, Field> fields;

    private TableSchema(Map<String, Field> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static TableSchema of(List<Field> fields) {
        Objects.requireNonNull(fields, "Fields must not be null");
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate column '" + field.name() + "'");
            }
        }
        return new TableSchema(byName);
    }

    public static TableSchema empty() {
        return new TableSchema(new LinkedHashMap<>());
    }

    /**
     * Additive merge: every column of this schema keeps its position and type;
     * columns of {@code other} that are missing here are appended.
     *
     * @param other schema to merge in
     * @return merged schema; {@code this} when nothing is new
     */
    public TableSchema merge(TableSchema other) {
        Objects.requireNonNull(other, "Schema must not be null");
        Map<String, Field> merged = new LinkedHashMap<>(fields);
        boolean changed = false;
        for (Field field : other.fields.values()) {
            if (merged.putIfAbsent(field.name(), field) == null) {
                changed = true;
            }
        }
        return changed ? new TableSchema(merged) : this;
    }

    /**
     * @return columns of {@code other} that this schema lacks, in order
     */
    public List<Field> missingFrom(TableSchema other) {
        List<Field> missing = new ArrayList<>();
        for (Field field : other.fields.values()) {
            if (!fields.containsKey(field.name())) {
                missing.add(field);
            }
        }
        return missing;
    }

    public List<Field> getFields() {
        return List.copyOf(fields.values());
    }

    public Optional<Field> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TableSchema))
            return false;
        return new ArrayList<>(fields.values()).equals(new ArrayList<>(((TableSchema) o).fields.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(new ArrayList<>(fields.values()));
    }

    @Override
    public String toString() {
        return "TableSchema" + fields.values();
    }

    /**
     * One nullable column.
     *
     * @param name column name
     * @param type BigQuery column type ({@code STRING}, {@code FLOAT64}, ...)
     */
    public record Field(String name, String type) {

        public Field {
            Objects.requireNonNull(name, "Column name must not be null");
            Objects.requireNonNull(type, "Column type must not be null");
        }
    }
}
