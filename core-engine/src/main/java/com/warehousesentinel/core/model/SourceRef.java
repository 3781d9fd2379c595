package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A raw (bronze) table feeding an {@link Entity}.
 *
 * @param id             identifier used by per-source overrides
 * @param dataset        raw dataset
 * @param table          raw table
 * @param columns        columns known to exist in the raw table; empty when
 *                       unknown, which disables column checks
 * @param fieldOverrides entity field name to mapping, applied to every field
 *                       of this source that has no field-level override
 * @param filter         optional predicate-language row filter, or
 *                       {@code null}
 * @since 1.0.0
 */
public record SourceRef(String id,
                        String dataset,
                        String table,
                        Set<String> columns,
                        Map<String, FieldMapping> fieldOverrides,
                        String filter) {

    public SourceRef {
        Objects.requireNonNull(id, "Source id must not be null");
        Objects.requireNonNull(dataset, "Source dataset must not be null for source '" + id + "'");
        Objects.requireNonNull(table, "Source table must not be null for source '" + id + "'");
        columns = columns == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(columns));
        fieldOverrides = fieldOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldOverrides));
        filter = filter == null || filter.isBlank() ? null : filter;
    }

    public static SourceRef of(String id, String dataset, String table) {
        return new SourceRef(id, dataset, table, null, null, null);
    }

    public boolean hasKnownColumns() {
        return !columns.isEmpty();
    }

    /**
     * @return {@code dataset.table}
     */
    public String fqn() {
        return dataset + "." + table;
    }
}
