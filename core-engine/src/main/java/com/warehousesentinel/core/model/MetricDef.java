package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metric (quantitative measure) of an {@link Entity}.
 *
 * <p>
 * Column-backed metrics are aggregated with {@link #aggregation()} during
 * materialization. Expression-backed metrics must aggregate inside the
 * expression themselves; their declared aggregation is still what reports
 * inherit when they re-aggregate the materialized column.
 * </p>
 *
 * @param type              logical type
 * @param aggregation       default aggregation
 * @param mapping           default mapping, or {@code null} for a same-name
 *                          column
 * @param perSourceOverride source id to mapping
 * @since 1.0.0
 */
public record MetricDef(FieldType type,
                        Aggregation aggregation,
                        FieldMapping mapping,
                        Map<String, FieldMapping> perSourceOverride) {

    public MetricDef {
        Objects.requireNonNull(type, "Metric type must not be null");
        Objects.requireNonNull(aggregation, "Metric aggregation must not be null");
        perSourceOverride = perSourceOverride == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(perSourceOverride));
    }

    public static MetricDef of(Aggregation aggregation) {
        return new MetricDef(FieldType.NUMBER, aggregation, null, null);
    }

    public static MetricDef of(Aggregation aggregation, FieldMapping mapping) {
        return new MetricDef(FieldType.NUMBER, aggregation, mapping, null);
    }
}
