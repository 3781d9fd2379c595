package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observation of a measure.
 *
 * @param timestamp ISO-8601 date or timestamp text; points of one series
 *                  sort chronologically by this text
 * @param value     measure value
 * @param metrics   context metric values at the same timestamp
 * @since 1.0.0
 */
public record TimeSeriesPoint(String timestamp, double value, Map<String, Double> metrics) {

    public TimeSeriesPoint {
        Objects.requireNonNull(timestamp, "Point timestamp must not be null");
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static TimeSeriesPoint of(String timestamp, double value) {
        return new TimeSeriesPoint(timestamp, value, Map.of());
    }
}
