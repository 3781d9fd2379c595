package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a detection strategy for one point of one series.
 *
 * @param score   severity in {@code [0, 1]}
 * @param impact  magnitude in the measure's units
 * @param message human-readable explanation
 * @param context triggering date and value plus strategy-specific details;
 *                always contains {@code value}
 * @since 1.0.0
 */
public record Anomaly(double score, double impact, String message, Map<String, Object> context) {

    public Anomaly {
        if (score < 0 || score > 1) {
            throw new IllegalArgumentException("Anomaly score must be within [0, 1], got " + score);
        }
        Objects.requireNonNull(message, "Anomaly message must not be null");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * @return the triggering value recorded in the context, or {@code null}
     */
    public Object value() {
        return context.get("value");
    }
}
