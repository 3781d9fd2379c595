package com.warehousesentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Aggregate function applied to a metric.
 *
 * @since 1.0.0
 */
public enum Aggregation {

    SUM,
    AVG,
    COUNT,
    MIN,
    MAX,
    COUNT_DISTINCT;

    /**
     * Render the aggregate call over a SQL operand.
     *
     * @param operand column or expression SQL
     * @return e.g. {@code SUM(spend)} or {@code COUNT(DISTINCT user_id)}
     */
    public String apply(String operand) {
        if (this == COUNT_DISTINCT) {
            return "COUNT(DISTINCT " + operand + ")";
        }
        return name() + "(" + operand + ")";
    }

    /**
     * Parse an aggregation name as written in definitions ({@code "sum"},
     * {@code "count_distinct"}, ...).
     *
     * @param name aggregation name; must not be {@code null}
     * @return the matching aggregation
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Aggregation fromString(String name) {
        Objects.requireNonNull(name, "Aggregation must not be null");
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Aggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
                return aggregation;
            }
        }
        throw new IllegalArgumentException(
                "Unknown aggregation: '" + name + "'. Supported: sum, avg, count, min, max, count_distinct");
    }
}
