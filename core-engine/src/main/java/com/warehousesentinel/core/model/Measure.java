package com.warehousesentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named, reusable metric expression over an {@link Entity}, watched by
 * monitors.
 *
 * @param id                unique id
 * @param entityId          entity the measure reads from
 * @param name              display name, defaults to the id
 * @param description       free text, may be {@code null}
 * @param value             what is measured
 * @param allowedDimensions dimensions callers may slice by; empty means any
 * @param filters           baseline filters always applied
 * @since 1.0.0
 */
public record Measure(String id,
                      String entityId,
                      String name,
                      String description,
                      Value value,
                      List<String> allowedDimensions,
                      List<FilterCondition> filters) {

    public Measure {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("id is required");
        }
        if (entityId == null || entityId.isBlank()) {
            errors.add("entityId is required");
        }
        if (value == null) {
            errors.add("value is required");
        }
        DefinitionException.throwIfAny("Invalid measure '" + id + "'", errors);
        name = name == null || name.isBlank() ? id : name;
        allowedDimensions = allowedDimensions == null ? List.of() : List.copyOf(allowedDimensions);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    /**
     * Name of the metric column anomalies surface their value under: the
     * measured field, or the measure id for expression measures.
     */
    public String metricName() {
        return value.isExpression() ? id : value.field();
    }

    public boolean allowsDimension(String dimension) {
        return allowedDimensions.isEmpty() || allowedDimensions.contains(dimension);
    }

    /**
     * Measured value: {@code field} aggregated with {@code aggregation}, or a
     * raw aggregate {@code expression}.
     *
     * @param field       entity column, or {@code null}
     * @param aggregation aggregation of {@code field}, or {@code null}
     * @param expression  raw SQL aggregate expression, or {@code null}
     */
    public record Value(String field, Aggregation aggregation, String expression) {

        public Value {
            boolean hasField = field != null && !field.isBlank();
            boolean hasExpression = expression != null && !expression.isBlank();
            if (hasField == hasExpression) {
                throw new DefinitionException("Measure value needs exactly one of field or expression");
            }
            if (hasField) {
                Objects.requireNonNull(aggregation, "Aggregation must not be null for measure field '" + field + "'");
            }
        }

        public static Value of(String field, Aggregation aggregation) {
            return new Value(field, aggregation, null);
        }

        public static Value expression(String expression) {
            return new Value(null, null, expression);
        }

        public boolean isExpression() {
            return expression != null && !expression.isBlank();
        }
    }
}
