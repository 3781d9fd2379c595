package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output shape of an {@link AggregateReport}.
 *
 * @param grain             attribution key; the inner query groups by it
 * @param includeDimensions dimensions carried through with {@code ANY_VALUE}
 * @param metrics           output alias to metric definition, in select order
 * @param derivedFields     output alias to derived field, computed over the
 *                          aggregated row
 * @since 1.0.0
 */
public record ReportOutput(List<String> grain,
                           List<String> includeDimensions,
                           Map<String, OutputMetric> metrics,
                           Map<String, DerivedField> derivedFields) {

    public ReportOutput {
        grain = grain == null ? List.of() : List.copyOf(grain);
        includeDimensions = includeDimensions == null ? List.of() : List.copyOf(includeDimensions);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        derivedFields = derivedFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(derivedFields));
    }

    /**
     * Metric of the report output. Either {@code expression} is set, or the
     * metric re-aggregates an entity metric ({@code sourceMetric}, defaulting
     * to the alias) with {@code aggregation}, defaulting to the entity
     * metric's own aggregation.
     *
     * @param sourceMetric entity metric name, or {@code null} for the alias
     * @param aggregation  aggregation override, or {@code null}
     * @param expression   raw SQL aggregate expression, or {@code null}
     */
    public record OutputMetric(String sourceMetric, Aggregation aggregation, String expression) {

        public OutputMetric {
            sourceMetric = sourceMetric == null || sourceMetric.isBlank() ? null : sourceMetric;
            expression = expression == null || expression.isBlank() ? null : expression;
        }

        public static OutputMetric of(String sourceMetric) {
            return new OutputMetric(sourceMetric, null, null);
        }

        public static OutputMetric of(String sourceMetric, Aggregation aggregation) {
            return new OutputMetric(sourceMetric, aggregation, null);
        }

        public static OutputMetric expression(String expression) {
            return new OutputMetric(null, null, expression);
        }

        public boolean isExpression() {
            return expression != null;
        }
    }

    /**
     * Field computed in the outer projection from the aggregated row.
     *
     * @param expression raw SQL expression over output columns
     * @param type       logical type of the result
     */
    public record DerivedField(String expression, FieldType type) {

        public DerivedField {
            Objects.requireNonNull(expression, "Derived field expression must not be null");
            type = type == null ? FieldType.NUMBER : type;
        }
    }
}
