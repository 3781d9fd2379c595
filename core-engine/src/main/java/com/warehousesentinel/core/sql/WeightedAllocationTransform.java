package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldMapping;
import com.warehousesentinel.core.model.Names;
import com.warehousesentinel.core.model.SourceRef;
import com.warehousesentinel.core.model.TransformQueryBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Join-based transform that splits an amount across channels.
 *
 * <p>
 * The base source (alias {@code c}) is joined with a carve-out source whose
 * amount is verified directly, for example shopping spend taken from listing
 * groups. What is left after the carve-out (the residual) is spread over the
 * allocation metrics in proportion to their weight expressions. When every
 * weight is zero the whole residual goes to the fallback metric.
 * </p>
 *
 * <h3>Output columns</h3>
 * <ul>
 * <li>grain fields and non-grain dimensions, resolved against the base
 * source</li>
 * <li>{@code totalMetric}: base amount</li>
 * <li>{@code carveOutMetric}: carve-out amount, 0 when absent</li>
 * <li>{@code residualMetric}: {@code GREATEST(total - carve_out, 0)}</li>
 * <li>one column per allocation metric</li>
 * <li>pass-through metrics, aggregate SQL over the base rows</li>
 * </ul>
 * <p>
 * Every entity metric must be produced by one of these columns.
 * </p>
 *
 * @since 1.0.0
 */
public final class WeightedAllocationTransform implements TransformQueryBuilder {

    private final String baseSourceId;
    private final String carveOutSourceId;
    private final List<String> joinKeys;
    private final String amountColumn;
    private final String baseFilter;
    private final String carveOutFilter;
    private final String totalMetric;
    private final String carveOutMetric;
    private final String residualMetric;
    private final Map<String, String> weights;
    private final String fallbackMetric;
    private final Map<String, String> passThrough;

    private WeightedAllocationTransform(Builder builder) {
        this.baseSourceId = builder.baseSourceId;
        this.carveOutSourceId = builder.carveOutSourceId;
        this.joinKeys = List.copyOf(builder.joinKeys);
        this.amountColumn = builder.amountColumn;
        this.baseFilter = builder.baseFilter;
        this.carveOutFilter = builder.carveOutFilter;
        this.totalMetric = builder.totalMetric;
        this.carveOutMetric = builder.carveOutMetric;
        this.residualMetric = builder.residualMetric;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(builder.weights));
        this.fallbackMetric = builder.fallbackMetric != null
                ? builder.fallbackMetric
                : new ArrayList<>(builder.weights.keySet()).get(builder.weights.size() - 1);
        this.passThrough = Collections.unmodifiableMap(new LinkedHashMap<>(builder.passThrough));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String buildQuery(Entity entity) {
        SourceRef base = source(entity, baseSourceId);
        SourceRef carveOut = source(entity, carveOutSourceId);
        checkCoverage(entity);

        List<String> dimensions = new ArrayList<>(entity.getGrain());
        dimensions.addAll(entity.nonGrainDimensions());

        String residual = "GREATEST(total_amount - carve_amount, 0)";
        String weightSum = weights.keySet().stream()
                .map(WeightedAllocationTransform::weightColumn)
                .collect(Collectors.joining(" + "));

        StringBuilder sql = new StringBuilder("WITH carve_out AS (\n  SELECT\n    ");
        List<String> carveColumns = new ArrayList<>();
        for (String key : joinKeys) {
            carveColumns.add(entity.resolve(key, carveOut).sql() + " AS " + key);
        }
        carveColumns.add("SUM(SAFE_CAST(" + amountColumn + " AS FLOAT64)) AS carve_amount");
        sql.append(String.join(",\n    ", carveColumns))
                .append("\n  FROM `").append(carveOut.fqn()).append('`');
        if (carveOutFilter != null) {
            sql.append("\n  WHERE ").append(carveOutFilter);
        }
        sql.append("\n  GROUP BY ").append(ordinals(joinKeys.size())).append("\n),\n");

        List<String> allocatedColumns = new ArrayList<>();
        for (String dimension : dimensions) {
            allocatedColumns.add(baseColumn(entity.resolve(dimension, base)) + " AS " + dimension);
        }
        allocatedColumns.add("COALESCE(SUM(SAFE_CAST(c." + amountColumn + " AS FLOAT64)), 0) AS total_amount");
        allocatedColumns.add("COALESCE(ANY_VALUE(l.carve_amount), 0) AS carve_amount");
        weights.forEach((metric, weight) ->
                allocatedColumns.add("COALESCE(" + weight + ", 0) AS " + weightColumn(metric)));
        passThrough.forEach((metric, expression) -> allocatedColumns.add(expression + " AS " + metric));

        String joinCondition = joinKeys.stream()
                .map(key -> baseColumn(entity.resolve(key, base)) + " = l." + key)
                .collect(Collectors.joining(" AND "));
        sql.append("allocated AS (\n  SELECT\n    ")
                .append(String.join(",\n    ", allocatedColumns))
                .append("\n  FROM `").append(base.fqn()).append("` AS c")
                .append("\n  LEFT JOIN carve_out AS l ON ").append(joinCondition);
        if (baseFilter != null) {
            sql.append("\n  WHERE ").append(baseFilter);
        }
        sql.append("\n  GROUP BY ").append(ordinals(dimensions.size())).append("\n)\n");

        List<String> finalColumns = new ArrayList<>(dimensions);
        finalColumns.add("total_amount AS " + totalMetric);
        finalColumns.add("carve_amount AS " + carveOutMetric);
        finalColumns.add(residual + " AS " + residualMetric);
        for (String metric : weights.keySet()) {
            String whenUnweighted = metric.equals(fallbackMetric) ? residual : "0";
            finalColumns.add("CASE\n    WHEN " + residual + " <= 0 THEN 0"
                    + "\n    WHEN (" + weightSum + ") = 0 THEN " + whenUnweighted
                    + "\n    ELSE " + residual + " * SAFE_DIVIDE(" + weightColumn(metric) + ", " + weightSum + ")"
                    + "\n  END AS " + metric);
        }
        finalColumns.addAll(passThrough.keySet());
        return sql.append("SELECT\n  ")
                .append(String.join(",\n  ", finalColumns))
                .append("\nFROM allocated")
                .toString();
    }

    public String getFallbackMetric() {
        return fallbackMetric;
    }

    @Override
    public String toString() {
        return "WeightedAllocationTransform{base=" + baseSourceId
                + ", carveOut=" + carveOutSourceId
                + ", weights=" + weights.keySet() + '}';
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void checkCoverage(Entity entity) {
        Set<String> produced = new LinkedHashSet<>(List.of(totalMetric, carveOutMetric, residualMetric));
        produced.addAll(weights.keySet());
        produced.addAll(passThrough.keySet());

        List<String> errors = new ArrayList<>();
        for (String metric : entity.getMetrics().keySet()) {
            if (!produced.contains(metric)) {
                errors.add("metric '" + metric + "' is not produced by the allocation");
            }
        }
        for (String key : joinKeys) {
            if (!entity.getGrain().contains(key)) {
                errors.add("join key '" + key + "' is not a grain field");
            }
        }
        DefinitionException.throwIfAny("Weighted allocation of entity '" + entity.getId() + "'", errors);
    }

    private static SourceRef source(Entity entity, String id) {
        return entity.getSources().stream()
                .filter(source -> source.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new DefinitionException(
                        "Weighted allocation of entity '" + entity.getId() + "' names unknown source '" + id + "'"));
    }

    private static String baseColumn(FieldMapping mapping) {
        return mapping.isExpression() ? mapping.expression() : "c." + mapping.sourceField();
    }

    private static String weightColumn(String metric) {
        return "weight_" + metric;
    }

    private static String ordinals(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(", "));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String baseSourceId;
        private String carveOutSourceId;
        private List<String> joinKeys = new ArrayList<>();
        private String amountColumn;
        private String baseFilter;
        private String carveOutFilter;
        private String totalMetric;
        private String carveOutMetric;
        private String residualMetric;
        private final Map<String, String> weights = new LinkedHashMap<>();
        private String fallbackMetric;
        private final Map<String, String> passThrough = new LinkedHashMap<>();

        public Builder baseSource(String sourceId) {
            this.baseSourceId = sourceId;
            return this;
        }

        public Builder carveOutSource(String sourceId) {
            this.carveOutSourceId = sourceId;
            return this;
        }

        public Builder joinKeys(List<String> keys) {
            this.joinKeys = keys == null ? new ArrayList<>() : new ArrayList<>(keys);
            return this;
        }

        /** Raw column holding the amount in both sources. */
        public Builder amountColumn(String column) {
            this.amountColumn = column;
            return this;
        }

        /** Raw SQL filter over the base rows, alias {@code c}. */
        public Builder baseFilter(String filter) {
            this.baseFilter = filter == null || filter.isBlank() ? null : filter;
            return this;
        }

        /** Raw SQL filter over the carve-out source rows. */
        public Builder carveOutFilter(String filter) {
            this.carveOutFilter = filter == null || filter.isBlank() ? null : filter;
            return this;
        }

        public Builder totalMetric(String metric) {
            this.totalMetric = metric;
            return this;
        }

        public Builder carveOutMetric(String metric) {
            this.carveOutMetric = metric;
            return this;
        }

        public Builder residualMetric(String metric) {
            this.residualMetric = metric;
            return this;
        }

        /**
         * @param metric entity metric receiving a share of the residual
         * @param weight aggregate SQL over the base rows (alias {@code c})
         */
        public Builder weight(String metric, String weight) {
            this.weights.put(metric, weight);
            return this;
        }

        /** Allocation metric taking the whole residual when all weights are 0; defaults to the last one. */
        public Builder fallbackMetric(String metric) {
            this.fallbackMetric = metric;
            return this;
        }

        public Builder passThrough(String metric, String aggregateSql) {
            this.passThrough.put(metric, aggregateSql);
            return this;
        }

        /**
         * @return a validated transform
         * @throws DefinitionException if any setting is missing or invalid
         */
        public WeightedAllocationTransform build() {
            List<String> errors = new ArrayList<>();
            requireName("baseSource", baseSourceId, errors);
            requireName("carveOutSource", carveOutSourceId, errors);
            if (baseSourceId != null && baseSourceId.equals(carveOutSourceId)) {
                errors.add("baseSource and carveOutSource must differ");
            }
            if (joinKeys.isEmpty()) {
                errors.add("joinKeys must not be empty");
            }
            joinKeys.forEach(key -> requireIdentifier("join key", key, errors));
            requireIdentifier("amountColumn", amountColumn, errors);
            requireIdentifier("totalMetric", totalMetric, errors);
            requireIdentifier("carveOutMetric", carveOutMetric, errors);
            requireIdentifier("residualMetric", residualMetric, errors);
            if (weights.isEmpty()) {
                errors.add("at least one weight is required");
            }
            weights.forEach((metric, weight) -> {
                requireIdentifier("weighted metric", metric, errors);
                if (weight == null || weight.isBlank()) {
                    errors.add("weight of '" + metric + "' must not be blank");
                }
            });
            if (fallbackMetric != null && !weights.containsKey(fallbackMetric)) {
                errors.add("fallbackMetric '" + fallbackMetric + "' is not a weighted metric");
            }
            passThrough.forEach((metric, expression) -> {
                requireIdentifier("pass-through metric", metric, errors);
                if (expression == null || expression.isBlank()) {
                    errors.add("pass-through '" + metric + "' must not be blank");
                }
            });
            DefinitionException.throwIfAny("Invalid weighted allocation", errors);
            return new WeightedAllocationTransform(this);
        }

        private static void requireName(String name, String value, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add(name + " is required");
            }
        }

        private static void requireIdentifier(String name, String value, List<String> errors) {
            if (!Names.isSqlIdentifier(value)) {
                errors.add(name + " '" + value + "' is not a valid identifier");
            }
        }
    }

}
