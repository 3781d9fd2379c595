package com.warehousesentinel.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-account ranking declared on an {@link Entity}: for every target metric,
 * the dimension item with the highest (or lowest) aggregated value.
 *
 * <p>
 * Items are grouped by {@code dimensionId} and displayed through
 * {@code dimensionLabel}. Without an {@code expression} each target metric is
 * aggregated with its entity aggregation; with one, the expression is the
 * aggregate SQL and the single target metric only names the result.
 * </p>
 *
 * @param dimensionId    column identifying an item
 * @param dimensionLabel column naming an item
 * @param targetMetrics  metrics to rank on, at least one
 * @param expression     aggregate SQL replacing the metric's aggregation, or
 *                       {@code null}
 * @param rankType       which end of the ranking to keep
 * @since 1.0.0
 */
public record Superlative(String dimensionId,
                          String dimensionLabel,
                          List<String> targetMetrics,
                          String expression,
                          RankType rankType) {

    public Superlative {
        Objects.requireNonNull(dimensionId, "Superlative dimensionId must not be null");
        Objects.requireNonNull(dimensionLabel, "Superlative dimensionLabel must not be null");
        targetMetrics = targetMetrics == null ? List.of() : List.copyOf(targetMetrics);
        if (expression != null && expression.isBlank()) {
            expression = null;
        }
        rankType = rankType == null ? RankType.HIGHEST : rankType;
    }

    public static Superlative of(String dimensionId, String dimensionLabel, String... targetMetrics) {
        return new Superlative(dimensionId, dimensionLabel, List.of(targetMetrics), null, RankType.HIGHEST);
    }

    public boolean hasExpression() {
        return expression != null;
    }

    /**
     * End of the ranking a superlative keeps.
     */
    public enum RankType {

        HIGHEST("DESC"),
        LOWEST("ASC");

        private final String direction;

        RankType(String direction) {
            this.direction = direction;
        }

        /**
         * @return SQL sort direction putting the winner first
         */
        public String direction() {
            return direction;
        }

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * @param name {@code highest} or {@code lowest}, any case
         * @return the matching rank type
         * @throws IllegalArgumentException if the name is unknown
         */
        public static RankType fromString(String name) {
            Objects.requireNonNull(name, "Rank type must not be null");
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (RankType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown rank type: '" + name + "'. Supported: highest, lowest");
        }
    }
}
