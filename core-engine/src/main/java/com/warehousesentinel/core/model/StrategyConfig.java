package com.warehousesentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Detection strategy configuration of a {@link Monitor}, one record per
 * strategy type. Each record validates its parameters at construction.
 *
 * @since 1.0.0
 */
public sealed interface StrategyConfig
        permits StrategyConfig.ThresholdConfig, StrategyConfig.RelativeDeltaConfig,
        StrategyConfig.ZScoreConfig, StrategyConfig.PoissonConfig,
        StrategyConfig.SeasonalTrendConfig {

    Type type();

    /**
     * Strategy type names as written in definitions.
     */
    enum Type {
        THRESHOLD("threshold"),
        RELATIVE_DELTA("relative_delta"),
        Z_SCORE("z_score"),
        POISSON("poisson"),
        SEASONAL_TREND("seasonal_trend");

        private final String id;

        Type(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        public static Type fromString(String value) {
            Objects.requireNonNull(value, "Strategy type must not be null");
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Type type : values()) {
                if (type.id.equals(normalized)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown strategy type: '" + value
                    + "'. Supported: threshold, relative_delta, z_score, poisson, seasonal_trend");
        }
    }

    // ---------------------------------------------------------------
    // Configurations
    // ---------------------------------------------------------------

    /**
     * Flags values below {@code min} or above {@code max}. At least one bound
     * is required.
     */
    record ThresholdConfig(Double min, Double max) implements StrategyConfig {
        public ThresholdConfig {
            if (min == null && max == null) {
                throw new DefinitionException("Threshold strategy needs at least one of min or max");
            }
            if (min != null && max != null && min > max) {
                throw new DefinitionException("Threshold min " + min + " is greater than max " + max);
            }
        }

        public static ThresholdConfig max(double max) {
            return new ThresholdConfig(null, max);
        }

        public static ThresholdConfig min(double min) {
            return new ThresholdConfig(min, null);
        }

        @Override
        public Type type() {
            return Type.THRESHOLD;
        }
    }

    /**
     * Flags consecutive points whose percentage change exceeds
     * {@code maxDeltaPct}.
     */
    record RelativeDeltaConfig(Comparison comparison, double maxDeltaPct) implements StrategyConfig {
        public RelativeDeltaConfig {
            comparison = comparison == null ? Comparison.PREVIOUS_PERIOD : comparison;
            if (!(maxDeltaPct > 0)) {
                throw new DefinitionException("Relative delta maxDeltaPct must be > 0, got " + maxDeltaPct);
            }
        }

        @Override
        public Type type() {
            return Type.RELATIVE_DELTA;
        }
    }

    enum Comparison {
        PREVIOUS_PERIOD, YEAR_OVER_YEAR;

        public static Comparison fromString(String value) {
            return value == null ? PREVIOUS_PERIOD : valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Flags points more than {@code threshold} population standard deviations
     * from the series mean.
     */
    record ZScoreConfig(double threshold, int minDataPoints) implements StrategyConfig {

        public static final double DEFAULT_THRESHOLD = 3.0;
        public static final int DEFAULT_MIN_DATA_POINTS = 14;

        public ZScoreConfig {
            if (!(threshold > 0)) {
                throw new DefinitionException("Z-score threshold must be > 0, got " + threshold);
            }
            if (minDataPoints < 2) {
                throw new DefinitionException("Z-score minDataPoints must be >= 2, got " + minDataPoints);
            }
        }

        public static ZScoreConfig defaults() {
            return new ZScoreConfig(DEFAULT_THRESHOLD, DEFAULT_MIN_DATA_POINTS);
        }

        @Override
        public Type type() {
            return Type.Z_SCORE;
        }
    }

    /** Rare-event detection; accepted in definitions, not executable yet. */
    record PoissonConfig(double confidence) implements StrategyConfig {

        public static final double DEFAULT_CONFIDENCE = 0.99;

        public PoissonConfig {
            if (!(confidence > 0 && confidence < 1)) {
                throw new DefinitionException("Poisson confidence must be in (0, 1), got " + confidence);
            }
        }

        @Override
        public Type type() {
            return Type.POISSON;
        }
    }

    /** Seasonality-aware detection; accepted in definitions, not executable yet. */
    record SeasonalTrendConfig(int seasonalityPeriod) implements StrategyConfig {

        public static final int DEFAULT_SEASONALITY_PERIOD = 7;

        public SeasonalTrendConfig {
            if (seasonalityPeriod < 2) {
                throw new DefinitionException("Seasonality period must be >= 2, got " + seasonalityPeriod);
            }
        }

        @Override
        public Type type() {
            return Type.SEASONAL_TREND;
        }
    }
}
