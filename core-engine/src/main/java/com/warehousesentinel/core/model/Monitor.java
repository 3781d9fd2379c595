package com.warehousesentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A statistical watch over one {@link Measure}.
 *
 * <p>
 * Each run re-evaluates the last {@code lookbackDays} days, splits the
 * measure into one time series per combination of the scan dimensions,
 * drops series whose total volume is below {@code minVolume}, and runs the
 * configured strategy on the rest.
 * </p>
 *
 * @since 1.0.0
 */
public final class Monitor {

    /** Dataset every monitor appends its anomalies to. */
    public static final String ANOMALY_DATASET = "anomalies";

    private final String id;
    private final String measureId;
    private final boolean enabled;
    private final String schedule;
    private final int lookbackDays;
    private final ScanConfig scanConfig;
    private final StrategyConfig strategy;
    private final Classification classification;
    private final ImpactConfig impact;
    private final List<String> contextMetrics;

    private Monitor(Builder builder) {
        this.id = builder.id;
        this.measureId = builder.measureId;
        this.enabled = builder.enabled;
        this.schedule = builder.schedule;
        this.lookbackDays = builder.lookbackDays;
        this.scanConfig = builder.scanConfig;
        this.strategy = builder.strategy;
        this.classification = builder.classification;
        this.impact = builder.impact;
        this.contextMetrics = List.copyOf(builder.contextMetrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return table the monitor's anomalies are appended to
     */
    public String anomalyTable() {
        return Names.snakeCase(id);
    }

    // ---------------------------------------------------------------
    // Nested value types
    // ---------------------------------------------------------------

    /**
     * Series split and pruning settings.
     *
     * @param dimensions dimensions forming the series key; the date field is
     *                   added implicitly
     * @param minVolume  series whose value sum is below this are skipped
     * @param filters    extra filters merged with the measure's own
     */
    public record ScanConfig(List<String> dimensions, double minVolume, List<FilterCondition> filters) {

        public ScanConfig {
            dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
            filters = filters == null ? List.of() : List.copyOf(filters);
        }
    }

    public enum Classification {
        KNOWN_PROBLEM, HEURISTIC, STATISTICAL, EFFICIENCY, CREATIVE;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Classification fromString(String value) {
            return value == null ? HEURISTIC : valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ImpactType {
        FINANCIAL, PERFORMANCE, OPERATIONAL;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static ImpactType fromString(String value) {
            Objects.requireNonNull(value, "Impact type must not be null");
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * How an anomaly's impact is reported.
     *
     * @param type       impact category
     * @param unit       display unit, may be {@code null}
     * @param multiplier factor applied to financial impact, defaults to 1
     */
    public record ImpactConfig(ImpactType type, String unit, double multiplier) {

        public ImpactConfig {
            Objects.requireNonNull(type, "Impact type must not be null");
        }

        public static ImpactConfig of(ImpactType type, String unit) {
            return new ImpactConfig(type, unit, 1.0);
        }

        public boolean isFinancial() {
            return type == ImpactType.FINANCIAL;
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getMeasureId() {
        return measureId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<String> getSchedule() {
        return Optional.ofNullable(schedule);
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public ScanConfig getScanConfig() {
        return scanConfig;
    }

    public StrategyConfig getStrategy() {
        return strategy;
    }

    public Classification getClassification() {
        return classification;
    }

    public Optional<ImpactConfig> getImpact() {
        return Optional.ofNullable(impact);
    }

    public List<String> getContextMetrics() {
        return contextMetrics;
    }

    @Override
    public String toString() {
        return "Monitor{" +
                "id='" + id + '\'' +
                ", measureId='" + measureId + '\'' +
                ", strategy=" + strategy.type().id() +
                ", enabled=" + enabled +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Monitor}.
     */
    public static class Builder {
        private String id;
        private String measureId;
        private boolean enabled = true;
        private String schedule;
        private int lookbackDays;
        private ScanConfig scanConfig;
        private StrategyConfig strategy;
        private Classification classification = Classification.HEURISTIC;
        private ImpactConfig impact;
        private final List<String> contextMetrics = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder measureId(String measureId) {
            this.measureId = measureId;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder lookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
            return this;
        }

        public Builder scanConfig(ScanConfig scanConfig) {
            this.scanConfig = scanConfig;
            return this;
        }

        public Builder strategy(StrategyConfig strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder classification(Classification classification) {
            this.classification = classification == null ? Classification.HEURISTIC : classification;
            return this;
        }

        public Builder impact(ImpactConfig impact) {
            this.impact = impact;
            return this;
        }

        public Builder contextMetrics(List<String> metrics) {
            this.contextMetrics.addAll(metrics);
            return this;
        }

        /**
         * Validate and build the monitor.
         *
         * @return a new immutable {@link Monitor}
         * @throws DefinitionException if any invariant is violated
         */
        public Monitor build() {
            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("id is required");
            }
            if (measureId == null || measureId.isBlank()) {
                errors.add("measureId is required");
            }
            if (lookbackDays <= 0) {
                errors.add("lookbackDays must be > 0, got " + lookbackDays);
            }
            if (strategy == null) {
                errors.add("strategy is required");
            }
            if (scanConfig == null) {
                errors.add("scanConfig is required");
            } else {
                if (scanConfig.dimensions().isEmpty()) {
                    errors.add("scanConfig.dimensions must not be empty");
                }
                if (scanConfig.minVolume() < 0) {
                    errors.add("scanConfig.minVolume must be >= 0, got " + scanConfig.minVolume());
                }
            }
            DefinitionException.throwIfAny("Invalid monitor '" + id + "'", errors);
            return new Monitor(this);
        }
    }
}
