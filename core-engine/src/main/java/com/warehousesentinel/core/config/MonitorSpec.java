package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.FilterCondition;
import com.warehousesentinel.core.model.Monitor;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.StrategyConfig.PoissonConfig;
import com.warehousesentinel.core.model.StrategyConfig.SeasonalTrendConfig;
import com.warehousesentinel.core.model.StrategyConfig.ZScoreConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML bean for a monitor.
 *
 * <pre>
 * - id: spend_spike
 *   measure: daily_spend
 *   lookbackDays: 30
 *   scan:
 *     dimensions: [account_id, date]
 *     minVolume: 10
 *   strategy:
 *     type: z_score
 *     threshold: 3
 *     minDataPoints: 14
 *   classification: statistical
 *   impact: { type: financial, unit: USD }
 *   contextMetrics: [clicks]
 * </pre>
 *
 * <p>
 * The strategy block is flat: {@code type} selects which of the remaining
 * keys are read.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorSpec {

    private String id;
    private String measure;
    private boolean enabled = true;
    private String schedule;
    private int lookbackDays = 30;
    private ScanSpec scan;
    private StrategySpec strategy;
    private String classification;
    private ImpactSpec impact;
    private List<String> contextMetrics = new ArrayList<>();

    /**
     * @return the validated monitor
     * @throws DefinitionException if the definition is invalid
     */
    public Monitor toMonitor() {
        List<String> errors = new ArrayList<>();
        Monitor.Builder builder = Monitor.builder()
                .id(id)
                .measureId(measure)
                .enabled(enabled)
                .schedule(schedule)
                .lookbackDays(lookbackDays)
                .contextMetrics(contextMetrics);
        if (scan != null) {
            try {
                builder.scanConfig(scan.toScanConfig());
            } catch (IllegalArgumentException e) {
                errors.add("scan: " + e.getMessage());
            }
        }
        if (strategy != null) {
            try {
                builder.strategy(strategy.toConfig());
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add("strategy: " + e.getMessage());
            }
        }
        try {
            builder.classification(Monitor.Classification.fromString(classification));
        } catch (IllegalArgumentException e) {
            errors.add("unknown classification '" + classification + "'");
        }
        if (impact != null) {
            try {
                builder.impact(impact.toImpactConfig());
            } catch (IllegalArgumentException e) {
                errors.add("impact: " + e.getMessage());
            }
        }
        DefinitionException.throwIfAny("Invalid monitor '" + id + "'", errors);
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getMeasure() {
        return measure;
    }

    public void setMeasure(String measure) {
        this.measure = measure;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public ScanSpec getScan() {
        return scan;
    }

    public void setScan(ScanSpec scan) {
        this.scan = scan;
    }

    public StrategySpec getStrategy() {
        return strategy;
    }

    public void setStrategy(StrategySpec strategy) {
        this.strategy = strategy;
    }

    public String getClassification() {
        return classification;
    }

    public void setClassification(String classification) {
        this.classification = classification;
    }

    public ImpactSpec getImpact() {
        return impact;
    }

    public void setImpact(ImpactSpec impact) {
        this.impact = impact;
    }

    public List<String> getContextMetrics() {
        return contextMetrics;
    }

    public void setContextMetrics(List<String> contextMetrics) {
        this.contextMetrics = contextMetrics != null ? contextMetrics : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MonitorSpec{id='" + id + "', measure='" + measure + "', strategy="
                + (strategy == null ? null : strategy.getType()) + '}';
    }

    // ---------------------------------------------------------------
    // Nested beans
    // ---------------------------------------------------------------

    public static class ScanSpec {

        private List<String> dimensions = new ArrayList<>();
        private double minVolume;
        private List<FilterSpec> filters = new ArrayList<>();

        Monitor.ScanConfig toScanConfig() {
            List<FilterCondition> conditions = new ArrayList<>();
            for (FilterSpec filter : filters) {
                conditions.add(filter.toCondition());
            }
            return new Monitor.ScanConfig(dimensions, minVolume, conditions);
        }

        public List<String> getDimensions() {
            return dimensions;
        }

        public void setDimensions(List<String> dimensions) {
            this.dimensions = dimensions != null ? dimensions : new ArrayList<>();
        }

        public double getMinVolume() {
            return minVolume;
        }

        public void setMinVolume(double minVolume) {
            this.minVolume = minVolume;
        }

        public List<FilterSpec> getFilters() {
            return filters;
        }

        public void setFilters(List<FilterSpec> filters) {
            this.filters = filters != null ? filters : new ArrayList<>();
        }
    }

    public static class StrategySpec {

        private String type;

        // threshold
        private Double min;
        private Double max;

        // relative_delta
        private String comparison;
        private Double maxDeltaPct;

        // z_score
        private Double threshold;
        private Integer minDataPoints;

        // poisson
        private Double confidence;

        // seasonal_trend
        private Integer seasonalityPeriod;

        StrategyConfig toConfig() {
            if (MappingSpec.isBlank(type)) {
                throw new DefinitionException("strategy type is required");
            }
            StrategyConfig.Type strategyType = StrategyConfig.Type.fromString(type);
            return switch (strategyType) {
                case THRESHOLD -> new StrategyConfig.ThresholdConfig(min, max);
                case RELATIVE_DELTA -> {
                    if (maxDeltaPct == null) {
                        throw new DefinitionException("relative_delta needs maxDeltaPct");
                    }
                    yield new StrategyConfig.RelativeDeltaConfig(
                            StrategyConfig.Comparison.fromString(comparison), maxDeltaPct);
                }
                case Z_SCORE -> new ZScoreConfig(
                        threshold != null ? threshold : ZScoreConfig.DEFAULT_THRESHOLD,
                        minDataPoints != null ? minDataPoints : ZScoreConfig.DEFAULT_MIN_DATA_POINTS);
                case POISSON -> new PoissonConfig(
                        confidence != null ? confidence : PoissonConfig.DEFAULT_CONFIDENCE);
                case SEASONAL_TREND -> new SeasonalTrendConfig(
                        seasonalityPeriod != null ? seasonalityPeriod : SeasonalTrendConfig.DEFAULT_SEASONALITY_PERIOD);
            };
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public String getComparison() {
            return comparison;
        }

        public void setComparison(String comparison) {
            this.comparison = comparison;
        }

        public Double getMaxDeltaPct() {
            return maxDeltaPct;
        }

        public void setMaxDeltaPct(Double maxDeltaPct) {
            this.maxDeltaPct = maxDeltaPct;
        }

        public Double getThreshold() {
            return threshold;
        }

        public void setThreshold(Double threshold) {
            this.threshold = threshold;
        }

        public Integer getMinDataPoints() {
            return minDataPoints;
        }

        public void setMinDataPoints(Integer minDataPoints) {
            this.minDataPoints = minDataPoints;
        }

        public Double getConfidence() {
            return confidence;
        }

        public void setConfidence(Double confidence) {
            this.confidence = confidence;
        }

        public Integer getSeasonalityPeriod() {
            return seasonalityPeriod;
        }

        public void setSeasonalityPeriod(Integer seasonalityPeriod) {
            this.seasonalityPeriod = seasonalityPeriod;
        }
    }

    public static class ImpactSpec {

        private String type;
        private String unit;
        private double multiplier = 1.0;

        Monitor.ImpactConfig toImpactConfig() {
            if (MappingSpec.isBlank(type)) {
                throw new IllegalArgumentException("impact type is required");
            }
            return new Monitor.ImpactConfig(Monitor.ImpactType.fromString(type), unit, multiplier);
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUnit() {
            return unit;
        }

        public void setUnit(String unit) {
            this.unit = unit;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
