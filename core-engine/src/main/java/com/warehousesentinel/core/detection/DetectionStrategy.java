package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;

import java.util.List;

/**
 * Contract for all detection strategies.
 *
 * <p>
 * Strategies are stateless pure functions over one series: the same series
 * and configuration always give the same anomalies. A single instance may be
 * shared across threads and monitors.
 * </p>
 *
 * @since 1.0.0
 */
public interface DetectionStrategy {

    /**
     * Evaluate one series.
     *
     * @param series points of one dimension combination; not necessarily
     *               sorted
     * @param config configuration of the strategy's own type
     * @return anomalies found, possibly empty; never {@code null}
     * @throws IllegalArgumentException if {@code config} is of another type
     */
    List<Anomaly> detect(List<TimeSeriesPoint> series, StrategyConfig config);

    /**
     * @return the strategy type this implementation evaluates
     */
    StrategyConfig.Type getType();

    /**
     * Narrow a configuration to the type a strategy expects.
     *
     * @param config   configuration passed to {@link #detect}
     * @param expected expected configuration class
     * @return {@code config} as {@code expected}
     * @throws IllegalArgumentException on a type mismatch
     */
    static <C extends StrategyConfig> C expect(StrategyConfig config, Class<C> expected) {
        if (!expected.isInstance(config)) {
            throw new IllegalArgumentException("Expected " + expected.getSimpleName() + " but got "
                    + (config == null ? "null" : config.getClass().getSimpleName()));
        }
        return expected.cast(config);
    }
}
