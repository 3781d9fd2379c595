package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates the {@link DetectionStrategy} for a strategy configuration.
 *
 * <p>
 * This is the single point of extension when adding strategy types. Types
 * accepted in definitions but without an implementation fail fast with
 * {@link UnsupportedOperationException} rather than silently detecting
 * nothing.
 * </p>
 *
 * @since 1.0.0
 */
public final class StrategyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyFactory.class);

    private static final DetectionStrategy THRESHOLD = new ThresholdStrategy();
    private static final DetectionStrategy RELATIVE_DELTA = new RelativeDeltaStrategy();
    private static final DetectionStrategy Z_SCORE = new ZScoreStrategy();

    private StrategyFactory() {
        // utility class, not instantiable
    }

    /**
     * @param config strategy configuration; must not be {@code null}
     * @return the shared strategy instance for the configuration's type
     * @throws UnsupportedOperationException for {@code poisson} and
     *                                       {@code seasonal_trend}
     */
    public static DetectionStrategy create(StrategyConfig config) {
        Objects.requireNonNull(config, "Strategy config must not be null");
        StrategyConfig.Type type = config.type();
        DetectionStrategy strategy = switch (type) {
            case THRESHOLD -> THRESHOLD;
            case RELATIVE_DELTA -> RELATIVE_DELTA;
            case Z_SCORE -> Z_SCORE;
            case POISSON, SEASONAL_TREND -> throw new UnsupportedOperationException(
                    "Strategy '" + type.id() + "' is not yet implemented.");
        };
        LOG.trace("Resolved strategy {} for {}", strategy.getClass().getSimpleName(), type.id());
        return strategy;
    }
}
