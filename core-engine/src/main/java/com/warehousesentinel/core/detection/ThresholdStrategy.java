package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.StrategyConfig.ThresholdConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static bounds on every point of a series.
 *
 * <p>
 * A point is flagged when its value is below {@code min} or above
 * {@code max}. The detector is binary, so the score is always {@code 1.0};
 * the impact is the distance to the violated bound. The anomaly context
 * carries the point's date, value and context metrics.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdStrategy.class);

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> series, StrategyConfig config) {
        Objects.requireNonNull(series, "Series must not be null");
        ThresholdConfig threshold = DetectionStrategy.expect(config, ThresholdConfig.class);

        List<Anomaly> anomalies = new ArrayList<>();
        for (TimeSeriesPoint point : series) {
            double value = point.value();
            String message;
            double bound;
            if (threshold.max() != null && value > threshold.max()) {
                bound = threshold.max();
                message = "Value " + Numbers.plain(value) + " is above maximum threshold " + Numbers.plain(bound);
            } else if (threshold.min() != null && value < threshold.min()) {
                bound = threshold.min();
                message = "Value " + Numbers.plain(value) + " is below minimum threshold " + Numbers.plain(bound);
            } else {
                continue;
            }
            LOG.debug("Threshold fired at {}: {}", point.timestamp(), message);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("date", point.timestamp());
            context.put("value", value);
            context.putAll(point.metrics());
            anomalies.add(new Anomaly(1.0, Math.abs(value - bound), message, context));
        }
        return anomalies;
    }

    @Override
    public StrategyConfig.Type getType() {
        return StrategyConfig.Type.THRESHOLD;
    }
}
