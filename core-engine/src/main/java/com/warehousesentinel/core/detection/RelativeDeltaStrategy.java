package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.StrategyConfig.RelativeDeltaConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Percentage change between consecutive points.
 *
 * <p>
 * Points are sorted by timestamp. For each consecutive pair whose previous
 * value is non-zero the change {@code (curr - prev) * 100 / prev} is
 * computed; a pair is flagged only when {@code |change|} is strictly greater
 * than {@code maxDeltaPct}, so a change exactly at the limit passes.
 * </p>
 *
 * <ul>
 * <li>score: {@code min(|change| / maxDeltaPct, 1)}</li>
 * <li>impact: {@code |curr - prev|}</li>
 * <li>context: both points' date and value</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RelativeDeltaStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(RelativeDeltaStrategy.class);

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> series, StrategyConfig config) {
        Objects.requireNonNull(series, "Series must not be null");
        RelativeDeltaConfig delta = DetectionStrategy.expect(config, RelativeDeltaConfig.class);
        if (series.size() < 2) {
            return List.of();
        }

        List<TimeSeriesPoint> sorted = new ArrayList<>(series);
        sorted.sort(Comparator.comparing(TimeSeriesPoint::timestamp));

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            TimeSeriesPoint previous = sorted.get(i - 1);
            TimeSeriesPoint current = sorted.get(i);
            if (previous.value() == 0) {
                continue;
            }
            double changePct = (current.value() - previous.value()) * 100 / previous.value();
            double absChangePct = Math.abs(changePct);
            if (!(absChangePct > delta.maxDeltaPct())) {
                continue;
            }
            String message = "Change of " + Numbers.fixed2(changePct) + "% exceeds limit of "
                    + Numbers.plain(delta.maxDeltaPct()) + "%";
            LOG.debug("Relative delta fired at {}: {}", current.timestamp(), message);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("date", current.timestamp());
            context.put("value", current.value());
            context.put("previousDate", previous.timestamp());
            context.put("previousValue", previous.value());
            anomalies.add(new Anomaly(
                    Math.min(absChangePct / delta.maxDeltaPct(), 1.0),
                    Math.abs(current.value() - previous.value()),
                    message,
                    context));
        }
        return anomalies;
    }

    @Override
    public StrategyConfig.Type getType() {
        return StrategyConfig.Type.RELATIVE_DELTA;
    }
}
