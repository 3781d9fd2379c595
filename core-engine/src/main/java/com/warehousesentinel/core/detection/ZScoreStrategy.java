package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.StrategyConfig.ZScoreConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Statistical outlier detection over the whole series.
 *
 * <h3>Warm-up</h3>
 * <p>
 * Series shorter than {@code minDataPoints} yield nothing, and so does a
 * series without variance: with a zero standard deviation no point can be a
 * statistical outlier.
 * </p>
 *
 * <p>
 * Mean and population standard deviation are computed over every point; a
 * point is flagged when {@code |z| > threshold}. Score is
 * {@code min(|z| / (2 * threshold), 1)}, impact is {@code |value - mean|}.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreStrategy.class);

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> series, StrategyConfig config) {
        Objects.requireNonNull(series, "Series must not be null");
        ZScoreConfig zScore = DetectionStrategy.expect(config, ZScoreConfig.class);
        if (series.size() < zScore.minDataPoints()) {
            LOG.trace("Series of {} point(s) is below minDataPoints {}", series.size(), zScore.minDataPoints());
            return List.of();
        }

        if (isConstant(series)) {
            return List.of();
        }
        double mean = computeMean(series);
        double stdDev = computeStdDev(series, mean);

        List<Anomaly> anomalies = new ArrayList<>();
        for (TimeSeriesPoint point : series) {
            double z = (point.value() - mean) / stdDev;
            double absZ = Math.abs(z);
            if (!(absZ > zScore.threshold())) {
                continue;
            }
            String message = "Z-Score " + Numbers.fixed2(z) + " exceeds threshold "
                    + Numbers.plain(zScore.threshold());
            LOG.debug("Z-score fired at {}: {} (mean={}, stdDev={})", point.timestamp(), message, mean, stdDev);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("date", point.timestamp());
            context.put("value", point.value());
            context.put("mean", Numbers.round2(mean));
            context.put("stdDev", Numbers.round2(stdDev));
            context.put("zScore", Numbers.round2(z));
            anomalies.add(new Anomaly(
                    Math.min(absZ / (zScore.threshold() * 2), 1.0),
                    Math.abs(point.value() - mean),
                    message,
                    context));
        }
        return anomalies;
    }

    @Override
    public StrategyConfig.Type getType() {
        return StrategyConfig.Type.Z_SCORE;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    /**
     * All values equal. Checked on the values themselves: the computed
     * deviation of a constant fractional series is a rounding residue, not 0.
     */
    private static boolean isConstant(List<TimeSeriesPoint> series) {
        double first = series.get(0).value();
        for (TimeSeriesPoint point : series) {
            if (Double.compare(point.value(), first) != 0) {
                return false;
            }
        }
        return true;
    }

    private static double computeMean(List<TimeSeriesPoint> series) {
        double sum = 0;
        for (TimeSeriesPoint point : series) {
            sum += point.value();
        }
        return sum / series.size();
    }

    /** Population standard deviation. */
    private static double computeStdDev(List<TimeSeriesPoint> series, double mean) {
        double sumSq = 0;
        for (TimeSeriesPoint point : series) {
            double diff = point.value() - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / series.size());
    }
}
