package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig.ZScoreConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreStrategy}.
 */
class ZScoreStrategyTest {

    private final ZScoreStrategy strategy = new ZScoreStrategy();

    @Test
    @DisplayName("Should flag the single outlier of an otherwise flat series")
    void shouldFlagOutlier() {
        List<TimeSeriesPoint> series = flat(13, 100);
        series.add(TimeSeriesPoint.of("2024-01-14", 200));

        List<Anomaly> anomalies = strategy.detect(series, ZScoreConfig.defaults());

        // one outlier among n points always sits sqrt(n - 1) deviations away
        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.message()).isEqualTo("Z-Score 3.61 exceeds threshold 3");
            assertThat(anomaly.score()).isCloseTo(Math.sqrt(13) / 6, within(1e-9));
            assertThat(anomaly.context())
                    .containsEntry("date", "2024-01-14")
                    .containsEntry("zScore", 3.61)
                    .containsEntry("mean", 107.14);
        });
    }

    @Test
    @DisplayName("Should NOT flag anything in a constant series")
    void shouldIgnoreConstantSeries() {
        assertThat(strategy.detect(flat(20, 42), ZScoreConfig.defaults())).isEmpty();
    }

    @Test
    @DisplayName("Should NOT flag a constant series of fractional values")
    void shouldIgnoreConstantFractionalSeries() {
        List<TimeSeriesPoint> series = flat(3, 0.1);

        assertThat(strategy.detect(series, new ZScoreConfig(0.5, 3))).isEmpty();
        assertThat(strategy.detect(flat(30, 0.7), new ZScoreConfig(0.01, 2))).isEmpty();
    }

    @Test
    @DisplayName("Should wait for minDataPoints before evaluating")
    void shouldRespectWarmUp() {
        List<TimeSeriesPoint> series = flat(5, 100);
        series.add(TimeSeriesPoint.of("2024-01-06", 10_000));

        assertThat(strategy.detect(series, new ZScoreConfig(1.5, 7))).isEmpty();
        assertThat(strategy.detect(series, new ZScoreConfig(1.5, 6))).hasSize(1);
    }

    private static List<TimeSeriesPoint> flat(int count, double value) {
        List<TimeSeriesPoint> series = new ArrayList<>();
        for (int day = 1; day <= count; day++) {
            series.add(TimeSeriesPoint.of(String.format("2024-01-%02d", day), value));
        }
        return series;
    }
}
