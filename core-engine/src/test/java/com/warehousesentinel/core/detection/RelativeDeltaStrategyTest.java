package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.StrategyConfig.Comparison;
import com.warehousesentinel.core.model.StrategyConfig.RelativeDeltaConfig;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RelativeDeltaStrategy}.
 */
class RelativeDeltaStrategyTest {

    private static final RelativeDeltaConfig MAX_49 = new RelativeDeltaConfig(Comparison.PREVIOUS_PERIOD, 49);

    private final RelativeDeltaStrategy strategy = new RelativeDeltaStrategy();

    @Test
    @DisplayName("Should NOT flag a change exactly at the limit")
    void shouldPassChangeAtLimit() {
        List<TimeSeriesPoint> series = List.of(
                TimeSeriesPoint.of("2024-01-01", 100),
                TimeSeriesPoint.of("2024-01-02", 149));

        assertThat(strategy.detect(series, MAX_49)).isEmpty();
    }

    @Test
    @DisplayName("Should flag a change above the limit with both points in context")
    void shouldFlagChangeAboveLimit() {
        List<TimeSeriesPoint> series = List.of(
                TimeSeriesPoint.of("2024-01-02", 150),
                TimeSeriesPoint.of("2024-01-01", 100));

        List<Anomaly> anomalies = strategy.detect(series, MAX_49);

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.message()).isEqualTo("Change of 50.00% exceeds limit of 49%");
            assertThat(anomaly.score()).isEqualTo(1.0);
            assertThat(anomaly.impact()).isEqualTo(50.0);
            assertThat(anomaly.context())
                    .containsEntry("date", "2024-01-02")
                    .containsEntry("previousDate", "2024-01-01")
                    .containsEntry("previousValue", 100.0);
        });
    }

    @Test
    @DisplayName("Should flag drops and skip pairs starting from zero")
    void shouldHandleDropsAndZeroBase() {
        List<TimeSeriesPoint> series = List.of(
                TimeSeriesPoint.of("2024-01-01", 0),
                TimeSeriesPoint.of("2024-01-02", 200),
                TimeSeriesPoint.of("2024-01-03", 50));

        List<Anomaly> anomalies = strategy.detect(series, new RelativeDeltaConfig(null, 60));

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.message()).isEqualTo("Change of -75.00% exceeds limit of 60%");
            assertThat(anomaly.context()).containsEntry("date", "2024-01-03");
        });
    }

    @Test
    @DisplayName("Should return nothing for a single point")
    void shouldIgnoreSinglePoint() {
        assertThat(strategy.detect(List.of(TimeSeriesPoint.of("2024-01-01", 1)), MAX_49)).isEmpty();
    }
}
