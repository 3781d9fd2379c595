package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.StrategyConfig.Comparison;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StrategyFactory}.
 */
class StrategyFactoryTest {

    @Test
    @DisplayName("Should create the strategy matching each implemented type")
    void shouldCreateImplementedStrategies() {
        assertThat(StrategyFactory.create(StrategyConfig.ThresholdConfig.max(1)))
                .isInstanceOf(ThresholdStrategy.class);
        assertThat(StrategyFactory.create(new StrategyConfig.RelativeDeltaConfig(Comparison.PREVIOUS_PERIOD, 10)))
                .isInstanceOf(RelativeDeltaStrategy.class);
        assertThat(StrategyFactory.create(StrategyConfig.ZScoreConfig.defaults()).getType())
                .isEqualTo(StrategyConfig.Type.Z_SCORE);
    }

    @Test
    @DisplayName("Should fail fast for strategies that are not implemented")
    void shouldRejectUnimplementedStrategies() {
        assertThatThrownBy(() -> StrategyFactory.create(new StrategyConfig.PoissonConfig(0.99)))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Strategy 'poisson' is not yet implemented.");
        assertThatThrownBy(() -> StrategyFactory.create(new StrategyConfig.SeasonalTrendConfig(7)))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Strategy 'seasonal_trend' is not yet implemented.");
    }

    @Test
    @DisplayName("Should reject unknown strategy names")
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> StrategyConfig.Type.fromString("moving_average"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown strategy type");
    }
}
