package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.DefinitionRegistry;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldMapping;
import com.warehousesentinel.core.model.FilterCondition;
import com.warehousesentinel.core.model.Monitor;
import com.warehousesentinel.core.model.ReportKind;
import com.warehousesentinel.core.model.StrategyConfig;
import com.warehousesentinel.core.model.Superlative;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefinitionsLoader}.
 */
class DefinitionsLoaderTest {

    @Nested
    @DisplayName("Valid definitions")
    class ValidDefinitions {

        private final DefinitionRegistry registry = DefinitionsLoader.fromClasspath("test-definitions.yml");

        @Test
        @DisplayName("Should load every definition kind from classpath")
        void shouldLoadFromClasspath() {
            assertThat(registry.entities()).extracting(Entity::getId).containsExactly("ad_performance");
            assertThat(registry.reports()).extracting(AggregateReport::getId).containsExactly("wasted_spend");
            assertThat(registry.measures()).hasSize(1);
            assertThat(registry.monitors()).extracting(Monitor::getId).containsExactly("spend_spike", "spend_jump");
            assertThat(registry.enabledMonitors()).extracting(Monitor::getId).containsExactly("spend_spike");
        }

        @Test
        @DisplayName("Should apply entity defaults and per-source overrides")
        void shouldMapEntity() {
            Entity entity = registry.entity("ad_performance");

            assertThat(entity.fqn()).isEqualTo("entities.ad_performance");
            assertThat(entity.dateField()).contains("date");
            assertThat(entity.getClusterBy()).containsExactly("account_id", "campaign_id");
            assertThat(entity.resolve("campaign_name", entity.getSources().get(0)))
                    .isEqualTo(FieldMapping.column("campaign"));
            assertThat(entity.resolve("spend", entity.getSources().get(1)))
                    .isEqualTo(FieldMapping.column("cost"));
        }

        @Test
        @DisplayName("Should map superlatives with their rank type and expression")
        void shouldMapSuperlatives() {
            Entity entity = registry.entity("ad_performance");

            assertThat(entity.getSuperlatives()).containsExactly(
                    Superlative.of("campaign_id", "campaign_name", "spend", "clicks"),
                    new Superlative("campaign_id", "campaign_name", List.of("cpa"),
                            "SAFE_DIVIDE(SUM(spend), SUM(conversions))", Superlative.RankType.LOWEST));
        }

        @Test
        @DisplayName("Should map signal reports to the signals dataset")
        void shouldMapReport() {
            AggregateReport report = registry.report("wasted_spend");

            assertThat(report.getKind()).isEqualTo(ReportKind.SIGNAL);
            assertThat(report.getDataset()).isEqualTo("signals");
            assertThat(report.getTable()).isEqualTo("wasted_spend");
            assertThat(report.getWindow()).contains(AggregateReport.Window.lastDays(7));
            assertThat(report.getOrderBy())
                    .contains(new AggregateReport.OrderBy("spend", AggregateReport.Direction.DESC));
            assertThat(report.getOutput().metrics()).containsOnlyKeys("spend", "conversions");
        }

        @Test
        @DisplayName("Should apply strategy defaults and monitor settings")
        void shouldMapMonitors() {
            Monitor spike = registry.monitor("spend_spike");
            assertThat(spike.getStrategy()).isEqualTo(StrategyConfig.ZScoreConfig.defaults());
            assertThat(spike.getLookbackDays()).isEqualTo(30);
            assertThat(spike.getScanConfig().minVolume()).isEqualTo(10.0);
            assertThat(spike.getClassification()).isEqualTo(Monitor.Classification.STATISTICAL);
            assertThat(spike.getImpact()).contains(Monitor.ImpactConfig.of(Monitor.ImpactType.FINANCIAL, "USD"));
            assertThat(spike.getContextMetrics()).containsExactly("clicks");

            Monitor jump = registry.monitor("spend_jump");
            assertThat(jump.getStrategy()).isEqualTo(
                    new StrategyConfig.RelativeDeltaConfig(StrategyConfig.Comparison.PREVIOUS_PERIOD, 50));
            assertThat(jump.getLookbackDays()).isEqualTo(14);
            assertThat(jump.getScanConfig().filters())
                    .containsExactly(FilterCondition.of("account_id", "=", "acc-1"));
            assertThat(registry.measureFor(jump).id()).isEqualTo("daily_spend");
        }
    }

    // ---------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should report every invalid definition at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> DefinitionsLoader.fromClasspath("invalid-definitions.yml"))
                .isInstanceOfSatisfying(DefinitionException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anySatisfy(error -> assertThat(error)
                                .startsWith("Invalid entity 'orders'")
                                .contains("aggregation is required for metric 'refunds'"))
                        .anySatisfy(error -> assertThat(error)
                                .startsWith("Invalid monitor 'revenue_drop'")
                                .contains("Unknown strategy type: 'moving_average'")))
                .hasMessageStartingWith("Definitions validation failed");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> DefinitionsLoader.fromClasspath("duplicate-key-definitions.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed definitions in duplicate-key-definitions.yml");
    }

    @Test
    @DisplayName("Should return an empty registry for an empty file")
    void shouldAcceptEmptyFile() {
        DefinitionRegistry registry = DefinitionsLoader.fromClasspath("empty-definitions.yml");

        assertThat(registry.entities()).isEmpty();
        assertThat(registry.monitors()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DefinitionsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file path and fail for a missing file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definitions.yml");
        Files.writeString(file, "entities:\n"
                + "  - id: orders\n"
                + "    sources: [{ id: shop, dataset: raw_shop, table: orders }]\n"
                + "    grain: [order_id]\n"
                + "    dimensions: { order_id: {} }\n");

        assertThat(DefinitionsLoader.fromFile(file.toString()).entity("orders").getTable()).isEqualTo("orders");
        assertThat(DefinitionsLoader.load(file.toString()).entities()).hasSize(1);
        assertThatThrownBy(() -> DefinitionsLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Definitions file not found");
    }
}
