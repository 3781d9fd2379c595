package com.warehousesentinel.core.model;

import com.warehousesentinel.core.TestDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Entity}.
 */
class EntityTest {

    @Test
    @DisplayName("Should default table to the snake_case id and dataset to entities")
    void shouldApplyDefaults() {
        Entity entity = Entity.builder()
                .id("adsDaily")
                .source(SourceRef.of("ads", "raw", "ads"))
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .build();

        assertThat(entity.getTable()).isEqualTo("ads_daily");
        assertThat(entity.getDataset()).isEqualTo(Entity.DEFAULT_DATASET);
        assertThat(entity.fqn()).isEqualTo("entities.ads_daily");
    }

    @Test
    @DisplayName("Should resolve per-source override before source override before default mapping")
    void shouldResolveInPrecedenceOrder() {
        SourceRef google = new SourceRef("google", "raw", "g", null,
                Map.of("campaign_name", FieldMapping.column("g_source_level")), null);
        SourceRef meta = new SourceRef("meta", "raw", "m", null,
                Map.of("campaign_name", FieldMapping.column("m_source_level")), null);
        SourceRef tiktok = SourceRef.of("tiktok", "raw", "t");
        Entity entity = Entity.builder()
                .id("ads")
                .source(google).source(meta).source(tiktok)
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .dimension("campaign_name", new DimensionDef(FieldType.STRING, FieldMapping.column("name"),
                        Map.of("google", FieldMapping.column("g_field_level"))))
                .build();

        assertThat(entity.resolve("campaign_name", google).sql()).isEqualTo("g_field_level");
        assertThat(entity.resolve("campaign_name", meta).sql()).isEqualTo("m_source_level");
        assertThat(entity.resolve("campaign_name", tiktok).sql()).isEqualTo("name");
        assertThat(entity.resolve("date", tiktok).sql()).isEqualTo("date");
    }

    @Test
    @DisplayName("Should reject a grain field that is a metric")
    void shouldRejectMetricInGrain() {
        assertThatThrownBy(() -> Entity.builder()
                .id("bad")
                .source(SourceRef.of("s", "raw", "t"))
                .grain("date", "spend")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .metric("spend", MetricDef.of(Aggregation.SUM))
                .build())
                .isInstanceOf(DefinitionException.class)
                .hasMessageContaining("grain field 'spend' is a metric");
    }

    @Test
    @DisplayName("Should reject a name declared as both dimension and metric")
    void shouldRejectDimensionMetricCollision() {
        assertThatThrownBy(() -> Entity.builder()
                .id("bad")
                .source(SourceRef.of("s", "raw", "t"))
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .dimension("clicks", DimensionDef.of(FieldType.STRING))
                .metric("clicks", MetricDef.of(Aggregation.SUM))
                .build())
                .isInstanceOf(DefinitionException.class)
                .hasMessageContaining("'clicks' is declared as both a dimension and a metric");
    }

    @Test
    @DisplayName("Should reject partitionBy and clusterBy fields that are not dimensions")
    void shouldRejectUnknownLayoutFields() {
        assertThatThrownBy(() -> Entity.builder()
                .id("bad")
                .source(SourceRef.of("s", "raw", "t"))
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .partitionBy("day")
                .clusterBy("account_id")
                .build())
                .isInstanceOf(DefinitionException.class)
                .satisfies(e -> assertThat(((DefinitionException) e).getErrors())
                        .containsExactly("partitionBy 'day' is not a dimension",
                                "clusterBy field 'account_id' is not a dimension"));
    }

    @Test
    @DisplayName("Should reject a field resolving to a column the source does not provide")
    void shouldRejectUnresolvableColumn() {
        SourceRef source = new SourceRef("s", "raw", "t", Set.of("date", "cost"), null, null);

        assertThatThrownBy(() -> Entity.builder()
                .id("bad")
                .source(source)
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .metric("spend", MetricDef.of(Aggregation.SUM))
                .build())
                .isInstanceOf(DefinitionException.class)
                .hasMessageContaining("field 'spend' resolves to column 'spend' which source 's' does not provide");
    }

    @Test
    @DisplayName("Should collect every violation before throwing")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> Entity.builder().id("empty").build())
                .isInstanceOf(DefinitionException.class)
                .satisfies(e -> assertThat(((DefinitionException) e).getErrors())
                        .contains("at least one source is required", "grain must not be empty"));
    }

    @Test
    @DisplayName("Should find the date field by type before falling back to its name")
    void shouldFindDateField() {
        Entity typed = Entity.builder()
                .id("typed")
                .source(SourceRef.of("s", "raw", "t"))
                .grain("report_day")
                .dimension("report_day", DimensionDef.of(FieldType.DATE))
                .build();
        Entity named = Entity.builder()
                .id("named")
                .source(SourceRef.of("s", "raw", "t"))
                .grain("day")
                .dimension("day", DimensionDef.of(FieldType.STRING))
                .build();

        assertThat(typed.dateField()).contains("report_day");
        assertThat(named.dateField()).contains("day");
        assertThat(TestDefinitions.adPerformance().dateField()).contains("date");
    }

    @Test
    @DisplayName("Should list non-grain dimensions in declaration order")
    void shouldListNonGrainDimensions() {
        assertThat(TestDefinitions.adPerformance().nonGrainDimensions())
                .containsExactly("campaign_name", "channel");
    }

    @Test
    @DisplayName("Should accept superlatives on entity dimensions and metrics")
    void shouldAcceptSuperlatives() {
        Entity entity = TestDefinitions.adPerformanceBuilder()
                .superlative(Superlative.of("campaign_id", "campaign_name", "spend", "clicks"))
                .superlative(new Superlative("campaign_id", "campaign_name", List.of("cpa"),
                        "SAFE_DIVIDE(SUM(spend), SUM(conversions))", Superlative.RankType.LOWEST))
                .build();

        assertThat(entity.getSuperlatives()).hasSize(2);
        assertThat(entity.getSuperlatives().get(0).rankType()).isEqualTo(Superlative.RankType.HIGHEST);
        assertThat(entity.getSuperlatives().get(1).hasExpression()).isTrue();
    }

    @Test
    @DisplayName("Should reject superlatives on unknown fields")
    void shouldRejectInvalidSuperlatives() {
        assertThatThrownBy(() -> TestDefinitions.adPerformanceBuilder()
                .superlative(Superlative.of("ad_id", "campaign_name", "spend", "revenue"))
                .superlative(new Superlative("campaign_id", "campaign_name", List.of("cpa", "roas"),
                        "SUM(spend)", null))
                .superlative(Superlative.of("campaign_id", "campaign_name"))
                .build())
                .isInstanceOf(DefinitionException.class)
                .satisfies(e -> assertThat(((DefinitionException) e).getErrors()).containsExactly(
                        "superlative #1 ranks by 'ad_id' which is not a dimension",
                        "superlative #1 targets 'revenue' which is not a metric",
                        "superlative #2 has an expression and must name exactly one target metric, got [cpa, roas]",
                        "superlative #3 has no targetMetrics"));
    }

    @Test
    @DisplayName("Should require an account_id dimension for superlatives")
    void shouldRequireAccountForSuperlatives() {
        assertThatThrownBy(() -> Entity.builder()
                .id("campaign_daily")
                .source(SourceRef.of("ads", "raw_ads", "daily"))
                .grain("date", "campaign_id")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .dimension("campaign_id", DimensionDef.of(FieldType.STRING))
                .metric("spend", MetricDef.of(Aggregation.SUM))
                .superlative(Superlative.of("campaign_id", "campaign_id", "spend"))
                .build())
                .isInstanceOf(DefinitionException.class)
                .hasMessageContaining("superlatives require an 'account_id' dimension");
    }

    @Test
    @DisplayName("Should parse rank types in any case and reject unknown ones")
    void shouldParseRankType() {
        assertThat(Superlative.RankType.fromString(" Lowest ")).isEqualTo(Superlative.RankType.LOWEST);
        assertThat(Superlative.RankType.HIGHEST.direction()).isEqualTo("DESC");
        assertThatThrownBy(() -> Superlative.RankType.fromString("median"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rank type: 'median'");
    }
}
