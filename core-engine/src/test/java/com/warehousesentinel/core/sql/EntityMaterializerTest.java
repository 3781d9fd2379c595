package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.DimensionDef;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldMapping;
import com.warehousesentinel.core.model.FieldType;
import com.warehousesentinel.core.model.MetricDef;
import com.warehousesentinel.core.model.SourceRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EntityMaterializer}.
 */
class EntityMaterializerTest {

    private EntityMaterializer materializer;

    @BeforeEach
    void setUp() {
        materializer = new EntityMaterializer();
    }

    @Test
    @DisplayName("Should alias differently named source columns to the same output column")
    void shouldUnionSourcesWithSameColumns() {
        String sql = materializer.buildTransformQuery(TestDefinitions.adPerformance());

        String[] branches = sql.split("\nUNION ALL\n");
        assertThat(branches).hasSize(2);
        assertThat(branches[0]).isEqualTo("SELECT\n"
                + "  date AS date,\n"
                + "  account_id AS account_id,\n"
                + "  campaign_id AS campaign_id,\n"
                + "  ANY_VALUE(campaign) AS campaign_name,\n"
                + "  ANY_VALUE(channel) AS channel,\n"
                + "  COALESCE(SUM(SAFE_CAST(cost AS FLOAT64)), 0) AS spend,\n"
                + "  COALESCE(SUM(SAFE_CAST(clicks AS FLOAT64)), 0) AS clicks,\n"
                + "  COALESCE(SUM(SAFE_CAST(conversions AS FLOAT64)), 0) AS conversions\n"
                + "FROM `raw_google.campaign_stats`\n"
                + "GROUP BY 1, 2, 3");
        assertThat(branches[1])
                .contains("ANY_VALUE(campaign_name) AS campaign_name")
                .contains("FROM `raw_meta.ad_insights`");
        assertThat(columnAliases(branches[0])).isEqualTo(columnAliases(branches[1]));
    }

    @Test
    @DisplayName("Should compile the source filter and keep expression metrics uncast")
    void shouldCompileFilterAndExpressions() {
        Entity entity = Entity.builder()
                .id("orders")
                .source(new SourceRef("shop", "raw", "orders", null, null, "status != 'CANCELLED'"))
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE, FieldMapping.expression("DATE(created_at)")))
                .metric("revenue", MetricDef.of(Aggregation.SUM,
                        FieldMapping.expression("SUM(price * quantity)")))
                .build();

        String sql = materializer.buildTransformQuery(entity);

        assertThat(sql).isEqualTo("SELECT\n"
                + "  DATE(created_at) AS date,\n"
                + "  COALESCE(SUM(price * quantity), 0) AS revenue\n"
                + "FROM `raw.orders`\n"
                + "WHERE (status <> 'CANCELLED')\n"
                + "GROUP BY 1");
    }

    @Test
    @DisplayName("Should wrap the transform in a partitioned and clustered full-replace DDL")
    void shouldBuildDdl() {
        String ddl = materializer.buildMaterializeDdl(TestDefinitions.adPerformance());

        assertThat(ddl).startsWith("CREATE OR REPLACE TABLE `entities.ad_performance`"
                + " PARTITION BY date CLUSTER BY account_id, campaign_id AS\nSELECT\n");
        assertThat(ddl).contains("\nUNION ALL\n");
    }

    @Test
    @DisplayName("Should keep only the first four clustering fields")
    void shouldTruncateClustering() {
        assertThat(EntityMaterializer.clusterFields(List.of("a", "b", "c", "d", "e"), "test"))
                .containsExactly("a", "b", "c", "d");
        assertThat(EntityMaterializer.clusterFields(List.of("account id", "date"), "test"))
                .containsExactly("accountid", "date");
    }

    @Test
    @DisplayName("Should use a custom transform verbatim inside the DDL")
    void shouldUseCustomTransform() {
        Entity entity = Entity.builder()
                .id("spend_rollup")
                .source(SourceRef.of("ads", "raw", "ads"))
                .grain("date")
                .dimension("date", DimensionDef.of(FieldType.DATE))
                .metric("spend", MetricDef.of(Aggregation.SUM))
                .transform(new SqlTransform("  SELECT date, SUM(cost) AS spend FROM ${source.ads} GROUP BY 1  "))
                .build();

        assertThat(materializer.buildMaterializeDdl(entity)).isEqualTo(
                "CREATE OR REPLACE TABLE `entities.spend_rollup` AS\n"
                        + "SELECT date, SUM(cost) AS spend FROM `raw.ads` GROUP BY 1");
    }

    private static List<String> columnAliases(String branch) {
        return branch.lines()
                .filter(line -> line.contains(" AS "))
                .filter(line -> !line.startsWith("FROM"))
                .map(line -> line.substring(line.lastIndexOf(" AS ") + 4).replace(",", ""))
                .toList();
    }
}
