package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.model.DefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SqlTransform}.
 */
class SqlTransformTest {

    @Test
    @DisplayName("Should expand source placeholders to quoted table names")
    void shouldExpandSources() {
        SqlTransform transform = new SqlTransform(
                "SELECT * FROM ${source.google} UNION ALL SELECT * FROM ${source.meta}");

        assertThat(transform.buildQuery(TestDefinitions.adPerformance())).isEqualTo(
                "SELECT * FROM `raw_google.campaign_stats` UNION ALL SELECT * FROM `raw_meta.ad_insights`");
    }

    @Test
    @DisplayName("Should reject placeholders naming unknown sources")
    void shouldRejectUnknownSource() {
        SqlTransform transform = new SqlTransform("SELECT * FROM ${source.tiktok}");

        assertThatThrownBy(() -> transform.buildQuery(TestDefinitions.adPerformance()))
                .isInstanceOf(DefinitionException.class)
                .hasMessageContaining("unknown source 'tiktok'");
    }

    @Test
    @DisplayName("Should reject blank SQL")
    void shouldRejectBlankSql() {
        assertThatThrownBy(() -> new SqlTransform("   "))
                .isInstanceOf(DefinitionException.class);
    }
}
