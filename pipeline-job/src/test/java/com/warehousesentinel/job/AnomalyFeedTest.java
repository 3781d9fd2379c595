package com.warehousesentinel.job;

import com.warehousesentinel.core.config.DefinitionsLoader;
import com.warehousesentinel.core.model.DefinitionRegistry;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyFeed}.
 */
class AnomalyFeedTest {

    private DefinitionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DefinitionsLoader.fromClasspath("definitions.yml");
    }

    @Test
    @DisplayName("Should query one monitor table scoped to the account")
    void shouldBuildMonitorQuery() {
        String sql = AnomalyFeed.buildQuery(registry.monitor("spend_outliers"));

        assertThat(sql).isEqualTo("SELECT *, 'spend_outliers' AS source_table\n"
                + "FROM `anomalies.spend_outliers`\n"
                + "WHERE account_id = @accountId\n"
                + "ORDER BY detected_at DESC\n"
                + "LIMIT @limit");
    }

    @Test
    @DisplayName("Should merge monitors newest first and trim to the limit")
    void shouldMergeAndSort() {
        ScriptedWarehouseGateway gateway = new ScriptedWarehouseGateway(sql -> sql.contains("spend_outliers")
                ? List.of(anomaly("a1", "2024-02-01T06:00:00Z"), anomaly("a2", "2024-01-30T06:00:00Z"))
                : List.of(anomaly("b1", "2024-01-31T06:00:00Z")));
        AnomalyFeed feed = new AnomalyFeed(gateway, registry.monitors(), Duration.ofSeconds(30));

        List<Map<String, Object>> rows = feed.latest("acc-1", 2);

        assertThat(rows).extracting(row -> row.get("id")).containsExactly("a1", "b1");
        assertThat(gateway.queries()).hasSize(2).allSatisfy(query -> {
            assertThat(query.params()).containsEntry("accountId", "acc-1").containsEntry("limit", 2L);
            assertThat(query.timeout()).isEqualTo(Duration.ofSeconds(30));
        });
    }

    @Test
    @DisplayName("Should treat a missing table as no anomalies and keep the others")
    void shouldSkipMissingTable() {
        ScriptedWarehouseGateway gateway = new ScriptedWarehouseGateway(sql -> {
            if (sql.contains("spend_jump")) {
                throw new TableNotFoundException("anomalies.spend_jump", null);
            }
            return List.of(anomaly("a1", "2024-02-01T06:00:00Z"));
        });
        AnomalyFeed feed = new AnomalyFeed(gateway, registry.monitors(), Duration.ofSeconds(30));

        assertThat(feed.latest("acc-1", 10)).extracting(row -> row.get("id")).containsExactly("a1");
    }

    @Test
    @DisplayName("Should skip a monitor whose read fails")
    void shouldSkipFailingMonitor() {
        ScriptedWarehouseGateway gateway = new ScriptedWarehouseGateway(sql -> {
            if (sql.contains("spend_outliers")) {
                throw new QueryExecutionException("Access Denied", false, sql, null);
            }
            return List.of(anomaly("b1", "2024-01-31T06:00:00Z"));
        });
        AnomalyFeed feed = new AnomalyFeed(gateway, registry.monitors(), Duration.ofSeconds(30));

        assertThat(feed.latest("acc-1", 10)).extracting(row -> row.get("id")).containsExactly("b1");
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectInvalidLimit() {
        AnomalyFeed feed = new AnomalyFeed(new ScriptedWarehouseGateway(), registry.monitors(),
                Duration.ofSeconds(30));

        assertThatThrownBy(() -> feed.latest("acc-1", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit");
    }

    private static Map<String, Object> anomaly(String id, String detectedAt) {
        return Map.of("id", id, "detected_at", Instant.parse(detectedAt));
    }
}
