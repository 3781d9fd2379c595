package com.warehousesentinel.core.report;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.Superlative;
import com.warehousesentinel.core.sql.QueryOptions;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.RecordingWarehouseGateway;
import com.warehousesentinel.core.warehouse.RecordingWarehouseGateway.EnsuredTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SuperlativeExecutor}.
 */
class SuperlativeExecutorTest {

    private static final Instant NOW = Instant.parse("2024-02-01T06:00:00Z");

    private RecordingWarehouseGateway gateway;
    private SuperlativeExecutor executor;
    private Entity entity;

    @BeforeEach
    void setUp() {
        gateway = new RecordingWarehouseGateway();
        executor = new SuperlativeExecutor(gateway, Duration.ofMinutes(2), Clock.fixed(NOW, ZoneOffset.UTC));
        entity = TestDefinitions.adPerformanceBuilder()
                .superlative(Superlative.of("campaign_id", "campaign_name", "spend", "clicks"))
                .build();
    }

    @Test
    @DisplayName("Should rank every target metric per discovered account and append the winners")
    void shouldPersistWinners() {
        gateway.willReturn(List.of(Map.of("account_id", "acc-1"), Map.of("account_id", "acc-2")))
                .willReturn(List.of(winner("c1", "Brand", 420.5)))
                .willReturn(List.of(winner("c2", "Generic", 1200L)))
                .willReturn(List.of(winner("c7", "Retargeting", new BigDecimal("99.5"))))
                .willReturn(List.of());

        int written = executor.execute(List.of(entity), QueryOptions.defaults());

        assertThat(written).isEqualTo(3);
        assertThat(gateway.getQueries()).hasSize(5);
        assertThat(gateway.getQueries().get(0).sql()).startsWith("SELECT DISTINCT `account_id`");
        assertThat(gateway.getQueries().get(1).params()).containsEntry("accountId", "acc-1");
        assertThat(gateway.getQueries().get(4).params()).containsEntry("accountId", "acc-2");
        assertThat(gateway.getQueries()).allSatisfy(query ->
                assertThat(query.timeout()).isEqualTo(Duration.ofMinutes(2)));

        EnsuredTable table = gateway.getEnsuredTables().get(0);
        assertThat(table.dataset()).isEqualTo("reports");
        assertThat(table.table()).isEqualTo("superlatives");
        assertThat(table.partitionField()).isEqualTo("detected_at");
        assertThat(table.clustering()).containsExactly("account_id", "entity_type", "metric_name");

        List<Map<String, Object>> rows = gateway.loadedRows("reports", "superlatives");
        assertThat(rows).extracting(row -> row.get("metric_name")).containsExactly("spend", "clicks", "spend");
        assertThat(rows.get(0))
                .containsEntry("report_date", LocalDate.of(2024, 2, 1))
                .containsEntry("account_id", "acc-1")
                .containsEntry("time_period", "all_time")
                .containsEntry("entity_type", "ad_performance")
                .containsEntry("dimension", "campaign_name")
                .containsEntry("item_name", "Brand")
                .containsEntry("item_id", "c1")
                .containsEntry("metric_value", 420.5)
                .containsEntry("rank_type", "highest")
                .containsEntry("detected_at", NOW);
        assertThat(rows.get(1)).containsEntry("metric_value", 1200.0);
        assertThat(rows.get(2)).containsEntry("account_id", "acc-2").containsEntry("metric_value", 99.5);
    }

    @Test
    @DisplayName("Should label bounded runs as a custom range and scope account discovery")
    void shouldApplyRunOptions() {
        gateway.willReturn(List.of(Map.of("account_id", "acc-1")))
                .willReturn(List.of(winner("c1", "Brand", 10.0)));
        QueryOptions options = QueryOptions.builder()
                .startDate("2024-01-01")
                .accountIds(List.of("acc-1"))
                .build();

        executor.execute(List.of(entity), options);

        assertThat(gateway.getQueries().get(0).params()).containsEntry("accountIds", List.of("acc-1"));
        assertThat(gateway.loadedRows("reports", "superlatives").get(0))
                .containsEntry("time_period", "custom_range");
    }

    @Test
    @DisplayName("Should skip entities without superlatives and leave the table alone when nothing wins")
    void shouldSkipWhenNothingToRank() {
        gateway.willReturn(List.of(Map.of("account_id", "acc-1")));

        int written = executor.execute(List.of(TestDefinitions.adPerformance(), entity), QueryOptions.defaults());

        assertThat(written).isZero();
        assertThat(gateway.getQueries()).hasSize(3);
        assertThat(gateway.getEnsuredTables()).isEmpty();
    }

    @Test
    @DisplayName("Should write the other winners and then fail when a ranking query fails")
    void shouldFailAfterPersistingOtherWinners() {
        gateway.willReturn(List.of(Map.of("account_id", "acc-1")))
                .willFail(new QueryExecutionException("Unrecognized name: spend", false, null))
                .willReturn(List.of(winner("c1", "Brand", 30L)));

        assertThatThrownBy(() -> executor.execute(List.of(entity), QueryOptions.defaults()))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageStartingWith("1 superlative query(ies) failed, first: Unrecognized name: spend")
                .hasMessageContaining("--- SQL ---");
        assertThat(gateway.loadedRows("reports", "superlatives"))
                .singleElement()
                .satisfies(row -> assertThat(row).containsEntry("metric_name", "clicks"));
    }

    @Test
    @DisplayName("Should fail when accounts cannot be discovered")
    void shouldFailOnDiscoveryError() {
        gateway.willFail(new QueryExecutionException("Backend error", true, null));

        assertThatThrownBy(() -> executor.execute(List.of(entity), QueryOptions.defaults()))
                .isInstanceOfSatisfying(QueryExecutionException.class, e ->
                        assertThat(e.isTransient()).isTrue());
        assertThat(gateway.getQueries()).hasSize(1);
        assertThat(gateway.getEnsuredTables()).isEmpty();
    }

    private static Map<String, Object> winner(String id, String name, Object value) {
        return Map.of("item_id", id, "item_name", name, "metric_value", value);
    }
}
