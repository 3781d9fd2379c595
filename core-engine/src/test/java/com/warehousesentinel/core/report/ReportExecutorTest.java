package com.warehousesentinel.core.report;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.ReportKind;
import com.warehousesentinel.core.sql.QueryOptions;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.RecordingWarehouseGateway;
import com.warehousesentinel.core.warehouse.RecordingWarehouseGateway.EnsuredTable;
import com.warehousesentinel.core.warehouse.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReportExecutor}.
 */
class ReportExecutorTest {

    private RecordingWarehouseGateway gateway;
    private ReportExecutor executor;
    private AggregateReport report;

    @BeforeEach
    void setUp() {
        gateway = new RecordingWarehouseGateway();
        executor = new ReportExecutor(gateway, Duration.ofMinutes(5));
        report = TestDefinitions.wastedSpend(TestDefinitions.campaignDaily());
    }

    @Test
    @DisplayName("Should append report rows to a table partitioned by detected_at")
    void shouldPersistRows() {
        gateway.willReturn(List.of(row("c1", 120.5), row("c2", 80.0)));

        int appended = executor.execute(report, QueryOptions.defaults());

        assertThat(appended).isEqualTo(2);
        assertThat(gateway.lastQuery().sql()).contains("FROM `entities.campaign_daily`");
        assertThat(gateway.lastQuery().timeout()).isEqualTo(Duration.ofMinutes(5));

        EnsuredTable table = gateway.getEnsuredTables().get(0);
        assertThat(table.dataset()).isEqualTo(ReportKind.REPORT.defaultDataset());
        assertThat(table.table()).isEqualTo("wasted_spend");
        assertThat(table.partitionField()).isEqualTo("detected_at");
        assertThat(table.clustering()).containsExactly("campaign_id");
        assertThat(table.schema().getFields()).contains(
                new TableSchema.Field("detected_at", "TIMESTAMP"),
                new TableSchema.Field("spend", "FLOAT64"));
        assertThat(gateway.loadedRows(report.getDataset(), "wasted_spend")).hasSize(2);
    }

    @Test
    @DisplayName("Should bind account ids when the run is account scoped")
    void shouldBindAccountScope() {
        QueryOptions options = QueryOptions.builder().accountIds(List.of("acc-1", "acc-2")).build();

        executor.execute(report, options);

        assertThat(gateway.lastQuery().params())
                .containsEntry(QueryOptions.ACCOUNT_IDS_PARAM, List.of("acc-1", "acc-2"));
    }

    @Test
    @DisplayName("Should not touch the report table when the query returns nothing")
    void shouldSkipEmptyResults() {
        assertThat(executor.execute(report, QueryOptions.defaults())).isZero();
        assertThat(gateway.getEnsuredTables()).isEmpty();
    }

    @Test
    @DisplayName("Should attach the report SQL to a failed query")
    void shouldAttachSql() {
        gateway.willFail(new QueryExecutionException("Unrecognized name: conversions", false, null));

        assertThatThrownBy(() -> executor.execute(report, QueryOptions.defaults()))
                .isInstanceOfSatisfying(QueryExecutionException.class,
                        e -> assertThat(e.getSql()).contains("HAVING"));
    }

    private static Map<String, Object> row(String campaign, double spend) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("report_id", "wasted_spend");
        row.put("detected_at", Instant.parse("2024-02-01T00:00:00Z"));
        row.put("campaign_id", campaign);
        row.put("spend", spend);
        row.put("conversions", 0L);
        return row;
    }
}
