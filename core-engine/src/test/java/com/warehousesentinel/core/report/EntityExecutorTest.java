package com.warehousesentinel.core.report;

import com.warehousesentinel.core.TestDefinitions;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.RecordingWarehouseGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityExecutorTest {

    private final RecordingWarehouseGateway gateway = new RecordingWarehouseGateway();
    private final EntityExecutor executor = new EntityExecutor(gateway, Duration.ofSeconds(60));

    @Test
    @DisplayName("Should run the full-replace DDL without parameters")
    void shouldMaterializeEntity() {
        executor.materialize(TestDefinitions.adPerformance());

        assertThat(gateway.getQueries()).singleElement().satisfies(query -> {
            assertThat(query.sql()).startsWith("CREATE OR REPLACE TABLE `entities.ad_performance`"
                    + " PARTITION BY date CLUSTER BY account_id, campaign_id AS\n");
            assertThat(query.params()).isEmpty();
            assertThat(query.timeout()).isEqualTo(Duration.ofSeconds(60));
        });
    }

    @Test
    @DisplayName("Should attach the DDL to a failed materialization")
    void shouldAttachDdlToFailure() {
        gateway.willFail(new QueryExecutionException("Table raw_meta.ad_insights was not found", false, null));

        assertThatThrownBy(() -> executor.materialize(TestDefinitions.adPerformance()))
                .isInstanceOfSatisfying(QueryExecutionException.class,
                        e -> assertThat(e.getSql()).startsWith("CREATE OR REPLACE TABLE"));
    }
}
