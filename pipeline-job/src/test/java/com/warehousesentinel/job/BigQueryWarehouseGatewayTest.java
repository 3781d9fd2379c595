package com.warehousesentinel.job;

import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the client-independent parts of
 * {@link BigQueryWarehouseGateway}.
 */
class BigQueryWarehouseGatewayTest {

    @Nested
    @DisplayName("Query parameters")
    class Parameters {

        @Test
        @DisplayName("Should bind dates as DATE")
        void shouldBindDate() {
            QueryParameterValue value = BigQueryWarehouseGateway.toParameter("start_date", LocalDate.of(2024, 1, 2));

            assertThat(value.getType()).isEqualTo(StandardSQLTypeName.DATE);
            assertThat(value.getValue()).isEqualTo("2024-01-02");
        }

        @Test
        @DisplayName("Should bind scalars by their Java type")
        void shouldBindScalars() {
            assertThat(BigQueryWarehouseGateway.toParameter("p", "acc-1").getType())
                    .isEqualTo(StandardSQLTypeName.STRING);
            assertThat(BigQueryWarehouseGateway.toParameter("p", 10).getType())
                    .isEqualTo(StandardSQLTypeName.INT64);
            assertThat(BigQueryWarehouseGateway.toParameter("p", 10L).getType())
                    .isEqualTo(StandardSQLTypeName.INT64);
            assertThat(BigQueryWarehouseGateway.toParameter("p", 2.5).getType())
                    .isEqualTo(StandardSQLTypeName.FLOAT64);
            assertThat(BigQueryWarehouseGateway.toParameter("p", new BigDecimal("1.25")).getType())
                    .isEqualTo(StandardSQLTypeName.NUMERIC);
            assertThat(BigQueryWarehouseGateway.toParameter("p", true).getType())
                    .isEqualTo(StandardSQLTypeName.BOOL);
        }

        @Test
        @DisplayName("Should bind lists as typed arrays")
        void shouldBindArrays() {
            QueryParameterValue accounts = BigQueryWarehouseGateway.toParameter("accountIds", List.of("acc-1", "acc-2"));
            QueryParameterValue ids = BigQueryWarehouseGateway.toParameter("ids", List.of(1, 2L));

            assertThat(accounts.getType()).isEqualTo(StandardSQLTypeName.ARRAY);
            assertThat(accounts.getArrayType()).isEqualTo(StandardSQLTypeName.STRING);
            assertThat(accounts.getArrayValues()).extracting(QueryParameterValue::getValue)
                    .containsExactly("acc-1", "acc-2");
            assertThat(ids.getArrayType()).isEqualTo(StandardSQLTypeName.INT64);
        }

        @Test
        @DisplayName("Should reject a null parameter")
        void shouldRejectNull() {
            assertThatThrownBy(() -> BigQueryWarehouseGateway.toParameter("accountId", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'accountId'");
        }
    }

    @Nested
    @DisplayName("Error translation")
    class Errors {

        @Test
        @DisplayName("Should map 404 to a missing table")
        void shouldMapNotFound() {
            BigQueryException error = new BigQueryException(404,
                    "Not found: Table acme:anomalies.spend_outliers was not found in location US");

            QueryExecutionException translated = BigQueryWarehouseGateway.translate(error, "SELECT 1");

            assertThat(translated).isInstanceOf(TableNotFoundException.class);
            assertThat(((TableNotFoundException) translated).getTable())
                    .isEqualTo("acme:anomalies.spend_outliers");
            assertThat(translated.isTransient()).isFalse();
        }

        @Test
        @DisplayName("Should mark unavailable backends as transient")
        void shouldMarkTransient() {
            QueryExecutionException translated = BigQueryWarehouseGateway.translate(
                    new BigQueryException(503, "Service unavailable"), "SELECT 1");

            assertThat(translated.isTransient()).isTrue();
            assertThat(translated.getSql()).isEqualTo("SELECT 1");
        }

        @Test
        @DisplayName("Should keep invalid queries permanent")
        void shouldKeepInvalidQueryPermanent() {
            QueryExecutionException translated = BigQueryWarehouseGateway.translate(
                    new BigQueryException(400, "Syntax error: Unexpected keyword FROM"), "SELECT FROM");

            assertThat(translated.isTransient()).isFalse();
            assertThat(translated.getMessage()).startsWith("Syntax error: Unexpected keyword FROM")
                    .contains("--- SQL ---\nSELECT FROM");
        }
    }
}
