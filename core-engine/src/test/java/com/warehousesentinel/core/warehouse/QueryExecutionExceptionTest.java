package com.warehousesentinel.core.warehouse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link QueryExecutionException}.
 */
class QueryExecutionExceptionTest {

    @Test
    @DisplayName("Should append the SQL to the message and keep the transient flag")
    void shouldAttachSql() {
        QueryExecutionException original = new QueryExecutionException("Rate limit exceeded", true, null);

        QueryExecutionException withSql = QueryExecutionException.withSql(original, "SELECT 1");

        assertThat(withSql.getSql()).isEqualTo("SELECT 1");
        assertThat(withSql.isTransient()).isTrue();
        assertThat(withSql.getMessage()).isEqualTo("Rate limit exceeded\n--- SQL ---\nSELECT 1");
        assertThat(withSql.getCause()).isSameAs(original);
    }

    @Test
    @DisplayName("Should NOT wrap failures that already carry SQL or a missing table")
    void shouldNotRewrap() {
        QueryExecutionException carrying = new QueryExecutionException("Syntax error", false, "SELECT", null);
        TableNotFoundException missing = new TableNotFoundException("anomalies.spend", null);

        assertThat(QueryExecutionException.withSql(carrying, "SELECT 2")).isSameAs(carrying);
        assertThat(QueryExecutionException.withSql(missing, "SELECT 2")).isSameAs(missing);
        assertThat(missing.getMessage()).isEqualTo("Not found: Table anomalies.spend");
        assertThat(missing.isTransient()).isFalse();
    }
}
