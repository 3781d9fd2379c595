package com.warehousesentinel.core.warehouse;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Contract of the data warehouse the engine runs against.
 *
 * <p>
 * Implementations must be safe for concurrent use: batch runs call one
 * gateway from several worker threads, always on different output tables.
 * </p>
 *
 * @since 1.0.0
 */
public interface WarehouseGateway {

    /**
     * Run a query.
     *
     * @param sql     BigQuery Standard SQL with {@code @name} placeholders
     * @param params  named parameters; {@link java.util.List} values bind as
     *                arrays (for {@code UNNEST}), {@link java.time.LocalDate}
     *                as {@code DATE}
     * @param timeout upper bound for the call
     * @return result rows, column name to value
     * @throws QueryExecutionException if the query fails or times out
     * @throws TableNotFoundException  if a referenced table does not exist
     */
    List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params, Duration timeout);

    /**
     * Create the table if absent, otherwise add the schema's new columns.
     * Existing columns are never changed or dropped.
     *
     * @param dataset          dataset, created when missing
     * @param table            table name
     * @param schema           desired columns
     * @param partitionField   day-partitioning column, or {@code null}
     * @param clusteringFields at most four clustering columns
     */
    void ensureTable(String dataset, String table, TableSchema schema, String partitionField,
                     List<String> clusteringFields);

    /**
     * Append rows to an existing table.
     *
     * @param dataset dataset
     * @param table   table name
     * @param rows    rows to append; an empty list is a no-op
     */
    void bulkLoad(String dataset, String table, List<Map<String, Object>> rows);

    /**
     * @return partitioning, clustering and schema of the table
     * @throws TableNotFoundException if the table does not exist
     */
    TableMetadata getTableMetadata(String dataset, String table);
}
