package com.warehousesentinel.core.warehouse;

import java.util.List;

/**
 * Physical layout of a warehouse table.
 *
 * @param partitionField day-partitioning column, or {@code null}
 * @param clustering     clustering columns, in order
 * @param schema         current columns
 * @since 1.0.0
 */
public record TableMetadata(String partitionField, List<String> clustering, TableSchema schema) {

    public TableMetadata {
        clustering = clustering == null ? List.of() : List.copyOf(clustering);
        schema = schema == null ? TableSchema.empty() : schema;
    }
}
