package com.warehousesentinel.job;

import com.warehousesentinel.core.warehouse.TableMetadata;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import com.warehousesentinel.core.warehouse.TableSchema;
import com.warehousesentinel.core.warehouse.WarehouseGateway;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Thread-safe in-memory {@link WarehouseGateway}. Queries are answered by a
 * handler keyed on the SQL text; every call is recorded.
 */
class ScriptedWarehouseGateway implements WarehouseGateway {

    record Query(String sql, Map<String, Object> params, Duration timeout) {
    }

    private final Function<String, List<Map<String, Object>>> handler;
    private final List<Query> queries = new ArrayList<>();
    private final List<String> ensuredTables = new ArrayList<>();
    private final Map<String, List<Map<String, Object>>> loaded = new LinkedHashMap<>();

    ScriptedWarehouseGateway() {
        this(sql -> List.of());
    }

    ScriptedWarehouseGateway(Function<String, List<Map<String, Object>>> handler) {
        this.handler = handler;
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params, Duration timeout) {
        synchronized (this) {
            queries.add(new Query(sql, params, timeout));
        }
        return handler.apply(sql);
    }

    @Override
    public synchronized void ensureTable(String dataset, String table, TableSchema schema,
                                         String partitionField, List<String> clusteringFields) {
        ensuredTables.add(dataset + "." + table);
    }

    @Override
    public synchronized void bulkLoad(String dataset, String table, List<Map<String, Object>> rows) {
        loaded.computeIfAbsent(dataset + "." + table, k -> new ArrayList<>()).addAll(rows);
    }

    @Override
    public TableMetadata getTableMetadata(String dataset, String table) {
        throw new TableNotFoundException(dataset + "." + table, null);
    }

    synchronized List<Query> queries() {
        return new ArrayList<>(queries);
    }

    synchronized List<String> ensuredTables() {
        return new ArrayList<>(ensuredTables);
    }

    synchronized List<Map<String, Object>> loadedRows(String fqn) {
        return loaded.getOrDefault(fqn, List.of());
    }
}
