package com.warehousesentinel.job;

import com.warehousesentinel.core.model.Monitor;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the most recent anomalies of one account across all monitors.
 *
 * <p>
 * Each monitor table is queried on its own. A monitor that has never
 * detected anything has no table yet and contributes nothing; any other
 * failing monitor is logged and skipped, so one broken table never hides
 * the rest of the feed. Rows carry a {@code source_table} column naming the
 * table they came from.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyFeed {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyFeed.class);

    static final String DETECTED_AT = "detected_at";

    private final WarehouseGateway gateway;
    private final List<Monitor> monitors;
    private final Duration queryTimeout;

    public AnomalyFeed(WarehouseGateway gateway, Collection<Monitor> monitors, Duration queryTimeout) {
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
        this.monitors = List.copyOf(Objects.requireNonNull(monitors, "Monitors must not be null"));
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "Query timeout must not be null");
    }

    /**
     * @param accountId account to read
     * @param limit     maximum rows per monitor and in the merged result
     * @return anomalies, newest first
     */
    public List<Map<String, Object>> latest(String accountId, int limit) {
        Objects.requireNonNull(accountId, "Account id must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        List<Map<String, Object>> merged = new ArrayList<>();
        for (Monitor monitor : monitors) {
            merged.addAll(readMonitor(monitor, accountId, limit));
        }
        merged.sort(Comparator.comparing(AnomalyFeed::detectedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return merged.size() > limit ? new ArrayList<>(merged.subList(0, limit)) : merged;
    }

    static String buildQuery(Monitor monitor) {
        String table = monitor.anomalyTable();
        return "SELECT *, '" + table + "' AS source_table\n"
                + "FROM `" + Monitor.ANOMALY_DATASET + "." + table + "`\n"
                + "WHERE account_id = @accountId\n"
                + "ORDER BY " + DETECTED_AT + " DESC\n"
                + "LIMIT @limit";
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Map<String, Object>> readMonitor(Monitor monitor, String accountId, int limit) {
        try {
            return gateway.executeQuery(buildQuery(monitor),
                    Map.of("accountId", accountId, "limit", (long) limit), queryTimeout);
        } catch (TableNotFoundException e) {
            LOG.warn("Monitor [{}] has no anomaly table yet, skipping", monitor.getId());
            return List.of();
        } catch (QueryExecutionException e) {
            LOG.warn("Failed to read anomalies of monitor [{}], skipping: {}", monitor.getId(), e.getMessage());
            return List.of();
        }
    }

    private static Instant detectedAt(Map<String, Object> row) {
        Object value = row.get(DETECTED_AT);
        if (value instanceof Instant instant) {
            return instant;
        }
        return value == null ? null : Instant.parse(value.toString());
    }
}
