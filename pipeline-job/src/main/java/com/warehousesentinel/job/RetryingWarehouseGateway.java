package com.warehousesentinel.job;

import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableMetadata;
import com.warehousesentinel.core.warehouse.TableSchema;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries transient warehouse failures with exponential backoff.
 *
 * <p>
 * Only failures whose {@link QueryExecutionException#isTransient()} is set
 * are retried; the backoff doubles after each attempt, capped at one minute.
 * {@link #bulkLoad} is passed through once: an append that failed after the
 * load job started may already have written rows.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryingWarehouseGateway implements WarehouseGateway {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingWarehouseGateway.class);

    static final Duration MAX_BACKOFF = Duration.ofMinutes(1);

    /** Pause between attempts. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final WarehouseGateway delegate;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    public RetryingWarehouseGateway(WarehouseGateway delegate, int maxRetries, Duration initialBackoff) {
        this(delegate, maxRetries, initialBackoff, duration -> Thread.sleep(duration.toMillis()));
    }

    RetryingWarehouseGateway(WarehouseGateway delegate, int maxRetries, Duration initialBackoff, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        this.delegate = Objects.requireNonNull(delegate, "Delegate gateway must not be null");
        this.maxRetries = maxRetries;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "Initial backoff must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper must not be null");
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params, Duration timeout) {
        return withRetry("query", () -> delegate.executeQuery(sql, params, timeout));
    }

    @Override
    public void ensureTable(String dataset, String table, TableSchema schema, String partitionField,
                            List<String> clusteringFields) {
        withRetry("ensure " + dataset + "." + table, () -> {
            delegate.ensureTable(dataset, table, schema, partitionField, clusteringFields);
            return null;
        });
    }

    @Override
    public void bulkLoad(String dataset, String table, List<Map<String, Object>> rows) {
        delegate.bulkLoad(dataset, table, rows);
    }

    @Override
    public TableMetadata getTableMetadata(String dataset, String table) {
        return withRetry("metadata " + dataset + "." + table, () -> delegate.getTableMetadata(dataset, table));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> T withRetry(String operation, Supplier<T> call) {
        Duration backoff = initialBackoff;
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (QueryExecutionException e) {
                if (!e.isTransient() || attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                LOG.warn("Transient failure in {} (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxRetries, backoff.toMillis(), firstLine(e.getMessage()));
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while backing off from {}, giving up", operation);
                    throw e;
                }
                backoff = backoff.multipliedBy(2);
                if (backoff.compareTo(MAX_BACKOFF) > 0) {
                    backoff = MAX_BACKOFF;
                }
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
