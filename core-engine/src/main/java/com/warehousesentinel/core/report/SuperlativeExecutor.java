package com.warehousesentinel.core.report;

import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.Superlative;
import com.warehousesentinel.core.sql.ParameterizedQuery;
import com.warehousesentinel.core.sql.QueryOptions;
import com.warehousesentinel.core.sql.SuperlativeQueryBuilder;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableSchema;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks every account's top (or bottom) item per superlative target metric
 * and appends the winners to {@value #DATASET}.{@value #TABLE}.
 *
 * <h3>Run</h3>
 * <ol>
 * <li>for each entity with superlatives, discover the accounts with rows in
 * the window (restricted to the run's account scope when it has one)</li>
 * <li>for each account, superlative and target metric, fetch the single
 * winning item</li>
 * <li>append all winners in one load; the table is partitioned by
 * {@code detected_at} and clustered by account, entity and metric</li>
 * </ol>
 *
 * <p>
 * A failing query skips its entity (account discovery) or its metric
 * (ranking); the remaining rankings still run and their winners are still
 * written. The run then fails with the first error.
 * </p>
 *
 * @since 1.0.0
 */
public final class SuperlativeExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(SuperlativeExecutor.class);

    public static final String DATASET = "reports";
    public static final String TABLE = "superlatives";

    static final String ALL_TIME = "all_time";
    static final String CUSTOM_RANGE = "custom_range";

    static final TableSchema SCHEMA = TableSchema.of(List.of(
            new TableSchema.Field("report_date", "DATE"),
            new TableSchema.Field("account_id", "STRING"),
            new TableSchema.Field("time_period", "STRING"),
            new TableSchema.Field("entity_type", "STRING"),
            new TableSchema.Field("dimension", "STRING"),
            new TableSchema.Field("item_name", "STRING"),
            new TableSchema.Field("item_id", "STRING"),
            new TableSchema.Field("metric_name", "STRING"),
            new TableSchema.Field("metric_value", "FLOAT64"),
            new TableSchema.Field("rank_type", "STRING"),
            new TableSchema.Field("detected_at", "TIMESTAMP")));

    private static final List<String> CLUSTERING = List.of("account_id", "entity_type", "metric_name");

    private final WarehouseGateway gateway;
    private final SuperlativeQueryBuilder queryBuilder = new SuperlativeQueryBuilder();
    private final Duration queryTimeout;
    private final Clock clock;

    public SuperlativeExecutor(WarehouseGateway gateway, Duration queryTimeout) {
        this(gateway, queryTimeout, Clock.systemUTC());
    }

    public SuperlativeExecutor(WarehouseGateway gateway, Duration queryTimeout, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "Query timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Rank and persist the superlatives of the given entities.
     *
     * @param entities entities; those without superlatives are skipped
     * @param options  window and account scope
     * @return number of winners appended
     * @throws QueryExecutionException if any query failed, after the winners
     *                                 of the other queries were written
     */
    public int execute(Collection<Entity> entities, QueryOptions options) {
        Objects.requireNonNull(entities, "Entities must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        Instant detectedAt = Instant.now(clock);
        LocalDate reportDate = LocalDate.now(clock);
        String timePeriod = options.getStartDate().isPresent() ? CUSTOM_RANGE : ALL_TIME;

        List<Map<String, Object>> winners = new ArrayList<>();
        List<QueryExecutionException> failures = new ArrayList<>();
        for (Entity entity : entities) {
            if (entity.getSuperlatives().isEmpty()) {
                continue;
            }
            List<String> accounts;
            try {
                accounts = discoverAccounts(entity, options);
            } catch (QueryExecutionException e) {
                LOG.warn("Superlatives of entity [{}] skipped, account discovery failed: {}",
                        entity.getId(), e.getMessage());
                failures.add(e);
                continue;
            }
            LOG.info("Ranking superlatives of entity [{}] for {} account(s)", entity.getId(), accounts.size());

            for (String accountId : accounts) {
                for (Superlative superlative : entity.getSuperlatives()) {
                    for (String metric : superlative.targetMetrics()) {
                        ParameterizedQuery query = queryBuilder.rankQuery(entity, superlative, metric,
                                accountId, options);
                        List<Map<String, Object>> rows;
                        try {
                            rows = gateway.executeQuery(query.sql(), query.params(), queryTimeout);
                        } catch (QueryExecutionException e) {
                            LOG.warn("Superlative [{}.{}] by {} failed for account [{}]: {}",
                                    entity.getId(), metric, superlative.dimensionLabel(), accountId, e.getMessage());
                            failures.add(QueryExecutionException.withSql(e, query.sql()));
                            continue;
                        }
                        if (rows.isEmpty()) {
                            continue;
                        }
                        Map<String, Object> winner = rows.get(0);
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("report_date", reportDate);
                        row.put("account_id", accountId);
                        row.put("time_period", timePeriod);
                        row.put("entity_type", entity.getId());
                        row.put("dimension", superlative.dimensionLabel());
                        row.put("item_name", stringValue(winner.get("item_name")));
                        row.put("item_id", stringValue(winner.get("item_id")));
                        row.put("metric_name", metric);
                        row.put("metric_value", numericValue(winner.get("metric_value")));
                        row.put("rank_type", superlative.rankType().id());
                        row.put("detected_at", detectedAt);
                        winners.add(row);
                    }
                }
            }
        }

        if (winners.isEmpty()) {
            LOG.info("No superlatives found");
        } else {
            gateway.ensureTable(DATASET, TABLE, SCHEMA, "detected_at", CLUSTERING);
            gateway.bulkLoad(DATASET, TABLE, winners);
            LOG.info("Appended {} superlative(s) to {}.{}", winners.size(), DATASET, TABLE);
        }

        if (!failures.isEmpty()) {
            QueryExecutionException first = failures.get(0);
            throw new QueryExecutionException(failures.size() + " superlative query(ies) failed, first: "
                    + first.getMessage(), first.isTransient(), first);
        }
        return winners.size();
    }

    private List<String> discoverAccounts(Entity entity, QueryOptions options) {
        ParameterizedQuery query = queryBuilder.accountsQuery(entity, options);
        List<Map<String, Object>> rows;
        try {
            rows = gateway.executeQuery(query.sql(), query.params(), queryTimeout);
        } catch (QueryExecutionException e) {
            throw QueryExecutionException.withSql(e, query.sql());
        }
        List<String> accounts = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object accountId = row.get(SuperlativeQueryBuilder.ACCOUNT_ID);
            if (accountId != null) {
                accounts.add(accountId.toString());
            }
        }
        return accounts;
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static Double numericValue(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value == null ? null : Double.valueOf(value.toString());
    }
}
