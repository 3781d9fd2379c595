package com.warehousesentinel.job;

import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads the latest snapshot of a persisted report.
 *
 * <p>
 * Every run appends a full snapshot, so the table holds one row per grain
 * and run. The reader keeps the newest row per grain combination and orders
 * the result by the report's own order, or newest first when it has none.
 * A report that has never run yields an empty list.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportReader {

    private static final Logger LOG = LoggerFactory.getLogger(ReportReader.class);

    private static final String ACCOUNT_ID = "account_id";

    private final WarehouseGateway gateway;
    private final Duration queryTimeout;

    public ReportReader(WarehouseGateway gateway, Duration queryTimeout) {
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "Query timeout must not be null");
    }

    /**
     * @param report    report definition
     * @param accountId account to restrict to, or {@code null} for all
     * @param limit     maximum rows
     * @return newest row per grain combination
     * @throws IllegalArgumentException if {@code accountId} is given but the
     *                                  report has no {@code account_id}
     *                                  column
     */
    public List<Map<String, Object>> latestSnapshot(AggregateReport report, String accountId, int limit) {
        Objects.requireNonNull(report, "Report must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        if (accountId != null && !hasAccountColumn(report)) {
            throw new IllegalArgumentException("Report '" + report.getId()
                    + "' has no account_id column and cannot be filtered by account");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        if (accountId != null) {
            params.put("accountId", accountId);
        }
        params.put("limit", (long) limit);

        try {
            return gateway.executeQuery(buildQuery(report, accountId != null), params, queryTimeout);
        } catch (TableNotFoundException e) {
            LOG.warn("Report [{}] has not been persisted yet ({}.{})",
                    report.getId(), report.getDataset(), report.getTable());
            return List.of();
        }
    }

    static String buildQuery(AggregateReport report, boolean byAccount) {
        String partition = report.getOutput().grain().stream()
                .map(ReportReader::quote)
                .collect(Collectors.joining(", "));
        String orderBy = report.getOrderBy()
                .map(AggregateReport.OrderBy::toSql)
                .orElse("detected_at DESC");

        StringBuilder sql = new StringBuilder()
                .append("SELECT * EXCEPT(snapshot_rank)\n")
                .append("FROM (\n")
                .append("  SELECT *, ROW_NUMBER() OVER (PARTITION BY ").append(partition)
                .append(" ORDER BY detected_at DESC) AS snapshot_rank\n")
                .append("  FROM `").append(report.getDataset()).append('.').append(report.getTable()).append("`\n");
        if (byAccount) {
            sql.append("  WHERE ").append(ACCOUNT_ID).append(" = @accountId\n");
        }
        return sql.append(")\n")
                .append("WHERE snapshot_rank = 1\n")
                .append("ORDER BY ").append(orderBy).append('\n')
                .append("LIMIT @limit")
                .toString();
    }

    private static boolean hasAccountColumn(AggregateReport report) {
        return report.getOutput().grain().contains(ACCOUNT_ID)
                || report.getOutput().includeDimensions().contains(ACCOUNT_ID);
    }

    private static String quote(String identifier) {
        return "`" + identifier + "`";
    }
}
