package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.AnomalyRecord;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.Measure;
import com.warehousesentinel.core.model.Monitor;
import com.warehousesentinel.core.model.TimeSeriesPoint;
import com.warehousesentinel.core.sql.EntityMaterializer;
import com.warehousesentinel.core.sql.MeasureQuery;
import com.warehousesentinel.core.sql.MeasureQueryBuilder;
import com.warehousesentinel.core.sql.ParameterizedQuery;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.SchemaInference;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs one {@link Monitor} end to end.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li><b>Fetch</b>: the measure over {@code today - lookbackDays .. today},
 * sliced by the scan dimensions plus the entity's date field, with the
 * monitor's scan filters added to the measure's own</li>
 * <li><b>Group</b>: one series per combination of the non-date scan
 * dimensions, points sorted by date</li>
 * <li><b>Prune</b>: series whose value total is below {@code minVolume} are
 * dropped before any strategy sees them</li>
 * <li><b>Detect</b>: the monitor's strategy runs on each remaining series</li>
 * <li><b>Persist</b>: anomalies are appended to
 * {@code anomalies.<snake_case monitor id>}, partitioned by
 * {@code detected_at}</li>
 * </ol>
 *
 * <p>
 * The strategy is resolved before anything is fetched, so an unimplemented
 * strategy type fails without touching the warehouse.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorEngine.class);

    /** Date field assumed when the entity declares none. */
    static final String DEFAULT_DATE_FIELD = "date";

    private final WarehouseGateway gateway;
    private final Duration queryTimeout;
    private final Clock clock;
    private final MeasureQueryBuilder queryBuilder = new MeasureQueryBuilder();

    public MonitorEngine(WarehouseGateway gateway, Duration queryTimeout) {
        this(gateway, queryTimeout, Clock.systemUTC());
    }

    public MonitorEngine(WarehouseGateway gateway, Duration queryTimeout, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "Query timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run the monitor.
     *
     * @param monitor monitor definition
     * @param measure the monitor's measure
     * @param entity  the measure's entity
     * @return counts and the persisted anomalies
     * @throws UnsupportedOperationException if the strategy is not
     *                                       implemented
     * @throws QueryExecutionException       if a warehouse call fails
     */
    public MonitorRunResult run(Monitor monitor, Measure measure, Entity entity) {
        Objects.requireNonNull(monitor, "Monitor must not be null");
        Objects.requireNonNull(measure, "Measure must not be null");
        Objects.requireNonNull(entity, "Entity must not be null");

        DetectionStrategy strategy = StrategyFactory.create(monitor.getStrategy());
        String dateField = entity.dateField().orElse(DEFAULT_DATE_FIELD);
        List<String> seriesDimensions = monitor.getScanConfig().dimensions().stream()
                .filter(dimension -> !dimension.equals(dateField))
                .collect(Collectors.toList());

        List<Map<String, Object>> rows = fetch(monitor, measure, entity, dateField, seriesDimensions);
        Map<String, Series> series = groupIntoSeries(rows, seriesDimensions, dateField, monitor.getContextMetrics());

        Instant detectedAt = Instant.now(clock);
        List<AnomalyRecord> records = new ArrayList<>();
        int pruned = 0;
        for (Series candidate : series.values()) {
            double volume = candidate.volume();
            if (volume < monitor.getScanConfig().minVolume()) {
                LOG.trace("Monitor [{}]: pruned series {} with volume {}", monitor.getId(), candidate.key(), volume);
                pruned++;
                continue;
            }
            for (Anomaly anomaly : strategy.detect(candidate.points(), monitor.getStrategy())) {
                records.add(new AnomalyRecord(monitor.getId(), measure.id(), entity.getId(),
                        measure.metricName(), candidate.dimensions(), anomaly, detectedAt));
            }
        }

        persist(monitor, seriesDimensions, records);
        LOG.info("Monitor [{}]: {} row(s), {} series, {} pruned, {} anomalies",
                monitor.getId(), rows.size(), series.size(), pruned, records.size());
        return new MonitorRunResult(monitor.getId(), rows.size(), series.size(), pruned, records);
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    private List<Map<String, Object>> fetch(Monitor monitor, Measure measure, Entity entity,
                                            String dateField, List<String> seriesDimensions) {
        LocalDate today = LocalDate.now(clock);
        List<String> dimensions = new ArrayList<>(seriesDimensions);
        dimensions.add(dateField);
        MeasureQuery request = new MeasureQuery(today.minusDays(monitor.getLookbackDays()), today, dimensions,
                monitor.getContextMetrics(), monitor.getScanConfig().filters());
        ParameterizedQuery query = queryBuilder.buildQuery(measure, entity, request);
        LOG.debug("Monitor [{}] fetch:\n{}", monitor.getId(), query.sql());
        try {
            return gateway.executeQuery(query.sql(), query.params(), queryTimeout);
        } catch (QueryExecutionException e) {
            throw QueryExecutionException.withSql(e, query.sql());
        }
    }

    static Map<String, Series> groupIntoSeries(List<Map<String, Object>> rows, List<String> seriesDimensions,
                                               String dateField, List<String> contextMetrics) {
        Map<String, Series> series = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Double value = toDouble(row.get(MeasureQueryBuilder.VALUE_COLUMN));
            Object date = row.get(dateField);
            if (value == null || date == null) {
                LOG.trace("Skipping row without numeric value or date: {}", row);
                continue;
            }
            Map<String, Object> dimensions = new LinkedHashMap<>();
            for (String dimension : seriesDimensions) {
                dimensions.put(dimension, row.get(dimension));
            }
            String key = dimensions.entrySet().stream()
                    .map(entry -> entry.getKey() + ":" + entry.getValue())
                    .collect(Collectors.joining("|"));

            Map<String, Double> metrics = new LinkedHashMap<>();
            for (String metric : contextMetrics) {
                Double metricValue = toDouble(row.get(metric));
                if (metricValue != null) {
                    metrics.put(metric, metricValue);
                }
            }
            series.computeIfAbsent(key, k -> new Series(k, dimensions, new ArrayList<>()))
                    .points().add(new TimeSeriesPoint(date.toString(), value, metrics));
        }
        series.values().forEach(s -> s.points().sort(Comparator.comparing(TimeSeriesPoint::timestamp)));
        return series;
    }

    private void persist(Monitor monitor, List<String> seriesDimensions, List<AnomalyRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Map<String, Object>> rows = records.stream()
                .map(record -> AnomalyRowMapper.toRow(record, monitor))
                .collect(Collectors.toList());
        String table = monitor.anomalyTable();
        List<String> clustering = EntityMaterializer.clusterFields(seriesDimensions, "monitor '" + monitor.getId() + "'");
        gateway.ensureTable(Monitor.ANOMALY_DATASET, table, SchemaInference.infer(rows), "detected_at", clustering);
        gateway.bulkLoad(Monitor.ANOMALY_DATASET, table, rows);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Double toDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                LOG.trace("Ignoring non-numeric value '{}'", text);
                return null;
            }
        }
        return null;
    }

    /** Points of one dimension combination. */
    record Series(String key, Map<String, Object> dimensions, List<TimeSeriesPoint> points) {

        double volume() {
            double total = 0;
            for (TimeSeriesPoint point : points) {
                total += point.value();
            }
            return total;
        }
    }
}
