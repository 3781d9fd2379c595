package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.Anomaly;
import com.warehousesentinel.core.model.AnomalyRecord;
import com.warehousesentinel.core.model.Monitor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens an {@link AnomalyRecord} into the row appended to the monitor's
 * anomaly table.
 *
 * <h3>Columns, in order</h3>
 * <ol>
 * <li>{@code monitor_id}, {@code measure_id}, {@code entity_id},
 * {@code metric}, {@code detected_at}</li>
 * <li>{@code anomaly_score}, {@code anomaly_impact},
 * {@code anomaly_message}</li>
 * <li>{@code source_table}, {@code classification}, {@code impact_type},
 * {@code impact_unit}, {@code financial_impact}</li>
 * <li>the triggering value under the metric's own name</li>
 * <li>every anomaly context entry, then every scan dimension value</li>
 * </ol>
 * <p>
 * Context and dimension entries never replace a column already in the row:
 * a context key or dimension named like a metadata column or the metric is
 * dropped.
 * </p>
 * <p>
 * {@code financial_impact} is {@code impact * multiplier} for financial
 * impact configurations and {@code null} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRowMapper {

    private AnomalyRowMapper() {
        // utility class, not instantiable
    }

    public static Map<String, Object> toRow(AnomalyRecord record, Monitor monitor) {
        Objects.requireNonNull(record, "Record must not be null");
        Objects.requireNonNull(monitor, "Monitor must not be null");
        Anomaly anomaly = record.anomaly();

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("monitor_id", record.monitorId());
        row.put("measure_id", record.measureId());
        row.put("entity_id", record.entityId());
        row.put("metric", record.metric());
        row.put("detected_at", record.detectedAt());
        row.put("anomaly_score", anomaly.score());
        row.put("anomaly_impact", anomaly.impact());
        row.put("anomaly_message", anomaly.message());
        row.put("source_table", monitor.anomalyTable());
        row.put("classification", monitor.getClassification().id());
        row.put("impact_type", monitor.getImpact().map(impact -> impact.type().id()).orElse(null));
        row.put("impact_unit", monitor.getImpact().map(Monitor.ImpactConfig::unit).orElse(null));
        row.put("financial_impact", monitor.getImpact()
                .filter(Monitor.ImpactConfig::isFinancial)
                .map(impact -> anomaly.impact() * impact.multiplier())
                .orElse(null));
        row.put(record.metric(), anomaly.value());
        putNew(row, anomaly.context());
        putNew(row, record.dimensions());
        return row;
    }

    private static void putNew(Map<String, Object> row, Map<String, ?> values) {
        values.forEach((key, value) -> {
            if (!row.containsKey(key)) {
                row.put(key, value);
            }
        });
    }
}
