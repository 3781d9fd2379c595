package com.warehousesentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An {@link Anomaly} attributed to the monitor run and series that produced
 * it, ready to persist.
 *
 * @param monitorId  producing monitor
 * @param measureId  watched measure
 * @param entityId   entity the measure reads
 * @param metric     metric column name (measure field, or measure id)
 * @param dimensions scan-dimension values identifying the series
 * @param anomaly    strategy output
 * @param detectedAt detection time of the run
 * @since 1.0.0
 */
public record AnomalyRecord(String monitorId,
                            String measureId,
                            String entityId,
                            String metric,
                            Map<String, Object> dimensions,
                            Anomaly anomaly,
                            Instant detectedAt) {

    public AnomalyRecord {
        Objects.requireNonNull(monitorId, "monitorId must not be null");
        Objects.requireNonNull(measureId, "measureId must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        // series keys may carry null dimension values, so no Map.copyOf here
        dimensions = dimensions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }
}
