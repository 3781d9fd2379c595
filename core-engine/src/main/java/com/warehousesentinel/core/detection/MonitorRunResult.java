package com.warehousesentinel.core.detection;

import com.warehousesentinel.core.model.AnomalyRecord;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one monitor run.
 *
 * @param monitorId     monitor that ran
 * @param rowsFetched   measure rows returned by the warehouse
 * @param seriesScanned dimension combinations found
 * @param seriesPruned  combinations dropped for low volume
 * @param anomalies     anomalies detected and persisted
 * @since 1.0.0
 */
public record MonitorRunResult(String monitorId,
                               int rowsFetched,
                               int seriesScanned,
                               int seriesPruned,
                               List<AnomalyRecord> anomalies) {

    public MonitorRunResult {
        Objects.requireNonNull(monitorId, "monitorId must not be null");
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public int seriesEvaluated() {
        return seriesScanned - seriesPruned;
    }

    public int anomalyCount() {
        return anomalies.size();
    }
}
