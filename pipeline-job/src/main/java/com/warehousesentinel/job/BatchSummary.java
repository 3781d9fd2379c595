package com.warehousesentinel.job;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one stage: a result per unit, in submission order.
 *
 * @param stage   stage name, e.g. {@code monitors}
 * @param results per-unit results
 * @since 1.0.0
 */
public record BatchSummary(String stage, List<UnitResult> results) {

    public BatchSummary {
        Objects.requireNonNull(stage, "Stage must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public enum Status {
        SUCCEEDED, FAILED, TIMED_OUT
    }

    /**
     * @param unitId  definition id the unit ran
     * @param status  how it ended
     * @param detail  short outcome on success, failure message otherwise
     * @param elapsed wall time until the runner saw the outcome
     */
    public record UnitResult(String unitId, Status status, String detail, Duration elapsed) {

        public UnitResult {
            Objects.requireNonNull(unitId, "Unit id must not be null");
            Objects.requireNonNull(status, "Status must not be null");
        }

        public boolean succeeded() {
            return status == Status.SUCCEEDED;
        }
    }

    public List<UnitResult> failures() {
        return results.stream().filter(result -> !result.succeeded()).collect(Collectors.toList());
    }

    public long succeededCount() {
        return results.stream().filter(UnitResult::succeeded).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(result -> !result.succeeded());
    }

    @Override
    public String toString() {
        return "BatchSummary{" +
                "stage='" + stage + '\'' +
                ", units=" + results.size() +
                ", succeeded=" + succeededCount() +
                ", failed=" + failures().stream().map(UnitResult::unitId).collect(Collectors.toList()) +
                '}';
    }
}
