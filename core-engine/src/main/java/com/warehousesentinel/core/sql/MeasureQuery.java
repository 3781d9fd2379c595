package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.model.FilterCondition;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Request for a dimensioned time series of one measure.
 *
 * @param startDate      inclusive lower date bound
 * @param endDate        inclusive upper date bound
 * @param dimensions     columns to group by, usually including the date
 * @param contextMetrics entity metrics fetched alongside the value
 * @param filters        filters applied on top of the measure's own
 * @since 1.0.0
 */
public record MeasureQuery(LocalDate startDate,
                           LocalDate endDate,
                           List<String> dimensions,
                           List<String> contextMetrics,
                           List<FilterCondition> filters) {

    public MeasureQuery {
        Objects.requireNonNull(startDate, "Start date must not be null");
        Objects.requireNonNull(endDate, "End date must not be null");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("End date " + endDate + " is before start date " + startDate);
        }
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        contextMetrics = contextMetrics == null ? List.of() : List.copyOf(contextMetrics);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
