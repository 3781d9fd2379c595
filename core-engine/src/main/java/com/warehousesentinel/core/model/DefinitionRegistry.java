package com.warehousesentinel.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Index of every loaded definition, with the cross-definition links
 * resolved: report to entity, measure to entity, monitor to measure.
 *
 * <p>
 * Construction fails with a single {@link DefinitionException} listing every
 * duplicate id and dangling reference, so a registry that exists is always
 * consistent.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefinitionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final Map<String, Entity> entities;
    private final Map<String, AggregateReport> reports;
    private final Map<String, Measure> measures;
    private final Map<String, Monitor> monitors;

    private DefinitionRegistry(Map<String, Entity> entities,
                               Map<String, AggregateReport> reports,
                               Map<String, Measure> measures,
                               Map<String, Monitor> monitors) {
        this.entities = Collections.unmodifiableMap(entities);
        this.reports = Collections.unmodifiableMap(reports);
        this.measures = Collections.unmodifiableMap(measures);
        this.monitors = Collections.unmodifiableMap(monitors);
    }

    /**
     * Index and cross-validate definitions.
     *
     * @return a consistent registry
     * @throws DefinitionException on duplicate ids or unknown references
     */
    public static DefinitionRegistry of(List<Entity> entities,
                                        List<AggregateReport> reports,
                                        List<Measure> measures,
                                        List<Monitor> monitors) {
        Objects.requireNonNull(entities, "Entities must not be null");
        Objects.requireNonNull(reports, "Reports must not be null");
        Objects.requireNonNull(measures, "Measures must not be null");
        Objects.requireNonNull(monitors, "Monitors must not be null");

        List<String> errors = new ArrayList<>();
        Map<String, Entity> entityIndex = index("entity", entities, Entity::getId, errors);
        Map<String, AggregateReport> reportIndex = index("report", reports, AggregateReport::getId, errors);
        Map<String, Measure> measureIndex = index("measure", measures, Measure::id, errors);
        Map<String, Monitor> monitorIndex = index("monitor", monitors, Monitor::getId, errors);

        for (AggregateReport report : reports) {
            if (!entityIndex.containsKey(report.getSource().getId())) {
                errors.add("report '" + report.getId() + "' reads unknown entity '"
                        + report.getSource().getId() + "'");
            }
        }
        for (Measure measure : measures) {
            validateMeasure(measure, entityIndex.get(measure.entityId()), errors);
        }
        for (Monitor monitor : monitors) {
            Measure measure = measureIndex.get(monitor.getMeasureId());
            if (measure == null) {
                errors.add("monitor '" + monitor.getId() + "' watches unknown measure '"
                        + monitor.getMeasureId() + "'");
                continue;
            }
            Entity entity = entityIndex.get(measure.entityId());
            if (entity != null) {
                validateMonitor(monitor, entity, errors);
            }
        }

        DefinitionException.throwIfAny("Inconsistent definitions", errors);
        LOG.info("Registered {} entit(ies), {} report(s), {} measure(s), {} monitor(s)",
                entityIndex.size(), reportIndex.size(), measureIndex.size(), monitorIndex.size());
        return new DefinitionRegistry(entityIndex, reportIndex, measureIndex, monitorIndex);
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    public Entity entity(String id) {
        return require("entity", entities, id);
    }

    public AggregateReport report(String id) {
        return require("report", reports, id);
    }

    public Measure measure(String id) {
        return require("measure", measures, id);
    }

    public Monitor monitor(String id) {
        return require("monitor", monitors, id);
    }

    public Measure measureFor(Monitor monitor) {
        return measure(monitor.getMeasureId());
    }

    public Entity entityFor(Measure measure) {
        return entity(measure.entityId());
    }

    public Collection<Entity> entities() {
        return entities.values();
    }

    public Collection<AggregateReport> reports() {
        return reports.values();
    }

    public Collection<Measure> measures() {
        return measures.values();
    }

    public Collection<Monitor> monitors() {
        return monitors.values();
    }

    public List<Monitor> enabledMonitors() {
        return monitors.values().stream()
                .filter(Monitor::isEnabled)
                .toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void validateMeasure(Measure measure, Entity entity, List<String> errors) {
        String subject = "measure '" + measure.id() + "'";
        if (entity == null) {
            errors.add(subject + " reads unknown entity '" + measure.entityId() + "'");
            return;
        }
        Measure.Value value = measure.value();
        if (!value.isExpression() && !entity.hasMetric(value.field()) && !entity.hasDimension(value.field())) {
            errors.add(subject + " measures unknown field '" + value.field() + "' of entity '" + entity.getId() + "'");
        }
        for (String dimension : measure.allowedDimensions()) {
            if (!entity.hasDimension(dimension)) {
                errors.add(subject + " allows unknown dimension '" + dimension + "'");
            }
        }
        for (FilterCondition filter : measure.filters()) {
            if (!entity.hasDimension(filter.field()) && !entity.hasMetric(filter.field())) {
                errors.add(subject + " filters on unknown field '" + filter.field() + "'");
            }
        }
    }

    private static void validateMonitor(Monitor monitor, Entity entity, List<String> errors) {
        String subject = "monitor '" + monitor.getId() + "'";
        if (entity.dateField().isEmpty()) {
            errors.add(subject + " has no time axis: entity '" + entity.getId()
                    + "' declares no date dimension, 'date' or 'day'");
        }
        for (String dimension : monitor.getScanConfig().dimensions()) {
            if (!entity.hasDimension(dimension)) {
                errors.add(subject + " scans unknown dimension '" + dimension + "'");
            }
        }
        for (FilterCondition filter : monitor.getScanConfig().filters()) {
            if (!entity.hasDimension(filter.field()) && !entity.hasMetric(filter.field())) {
                errors.add(subject + " filters on unknown field '" + filter.field() + "'");
            }
        }
    }

    private static <T> Map<String, T> index(String kind, List<T> items, Function<T, String> idOf,
                                            List<String> errors) {
        Map<String, T> out = new LinkedHashMap<>();
        for (T item : items) {
            String id = idOf.apply(item);
            if (out.putIfAbsent(id, item) != null) {
                errors.add("duplicate " + kind + " id '" + id + "'");
            }
        }
        return out;
    }

    private static <T> T require(String kind, Map<String, T> index, String id) {
        T value = index.get(id);
        if (value == null) {
            throw new DefinitionException("Unknown " + kind + " '" + id + "'");
        }
        return value;
    }
}
