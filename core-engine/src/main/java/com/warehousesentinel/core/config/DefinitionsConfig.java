package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.DefinitionRegistry;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.Measure;
import com.warehousesentinel.core.model.Monitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the definitions YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * entities:
 *   - id: ad_performance
 *     ...
 * reports:
 *   - id: wasted_spend
 *     entity: ad_performance
 *     ...
 * measures:
 *   - id: daily_spend
 *     entity: ad_performance
 *     ...
 * monitors:
 *   - id: spend_spike
 *     measure: daily_spend
 *     ...
 * </pre>
 *
 * <p>
 * Call {@link #toRegistry()} after loading to convert and cross-validate
 * every definition.
 * </p>
 *
 * @since 1.0.0
 */
public class DefinitionsConfig {

    private List<EntitySpec> entities = new ArrayList<>();
    private List<ReportSpec> reports = new ArrayList<>();
    private List<MeasureSpec> measures = new ArrayList<>();
    private List<MonitorSpec> monitors = new ArrayList<>();

    public List<EntitySpec> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public void setEntities(List<EntitySpec> entities) {
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
    }

    public List<ReportSpec> getReports() {
        return Collections.unmodifiableList(reports);
    }

    public void setReports(List<ReportSpec> reports) {
        this.reports = reports != null ? new ArrayList<>(reports) : new ArrayList<>();
    }

    public List<MeasureSpec> getMeasures() {
        return Collections.unmodifiableList(measures);
    }

    public void setMeasures(List<MeasureSpec> measures) {
        this.measures = measures != null ? new ArrayList<>(measures) : new ArrayList<>();
    }

    public List<MonitorSpec> getMonitors() {
        return Collections.unmodifiableList(monitors);
    }

    public void setMonitors(List<MonitorSpec> monitors) {
        this.monitors = monitors != null ? new ArrayList<>(monitors) : new ArrayList<>();
    }

    public boolean isEmpty() {
        return entities.isEmpty() && reports.isEmpty() && measures.isEmpty() && monitors.isEmpty();
    }

    /**
     * Convert every definition and cross-validate the result.
     *
     * <p>
     * Entities are built first so reports can reference them. Errors from
     * every definition are collected and thrown as one exception.
     * </p>
     *
     * @return the consistent registry
     * @throws DefinitionException if any definition is invalid
     */
    public DefinitionRegistry toRegistry() {
        List<String> errors = new ArrayList<>();

        List<Entity> builtEntities = new ArrayList<>();
        Map<String, Entity> entitiesById = new LinkedHashMap<>();
        for (EntitySpec spec : entities) {
            try {
                Entity entity = spec.toEntity();
                builtEntities.add(entity);
                entitiesById.putIfAbsent(entity.getId(), entity);
            } catch (DefinitionException e) {
                errors.add(e.getMessage());
            }
        }

        List<AggregateReport> builtReports = new ArrayList<>();
        for (ReportSpec spec : reports) {
            Entity source = entitiesById.get(spec.getEntity());
            if (source == null) {
                errors.add("report '" + spec.getId() + "' reads unknown entity '" + spec.getEntity() + "'");
                continue;
            }
            try {
                builtReports.add(spec.toReport(source));
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        List<Measure> builtMeasures = new ArrayList<>();
        for (MeasureSpec spec : measures) {
            try {
                builtMeasures.add(spec.toMeasure());
            } catch (DefinitionException e) {
                errors.add(e.getMessage());
            }
        }

        List<Monitor> builtMonitors = new ArrayList<>();
        for (MonitorSpec spec : monitors) {
            try {
                builtMonitors.add(spec.toMonitor());
            } catch (DefinitionException e) {
                errors.add(e.getMessage());
            }
        }

        DefinitionException.throwIfAny("Definitions validation failed", errors);
        return DefinitionRegistry.of(builtEntities, builtReports, builtMeasures, builtMonitors);
    }

    @Override
    public String toString() {
        return "DefinitionsConfig{entities=" + entities.size() + ", reports=" + reports.size()
                + ", measures=" + measures.size() + ", monitors=" + monitors.size() + '}';
    }
}
