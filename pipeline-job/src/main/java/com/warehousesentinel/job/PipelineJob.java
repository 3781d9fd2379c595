package com.warehousesentinel.job;

import com.warehousesentinel.core.config.DefinitionsLoader;
import com.warehousesentinel.core.detection.MonitorEngine;
import com.warehousesentinel.core.detection.MonitorRunResult;
import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.DefinitionRegistry;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.Measure;
import com.warehousesentinel.core.model.Monitor;
import com.warehousesentinel.core.report.EntityExecutor;
import com.warehousesentinel.core.report.ReportExecutor;
import com.warehousesentinel.core.report.SuperlativeExecutor;
import com.warehousesentinel.core.sql.QueryOptions;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point of the Warehouse Sentinel batch job.
 *
 * <h3>Stages</h3>
 *
 * <pre>
 *   entities      → materialize every entity into entities.&lt;table&gt;
 *   reports       → run every aggregate report, append to reports / signals
 *   superlatives  → rank each account's top items, append to reports.superlatives
 *   monitors      → run every enabled monitor, append to anomalies.&lt;table&gt;
 * </pre>
 *
 * <p>
 * Stages run in this order, each restricted by {@code RUN_MODE}. Units of a
 * stage run in parallel and fail independently. Failures in later stages
 * do not stop the stages after them; a failed entity ends the run after the
 * entities stage. The process exits with status 1 when any unit failed.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineJob {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineJob.class);

    private final JobConfig config;
    private final DefinitionRegistry registry;
    private final WarehouseGateway gateway;

    PipelineJob(JobConfig config, DefinitionRegistry registry, WarehouseGateway gateway) {
        this.config = Objects.requireNonNull(config, "Config must not be null");
        this.registry = Objects.requireNonNull(registry, "Registry must not be null");
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Warehouse Sentinel with config: {}", config);

        // 2. Load definitions
        DefinitionRegistry registry = DefinitionsLoader.load(config.getDefinitionsPath());
        if (registry.entities().isEmpty()) {
            throw new IllegalStateException("No definitions loaded. Provide them via "
                    + DefinitionsLoader.ENV_DEFINITIONS_PATH + " or a classpath "
                    + DefinitionsLoader.DEFAULT_RESOURCE + " file.");
        }
        LOG.info("Loaded {} entity(ies), {} report(s), {} measure(s), {} monitor(s)",
                registry.entities().size(), registry.reports().size(),
                registry.measures().size(), registry.monitors().size());

        // 3. Connect to the warehouse
        WarehouseGateway gateway = new RetryingWarehouseGateway(
                BigQueryWarehouseGateway.create(config.getProjectId()),
                config.getMaxRetries(), config.getRetryBackoff());

        // 4. Run
        List<BatchSummary> summaries = new PipelineJob(config, registry, gateway).run();
        boolean failed = summaries.stream().anyMatch(BatchSummary::hasFailures);
        if (failed) {
            LOG.error("Run finished with failures");
            System.exit(1);
        }
        LOG.info("Run finished successfully");
    }

    /**
     * Run the stages selected by the run mode.
     *
     * @return one summary per stage that ran, in stage order
     */
    List<BatchSummary> run() {
        JobConfig.RunMode mode = config.getRunMode();
        List<BatchSummary> summaries = new ArrayList<>();
        try (BatchRunner runner = new BatchRunner(config.getWorkerThreads(), config.getUnitTimeout())) {
            if (mode.includes(JobConfig.RunMode.ENTITIES)) {
                BatchSummary entities = runner.run("entities", entityUnits());
                summaries.add(entities);
                if (entities.hasFailures()) {
                    LOG.error("Entity materialization failed, skipping the remaining stages");
                    logFailures(summaries);
                    return summaries;
                }
            }
            if (mode.includes(JobConfig.RunMode.REPORTS)) {
                summaries.add(runner.run("reports", reportUnits()));
            }
            if (mode.includes(JobConfig.RunMode.SUPERLATIVES)) {
                summaries.add(runner.run("superlatives", superlativeUnits()));
            }
            if (mode.includes(JobConfig.RunMode.MONITORS)) {
                summaries.add(runner.run("monitors", monitorUnits()));
            }
        }
        logFailures(summaries);
        return summaries;
    }

    private static void logFailures(List<BatchSummary> summaries) {
        for (BatchSummary summary : summaries) {
            summary.failures().forEach(failure -> LOG.error("Stage [{}] unit [{}] {}: {}",
                    summary.stage(), failure.unitId(), failure.status(), failure.detail()));
        }
    }

    // ---------------------------------------------------------------
    // Units
    // ---------------------------------------------------------------

    private List<BatchRunner.Unit> entityUnits() {
        EntityExecutor executor = new EntityExecutor(gateway, config.getQueryTimeout());
        List<BatchRunner.Unit> units = new ArrayList<>();
        for (Entity entity : registry.entities()) {
            units.add(new BatchRunner.Unit(entity.getId(), () -> {
                executor.materialize(entity);
                return "materialized " + entity.fqn();
            }));
        }
        return units;
    }

    private List<BatchRunner.Unit> reportUnits() {
        ReportExecutor executor = new ReportExecutor(gateway, config.getQueryTimeout());
        QueryOptions options = accountScope();
        List<BatchRunner.Unit> units = new ArrayList<>();
        for (AggregateReport report : registry.reports()) {
            units.add(new BatchRunner.Unit(report.getId(),
                    () -> executor.execute(report, options) + " row(s)"));
        }
        return units;
    }

    private QueryOptions accountScope() {
        return QueryOptions.builder()
                .accountIds(config.getAccountIds())
                .build();
    }

    /** Superlatives share one output table, so all entities run as a single unit. */
    private List<BatchRunner.Unit> superlativeUnits() {
        List<Entity> ranked = registry.entities().stream()
                .filter(entity -> !entity.getSuperlatives().isEmpty())
                .toList();
        if (ranked.isEmpty()) {
            return List.of();
        }
        SuperlativeExecutor executor = new SuperlativeExecutor(gateway, config.getQueryTimeout());
        QueryOptions options = accountScope();
        return List.of(new BatchRunner.Unit("superlatives",
                () -> executor.execute(ranked, options) + " superlative(s)"));
    }

    private List<BatchRunner.Unit> monitorUnits() {
        MonitorEngine engine = new MonitorEngine(gateway, config.getQueryTimeout());
        List<BatchRunner.Unit> units = new ArrayList<>();
        for (Monitor monitor : registry.enabledMonitors()) {
            units.add(new BatchRunner.Unit(monitor.getId(), () -> {
                Measure measure = registry.measureFor(monitor);
                MonitorRunResult result = engine.run(monitor, measure, registry.entityFor(measure));
                return result.anomalyCount() + " anomaly(ies) in " + result.seriesEvaluated() + " series";
            }));
        }
        return units;
    }
}
