/**
 * Batch job running Warehouse Sentinel against BigQuery.
 *
 * <p>
 * This package wires the core engine to the warehouse: it materializes
 * entities, runs aggregate reports and anomaly monitors on a bounded worker
 * pool, and offers read paths over the persisted results.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.warehousesentinel.job.PipelineJob}: main entry point</li>
 * <li>{@link com.warehousesentinel.job.BatchRunner}: isolated, time-bounded
 * units of work</li>
 * <li>{@link com.warehousesentinel.job.BigQueryWarehouseGateway}: the
 * BigQuery adapter</li>
 * <li>{@link com.warehousesentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.warehousesentinel.job;
