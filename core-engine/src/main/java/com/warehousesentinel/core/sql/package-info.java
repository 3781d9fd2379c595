/**
 * BigQuery Standard SQL builders.
 *
 * <p>
 * {@link com.warehousesentinel.core.sql.EntityMaterializer} turns entities
 * into full-replace DDL, {@link com.warehousesentinel.core.sql.AggregationQueryBuilder}
 * turns aggregate reports into two-stage snapshot queries and
 * {@link com.warehousesentinel.core.sql.MeasureQueryBuilder} fetches
 * measure time series for monitors. Superlative rankings come from
 * {@link com.warehousesentinel.core.sql.SuperlativeQueryBuilder}. All builders are pure and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.sql;
