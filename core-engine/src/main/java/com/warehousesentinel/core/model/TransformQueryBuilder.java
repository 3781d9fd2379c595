package com.warehousesentinel.core.model;

/**
 * Custom transform that replaces the default per-source {@code UNION ALL}
 * when materializing an {@link Entity}, for entities that need joins or
 * allocation logic. The result is wrapped in the same
 * {@code CREATE OR REPLACE TABLE} DDL as the default transform.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransformQueryBuilder {

    /**
     * Build the SELECT statement producing the entity's rows.
     *
     * @param entity the entity being materialized
     * @return SQL SELECT text
     */
    String buildQuery(Entity entity);
}
