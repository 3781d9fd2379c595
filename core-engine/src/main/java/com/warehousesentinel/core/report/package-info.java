/**
 * Execution of entity materialization, aggregate reports and superlative
 * rankings against a
 * {@link com.warehousesentinel.core.warehouse.WarehouseGateway}.
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.report;
