/**
 * Warehouse contract used by the engine: query execution, table creation with
 * additive schema evolution, bulk append and metadata lookup.
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.warehouse;
