/**
 * YAML definitions loading: SnakeYAML beans for entities, reports, measures
 * and monitors, converted and cross-validated into a
 * {@link com.warehousesentinel.core.model.DefinitionRegistry}.
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.config;
