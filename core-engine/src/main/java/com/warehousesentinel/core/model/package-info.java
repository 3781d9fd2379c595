/**
 * Declarative definition model.
 *
 * <p>
 * Entities (silver tables merged from raw sources), aggregate reports and
 * signals (gold insights over one entity), measures and monitors. All types
 * are immutable and validated at construction; invariant violations raise
 * {@link com.warehousesentinel.core.model.DefinitionException}.
 * {@link com.warehousesentinel.core.model.DefinitionRegistry} indexes a full
 * definition set and resolves the links between definitions.
 * </p>
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.model;
