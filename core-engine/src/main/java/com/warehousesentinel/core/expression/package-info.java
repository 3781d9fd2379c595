/**
 * Predicate and expression compiler.
 *
 * <p>
 * Definitions carry small boolean/arithmetic expressions (report predicates,
 * per-source filters, allocation weights). This package owns the lexer,
 * recursive-descent parser, AST and SQL renderer that turn them into
 * BigQuery Standard SQL fragments. The entry point is
 * {@link com.warehousesentinel.core.expression.ExpressionCompiler}.
 * </p>
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.expression;
