package com.warehousesentinel.core.expression;

import java.util.List;
import java.util.Objects;

/**
 * AST of the predicate language produced by {@link ExpressionParser}.
 *
 * <p>
 * The node set is closed; {@link SqlRenderer} translates each node kind
 * structurally and rejects any node it has no rule for.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface Expression
        permits Expression.Identifier, Expression.Literal, Expression.BinaryOp,
        Expression.UnaryOp, Expression.FunctionCall, Expression.InExpr,
        Expression.ListLiteral {

    // ---------------------------------------------------------------
    // Node types
    // ---------------------------------------------------------------

    /**
     * Field reference: {@code spend} or a qualified path such as {@code t.spend}.
     */
    record Identifier(List<String> path) implements Expression {
        public Identifier {
            Objects.requireNonNull(path, "Identifier path must not be null");
            if (path.isEmpty()) {
                throw new IllegalArgumentException("Identifier path must not be empty");
            }
            path = List.copyOf(path);
        }

        public boolean isQualified() {
            return path.size() > 1;
        }

        public String name() {
            return String.join(".", path);
        }
    }

    /**
     * Literal value: {@code 'text'}, {@code 42}, {@code 0.5}, {@code true},
     * {@code null}.
     */
    record Literal(LiteralType type, Object value) implements Expression {
        public Literal {
            Objects.requireNonNull(type, "Literal type must not be null");
        }

        public boolean isNull() {
            return type == LiteralType.NULL;
        }
    }

    enum LiteralType {
        STRING, INTEGER, DECIMAL, BOOLEAN, NULL
    }

    /**
     * Binary operation: comparison, arithmetic or logical connective.
     */
    record BinaryOp(Expression left, BinaryOperator operator, Expression right) implements Expression {
        public BinaryOp {
            Objects.requireNonNull(left, "Left operand must not be null");
            Objects.requireNonNull(operator, "Operator must not be null");
            Objects.requireNonNull(right, "Right operand must not be null");
        }
    }

    enum BinaryOperator {
        EQ("="),
        NE("<>"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        PLUS("+"),
        MINUS("-"),
        TIMES("*"),
        DIVIDE("/"),
        MODULO("%"),
        AND("AND"),
        OR("OR");

        private final String sql;

        BinaryOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }
    }

    /**
     * Prefix operation: arithmetic negation or logical {@code NOT}.
     */
    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
        public UnaryOp {
            Objects.requireNonNull(operator, "Operator must not be null");
            Objects.requireNonNull(operand, "Operand must not be null");
        }
    }

    enum UnaryOperator {
        NEGATE, NOT
    }

    /**
     * Function call: {@code SAFE_DIVIDE(conversions, clicks)}. The name is kept
     * exactly as written.
     */
    record FunctionCall(String name, List<Expression> arguments) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(name, "Function name must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Membership test: {@code x in [a, b]} or {@code x not in (a, b)}. The
     * candidates are whatever followed the operator; only a
     * {@link ListLiteral} can be rendered.
     */
    record InExpr(Expression operand, Expression candidates, boolean negated) implements Expression {
        public InExpr {
            Objects.requireNonNull(operand, "Operand must not be null");
            Objects.requireNonNull(candidates, "Candidates must not be null");
        }
    }

    /**
     * Bracketed or parenthesized list of values.
     */
    record ListLiteral(List<Expression> elements) implements Expression {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }
}
