package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.expression.Expression;
import com.warehousesentinel.core.expression.ExpressionCompiler;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Evaluates a compiled boolean clause against an aggregated row, standing in
 * for the warehouse in tests. Supports comparisons, AND / OR / NOT and
 * numeric literals.
 */
final class PredicateEvaluator {

    private PredicateEvaluator() {
    }

    static boolean matches(String clause, Map<String, Object> row) {
        return (Boolean) evaluate(ExpressionCompiler.parse(clause), row);
    }

    private static Object evaluate(Expression node, Map<String, Object> row) {
        if (node instanceof Expression.Identifier identifier) {
            return row.get(identifier.name());
        }
        if (node instanceof Expression.Literal literal) {
            Object value = literal.value();
            return value instanceof Number number ? new BigDecimal(number.toString()) : value;
        }
        if (node instanceof Expression.UnaryOp unary && unary.operator() == Expression.UnaryOperator.NOT) {
            return !(Boolean) evaluate(unary.operand(), row);
        }
        if (node instanceof Expression.BinaryOp binary) {
            Object left = evaluate(binary.left(), row);
            Object right = evaluate(binary.right(), row);
            return switch (binary.operator()) {
                case AND -> (Boolean) left && (Boolean) right;
                case OR -> (Boolean) left || (Boolean) right;
                case EQ -> compare(left, right) == 0;
                case NE -> compare(left, right) != 0;
                case LT -> compare(left, right) < 0;
                case LE -> compare(left, right) <= 0;
                case GT -> compare(left, right) > 0;
                case GE -> compare(left, right) >= 0;
                default -> throw new UnsupportedOperationException("Operator " + binary.operator());
            };
        }
        throw new UnsupportedOperationException("Node " + node.getClass().getSimpleName());
    }

    private static int compare(Object left, Object right) {
        return toDecimal(left).compareTo(toDecimal(right));
    }

    private static BigDecimal toDecimal(Object value) {
        return value instanceof BigDecimal decimal ? decimal : new BigDecimal(value.toString());
    }
}
