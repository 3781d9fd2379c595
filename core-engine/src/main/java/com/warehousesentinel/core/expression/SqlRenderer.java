package com.warehousesentinel.core.expression;

import com.warehousesentinel.core.expression.Expression.BinaryOp;
import com.warehousesentinel.core.expression.Expression.BinaryOperator;
import com.warehousesentinel.core.expression.Expression.FunctionCall;
import com.warehousesentinel.core.expression.Expression.Identifier;
import com.warehousesentinel.core.expression.Expression.InExpr;
import com.warehousesentinel.core.expression.Expression.ListLiteral;
import com.warehousesentinel.core.expression.Expression.Literal;
import com.warehousesentinel.core.expression.Expression.UnaryOp;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders an {@link Expression} tree as a BigQuery Standard SQL fragment.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>Unqualified identifiers are rewritten through the alias map; qualified
 * paths are emitted unchanged.</li>
 * <li>Equality against {@code null} on either side becomes
 * {@code x IS NULL} / {@code x IS NOT NULL}, with no surrounding
 * parentheses.</li>
 * <li>Every other binary node is wrapped in parentheses, so operator
 * precedence never depends on the SQL dialect.</li>
 * <li>{@code %} becomes {@code MOD(a, b)}; BigQuery has no modulo
 * operator.</li>
 * <li>String literals are single-quoted with {@code '} and {@code \}
 * backslash-escaped.</li>
 * </ul>
 *
 * @since 1.0.0
 */
final class SqlRenderer {

    private final String source;
    private final Map<String, String> aliasMap;

    SqlRenderer(String source, Map<String, String> aliasMap) {
        this.source = source;
        this.aliasMap = Objects.requireNonNull(aliasMap, "Alias map must not be null");
    }

    String render(Expression node) {
        if (node instanceof Identifier identifier) {
            return renderIdentifier(identifier);
        }
        if (node instanceof Literal literal) {
            return renderLiteral(literal);
        }
        if (node instanceof BinaryOp binary) {
            return renderBinary(binary);
        }
        if (node instanceof UnaryOp unary) {
            return switch (unary.operator()) {
                case NEGATE -> "(-" + render(unary.operand()) + ")";
                case NOT -> "(NOT " + render(unary.operand()) + ")";
            };
        }
        if (node instanceof FunctionCall call) {
            String args = call.arguments().stream()
                    .map(this::render)
                    .collect(Collectors.joining(", "));
            return call.name() + "(" + args + ")";
        }
        if (node instanceof InExpr in) {
            return renderIn(in);
        }
        throw new CompileException("Unsupported expression node: " + describe(node), source);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String renderIdentifier(Identifier identifier) {
        String name = identifier.name();
        if (identifier.isQualified()) {
            return name;
        }
        return aliasMap.getOrDefault(name, name);
    }

    private String renderBinary(BinaryOp binary) {
        BinaryOperator op = binary.operator();

        if (op.isEquality()) {
            String suffix = op == BinaryOperator.EQ ? " IS NULL" : " IS NOT NULL";
            if (isNullLiteral(binary.right())) {
                return render(binary.left()) + suffix;
            }
            if (isNullLiteral(binary.left())) {
                return render(binary.right()) + suffix;
            }
        }

        String left = render(binary.left());
        String right = render(binary.right());
        if (op == BinaryOperator.MODULO) {
            return "MOD(" + left + ", " + right + ")";
        }
        return "(" + left + " " + op.toSql() + " " + right + ")";
    }

    private String renderIn(InExpr in) {
        if (!(in.candidates() instanceof ListLiteral list)) {
            throw new CompileException(
                    "Right side of IN must be a list literal, got " + describe(in.candidates()), source);
        }
        if (list.elements().isEmpty()) {
            throw new CompileException("IN list must not be empty", source);
        }
        String values = list.elements().stream()
                .map(this::render)
                .collect(Collectors.joining(", "));
        return render(in.operand()) + (in.negated() ? " NOT IN (" : " IN (") + values + ")";
    }

    private static String renderLiteral(Literal literal) {
        return switch (literal.type()) {
            case STRING -> quote((String) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DECIMAL -> ((BigDecimal) literal.value()).toPlainString();
            case BOOLEAN -> Boolean.TRUE.equals(literal.value()) ? "TRUE" : "FALSE";
            case NULL -> "NULL";
        };
    }

    /**
     * Quote a value as a BigQuery string literal.
     *
     * @param value raw string
     * @return single-quoted, escaped literal
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    private static boolean isNullLiteral(Expression node) {
        return node instanceof Literal literal && literal.isNull();
    }

    private static String describe(Expression node) {
        if (node instanceof ListLiteral) {
            return "list literal (lists are only valid on the right side of IN)";
        }
        return node.getClass().getSimpleName();
    }
}
