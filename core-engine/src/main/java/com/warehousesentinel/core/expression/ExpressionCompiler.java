package com.warehousesentinel.core.expression;

import com.warehousesentinel.core.expression.Expression.BinaryOp;
import com.warehousesentinel.core.expression.Expression.BinaryOperator;
import com.warehousesentinel.core.expression.Expression.FunctionCall;
import com.warehousesentinel.core.expression.Expression.Identifier;
import com.warehousesentinel.core.expression.Expression.InExpr;
import com.warehousesentinel.core.expression.Expression.ListLiteral;
import com.warehousesentinel.core.expression.Expression.UnaryOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates predicate-language expressions into BigQuery SQL fragments.
 *
 * <p>
 * Compilation is a pure structural translation: the same text and alias map
 * always produce the same SQL. There is no optimization pass.
 * </p>
 *
 * <pre>{@code
 * ExpressionCompiler.compile("spend > 100", Map.of("spend", "total_spend"));
 * // (total_spend > 100)
 *
 * ExpressionCompiler.compile("keyword_text != null");
 * // keyword_text IS NOT NULL
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ExpressionCompiler {

    private ExpressionCompiler() {
        // utility class, not instantiable
    }

    /**
     * Compile an expression without alias substitution.
     *
     * @param expression predicate-language text; must not be {@code null}
     * @return SQL fragment
     * @throws CompileException if the text does not parse or contains a
     *                          construct with no SQL translation
     */
    public static String compile(String expression) {
        return compile(expression, Map.of());
    }

    /**
     * Compile an expression, rewriting unqualified identifiers through
     * {@code aliasMap}.
     *
     * @param expression predicate-language text; must not be {@code null}
     * @param aliasMap   identifier to replacement; must not be {@code null}
     * @return SQL fragment
     * @throws CompileException if the text does not parse or contains a
     *                          construct with no SQL translation
     */
    public static String compile(String expression, Map<String, String> aliasMap) {
        Objects.requireNonNull(aliasMap, "Alias map must not be null");
        return render(parse(expression), expression, aliasMap);
    }

    /**
     * Parse an expression into its AST.
     *
     * @param expression predicate-language text; must not be {@code null}
     * @return AST root
     * @throws CompileException if the text is blank or does not parse
     */
    public static Expression parse(String expression) {
        Objects.requireNonNull(expression, "Expression must not be null");
        if (expression.isBlank()) {
            throw new CompileException("Expression must not be blank", expression);
        }
        return ExpressionParser.parse(expression);
    }

    /**
     * Render an already-parsed AST.
     *
     * @param node       AST to render
     * @param source     original text, used in error messages
     * @param aliasMap   identifier to replacement
     * @return SQL fragment
     */
    public static String render(Expression node, String source, Map<String, String> aliasMap) {
        Objects.requireNonNull(node, "Expression node must not be null");
        return new SqlRenderer(source, aliasMap).render(node);
    }

    /**
     * Split an AST on its top-level {@code AND} connectives.
     *
     * @param node AST root
     * @return conjuncts in source order; a single element when the root is not
     *         an {@code AND}
     */
    public static List<Expression> conjuncts(Expression node) {
        List<Expression> out = new ArrayList<>();
        collectConjuncts(node, out);
        return Collections.unmodifiableList(out);
    }

    /**
     * Collect the unqualified identifier names referenced anywhere in the AST.
     * Function names are not included.
     *
     * @param node AST root
     * @return identifier names in first-seen order
     */
    public static Set<String> identifiers(Expression node) {
        Set<String> out = new LinkedHashSet<>();
        collectIdentifiers(node, out);
        return Collections.unmodifiableSet(out);
    }

    /**
     * Quote a string as a BigQuery string literal using the same escaping the
     * compiler applies to string literals.
     *
     * @param value raw value; must not be {@code null}
     * @return quoted literal
     */
    public static String quoteString(String value) {
        Objects.requireNonNull(value, "Value must not be null");
        return SqlRenderer.quote(value);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void collectConjuncts(Expression node, List<Expression> out) {
        if (node instanceof BinaryOp binary && binary.operator() == BinaryOperator.AND) {
            collectConjuncts(binary.left(), out);
            collectConjuncts(binary.right(), out);
        } else {
            out.add(node);
        }
    }

    private static void collectIdentifiers(Expression node, Set<String> out) {
        if (node instanceof Identifier identifier) {
            out.add(identifier.isQualified()
                    ? identifier.path().get(identifier.path().size() - 1)
                    : identifier.name());
        } else if (node instanceof BinaryOp binary) {
            collectIdentifiers(binary.left(), out);
            collectIdentifiers(binary.right(), out);
        } else if (node instanceof UnaryOp unary) {
            collectIdentifiers(unary.operand(), out);
        } else if (node instanceof FunctionCall call) {
            call.arguments().forEach(arg -> collectIdentifiers(arg, out));
        } else if (node instanceof InExpr in) {
            collectIdentifiers(in.operand(), out);
            collectIdentifiers(in.candidates(), out);
        } else if (node instanceof ListLiteral list) {
            list.elements().forEach(element -> collectIdentifiers(element, out));
        }
    }
}
