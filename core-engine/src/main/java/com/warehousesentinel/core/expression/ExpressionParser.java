package com.warehousesentinel.core.expression;

import com.warehousesentinel.core.expression.Expression.BinaryOp;
import com.warehousesentinel.core.expression.Expression.BinaryOperator;
import com.warehousesentinel.core.expression.Expression.FunctionCall;
import com.warehousesentinel.core.expression.Expression.Identifier;
import com.warehousesentinel.core.expression.Expression.InExpr;
import com.warehousesentinel.core.expression.Expression.ListLiteral;
import com.warehousesentinel.core.expression.Expression.Literal;
import com.warehousesentinel.core.expression.Expression.LiteralType;
import com.warehousesentinel.core.expression.Expression.UnaryOp;
import com.warehousesentinel.core.expression.Expression.UnaryOperator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the predicate language.
 *
 * <h3>Grammar (lowest to highest precedence)</h3>
 *
 * <pre>
 * or             := and (('||' | OR) and)*
 * and            := not (('&amp;&amp;' | AND) not)*
 * not            := ('!' | NOT) not | comparison
 * comparison     := additive ((== | = | != | &lt;&gt; | &gt; | &gt;= | &lt; | &lt;=) additive
 *                             | [NOT] IN additive)?
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/' | '%') unary)*
 * unary          := ('-' | '+') unary | primary
 * primary        := number | string | TRUE | FALSE | NULL
 *                 | identifier ('.' identifier)* ['(' args ')']
 *                 | '(' or ')' | '(' or (',' or)+ ')' | '[' list ']'
 * </pre>
 *
 * @since 1.0.0
 */
final class ExpressionParser {

    private final ExpressionLexer lexer;

    private ExpressionParser(String text) {
        this.lexer = new ExpressionLexer(text);
    }

    /**
     * Parse a complete expression.
     *
     * @param text source text
     * @return the AST root
     * @throws CompileException on any syntax error
     */
    static Expression parse(String text) {
        ExpressionParser parser = new ExpressionParser(text);
        Expression root = parser.parseOr();
        if (parser.lexer.token() != TokenType.EOF) {
            throw parser.error("Unexpected trailing input " + parser.describe());
        }
        return root;
    }

    // ---------------------------------------------------------------
    // Precedence levels
    // ---------------------------------------------------------------

    private Expression parseOr() {
        Expression left = parseAnd();
        while (at(TokenType.OR) || at(TokenType.PIPE_PIPE)) {
            lexer.nextToken();
            left = new BinaryOp(left, BinaryOperator.OR, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (at(TokenType.AND) || at(TokenType.AMP_AMP)) {
            lexer.nextToken();
            left = new BinaryOp(left, BinaryOperator.AND, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (at(TokenType.NOT) || at(TokenType.BANG)) {
            lexer.nextToken();
            return new UnaryOp(UnaryOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();

        BinaryOperator op = comparisonOperator(lexer.token());
        if (op != null) {
            lexer.nextToken();
            return new BinaryOp(left, op, parseAdditive());
        }
        if (at(TokenType.IN)) {
            lexer.nextToken();
            return new InExpr(left, parseAdditive(), false);
        }
        if (at(TokenType.NOT)) {
            lexer.nextToken();
            expect(TokenType.IN, "IN after NOT");
            return new InExpr(left, parseAdditive(), true);
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (at(TokenType.PLUS) || at(TokenType.MINUS)) {
            BinaryOperator op = at(TokenType.PLUS) ? BinaryOperator.PLUS : BinaryOperator.MINUS;
            lexer.nextToken();
            left = new BinaryOp(left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (true) {
            BinaryOperator op = switch (lexer.token()) {
                case STAR -> BinaryOperator.TIMES;
                case SLASH -> BinaryOperator.DIVIDE;
                case PERCENT -> BinaryOperator.MODULO;
                default -> null;
            };
            if (op == null) {
                return left;
            }
            lexer.nextToken();
            left = new BinaryOp(left, op, parseUnary());
        }
    }

    private Expression parseUnary() {
        if (at(TokenType.MINUS)) {
            lexer.nextToken();
            return new UnaryOp(UnaryOperator.NEGATE, parseUnary());
        }
        if (at(TokenType.PLUS)) {
            lexer.nextToken();
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        TokenType token = lexer.token();
        String value = lexer.stringVal();

        switch (token) {
            case INTEGER -> {
                lexer.nextToken();
                return integerLiteral(value);
            }
            case DECIMAL -> {
                lexer.nextToken();
                return new Literal(LiteralType.DECIMAL, new BigDecimal(value));
            }
            case STRING -> {
                lexer.nextToken();
                return new Literal(LiteralType.STRING, value);
            }
            case TRUE, FALSE -> {
                lexer.nextToken();
                return new Literal(LiteralType.BOOLEAN, token == TokenType.TRUE);
            }
            case NULL -> {
                lexer.nextToken();
                return new Literal(LiteralType.NULL, null);
            }
            case IDENTIFIER -> {
                return parseIdentifierOrCall();
            }
            case LPAREN -> {
                return parseParenthesized();
            }
            case LBRACKET -> {
                lexer.nextToken();
                List<Expression> elements = parseList(TokenType.RBRACKET);
                return new ListLiteral(elements);
            }
            default -> throw error("Unexpected " + describe());
        }
    }

    private Expression parseIdentifierOrCall() {
        List<String> path = new ArrayList<>();
        path.add(lexer.stringVal());
        lexer.nextToken();

        while (at(TokenType.DOT)) {
            lexer.nextToken();
            if (!at(TokenType.IDENTIFIER)) {
                throw error("Expected identifier after '.' but found " + describe());
            }
            path.add(lexer.stringVal());
            lexer.nextToken();
        }

        if (at(TokenType.LPAREN)) {
            lexer.nextToken();
            List<Expression> args = parseList(TokenType.RPAREN);
            return new FunctionCall(String.join(".", path), args);
        }
        return new Identifier(path);
    }

    /**
     * A parenthesized group is either a grouping of one expression or, when it
     * contains commas, a value list for {@code IN}.
     */
    private Expression parseParenthesized() {
        lexer.nextToken();
        Expression first = parseOr();
        if (at(TokenType.RPAREN)) {
            lexer.nextToken();
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (at(TokenType.COMMA)) {
            lexer.nextToken();
            elements.add(parseOr());
        }
        expect(TokenType.RPAREN, "')'");
        return new ListLiteral(elements);
    }

    /** Parse a comma-separated list up to and including {@code closing}. */
    private List<Expression> parseList(TokenType closing) {
        List<Expression> elements = new ArrayList<>();
        if (at(closing)) {
            lexer.nextToken();
            return elements;
        }
        elements.add(parseOr());
        while (at(TokenType.COMMA)) {
            lexer.nextToken();
            elements.add(parseOr());
        }
        expect(closing, closing == TokenType.RPAREN ? "')'" : "']'");
        return elements;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static BinaryOperator comparisonOperator(TokenType token) {
        return switch (token) {
            case EQ -> BinaryOperator.EQ;
            case NE -> BinaryOperator.NE;
            case LT -> BinaryOperator.LT;
            case LE -> BinaryOperator.LE;
            case GT -> BinaryOperator.GT;
            case GE -> BinaryOperator.GE;
            default -> null;
        };
    }

    private Literal integerLiteral(String text) {
        try {
            return new Literal(LiteralType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            return new Literal(LiteralType.DECIMAL, new BigDecimal(text));
        }
    }

    private boolean at(TokenType type) {
        return lexer.token() == type;
    }

    private void expect(TokenType type, String what) {
        if (!at(type)) {
            throw error("Expected " + what + " but found " + describe());
        }
        lexer.nextToken();
    }

    private String describe() {
        if (at(TokenType.EOF)) {
            return "end of input";
        }
        return lexer.stringVal() != null
                ? lexer.token() + " '" + lexer.stringVal() + "'"
                : lexer.token().toString();
    }

    private CompileException error(String message) {
        return new CompileException(message, lexer.text(), lexer.tokenPos());
    }
}
