package com.warehousesentinel.core.expression;

/**
 * Hand-written scanner for the predicate language.
 *
 * <p>
 * The lexer is pull-based: it always holds the current token, and
 * {@link #nextToken()} advances to the next one. String literals may be
 * single- or double-quoted; inside them a backslash escapes the next
 * character and a doubled quote stands for one quote.
 * </p>
 *
 * @since 1.0.0
 */
final class ExpressionLexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private TokenType token;
    private String stringVal;
    private int tokenPos;

    ExpressionLexer(String text) {
        this.text = text;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken();
    }

    // ---------------------------------------------------------------
    // Token access
    // ---------------------------------------------------------------

    TokenType token() {
        return token;
    }

    String stringVal() {
        return stringVal;
    }

    int tokenPos() {
        return tokenPos;
    }

    String text() {
        return text;
    }

    // ---------------------------------------------------------------
    // Scanning
    // ---------------------------------------------------------------

    void nextToken() {
        while (Character.isWhitespace(ch)) {
            advance();
        }

        tokenPos = pos;
        stringVal = null;

        if (pos >= text.length()) {
            token = TokenType.EOF;
            return;
        }

        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }

        if (ch == '\'' || ch == '"') {
            scanString(ch);
            return;
        }

        if (isDigit(ch)) {
            scanNumber();
            return;
        }

        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        while (isIdentifierPart(ch)) {
            advance();
        }
        stringVal = text.substring(start, pos);
        token = TokenType.keywordOrIdentifier(stringVal);
    }

    private void scanString(char quote) {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (pos < text.length()) {
            if (ch == '\\') {
                advance();
                if (pos >= text.length()) {
                    break;
                }
                sb.append(ch);
                advance();
            } else if (ch == quote) {
                if (peek() == quote) {
                    sb.append(quote);
                    advance();
                    advance();
                } else {
                    advance(); // closing quote
                    stringVal = sb.toString();
                    token = TokenType.STRING;
                    return;
                }
            } else {
                sb.append(ch);
                advance();
            }
        }
        throw new CompileException("Unterminated string literal", text, start);
    }

    private void scanNumber() {
        int start = pos;
        boolean decimal = false;

        while (isDigit(ch)) {
            advance();
        }
        if (ch == '.' && isDigit(peek())) {
            decimal = true;
            advance();
            while (isDigit(ch)) {
                advance();
            }
        }
        if (ch == 'e' || ch == 'E') {
            decimal = true;
            advance();
            if (ch == '+' || ch == '-') {
                advance();
            }
            if (!isDigit(ch)) {
                throw new CompileException("Malformed number exponent", text, pos);
            }
            while (isDigit(ch)) {
                advance();
            }
        }

        stringVal = text.substring(start, pos);
        token = decimal ? TokenType.DECIMAL : TokenType.INTEGER;
    }

    private void scanOperator() {
        switch (ch) {
            case '(' -> single(TokenType.LPAREN);
            case ')' -> single(TokenType.RPAREN);
            case '[' -> single(TokenType.LBRACKET);
            case ']' -> single(TokenType.RBRACKET);
            case ',' -> single(TokenType.COMMA);
            case '.' -> single(TokenType.DOT);
            case '+' -> single(TokenType.PLUS);
            case '-' -> single(TokenType.MINUS);
            case '*' -> single(TokenType.STAR);
            case '/' -> single(TokenType.SLASH);
            case '%' -> single(TokenType.PERCENT);
            case '=' -> {
                advance();
                if (ch == '=') {
                    advance();
                    if (ch == '=') {
                        advance(); // === behaves like ==
                    }
                }
                token = TokenType.EQ;
            }
            case '!' -> {
                advance();
                if (ch == '=') {
                    advance();
                    if (ch == '=') {
                        advance(); // !== behaves like !=
                    }
                    token = TokenType.NE;
                } else {
                    token = TokenType.BANG;
                }
            }
            case '<' -> {
                advance();
                if (ch == '=') {
                    advance();
                    token = TokenType.LE;
                } else if (ch == '>') {
                    advance();
                    token = TokenType.NE;
                } else {
                    token = TokenType.LT;
                }
            }
            case '>' -> {
                advance();
                if (ch == '=') {
                    advance();
                    token = TokenType.GE;
                } else {
                    token = TokenType.GT;
                }
            }
            case '&' -> {
                advance();
                if (ch != '&') {
                    throw new CompileException("Expected '&' after '&'", text, pos);
                }
                advance();
                token = TokenType.AMP_AMP;
            }
            case '|' -> {
                advance();
                if (ch != '|') {
                    throw new CompileException("Expected '|' after '|'", text, pos);
                }
                advance();
                token = TokenType.PIPE_PIPE;
            }
            default -> throw new CompileException("Unexpected character '" + ch + "'", text, pos);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void single(TokenType type) {
        advance();
        token = type;
    }

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
