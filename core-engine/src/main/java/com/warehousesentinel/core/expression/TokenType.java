package com.warehousesentinel.core.expression;

import java.util.Locale;
import java.util.Map;

/**
 * Token kinds produced by {@link ExpressionLexer}.
 *
 * <p>
 * Keyword tokens are matched case-insensitively, so {@code AND}, {@code and}
 * and {@code And} all produce {@link #AND}.
 * </p>
 *
 * @since 1.0.0
 */
public enum TokenType {

    // Literals
    EOF,
    IDENTIFIER,
    STRING,
    INTEGER,
    DECIMAL,

    // Keywords
    AND,
    OR,
    NOT,
    IN,
    TRUE,
    FALSE,
    NULL,

    // Comparison
    EQ,   // == or =
    NE,   // != or <>
    LT,
    LE,
    GT,
    GE,

    // Arithmetic
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,

    // Logical symbols
    AMP_AMP,   // &&
    PIPE_PIPE, // ||
    BANG,      // !

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT;

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", AND,
            "or", OR,
            "not", NOT,
            "in", IN,
            "true", TRUE,
            "false", FALSE,
            "null", NULL);

    /**
     * Look up a keyword token for an identifier-shaped word.
     *
     * @param word the scanned word
     * @return the keyword token, or {@link #IDENTIFIER} when the word is not a
     *         keyword
     */
    static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word.toLowerCase(Locale.ROOT), IDENTIFIER);
    }
}
