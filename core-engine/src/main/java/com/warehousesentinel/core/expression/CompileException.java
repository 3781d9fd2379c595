package com.warehousesentinel.core.expression;

/**
 * Raised when an expression cannot be translated into SQL: a syntax error, or
 * an expression node the renderer does not support.
 *
 * <p>
 * The offending expression text and the character position (when known) are
 * carried so callers can surface them alongside the definition that owns the
 * expression. Compile failures indicate a configuration bug and are never
 * retried.
 * </p>
 *
 * @since 1.0.0
 */
public class CompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Position value used when the failure is not tied to a character. */
    public static final int NO_POSITION = -1;

    private final String expression;
    private final int position;

    public CompileException(String message, String expression, int position) {
        super(format(message, expression, position));
        this.expression = expression;
        this.position = position;
    }

    public CompileException(String message, String expression) {
        this(message, expression, NO_POSITION);
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }

    private static String format(String message, String expression, int position) {
        StringBuilder sb = new StringBuilder(message);
        if (position >= 0) {
            sb.append(" at position ").append(position);
        }
        if (expression != null) {
            sb.append(" in expression '").append(expression).append('\'');
        }
        return sb.toString();
    }
}
