package com.warehousesentinel.core.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Baseline row filter of a {@link Measure} or a monitor scan.
 *
 * @param field    entity column
 * @param operator comparison
 * @param value    comparison value; a collection for {@code in} /
 *                 {@code not in}
 * @since 1.0.0
 */
public record FilterCondition(String field, Operator operator, Object value) {

    public FilterCondition {
        Objects.requireNonNull(field, "Filter field must not be null");
        Objects.requireNonNull(operator, "Filter operator must not be null");
        if (operator.isMembership() && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException(
                    "Filter on '" + field + "' with operator '" + operator.symbol() + "' needs a list value");
        }
        if (operator == Operator.CONTAINS && !(value instanceof String)) {
            throw new IllegalArgumentException(
                    "Filter on '" + field + "' with operator 'contains' needs a string value");
        }
    }

    public static FilterCondition of(String field, String operator, Object value) {
        return new FilterCondition(field, Operator.fromSymbol(operator), value);
    }

    /**
     * Filter operators accepted in definitions.
     */
    public enum Operator {
        EQ("="),
        NE("!="),
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<="),
        IN("in"),
        NOT_IN("not in"),
        CONTAINS("contains");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isMembership() {
            return this == IN || this == NOT_IN;
        }

        /**
         * @param symbol operator as written in definitions; {@code ==} is
         *               accepted for {@code =}
         * @return the operator
         * @throws IllegalArgumentException if the symbol is unknown
         */
        public static Operator fromSymbol(String symbol) {
            Objects.requireNonNull(symbol, "Operator must not be null");
            String normalized = symbol.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            if (normalized.equals("==")) {
                return EQ;
            }
            if (normalized.equals("<>")) {
                return NE;
            }
            for (Operator op : values()) {
                if (op.symbol.equals(normalized)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown filter operator: '" + symbol
                    + "'. Supported: =, !=, >, <, >=, <=, in, not in, contains");
        }
    }
}
