package com.warehousesentinel.core.model;

/**
 * How one entity field is produced from a raw source: either a raw column
 * name or a SQL expression over the raw columns. Exactly one is set.
 *
 * @param sourceField raw column name, or {@code null}
 * @param expression  SQL expression, or {@code null}
 * @since 1.0.0
 */
public record FieldMapping(String sourceField, String expression) {

    public FieldMapping {
        boolean hasField = sourceField != null && !sourceField.isBlank();
        boolean hasExpression = expression != null && !expression.isBlank();
        if (hasField == hasExpression) {
            throw new IllegalArgumentException(
                    "Field mapping needs exactly one of sourceField or expression");
        }
    }

    public static FieldMapping column(String sourceField) {
        return new FieldMapping(sourceField, null);
    }

    public static FieldMapping expression(String expression) {
        return new FieldMapping(null, expression);
    }

    public boolean isExpression() {
        return expression != null;
    }

    /**
     * @return the SQL text this mapping contributes to a SELECT list
     */
    public String sql() {
        return isExpression() ? expression : sourceField;
    }
}
