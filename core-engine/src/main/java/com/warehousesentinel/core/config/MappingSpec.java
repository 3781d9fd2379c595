package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.FieldMapping;

/**
 * YAML bean for a field mapping: exactly one of {@code column} or
 * {@code expression}.
 *
 * <pre>
 * campaign_name: { column: campaign }
 * ctr: { expression: "SAFE_DIVIDE(clicks, impressions)" }
 * </pre>
 *
 * @since 1.0.0
 */
public class MappingSpec {

    private String column;
    private String expression;

    public String getColumn() {
        return column;
    }

    public void setColumn(String column) {
        this.column = column;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    /**
     * @return the mapping, or {@code null} when neither key is set
     * @throws IllegalArgumentException when both keys are set
     */
    FieldMapping toMapping() {
        if (isBlank(column) && isBlank(expression)) {
            return null;
        }
        return new FieldMapping(column, expression);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return column != null ? "column:" + column : "expression:" + expression;
    }
}
