package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.FilterCondition;

/**
 * YAML bean for a filter condition.
 *
 * <pre>
 * - { field: status, operator: "=", value: active }
 * - { field: channel, operator: in, value: [search, social] }
 * </pre>
 *
 * @since 1.0.0
 */
public class FilterSpec {

    private String field;
    private String operator = "=";
    private Object value;

    /**
     * @throws IllegalArgumentException for an unknown operator or a value of
     *                                  the wrong shape
     */
    FilterCondition toCondition() {
        if (MappingSpec.isBlank(field)) {
            throw new IllegalArgumentException("filter field is required");
        }
        return FilterCondition.of(field, operator, value);
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator != null ? operator : "=";
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
