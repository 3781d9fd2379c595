package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.FilterCondition;
import com.warehousesentinel.core.model.Measure;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML bean for a measure.
 *
 * <pre>
 * - id: daily_spend
 *   entity: ad_performance
 *   field: spend
 *   aggregation: sum
 *   allowedDimensions: [date, account_id, channel]
 *   filters:
 *     - { field: channel, operator: "!=", value: internal }
 * </pre>
 *
 * @since 1.0.0
 */
public class MeasureSpec {

    private String id;
    private String entity;
    private String name;
    private String description;
    private String field;
    private String aggregation = "sum";
    private String expression;
    private List<String> allowedDimensions = new ArrayList<>();
    private List<FilterSpec> filters = new ArrayList<>();

    /**
     * @return the validated measure
     * @throws DefinitionException if the definition is invalid
     */
    public Measure toMeasure() {
        List<String> errors = new ArrayList<>();
        List<FilterCondition> conditions = new ArrayList<>();
        for (FilterSpec filter : filters) {
            try {
                conditions.add(filter.toCondition());
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        Measure.Value value = null;
        try {
            value = MappingSpec.isBlank(expression)
                    ? Measure.Value.of(field, Aggregation.fromString(aggregation))
                    : Measure.Value.expression(expression);
        } catch (DefinitionException | IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        DefinitionException.throwIfAny("Invalid measure '" + id + "'", errors);
        return new Measure(id, entity, name, description, value, allowedDimensions, conditions);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public void setEntity(String entity) {
        this.entity = entity;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation != null ? aggregation : "sum";
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public List<String> getAllowedDimensions() {
        return allowedDimensions;
    }

    public void setAllowedDimensions(List<String> allowedDimensions) {
        this.allowedDimensions = allowedDimensions != null ? allowedDimensions : new ArrayList<>();
    }

    public List<FilterSpec> getFilters() {
        return filters;
    }

    public void setFilters(List<FilterSpec> filters) {
        this.filters = filters != null ? filters : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MeasureSpec{id='" + id + "', entity='" + entity + "'}";
    }
}
