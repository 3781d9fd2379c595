package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldType;
import com.warehousesentinel.core.model.ReportKind;
import com.warehousesentinel.core.model.ReportOutput.DerivedField;
import com.warehousesentinel.core.model.ReportOutput.OutputMetric;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * YAML bean for an aggregate report or signal.
 *
 * <pre>
 * - id: wasted_spend
 *   kind: signal
 *   entity: ad_performance
 *   predicate: "spend > 0 AND conversions = 0"
 *   window: { lookbackDays: 7 }
 *   output:
 *     grain: [account_id, campaign_id]
 *     includeDimensions: [campaign_name]
 *     metrics:
 *       spend: {}
 *       conversions: { aggregation: sum }
 *   orderBy: { field: spend, direction: desc }
 * </pre>
 *
 * <p>
 * An output metric written as {@code name: {}} or {@code name:} re-aggregates
 * the entity metric of the same name.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportSpec {

    private String id;
    private String description;
    private String kind = "report";
    private String entity;
    private String predicate;
    private WindowSpec window;
    private OutputSpec output = new OutputSpec();
    private OrderBySpec orderBy;
    private String dataset;
    private String table;

    /**
     * @param source the entity named by {@code entity}, already built
     * @return the validated report
     * @throws DefinitionException if the definition is invalid
     */
    public AggregateReport toReport(Entity source) {
        AggregateReport.Builder builder = AggregateReport.builder()
                .id(id)
                .description(description)
                .kind(parseKind())
                .source(source)
                .predicate(predicate)
                .grain(output.getGrain())
                .includeDimensions(output.getIncludeDimensions())
                .dataset(dataset)
                .table(table);
        if (window != null) {
            builder.window(new AggregateReport.Window(window.getLookbackDays(), window.getDateDimension()));
        }
        if (orderBy != null) {
            if (MappingSpec.isBlank(orderBy.getField())) {
                throw new DefinitionException("Invalid aggregate report '" + id + "': orderBy field is required");
            }
            builder.orderBy(new AggregateReport.OrderBy(orderBy.getField(),
                    AggregateReport.Direction.fromString(orderBy.getDirection())));
        }
        output.getMetrics().forEach((alias, metric) -> builder.metric(alias,
                metric == null ? OutputMetric.of(null) : metric.toOutputMetric()));
        output.getDerivedFields().forEach((alias, field) -> {
            if (field == null) {
                throw new DefinitionException("Invalid aggregate report '" + id + "': derived field '"
                        + alias + "' has no expression");
            }
            builder.derivedField(alias, field.toDerivedField());
        });
        return builder.build();
    }

    private ReportKind parseKind() {
        try {
            return ReportKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DefinitionException("Unknown report kind: '" + kind + "'. Supported: report, signal");
        }
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind != null ? kind : "report";
    }

    public String getEntity() {
        return entity;
    }

    public void setEntity(String entity) {
        this.entity = entity;
    }

    public String getPredicate() {
        return predicate;
    }

    public void setPredicate(String predicate) {
        this.predicate = predicate;
    }

    public WindowSpec getWindow() {
        return window;
    }

    public void setWindow(WindowSpec window) {
        this.window = window;
    }

    public OutputSpec getOutput() {
        return output;
    }

    public void setOutput(OutputSpec output) {
        this.output = output != null ? output : new OutputSpec();
    }

    public OrderBySpec getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(OrderBySpec orderBy) {
        this.orderBy = orderBy;
    }

    public String getDataset() {
        return dataset;
    }

    public void setDataset(String dataset) {
        this.dataset = dataset;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    @Override
    public String toString() {
        return "ReportSpec{id='" + id + "', kind=" + kind + ", entity='" + entity + "'}";
    }

    // ---------------------------------------------------------------
    // Nested beans
    // ---------------------------------------------------------------

    public static class WindowSpec {

        private int lookbackDays;
        private String dateDimension;

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public String getDateDimension() {
            return dateDimension;
        }

        public void setDateDimension(String dateDimension) {
            this.dateDimension = dateDimension;
        }
    }

    public static class OutputSpec {

        private List<String> grain = new ArrayList<>();
        private List<String> includeDimensions = new ArrayList<>();
        private Map<String, OutputMetricSpec> metrics = new LinkedHashMap<>();
        private Map<String, DerivedFieldSpec> derivedFields = new LinkedHashMap<>();

        public List<String> getGrain() {
            return grain;
        }

        public void setGrain(List<String> grain) {
            this.grain = grain != null ? grain : new ArrayList<>();
        }

        public List<String> getIncludeDimensions() {
            return includeDimensions;
        }

        public void setIncludeDimensions(List<String> includeDimensions) {
            this.includeDimensions = includeDimensions != null ? includeDimensions : new ArrayList<>();
        }

        public Map<String, OutputMetricSpec> getMetrics() {
            return metrics;
        }

        public void setMetrics(Map<String, OutputMetricSpec> metrics) {
            this.metrics = metrics != null ? metrics : new LinkedHashMap<>();
        }

        public Map<String, DerivedFieldSpec> getDerivedFields() {
            return derivedFields;
        }

        public void setDerivedFields(Map<String, DerivedFieldSpec> derivedFields) {
            this.derivedFields = derivedFields != null ? derivedFields : new LinkedHashMap<>();
        }
    }

    public static class OutputMetricSpec {

        private String source;
        private String aggregation;
        private String expression;

        OutputMetric toOutputMetric() {
            if (!MappingSpec.isBlank(expression)) {
                return OutputMetric.expression(expression);
            }
            Aggregation override = MappingSpec.isBlank(aggregation) ? null : Aggregation.fromString(aggregation);
            return OutputMetric.of(source, override);
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getAggregation() {
            return aggregation;
        }

        public void setAggregation(String aggregation) {
            this.aggregation = aggregation;
        }

        public String getExpression() {
            return expression;
        }

        public void setExpression(String expression) {
            this.expression = expression;
        }
    }

    public static class DerivedFieldSpec {

        private String expression;
        private String type;

        DerivedField toDerivedField() {
            if (MappingSpec.isBlank(expression)) {
                throw new DefinitionException("derived field expression is required");
            }
            return new DerivedField(expression, type == null ? null : FieldType.fromString(type));
        }

        public String getExpression() {
            return expression;
        }

        public void setExpression(String expression) {
            this.expression = expression;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class OrderBySpec {

        private String field;
        private String direction;

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getDirection() {
            return direction;
        }

        public void setDirection(String direction) {
            this.direction = direction;
        }
    }
}
