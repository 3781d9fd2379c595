package com.warehousesentinel.core.model;

import com.warehousesentinel.core.expression.CompileException;
import com.warehousesentinel.core.expression.ExpressionCompiler;
import com.warehousesentinel.core.model.ReportOutput.DerivedField;
import com.warehousesentinel.core.model.ReportOutput.OutputMetric;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A derived (gold) insight definition sourced from exactly one
 * {@link Entity}: a report, or a signal when {@link #getKind()} is
 * {@link ReportKind#SIGNAL}.
 *
 * <p>
 * The predicate is evaluated on the aggregated row (HAVING semantics). Output
 * rows are snapshot-appended to {@code dataset.table} keyed by report id and
 * detection timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregateReport {

    /** Columns added to every snapshot row by the outer projection. */
    public static final List<String> METADATA_COLUMNS = List.of("report_id", "detected_at");

    private final String id;
    private final String description;
    private final ReportKind kind;
    private final Entity source;
    private final String predicate;
    private final Window window;
    private final ReportOutput output;
    private final OrderBy orderBy;
    private final String dataset;
    private final String table;

    private AggregateReport(Builder builder) {
        this.id = builder.id;
        this.description = builder.description;
        this.kind = builder.kind;
        this.source = builder.source;
        this.predicate = builder.predicate;
        this.window = builder.window;
        this.output = builder.output;
        this.orderBy = builder.orderBy;
        this.dataset = builder.dataset != null ? builder.dataset : builder.kind.defaultDataset();
        this.table = builder.table != null ? builder.table : Names.snakeCase(builder.id);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Nested value types
    // ---------------------------------------------------------------

    /**
     * Default time window.
     *
     * @param lookbackDays  days back from the current date
     * @param dateDimension entity dimension forming the time axis
     */
    public record Window(int lookbackDays, String dateDimension) {

        public Window {
            dateDimension = dateDimension == null || dateDimension.isBlank() ? "date" : dateDimension;
        }

        public static Window lastDays(int lookbackDays) {
            return new Window(lookbackDays, "date");
        }
    }

    /**
     * Final ordering of the snapshot rows.
     *
     * @param field     output column
     * @param direction sort direction
     */
    public record OrderBy(String field, Direction direction) {

        public OrderBy {
            Objects.requireNonNull(field, "Order field must not be null");
            direction = direction == null ? Direction.ASC : direction;
        }

        public String toSql() {
            return field + " " + direction.name();
        }
    }

    public enum Direction {
        ASC, DESC;

        public static Direction fromString(String value) {
            return value == null ? ASC : Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public ReportKind getKind() {
        return kind;
    }

    public Entity getSource() {
        return source;
    }

    public Optional<String> getPredicate() {
        return Optional.ofNullable(predicate);
    }

    public Optional<Window> getWindow() {
        return Optional.ofNullable(window);
    }

    /**
     * @return the window's date dimension, or {@code date} without a window
     */
    public String dateDimension() {
        return window != null ? window.dateDimension() : "date";
    }

    public ReportOutput getOutput() {
        return output;
    }

    public Optional<OrderBy> getOrderBy() {
        return Optional.ofNullable(orderBy);
    }

    public String getDataset() {
        return dataset;
    }

    public String getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "AggregateReport{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", source='" + source.getId() + '\'' +
                ", table='" + dataset + "." + table + '\'' +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AggregateReport}.
     */
    public static class Builder {
        private String id;
        private String description;
        private ReportKind kind = ReportKind.REPORT;
        private Entity source;
        private String predicate;
        private Window window;
        private final List<String> grain = new ArrayList<>();
        private final List<String> includeDimensions = new ArrayList<>();
        private final Map<String, OutputMetric> metrics = new LinkedHashMap<>();
        private final Map<String, DerivedField> derivedFields = new LinkedHashMap<>();
        private ReportOutput output;
        private OrderBy orderBy;
        private String dataset;
        private String table;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder kind(ReportKind kind) {
            this.kind = Objects.requireNonNull(kind, "Kind must not be null");
            return this;
        }

        public Builder source(Entity source) {
            this.source = source;
            return this;
        }

        public Builder predicate(String predicate) {
            this.predicate = predicate == null || predicate.isBlank() ? null : predicate;
            return this;
        }

        public Builder window(Window window) {
            this.window = window;
            return this;
        }

        public Builder grain(String... fields) {
            this.grain.addAll(List.of(fields));
            return this;
        }

        public Builder grain(List<String> fields) {
            this.grain.addAll(fields);
            return this;
        }

        public Builder includeDimensions(List<String> fields) {
            this.includeDimensions.addAll(fields);
            return this;
        }

        public Builder metric(String alias, OutputMetric metric) {
            this.metrics.put(alias, metric);
            return this;
        }

        public Builder derivedField(String alias, DerivedField field) {
            this.derivedFields.put(alias, field);
            return this;
        }

        public Builder orderBy(OrderBy orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder dataset(String dataset) {
            this.dataset = dataset;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        /**
         * Validate and build the report.
         *
         * @return a new immutable {@link AggregateReport}
         * @throws DefinitionException if any invariant is violated
         */
        public AggregateReport build() {
            output = new ReportOutput(grain, includeDimensions, metrics, derivedFields);

            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("id is required");
            }
            if (source == null) {
                errors.add("source entity is required");
            } else {
                validateAgainstSource(errors);
            }
            validateOutputNames(errors);
            if (predicate != null) {
                try {
                    ExpressionCompiler.compile(predicate);
                } catch (CompileException e) {
                    errors.add("predicate does not compile: " + e.getMessage());
                }
            }
            DefinitionException.throwIfAny("Invalid aggregate report '" + id + "'", errors);
            return new AggregateReport(this);
        }

        // -----------------------------------------------------------
        // Validation
        // -----------------------------------------------------------

        private void validateAgainstSource(List<String> errors) {
            if (grain.isEmpty()) {
                errors.add("output grain must not be empty");
            }
            for (String field : grain) {
                if (!source.hasDimension(field)) {
                    errors.add("grain field '" + field + "' is not a dimension of entity '" + source.getId() + "'");
                }
            }
            for (String field : includeDimensions) {
                if (!source.hasDimension(field)) {
                    errors.add("included dimension '" + field + "' is not a dimension of entity '"
                            + source.getId() + "'");
                }
            }
            if (window != null) {
                if (window.lookbackDays() <= 0) {
                    errors.add("window lookbackDays must be > 0, got " + window.lookbackDays());
                }
                if (!source.hasDimension(window.dateDimension())) {
                    errors.add("window dateDimension '" + window.dateDimension()
                            + "' is not a dimension of entity '" + source.getId() + "'");
                }
            }
        }

        private void validateOutputNames(List<String> errors) {
            Set<String> names = new LinkedHashSet<>(grain);
            names.add("date");
            names.addAll(includeDimensions);
            Set<String> seen = new HashSet<>(names);

            for (String alias : metrics.keySet()) {
                if (!Names.isSqlIdentifier(alias)) {
                    errors.add("metric alias '" + alias + "' is not a valid identifier");
                }
                if (!seen.add(alias)) {
                    errors.add("metric alias '" + alias + "' collides with another output column");
                }
            }
            for (Map.Entry<String, DerivedField> entry : derivedFields.entrySet()) {
                String alias = entry.getKey();
                if (!Names.isSqlIdentifier(alias)) {
                    errors.add("derived field '" + alias + "' is not a valid identifier");
                }
                if (!seen.add(alias)) {
                    errors.add("derived field '" + alias + "' collides with another output column");
                }
                if (entry.getValue().expression().isBlank()) {
                    errors.add("derived field '" + alias + "' has an empty expression");
                }
            }
            seen.addAll(METADATA_COLUMNS);
            if (orderBy != null && !seen.contains(orderBy.field())) {
                errors.add("orderBy field '" + orderBy.field() + "' is not an output column");
            }
        }
    }
}
