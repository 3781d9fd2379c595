package com.warehousesentinel.core.model;

import com.warehousesentinel.core.expression.CompileException;
import com.warehousesentinel.core.expression.ExpressionCompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A modeled (silver) table definition merged from one or more raw sources.
 *
 * <h3>Field resolution</h3>
 * <p>
 * For a given field and source the mapping is chosen in this order:
 * </p>
 * <ol>
 * <li>the field's own per-source override</li>
 * <li>the source's {@code fieldOverrides} entry</li>
 * <li>the field's default mapping</li>
 * <li>an implicit column with the field's name</li>
 * </ol>
 *
 * <h3>Invariants</h3>
 * <p>
 * Checked in {@link Builder#build()}; every violation is collected and
 * reported in one {@link DefinitionException}:
 * </p>
 * <ul>
 * <li>at least one source, with unique ids; non-empty grain</li>
 * <li>every grain field is a declared dimension or is overridden by every
 * source</li>
 * <li>when a source lists its columns, every column-backed resolution for
 * that source names one of them</li>
 * <li>{@code partitionBy} and {@code clusterBy} name entity dimensions</li>
 * <li>dimension and metric names do not collide</li>
 * <li>superlatives rank by dimensions and target entity metrics, unless
 * they carry their own expression for a single target</li>
 * </ul>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Entity {

    /** Dataset used when a definition does not name one. */
    public static final String DEFAULT_DATASET = "entities";

    private final String id;
    private final String description;
    private final List<SourceRef> sources;
    private final List<String> grain;
    private final Map<String, DimensionDef> dimensions;
    private final Map<String, MetricDef> metrics;
    private final String dataset;
    private final String table;
    private final String partitionBy;
    private final List<String> clusterBy;
    private final TransformQueryBuilder transform;
    private final List<Superlative> superlatives;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.description = builder.description;
        this.sources = List.copyOf(builder.sources);
        this.grain = List.copyOf(builder.grain);
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dimensions));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
        this.dataset = builder.dataset;
        this.table = builder.table != null ? builder.table : Names.snakeCase(builder.id);
        this.partitionBy = builder.partitionBy;
        this.clusterBy = List.copyOf(builder.clusterBy);
        this.transform = builder.transform;
        this.superlatives = List.copyOf(builder.superlatives);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * Resolve how {@code field} is produced from {@code source}.
     *
     * @param field  grain, dimension or metric name
     * @param source one of this entity's sources
     * @return the mapping; never {@code null}
     */
    public FieldMapping resolve(String field, SourceRef source) {
        Objects.requireNonNull(field, "Field must not be null");
        Objects.requireNonNull(source, "Source must not be null");

        Map<String, FieldMapping> perSource = Map.of();
        FieldMapping fallback = null;
        if (dimensions.containsKey(field)) {
            perSource = dimensions.get(field).perSourceOverride();
            fallback = dimensions.get(field).mapping();
        } else if (metrics.containsKey(field)) {
            perSource = metrics.get(field).perSourceOverride();
            fallback = metrics.get(field).mapping();
        }

        FieldMapping override = perSource.get(source.id());
        if (override != null) {
            return override;
        }
        FieldMapping sourceOverride = source.fieldOverrides().get(field);
        if (sourceOverride != null) {
            return sourceOverride;
        }
        if (fallback != null) {
            return fallback;
        }
        return FieldMapping.column(field);
    }

    /**
     * @return dimension names that are not part of the grain, in declaration
     *         order
     */
    public List<String> nonGrainDimensions() {
        List<String> out = new ArrayList<>();
        for (String name : dimensions.keySet()) {
            if (!grain.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }

    /**
     * @return {@code true} when {@code name} is a grain field or a declared
     *         dimension
     */
    public boolean hasDimension(String name) {
        return dimensions.containsKey(name) || grain.contains(name);
    }

    public boolean hasMetric(String name) {
        return metrics.containsKey(name);
    }

    public Optional<MetricDef> metric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    /**
     * Type of a dimension or metric; grain fields that are only resolved by
     * source overrides are treated as strings.
     */
    public FieldType fieldType(String name) {
        if (dimensions.containsKey(name)) {
            return dimensions.get(name).type();
        }
        if (metrics.containsKey(name)) {
            return metrics.get(name).type();
        }
        return FieldType.STRING;
    }

    /**
     * Find the field that forms the time axis: the first dimension of type
     * {@link FieldType#DATE}, then a dimension named {@code date}, then one
     * named {@code day}.
     *
     * @return the date-like field, if any
     */
    public Optional<String> dateField() {
        for (Map.Entry<String, DimensionDef> entry : dimensions.entrySet()) {
            if (entry.getValue().type() == FieldType.DATE) {
                return Optional.of(entry.getKey());
            }
        }
        if (hasDimension("date")) {
            return Optional.of("date");
        }
        if (hasDimension("day")) {
            return Optional.of("day");
        }
        return Optional.empty();
    }

    /**
     * @return {@code dataset.table} of the materialized table
     */
    public String fqn() {
        return dataset + "." + table;
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

    public List<SourceRef> getSources() {
        return sources;
    }

    public List<String> getGrain() {
        return grain;
    }

    public Map<String, DimensionDef> getDimensions() {
        return dimensions;
    }

    public Map<String, MetricDef> getMetrics() {
        return metrics;
    }

    public String getDataset() {
        return dataset;
    }

    public String getTable() {
        return table;
    }

    public Optional<String> getPartitionBy() {
        return Optional.ofNullable(partitionBy);
    }

    public List<String> getClusterBy() {
        return clusterBy;
    }

    public Optional<TransformQueryBuilder> getTransform() {
        return Optional.ofNullable(transform);
    }

    public List<Superlative> getSuperlatives() {
        return superlatives;
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", sources=" + sources.size() +
                ", grain=" + grain +
                ", table='" + fqn() + '\'' +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Entity}. {@link #build()} validates every
     * invariant and throws a single {@link DefinitionException} listing all
     * violations.
     */
    public static class Builder {
        private String id;
        private String description;
        private final List<SourceRef> sources = new ArrayList<>();
        private final List<String> grain = new ArrayList<>();
        private final Map<String, DimensionDef> dimensions = new LinkedHashMap<>();
        private final Map<String, MetricDef> metrics = new LinkedHashMap<>();
        private String dataset = DEFAULT_DATASET;
        private String table;
        private String partitionBy;
        private final List<String> clusterBy = new ArrayList<>();
        private TransformQueryBuilder transform;
        private final List<Superlative> superlatives = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(SourceRef source) {
            this.sources.add(Objects.requireNonNull(source, "Source must not be null"));
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

        public Builder dimension(String name, DimensionDef definition) {
            this.dimensions.put(name, definition);
            return this;
        }

        public Builder metric(String name, MetricDef definition) {
            this.metrics.put(name, definition);
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

        public Builder partitionBy(String partitionBy) {
            this.partitionBy = partitionBy;
            return this;
        }

        public Builder clusterBy(String... fields) {
            this.clusterBy.addAll(List.of(fields));
            return this;
        }

        public Builder clusterBy(List<String> fields) {
            this.clusterBy.addAll(fields);
            return this;
        }

        public Builder transform(TransformQueryBuilder transform) {
            this.transform = transform;
            return this;
        }

        public Builder superlative(Superlative superlative) {
            this.superlatives.add(Objects.requireNonNull(superlative, "Superlative must not be null"));
            return this;
        }

        /**
         * Validate and build the entity.
         *
         * @return a new immutable {@link Entity}
         * @throws DefinitionException if any invariant is violated
         */
        public Entity build() {
            List<String> errors = new ArrayList<>();
            validateIdentity(errors);
            validateSources(errors);
            validateFields(errors);
            validateGrain(errors);
            validateLayout(errors);
            validateSuperlatives(errors);
            if (transform == null && errors.isEmpty()) {
                validateResolutions(errors);
            }
            DefinitionException.throwIfAny("Invalid entity '" + id + "'", errors);
            return new Entity(this);
        }

        // -----------------------------------------------------------
        // Validation
        // -----------------------------------------------------------

        private void validateIdentity(List<String> errors) {
            if (id == null || id.isBlank()) {
                errors.add("id is required");
            }
            if (dataset == null || dataset.isBlank()) {
                errors.add("dataset is required");
            }
            if (table != null && !Names.isSqlIdentifier(table)) {
                errors.add("table '" + table + "' is not a valid identifier");
            }
        }

        private void validateSources(List<String> errors) {
            if (sources.isEmpty()) {
                errors.add("at least one source is required");
            }
            Set<String> seen = new HashSet<>();
            for (SourceRef source : sources) {
                if (!seen.add(source.id())) {
                    errors.add("duplicate source id '" + source.id() + "'");
                }
                if (source.filter() != null) {
                    try {
                        ExpressionCompiler.parse(source.filter());
                    } catch (CompileException e) {
                        errors.add("filter of source '" + source.id() + "' does not compile: " + e.getMessage());
                    }
                }
                for (String field : source.fieldOverrides().keySet()) {
                    if (!dimensions.containsKey(field) && !metrics.containsKey(field) && !grain.contains(field)) {
                        errors.add("source '" + source.id() + "' overrides unknown field '" + field + "'");
                    }
                }
            }
        }

        private void validateFields(List<String> errors) {
            Set<String> sourceIds = new HashSet<>();
            sources.forEach(s -> sourceIds.add(s.id()));

            for (Map.Entry<String, DimensionDef> entry : dimensions.entrySet()) {
                String name = entry.getKey();
                if (!Names.isSqlIdentifier(name)) {
                    errors.add("dimension '" + name + "' is not a valid identifier");
                }
                if (metrics.containsKey(name)) {
                    errors.add("'" + name + "' is declared as both a dimension and a metric");
                }
                checkOverrideSources("dimension", name, entry.getValue().perSourceOverride(), sourceIds, errors);
            }
            for (Map.Entry<String, MetricDef> entry : metrics.entrySet()) {
                String name = entry.getKey();
                if (!Names.isSqlIdentifier(name)) {
                    errors.add("metric '" + name + "' is not a valid identifier");
                }
                checkOverrideSources("metric", name, entry.getValue().perSourceOverride(), sourceIds, errors);
            }
        }

        private void validateGrain(List<String> errors) {
            if (grain.isEmpty()) {
                errors.add("grain must not be empty");
                return;
            }
            if (new LinkedHashSet<>(grain).size() != grain.size()) {
                errors.add("grain contains duplicate fields: " + grain);
            }
            for (String field : grain) {
                if (metrics.containsKey(field)) {
                    errors.add("grain field '" + field + "' is a metric");
                    continue;
                }
                if (dimensions.containsKey(field)) {
                    continue;
                }
                List<String> uncovered = sources.stream()
                        .filter(s -> !s.fieldOverrides().containsKey(field))
                        .map(SourceRef::id)
                        .toList();
                if (!uncovered.isEmpty()) {
                    errors.add("grain field '" + field + "' is not a declared dimension and is not"
                            + " overridden by source(s) " + uncovered);
                }
            }
        }

        private void validateLayout(List<String> errors) {
            if (partitionBy != null && !dimensions.containsKey(partitionBy) && !grain.contains(partitionBy)) {
                errors.add("partitionBy '" + partitionBy + "' is not a dimension");
            }
            for (String field : clusterBy) {
                if (!dimensions.containsKey(field) && !grain.contains(field)) {
                    errors.add("clusterBy field '" + field + "' is not a dimension");
                }
            }
        }

        private void validateSuperlatives(List<String> errors) {
            if (!superlatives.isEmpty() && !dimensions.containsKey("account_id") && !grain.contains("account_id")) {
                errors.add("superlatives require an 'account_id' dimension");
            }
            for (int i = 0; i < superlatives.size(); i++) {
                Superlative superlative = superlatives.get(i);
                String where = "superlative #" + (i + 1);
                for (String column : List.of(superlative.dimensionId(), superlative.dimensionLabel())) {
                    if (!dimensions.containsKey(column) && !grain.contains(column)) {
                        errors.add(where + " ranks by '" + column + "' which is not a dimension");
                    }
                }
                if (superlative.targetMetrics().isEmpty()) {
                    errors.add(where + " has no targetMetrics");
                }
                if (superlative.hasExpression()) {
                    if (superlative.targetMetrics().size() > 1) {
                        errors.add(where + " has an expression and must name exactly one target metric, got "
                                + superlative.targetMetrics());
                    }
                    superlative.targetMetrics().stream()
                            .filter(name -> !Names.isSqlIdentifier(name))
                            .forEach(name -> errors.add(where + " target metric '" + name
                                    + "' is not a valid identifier"));
                    continue;
                }
                for (String name : superlative.targetMetrics()) {
                    if (!metrics.containsKey(name)) {
                        errors.add(where + " targets '" + name + "' which is not a metric");
                    }
                }
            }
        }

        private void validateResolutions(List<String> errors) {
            Entity candidate = new Entity(this);
            List<String> fields = new ArrayList<>(grain);
            candidate.nonGrainDimensions().forEach(fields::add);
            fields.addAll(metrics.keySet());

            for (SourceRef source : sources) {
                if (!source.hasKnownColumns()) {
                    continue;
                }
                for (String field : fields) {
                    FieldMapping mapping = candidate.resolve(field, source);
                    if (!mapping.isExpression() && !source.columns().contains(mapping.sourceField())) {
                        errors.add("field '" + field + "' resolves to column '" + mapping.sourceField()
                                + "' which source '" + source.id() + "' does not provide;"
                                + " add an expression or a per-source override");
                    }
                }
            }
        }

        private static void checkOverrideSources(String kind, String name, Map<String, FieldMapping> overrides,
                                                 Set<String> sourceIds, List<String> errors) {
            for (String sourceId : overrides.keySet()) {
                if (!sourceIds.contains(sourceId)) {
                    errors.add(kind + " '" + name + "' overrides unknown source '" + sourceId + "'");
                }
            }
        }
    }
}
