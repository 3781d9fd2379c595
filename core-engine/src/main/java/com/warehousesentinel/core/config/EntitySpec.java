package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.DimensionDef;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldMapping;
import com.warehousesentinel.core.model.FieldType;
import com.warehousesentinel.core.model.MetricDef;
import com.warehousesentinel.core.model.SourceRef;
import com.warehousesentinel.core.model.Superlative;
import com.warehousesentinel.core.model.TransformQueryBuilder;
import com.warehousesentinel.core.sql.SqlTransform;
import com.warehousesentinel.core.sql.WeightedAllocationTransform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * YAML bean for one entity definition.
 *
 * <pre>
 * - id: ad_performance
 *   grain: [date, account_id, campaign_id]
 *   partitionBy: date
 *   clusterBy: [account_id]
 *   sources:
 *     - id: google
 *       dataset: raw_google
 *       table: campaign_stats
 *       fields:
 *         campaign_name: { column: campaign }
 *   dimensions:
 *     date: { type: date }
 *     account_id: { type: string }
 *   metrics:
 *     spend: { aggregation: sum, column: cost }
 *   superlatives:
 *     - dimensionId: campaign_id
 *       dimensionLabel: campaign_name
 *       targetMetrics: [spend, clicks]
 * </pre>
 *
 * @since 1.0.0
 */
public class EntitySpec {

    private String id;
    private String description;
    private String dataset;
    private String table;
    private String partitionBy;
    private List<String> clusterBy = new ArrayList<>();
    private List<String> grain = new ArrayList<>();
    private List<SourceSpec> sources = new ArrayList<>();
    private Map<String, FieldSpec> dimensions = new LinkedHashMap<>();
    private Map<String, FieldSpec> metrics = new LinkedHashMap<>();
    private TransformSpec transform;
    private List<SuperlativeSpec> superlatives = new ArrayList<>();

    /**
     * Convert to the immutable model.
     *
     * @return the validated entity
     * @throws DefinitionException if the definition is invalid
     */
    public Entity toEntity() {
        List<String> errors = new ArrayList<>();
        Entity.Builder builder = Entity.builder()
                .id(id)
                .description(description)
                .table(table)
                .partitionBy(partitionBy)
                .clusterBy(clusterBy)
                .grain(grain);
        if (dataset != null) {
            builder.dataset(dataset);
        }
        for (SourceSpec source : sources) {
            try {
                builder.source(source.toSourceRef());
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        dimensions.forEach((name, field) -> {
            try {
                builder.dimension(name, (field == null ? new FieldSpec() : field).toDimension());
            } catch (IllegalArgumentException e) {
                errors.add("dimension '" + name + "': " + e.getMessage());
            }
        });
        metrics.forEach((name, field) -> {
            try {
                builder.metric(name, (field == null ? new FieldSpec() : field).toMetric(name));
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add("metric '" + name + "': " + e.getMessage());
            }
        });
        if (transform != null) {
            try {
                builder.transform(transform.toTransform());
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add("transform: " + e.getMessage());
            }
        }
        for (SuperlativeSpec superlative : superlatives) {
            try {
                builder.superlative(superlative.toSuperlative());
            } catch (DefinitionException | IllegalArgumentException e) {
                errors.add("superlative: " + e.getMessage());
            }
        }
        DefinitionException.throwIfAny("Invalid entity '" + id + "'", errors);
        return builder.build();
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

    public String getPartitionBy() {
        return partitionBy;
    }

    public void setPartitionBy(String partitionBy) {
        this.partitionBy = partitionBy;
    }

    public List<String> getClusterBy() {
        return clusterBy;
    }

    public void setClusterBy(List<String> clusterBy) {
        this.clusterBy = clusterBy != null ? clusterBy : new ArrayList<>();
    }

    public List<String> getGrain() {
        return grain;
    }

    public void setGrain(List<String> grain) {
        this.grain = grain != null ? grain : new ArrayList<>();
    }

    public List<SourceSpec> getSources() {
        return sources;
    }

    public void setSources(List<SourceSpec> sources) {
        this.sources = sources != null ? sources : new ArrayList<>();
    }

    public Map<String, FieldSpec> getDimensions() {
        return dimensions;
    }

    public void setDimensions(Map<String, FieldSpec> dimensions) {
        this.dimensions = dimensions != null ? dimensions : new LinkedHashMap<>();
    }

    public Map<String, FieldSpec> getMetrics() {
        return metrics;
    }

    public void setMetrics(Map<String, FieldSpec> metrics) {
        this.metrics = metrics != null ? metrics : new LinkedHashMap<>();
    }

    public TransformSpec getTransform() {
        return transform;
    }

    public void setTransform(TransformSpec transform) {
        this.transform = transform;
    }

    public List<SuperlativeSpec> getSuperlatives() {
        return superlatives;
    }

    public void setSuperlatives(List<SuperlativeSpec> superlatives) {
        this.superlatives = superlatives != null ? superlatives : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EntitySpec{id='" + id + "', sources=" + sources.size()
                + ", dimensions=" + dimensions.keySet() + ", metrics=" + metrics.keySet() + '}';
    }

    // ---------------------------------------------------------------
    // Nested beans
    // ---------------------------------------------------------------

    /**
     * Raw table feeding the entity.
     */
    public static class SourceSpec {

        private String id;
        private String dataset;
        private String table;
        private List<String> columns = new ArrayList<>();
        private Map<String, MappingSpec> fields = new LinkedHashMap<>();
        private String filter;

        SourceRef toSourceRef() {
            List<String> errors = new ArrayList<>();
            if (MappingSpec.isBlank(id)) {
                errors.add("id is required");
            }
            if (MappingSpec.isBlank(dataset)) {
                errors.add("dataset is required");
            }
            if (MappingSpec.isBlank(table)) {
                errors.add("table is required");
            }
            DefinitionException.throwIfAny("Invalid source '" + id + "'", errors);
            Map<String, FieldMapping> overrides = new LinkedHashMap<>();
            fields.forEach((field, mapping) -> {
                FieldMapping resolved = mapping == null ? null : mapping.toMapping();
                if (resolved == null) {
                    throw new DefinitionException("Source '" + id + "' maps field '" + field
                            + "' without a column or expression");
                }
                overrides.put(field, resolved);
            });
            return new SourceRef(id, dataset, table, new LinkedHashSet<>(columns), overrides, filter);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
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

        public List<String> getColumns() {
            return columns;
        }

        public void setColumns(List<String> columns) {
            this.columns = columns != null ? columns : new ArrayList<>();
        }

        public Map<String, MappingSpec> getFields() {
            return fields;
        }

        public void setFields(Map<String, MappingSpec> fields) {
            this.fields = fields != null ? fields : new LinkedHashMap<>();
        }

        public String getFilter() {
            return filter;
        }

        public void setFilter(String filter) {
            this.filter = filter;
        }
    }

    /**
     * Dimension or metric declaration. {@code aggregation} applies to
     * metrics only; {@code type} defaults to {@code string} for dimensions
     * and {@code number} for metrics.
     */
    public static class FieldSpec {

        private String type;
        private String aggregation;
        private String column;
        private String expression;
        private Map<String, MappingSpec> perSource = new LinkedHashMap<>();

        DimensionDef toDimension() {
            FieldType fieldType = type == null ? FieldType.STRING : FieldType.fromString(type);
            return new DimensionDef(fieldType, mapping(), perSourceMappings());
        }

        MetricDef toMetric(String name) {
            if (MappingSpec.isBlank(aggregation)) {
                throw new DefinitionException("aggregation is required for metric '" + name + "'");
            }
            FieldType fieldType = type == null ? FieldType.NUMBER : FieldType.fromString(type);
            return new MetricDef(fieldType, Aggregation.fromString(aggregation), mapping(), perSourceMappings());
        }

        private FieldMapping mapping() {
            MappingSpec spec = new MappingSpec();
            spec.setColumn(column);
            spec.setExpression(expression);
            return spec.toMapping();
        }

        private Map<String, FieldMapping> perSourceMappings() {
            Map<String, FieldMapping> mappings = new LinkedHashMap<>();
            perSource.forEach((source, mapping) -> {
                FieldMapping resolved = mapping == null ? null : mapping.toMapping();
                if (resolved != null) {
                    mappings.put(source, resolved);
                }
            });
            return mappings;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getAggregation() {
            return aggregation;
        }

        public void setAggregation(String aggregation) {
            this.aggregation = aggregation;
        }

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

        public Map<String, MappingSpec> getPerSource() {
            return perSource;
        }

        public void setPerSource(Map<String, MappingSpec> perSource) {
            this.perSource = perSource != null ? perSource : new LinkedHashMap<>();
        }
    }

    /**
     * Custom transform replacing the generated union query.
     *
     * <pre>
     * transform:
     *   type: sql
     *   sql: "SELECT ... FROM ${source.google}"
     * </pre>
     */
    public static class TransformSpec {

        private String type;
        private String sql;
        private String baseSource;
        private String carveOutSource;
        private List<String> joinKeys = new ArrayList<>();
        private String amountColumn;
        private String baseFilter;
        private String carveOutFilter;
        private String totalMetric;
        private String carveOutMetric;
        private String residualMetric;
        private Map<String, String> weights = new LinkedHashMap<>();
        private String fallbackMetric;
        private Map<String, String> passThrough = new LinkedHashMap<>();

        TransformQueryBuilder toTransform() {
            if (MappingSpec.isBlank(type)) {
                throw new DefinitionException("transform type is required");
            }
            return switch (type.trim().toLowerCase(Locale.ROOT)) {
                case "sql" -> {
                    if (MappingSpec.isBlank(sql)) {
                        throw new DefinitionException("sql transform needs a sql text");
                    }
                    yield new SqlTransform(sql);
                }
                case "weighted_allocation" -> toWeightedAllocation();
                default -> throw new DefinitionException("Unknown transform type: '" + type
                        + "'. Supported: sql, weighted_allocation");
            };
        }

        private WeightedAllocationTransform toWeightedAllocation() {
            WeightedAllocationTransform.Builder builder = WeightedAllocationTransform.builder()
                    .baseSource(baseSource)
                    .carveOutSource(carveOutSource)
                    .joinKeys(joinKeys)
                    .amountColumn(amountColumn)
                    .baseFilter(baseFilter)
                    .carveOutFilter(carveOutFilter)
                    .totalMetric(totalMetric)
                    .carveOutMetric(carveOutMetric)
                    .residualMetric(residualMetric)
                    .fallbackMetric(fallbackMetric);
            weights.forEach(builder::weight);
            passThrough.forEach(builder::passThrough);
            return builder.build();
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getSql() {
            return sql;
        }

        public void setSql(String sql) {
            this.sql = sql;
        }

        public String getBaseSource() {
            return baseSource;
        }

        public void setBaseSource(String baseSource) {
            this.baseSource = baseSource;
        }

        public String getCarveOutSource() {
            return carveOutSource;
        }

        public void setCarveOutSource(String carveOutSource) {
            this.carveOutSource = carveOutSource;
        }

        public List<String> getJoinKeys() {
            return joinKeys;
        }

        public void setJoinKeys(List<String> joinKeys) {
            this.joinKeys = joinKeys != null ? joinKeys : new ArrayList<>();
        }

        public String getAmountColumn() {
            return amountColumn;
        }

        public void setAmountColumn(String amountColumn) {
            this.amountColumn = amountColumn;
        }

        public String getBaseFilter() {
            return baseFilter;
        }

        public void setBaseFilter(String baseFilter) {
            this.baseFilter = baseFilter;
        }

        public String getCarveOutFilter() {
            return carveOutFilter;
        }

        public void setCarveOutFilter(String carveOutFilter) {
            this.carveOutFilter = carveOutFilter;
        }

        public String getTotalMetric() {
            return totalMetric;
        }

        public void setTotalMetric(String totalMetric) {
            this.totalMetric = totalMetric;
        }

        public String getCarveOutMetric() {
            return carveOutMetric;
        }

        public void setCarveOutMetric(String carveOutMetric) {
            this.carveOutMetric = carveOutMetric;
        }

        public String getResidualMetric() {
            return residualMetric;
        }

        public void setResidualMetric(String residualMetric) {
            this.residualMetric = residualMetric;
        }

        public Map<String, String> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, String> weights) {
            this.weights = weights != null ? weights : new LinkedHashMap<>();
        }

        public String getFallbackMetric() {
            return fallbackMetric;
        }

        public void setFallbackMetric(String fallbackMetric) {
            this.fallbackMetric = fallbackMetric;
        }

        public Map<String, String> getPassThrough() {
            return passThrough;
        }

        public void setPassThrough(Map<String, String> passThrough) {
            this.passThrough = passThrough != null ? passThrough : new LinkedHashMap<>();
        }
    }

    /**
     * Per-account ranking of dimension items. {@code rankType} is
     * {@code highest} (default) or {@code lowest}.
     */
    public static class SuperlativeSpec {

        private String dimensionId;
        private String dimensionLabel;
        private List<String> targetMetrics = new ArrayList<>();
        private String expression;
        private String rankType;

        Superlative toSuperlative() {
            List<String> errors = new ArrayList<>();
            if (MappingSpec.isBlank(dimensionId)) {
                errors.add("dimensionId is required");
            }
            if (MappingSpec.isBlank(dimensionLabel)) {
                errors.add("dimensionLabel is required");
            }
            DefinitionException.throwIfAny("Invalid superlative on '" + dimensionId + "'", errors);
            Superlative.RankType type = rankType == null ? null : Superlative.RankType.fromString(rankType);
            return new Superlative(dimensionId, dimensionLabel, targetMetrics, expression, type);
        }

        public String getDimensionId() {
            return dimensionId;
        }

        public void setDimensionId(String dimensionId) {
            this.dimensionId = dimensionId;
        }

        public String getDimensionLabel() {
            return dimensionLabel;
        }

        public void setDimensionLabel(String dimensionLabel) {
            this.dimensionLabel = dimensionLabel;
        }

        public List<String> getTargetMetrics() {
            return targetMetrics;
        }

        public void setTargetMetrics(List<String> targetMetrics) {
            this.targetMetrics = targetMetrics != null ? targetMetrics : new ArrayList<>();
        }

        public String getExpression() {
            return expression;
        }

        public void setExpression(String expression) {
            this.expression = expression;
        }

        public String getRankType() {
            return rankType;
        }

        public void setRankType(String rankType) {
            this.rankType = rankType;
        }
    }
}
