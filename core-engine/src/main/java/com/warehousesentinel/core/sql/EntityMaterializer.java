package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.expression.CompiledExpressionCache;
import com.warehousesentinel.core.expression.ExpressionCompiler;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldMapping;
import com.warehousesentinel.core.model.MetricDef;
import com.warehousesentinel.core.model.Names;
import com.warehousesentinel.core.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Compiles an {@link Entity} into the SQL that (re)builds its silver table.
 *
 * <h3>Default transform</h3>
 * <p>
 * One {@code SELECT} per source, combined with {@code UNION ALL}. Every branch
 * lists the same columns in the same order:
 * </p>
 * <ol>
 * <li>grain fields, {@code <resolved> AS <name>}</li>
 * <li>non-grain dimensions, {@code ANY_VALUE(<resolved>) AS <name>}</li>
 * <li>metrics, {@code COALESCE(<AGG>(SAFE_CAST(<col> AS FLOAT64)), 0)} for
 * column mappings or {@code COALESCE(<expression>, 0)} for expressions</li>
 * </ol>
 * <p>
 * followed by the optional compiled source filter and a {@code GROUP BY} over
 * the grain ordinals. Entities carrying a custom
 * {@link com.warehousesentinel.core.model.TransformQueryBuilder} use it instead;
 * the DDL wrapping is the same either way.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(EntityMaterializer.class);

    /** BigQuery accepts at most four clustering columns. */
    public static final int MAX_CLUSTER_FIELDS = 4;

    private final CompiledExpressionCache cache;

    public EntityMaterializer() {
        this(null);
    }

    /**
     * @param cache compiled-filter cache shared with other builders, or
     *              {@code null} to compile on every call
     */
    public EntityMaterializer(CompiledExpressionCache cache) {
        this.cache = cache;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Build the query producing the entity's rows.
     *
     * @param entity entity definition; must not be {@code null}
     * @return the custom transform's SQL, or the per-source union
     */
    public String buildTransformQuery(Entity entity) {
        Objects.requireNonNull(entity, "Entity must not be null");
        if (entity.getTransform().isPresent()) {
            LOG.debug("Entity '{}' uses a custom transform", entity.getId());
            return entity.getTransform().get().buildQuery(entity).trim();
        }
        return entity.getSources().stream()
                .map(source -> buildSourceSelect(entity, source))
                .collect(Collectors.joining("\nUNION ALL\n"));
    }

    /**
     * Build the full-replace DDL for the entity table.
     *
     * @param entity entity definition; must not be {@code null}
     * @return {@code CREATE OR REPLACE TABLE ... AS} statement
     */
    public String buildMaterializeDdl(Entity entity) {
        Objects.requireNonNull(entity, "Entity must not be null");
        StringBuilder ddl = new StringBuilder("CREATE OR REPLACE TABLE `")
                .append(entity.fqn())
                .append('`');
        entity.getPartitionBy()
                .map(Names::sanitizeIdentifier)
                .ifPresent(field -> ddl.append(" PARTITION BY ").append(field));
        List<String> cluster = clusterFields(entity.getClusterBy(), "entity '" + entity.getId() + "'");
        if (!cluster.isEmpty()) {
            ddl.append(" CLUSTER BY ").append(String.join(", ", cluster));
        }
        return ddl.append(" AS\n").append(buildTransformQuery(entity)).toString();
    }

    /**
     * Sanitize a clustering list and cut it to {@value #MAX_CLUSTER_FIELDS}
     * fields, warning when fields are dropped.
     *
     * @param fields  requested clustering fields
     * @param subject table owner, for the warning
     * @return at most four sanitized, non-empty field names
     */
    public static List<String> clusterFields(List<String> fields, String subject) {
        List<String> sanitized = fields.stream()
                .map(Names::sanitizeIdentifier)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
        if (sanitized.size() > MAX_CLUSTER_FIELDS) {
            LOG.warn("Clustering of {} lists {} fields, keeping the first {}: {}",
                    subject, sanitized.size(), MAX_CLUSTER_FIELDS, sanitized.subList(0, MAX_CLUSTER_FIELDS));
            return List.copyOf(sanitized.subList(0, MAX_CLUSTER_FIELDS));
        }
        return sanitized;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String buildSourceSelect(Entity entity, SourceRef source) {
        List<String> columns = new ArrayList<>();
        for (String field : entity.getGrain()) {
            columns.add(entity.resolve(field, source).sql() + " AS " + field);
        }
        for (String field : entity.nonGrainDimensions()) {
            columns.add("ANY_VALUE(" + entity.resolve(field, source).sql() + ") AS " + field);
        }
        for (Map.Entry<String, MetricDef> metric : entity.getMetrics().entrySet()) {
            columns.add(metricColumn(entity, metric.getKey(), metric.getValue(), source));
        }

        StringBuilder sql = new StringBuilder("SELECT\n  ")
                .append(String.join(",\n  ", columns))
                .append("\nFROM `").append(source.fqn()).append('`');
        if (source.filter() != null) {
            sql.append("\nWHERE ").append(compileFilter(source.filter()));
        }
        String ordinals = IntStream.rangeClosed(1, entity.getGrain().size())
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(", "));
        return sql.append("\nGROUP BY ").append(ordinals).toString();
    }

    private static String metricColumn(Entity entity, String name, MetricDef metric, SourceRef source) {
        FieldMapping mapping = entity.resolve(name, source);
        if (mapping.isExpression()) {
            return "COALESCE(" + mapping.expression() + ", 0) AS " + name;
        }
        String cast = "SAFE_CAST(" + mapping.sourceField() + " AS FLOAT64)";
        return "COALESCE(" + metric.aggregation().apply(cast) + ", 0) AS " + name;
    }

    private String compileFilter(String filter) {
        return cache != null ? cache.compile(filter, Map.of()) : ExpressionCompiler.compile(filter);
    }
}
