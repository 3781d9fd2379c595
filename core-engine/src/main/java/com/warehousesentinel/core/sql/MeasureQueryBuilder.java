package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FilterCondition;
import com.warehousesentinel.core.model.Measure;
import com.warehousesentinel.core.model.MetricDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the query fetching a {@link Measure} over an entity table, sliced by
 * dimensions.
 *
 * <p>
 * The measured value is always selected as {@value #VALUE_COLUMN}; context
 * metrics keep their own names. Date bounds bind as {@code @start_date} and
 * {@code @end_date}, filter values as {@code @f0}, {@code @f1}, ... and never
 * appear in the SQL text. Identifiers are back-quoted.
 * </p>
 *
 * @since 1.0.0
 */
public final class MeasureQueryBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(MeasureQueryBuilder.class);

    /** Column carrying the measured value. */
    public static final String VALUE_COLUMN = "value";

    public static final String START_DATE_PARAM = "start_date";
    public static final String END_DATE_PARAM = "end_date";

    /**
     * Build the measure query.
     *
     * @param measure measure to fetch; must not be {@code null}
     * @param entity  entity the measure reads; must not be {@code null}
     * @param query   window, slicing and extra filters; must not be
     *                {@code null}
     * @return SQL with its bound parameters
     */
    public ParameterizedQuery buildQuery(Measure measure, Entity entity, MeasureQuery query) {
        Objects.requireNonNull(measure, "Measure must not be null");
        Objects.requireNonNull(entity, "Entity must not be null");
        Objects.requireNonNull(query, "Query must not be null");

        for (String dimension : query.dimensions()) {
            if (!measure.allowsDimension(dimension)) {
                LOG.warn("Dimension '{}' is not in the allowed dimensions of measure '{}': {}",
                        dimension, measure.id(), measure.allowedDimensions());
            }
        }

        List<String> select = new ArrayList<>();
        query.dimensions().forEach(dimension -> select.add(quote(dimension)));
        select.add(valueSql(measure) + " AS " + VALUE_COLUMN);
        for (String metric : query.contextMetrics()) {
            select.add(contextMetricSql(entity, metric) + " AS " + quote(metric));
        }

        Map<String, Object> params = new LinkedHashMap<>();
        List<String> where = new ArrayList<>();
        Optional<String> dateField = entity.dateField();
        if (dateField.isPresent()) {
            where.add(quote(dateField.get()) + " >= @" + START_DATE_PARAM);
            where.add(quote(dateField.get()) + " <= @" + END_DATE_PARAM);
            params.put(START_DATE_PARAM, query.startDate());
            params.put(END_DATE_PARAM, query.endDate());
        } else {
            LOG.warn("Entity '{}' has no date field; measure '{}' is fetched without date bounds",
                    entity.getId(), measure.id());
        }

        List<FilterCondition> filters = new ArrayList<>(measure.filters());
        filters.addAll(query.filters());
        Map<String, Object> filterParams = new LinkedHashMap<>();
        for (FilterCondition filter : filters) {
            where.add(filterSql(filter, filterParams));
        }
        params.putAll(filterParams);

        StringBuilder sql = new StringBuilder("SELECT\n  ")
                .append(String.join(",\n  ", select))
                .append("\nFROM `").append(entity.fqn()).append('`');
        if (!where.isEmpty()) {
            sql.append("\nWHERE ").append(String.join("\n  AND ", where));
        }
        if (!query.dimensions().isEmpty()) {
            sql.append("\nGROUP BY ").append(query.dimensions().stream()
                    .map(MeasureQueryBuilder::quote)
                    .collect(Collectors.joining(", ")));
        }
        if (dateField.isPresent() && query.dimensions().contains(dateField.get())) {
            sql.append("\nORDER BY ").append(quote(dateField.get())).append(" ASC");
        }
        return new ParameterizedQuery(sql.toString(), params);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String valueSql(Measure measure) {
        Measure.Value value = measure.value();
        if (value.isExpression()) {
            return value.expression();
        }
        return value.aggregation().apply(quote(value.field()));
    }

    private static String contextMetricSql(Entity entity, String metric) {
        Optional<MetricDef> declared = entity.metric(metric);
        if (declared.isEmpty()) {
            LOG.debug("Context metric '{}' is not declared on entity '{}'; summing the column",
                    metric, entity.getId());
        }
        Aggregation aggregation = declared.map(MetricDef::aggregation).orElse(Aggregation.SUM);
        return aggregation.apply(quote(metric));
    }

    private static String filterSql(FilterCondition filter, Map<String, Object> params) {
        String column = quote(filter.field());
        if (filter.value() == null) {
            return switch (filter.operator()) {
                case EQ -> column + " IS NULL";
                case NE -> column + " IS NOT NULL";
                default -> throw new IllegalArgumentException("Filter on '" + filter.field() + "' with operator '"
                        + filter.operator().symbol() + "' needs a value");
            };
        }
        String param = "f" + params.size();
        Object value = filter.value();
        if (value instanceof Collection<?> collection) {
            value = List.copyOf(collection);
        }
        params.put(param, value);
        return switch (filter.operator()) {
            case IN -> column + " IN UNNEST(@" + param + ")";
            case NOT_IN -> column + " NOT IN UNNEST(@" + param + ")";
            case CONTAINS -> column + " LIKE CONCAT('%', @" + param + ", '%')";
            default -> column + " " + filter.operator().symbol() + " @" + param;
        };
    }

    static String quote(String identifier) {
        return "`" + identifier.replace("`", "") + "`";
    }
}
