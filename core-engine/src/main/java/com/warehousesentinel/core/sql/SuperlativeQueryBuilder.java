package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.FieldType;
import com.warehousesentinel.core.model.MetricDef;
import com.warehousesentinel.core.model.Superlative;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the queries behind entity {@link Superlative superlatives}.
 *
 * <p>
 * {@link #accountsQuery} lists the accounts with rows in the run window;
 * {@link #rankQuery} returns the single winning item of one account for one
 * target metric as {@code item_id}, {@code item_name} and
 * {@code metric_value}. Items with a missing or empty label and items whose
 * value is not positive never win. Account id and date bounds are bound
 * parameters.
 * </p>
 *
 * @since 1.0.0
 */
public final class SuperlativeQueryBuilder {

    public static final String ACCOUNT_ID = "account_id";
    public static final String ACCOUNT_ID_PARAM = "accountId";

    /**
     * @param entity  entity carrying superlatives
     * @param options window and account scope of the run
     * @return one {@code account_id} per row, ordered
     */
    public ParameterizedQuery accountsQuery(Entity entity, QueryOptions options) {
        Objects.requireNonNull(entity, "Entity must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        Map<String, Object> params = new LinkedHashMap<>();
        List<String> where = dateBounds(entity, options, params);
        if (options.hasAccountScope()) {
            where.add(quote(ACCOUNT_ID) + " IN UNNEST(@" + QueryOptions.ACCOUNT_IDS_PARAM + ")");
            params.put(QueryOptions.ACCOUNT_IDS_PARAM, options.getAccountIds());
        }

        StringBuilder sql = new StringBuilder("SELECT DISTINCT ").append(quote(ACCOUNT_ID))
                .append("\nFROM `").append(entity.fqn()).append('`');
        if (!where.isEmpty()) {
            sql.append("\nWHERE ").append(String.join("\n  AND ", where));
        }
        sql.append("\nORDER BY ").append(quote(ACCOUNT_ID));
        return new ParameterizedQuery(sql.toString(), params);
    }

    /**
     * @param entity      entity carrying {@code superlative}
     * @param superlative ranking definition
     * @param metric      one of the superlative's target metrics
     * @param accountId   account to rank within
     * @param options     window of the run
     * @return the winning row, or no row when nothing qualifies
     * @throws IllegalArgumentException if {@code metric} is neither an entity
     *                                  metric nor backed by an expression
     */
    public ParameterizedQuery rankQuery(Entity entity, Superlative superlative, String metric,
                                        String accountId, QueryOptions options) {
        Objects.requireNonNull(entity, "Entity must not be null");
        Objects.requireNonNull(superlative, "Superlative must not be null");
        Objects.requireNonNull(accountId, "Account id must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        String value = valueSql(entity, superlative, metric);
        String id = quote(superlative.dimensionId());
        String label = quote(superlative.dimensionLabel());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put(ACCOUNT_ID_PARAM, accountId);
        List<String> where = new ArrayList<>();
        where.add(quote(ACCOUNT_ID) + " = @" + ACCOUNT_ID_PARAM);
        where.add(label + " IS NOT NULL");
        if (entity.fieldType(superlative.dimensionLabel()) == FieldType.STRING) {
            where.add(label + " != ''");
        }
        where.addAll(dateBounds(entity, options, params));

        List<String> groupBy = new ArrayList<>(List.of(id));
        if (!superlative.dimensionLabel().equals(superlative.dimensionId())) {
            groupBy.add(label);
        }

        String sql = "SELECT\n  "
                + id + " AS item_id,\n  "
                + label + " AS item_name,\n  "
                + value + " AS metric_value"
                + "\nFROM `" + entity.fqn() + '`'
                + "\nWHERE " + String.join("\n  AND ", where)
                + "\nGROUP BY " + String.join(", ", groupBy)
                + "\nHAVING " + value + " > 0"
                + "\nORDER BY metric_value " + superlative.rankType().direction()
                + "\nLIMIT 1";
        return new ParameterizedQuery(sql, params);
    }

    private static String valueSql(Entity entity, Superlative superlative, String metric) {
        if (superlative.hasExpression()) {
            return superlative.expression();
        }
        Optional<MetricDef> declared = entity.metric(metric);
        if (declared.isEmpty()) {
            throw new IllegalArgumentException("'" + metric + "' is not a metric of entity '" + entity.getId() + "'");
        }
        return declared.get().aggregation().apply(quote(metric));
    }

    private static List<String> dateBounds(Entity entity, QueryOptions options, Map<String, Object> params) {
        List<String> where = new ArrayList<>();
        String dateField = quote(entity.dateField().orElse("date"));
        options.getStartDate().ifPresent(start -> {
            where.add(dateField + " >= @" + MeasureQueryBuilder.START_DATE_PARAM);
            params.put(MeasureQueryBuilder.START_DATE_PARAM, start);
        });
        options.getEndDate().ifPresent(end -> {
            where.add(dateField + " <= @" + MeasureQueryBuilder.END_DATE_PARAM);
            params.put(MeasureQueryBuilder.END_DATE_PARAM, end);
        });
        return where;
    }

    private static String quote(String identifier) {
        return MeasureQueryBuilder.quote(identifier);
    }
}
