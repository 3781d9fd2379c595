package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.expression.CompileException;
import com.warehousesentinel.core.expression.CompiledExpressionCache;
import com.warehousesentinel.core.expression.Expression;
import com.warehousesentinel.core.expression.ExpressionCompiler;
import com.warehousesentinel.core.model.AggregateReport;
import com.warehousesentinel.core.model.Aggregation;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.MetricDef;
import com.warehousesentinel.core.model.ReportOutput;
import com.warehousesentinel.core.model.ReportOutput.OutputMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles an {@link AggregateReport} and run options into a two-stage query.
 *
 * <h3>Inner query</h3>
 * <p>
 * Grain fields (the date dimension is prepended in {@link TimeGrain#DAILY}
 * mode), {@code ANY_VALUE} of the included dimensions and one column per
 * output metric, read from the materialized entity table. Rows are bounded by
 * the date window and, when requested, {@code account_id IN UNNEST(@accountIds)}.
 * </p>
 *
 * <h3>Predicate placement</h3>
 * <p>
 * The predicate is split on its top-level {@code AND}s. A conjunct naming a
 * derived field is evaluated in the outer query, where derived values exist.
 * A conjunct naming an entity metric or an output metric alias is evaluated
 * in {@code HAVING}, with entity metrics rewritten to their output alias (or,
 * when not selected, to their aggregate). Any other conjunct only touches
 * dimensions and filters rows in {@code WHERE}.
 * </p>
 *
 * <h3>Outer query</h3>
 * <p>
 * {@code SELECT t.*, <derived> AS <alias>, '<id>' AS report_id,
 * CURRENT_TIMESTAMP() AS detected_at FROM (<inner>) AS t}, then the order and
 * limit. When conjuncts on derived fields remain, the projection is wrapped
 * in {@code SELECT * FROM (...) WHERE <conjuncts>} so they can reference the
 * derived aliases.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationQueryBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationQueryBuilder.class);

    private static final String ACCOUNT_ID = "account_id";

    /** Window applied when a report declares none and the run gives no start date. */
    static final int DEFAULT_LOOKBACK_DAYS = 30;

    private final CompiledExpressionCache cache;

    public AggregationQueryBuilder() {
        this(null);
    }

    /**
     * @param cache compiled-predicate cache shared with other builders, or
     *              {@code null} to compile on every call
     */
    public AggregationQueryBuilder(CompiledExpressionCache cache) {
        this.cache = cache;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Build the report query.
     *
     * @param report  report definition; must not be {@code null}
     * @param options run options; must not be {@code null}
     * @return BigQuery SQL; bind {@link QueryOptions#parameters()} when
     *         executing it
     * @throws CompileException if the predicate does not compile
     */
    public String buildQuery(AggregateReport report, QueryOptions options) {
        Objects.requireNonNull(report, "Report must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        Entity entity = report.getSource();
        ReportOutput output = report.getOutput();
        String dateDimension = report.dateDimension();

        List<String> grain = new ArrayList<>(output.grain());
        if (options.getTimeGrain() == TimeGrain.DAILY && !grain.contains(dateDimension)) {
            grain.add(0, dateDimension);
        }

        Map<String, String> metricColumns = metricColumns(report);
        PredicateParts predicate = report.getPredicate()
                .map(text -> splitPredicate(text, report, metricColumns.keySet()))
                .orElse(PredicateParts.EMPTY);

        List<String> select = new ArrayList<>();
        grain.forEach(field -> select.add(field + " AS " + field));
        for (String field : output.includeDimensions()) {
            if (!grain.contains(field)) {
                select.add("ANY_VALUE(" + field + ") AS " + field);
            }
        }
        metricColumns.forEach((alias, sql) -> select.add(sql + " AS " + alias));

        List<String> where = new ArrayList<>();
        where.add(dateDimension + " >= " + lowerBound(report, options));
        options.getEndDate().ifPresent(end -> where.add(dateDimension + " <= " + dateLiteral(end)));
        if (options.hasAccountScope()) {
            where.add(ACCOUNT_ID + " IN UNNEST(@" + QueryOptions.ACCOUNT_IDS_PARAM + ")");
        }
        where.addAll(predicate.where());

        StringBuilder inner = new StringBuilder("SELECT\n  ")
                .append(String.join(",\n  ", select))
                .append("\nFROM `").append(entity.fqn()).append('`')
                .append("\nWHERE ").append(String.join("\n  AND ", where))
                .append("\nGROUP BY ").append(String.join(", ", grain));
        if (!predicate.having().isEmpty()) {
            inner.append("\nHAVING ").append(String.join(" AND ", predicate.having()));
        }

        List<String> outerSelect = new ArrayList<>();
        outerSelect.add("t.*");
        output.derivedFields().forEach((alias, field) -> outerSelect.add(field.expression() + " AS " + alias));
        outerSelect.add(ExpressionCompiler.quoteString(report.getId()) + " AS report_id");
        outerSelect.add("CURRENT_TIMESTAMP() AS detected_at");

        String projection = "SELECT\n  " + String.join(",\n  ", outerSelect)
                + "\nFROM (\n" + indent(inner.toString()) + "\n) AS t";
        StringBuilder sql = new StringBuilder();
        if (predicate.outer().isEmpty()) {
            sql.append(projection);
        } else {
            // derived aliases are only visible one level up
            sql.append("SELECT *\nFROM (\n").append(indent(projection)).append("\n)")
                    .append("\nWHERE ").append(String.join(" AND ", predicate.outer()));
        }
        orderBy(report, options, dateDimension).ifPresent(order -> sql.append("\nORDER BY ").append(order));
        options.getLimit().ifPresent(limit -> sql.append("\nLIMIT ").append(limit));

        LOG.debug("Built query for report '{}' ({} grain): {} metric(s), {} derived field(s)",
                report.getId(), options.getTimeGrain(), metricColumns.size(), output.derivedFields().size());
        return sql.toString();
    }

    /**
     * Render a date as a BigQuery {@code DATE} literal.
     *
     * @param date calendar date
     * @return e.g. {@code DATE '2024-01-01'}
     */
    public static String dateLiteral(LocalDate date) {
        return "DATE '" + date + "'";
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Output alias to SQL aggregate, in declaration order. Metrics that
     * cannot be resolved are left out with a warning.
     */
    private static Map<String, String> metricColumns(AggregateReport report) {
        Entity entity = report.getSource();
        Map<String, String> columns = new LinkedHashMap<>();
        for (Map.Entry<String, OutputMetric> entry : report.getOutput().metrics().entrySet()) {
            String alias = entry.getKey();
            OutputMetric metric = entry.getValue();
            if (metric.isExpression()) {
                columns.put(alias, metric.expression());
                continue;
            }
            String source = metric.sourceMetric() != null ? metric.sourceMetric() : alias;
            Optional<MetricDef> declared = entity.metric(source);
            if (declared.isPresent()) {
                Aggregation aggregation = metric.aggregation() != null
                        ? metric.aggregation()
                        : declared.get().aggregation();
                columns.put(alias, aggregation.apply(source));
            } else if (metric.aggregation() != null) {
                columns.put(alias, metric.aggregation().apply(source));
            } else {
                LOG.warn("Report '{}' omits metric '{}': '{}' is not a metric of entity '{}'"
                        + " and no aggregation is given", report.getId(), alias, source, entity.getId());
            }
        }
        return columns;
    }

    private PredicateParts splitPredicate(String text, AggregateReport report, Set<String> selectedAliases) {
        Entity entity = report.getSource();
        ReportOutput output = report.getOutput();

        Map<String, String> outerAliases = new LinkedHashMap<>();
        Map<String, String> havingAliases = new LinkedHashMap<>();
        for (Map.Entry<String, MetricDef> metric : entity.getMetrics().entrySet()) {
            havingAliases.put(metric.getKey(), metric.getValue().aggregation().apply(metric.getKey()));
        }
        for (Map.Entry<String, OutputMetric> metric : output.metrics().entrySet()) {
            if (!selectedAliases.contains(metric.getKey())) {
                continue;
            }
            String source = metric.getValue().sourceMetric();
            if (source != null && !metric.getValue().isExpression()) {
                havingAliases.put(source, metric.getKey());
                outerAliases.put(source, metric.getKey());
            }
        }
        for (String alias : selectedAliases) {
            havingAliases.put(alias, alias);
        }

        Expression root = ExpressionCompiler.parse(text);
        List<Expression> conjuncts = ExpressionCompiler.conjuncts(root);
        List<Expression> having = new ArrayList<>();
        List<Expression> where = new ArrayList<>();
        List<Expression> outer = new ArrayList<>();
        for (Expression conjunct : conjuncts) {
            Set<String> names = ExpressionCompiler.identifiers(conjunct);
            if (intersects(names, output.derivedFields().keySet())) {
                outer.add(conjunct);
            } else if (intersects(names, havingAliases.keySet())) {
                having.add(conjunct);
            } else {
                where.add(conjunct);
            }
        }

        List<String> havingSql;
        if (having.size() == conjuncts.size()) {
            havingSql = List.of(compile(text, havingAliases));
        } else {
            havingSql = render(having, text, havingAliases);
        }
        return new PredicateParts(render(where, text, Map.of()), havingSql, render(outer, text, outerAliases));
    }

    private String compile(String text, Map<String, String> aliases) {
        return cache != null ? cache.compile(text, aliases) : ExpressionCompiler.compile(text, aliases);
    }

    private static List<String> render(List<Expression> nodes, String text, Map<String, String> aliases) {
        return nodes.stream()
                .map(node -> ExpressionCompiler.render(node, text, aliases))
                .collect(Collectors.toList());
    }

    private static String lowerBound(AggregateReport report, QueryOptions options) {
        if (options.getStartDate().isPresent()) {
            return dateLiteral(options.getStartDate().get());
        }
        int lookbackDays = report.getWindow()
                .map(AggregateReport.Window::lookbackDays)
                .orElse(DEFAULT_LOOKBACK_DAYS);
        return "DATE_SUB(CURRENT_DATE(), INTERVAL " + lookbackDays + " DAY)";
    }

    private static Optional<String> orderBy(AggregateReport report, QueryOptions options, String dateDimension) {
        if (report.getOrderBy().isPresent()) {
            return Optional.of(report.getOrderBy().get().toSql());
        }
        if (options.getTimeGrain() == TimeGrain.DAILY) {
            return Optional.of(dateDimension + " ASC");
        }
        return Optional.empty();
    }

    private static boolean intersects(Set<String> names, Set<String> candidates) {
        return !Collections.disjoint(names, candidates);
    }

    private static String indent(String sql) {
        return sql.lines().map(line -> "  " + line).collect(Collectors.joining("\n"));
    }

    private record PredicateParts(List<String> where, List<String> having, List<String> outer) {
        static final PredicateParts EMPTY = new PredicateParts(List.of(), List.of(), List.of());
    }
}
