package com.warehousesentinel.job;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.Clustering;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.TableResult;
import com.google.cloud.bigquery.TimePartitioning;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.TableMetadata;
import com.warehousesentinel.core.warehouse.TableNotFoundException;
import com.warehousesentinel.core.warehouse.TableSchema;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.channels.Channels;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link WarehouseGateway} backed by the BigQuery client library.
 *
 * <h3>Queries</h3>
 * <p>
 * Standard SQL with named parameters. {@link List} values bind as arrays,
 * {@link LocalDate} as {@code DATE}, {@link Instant} as {@code TIMESTAMP}.
 * The timeout is set as the job timeout. Result values come back as
 * {@code Long}, {@code Double}, {@code BigDecimal}, {@code Boolean},
 * {@code LocalDate}, {@code Instant} or {@code String}.
 * </p>
 *
 * <h3>Tables</h3>
 * <p>
 * Missing datasets and tables are created on demand; new tables are
 * day-partitioned and clustered as requested. An existing table only gains
 * the columns it lacks. Rows are appended with a newline-delimited JSON load
 * job rather than streaming inserts.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * HTTP 404 becomes {@link TableNotFoundException}; rate limits, backend
 * errors and 5xx responses become transient
 * {@link QueryExecutionException}s, everything else a permanent one.
 * </p>
 *
 * @since 1.0.0
 */
public final class BigQueryWarehouseGateway implements WarehouseGateway {

    private static final Logger LOG = LoggerFactory.getLogger(BigQueryWarehouseGateway.class);

    private static final Set<Integer> TRANSIENT_CODES = Set.of(408, 429, 500, 502, 503, 504);
    private static final Set<String> TRANSIENT_REASONS = Set.of("rateLimitExceeded", "backendError", "internalError");
    private static final Pattern NOT_FOUND = Pattern.compile("Not found: (?:Table|Dataset) (\\S+)");

    private final BigQuery bigQuery;
    private final NdjsonEncoder encoder = new NdjsonEncoder();

    public BigQueryWarehouseGateway(BigQuery bigQuery) {
        this.bigQuery = Objects.requireNonNull(bigQuery, "BigQuery client must not be null");
    }

    /**
     * @param projectId project to bill and resolve unqualified datasets in;
     *                  blank uses the environment's default project
     * @return a gateway using application default credentials
     */
    public static BigQueryWarehouseGateway create(String projectId) {
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        if (projectId != null && !projectId.isBlank()) {
            options.setProjectId(projectId);
        }
        return new BigQueryWarehouseGateway(options.build().getService());
    }

    // ---------------------------------------------------------------
    // WarehouseGateway
    // ---------------------------------------------------------------

    @Override
    public List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params, Duration timeout) {
        Objects.requireNonNull(sql, "SQL must not be null");
        Objects.requireNonNull(params, "Params must not be null");
        Objects.requireNonNull(timeout, "Timeout must not be null");

        QueryJobConfiguration.Builder config = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis());
        params.forEach((name, value) -> config.addNamedParameter(name, toParameter(name, value)));

        try {
            TableResult result = bigQuery.query(config.build());
            List<Map<String, Object>> rows = toRows(result);
            LOG.debug("Query returned {} row(s)", rows.size());
            return rows;
        } catch (BigQueryException e) {
            throw translate(e, sql);
        } catch (JobException e) {
            throw new QueryExecutionException(e.getMessage(), isTransient(e.getErrors()), sql, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for query", true, sql, e);
        }
    }

    @Override
    public void ensureTable(String dataset, String table, TableSchema schema, String partitionField,
                            List<String> clusteringFields) {
        Objects.requireNonNull(schema, "Schema must not be null");
        try {
            ensureDataset(dataset);
            TableId tableId = TableId.of(dataset, table);
            Table existing = bigQuery.getTable(tableId);
            if (existing == null) {
                createTable(tableId, schema, partitionField, clusteringFields == null ? List.of() : clusteringFields);
            } else {
                addMissingColumns(existing, schema);
            }
        } catch (BigQueryException e) {
            throw translate(e, null);
        }
    }

    @Override
    public void bulkLoad(String dataset, String table, List<Map<String, Object>> rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        if (rows.isEmpty()) {
            return;
        }
        TableId tableId = TableId.of(dataset, table);
        WriteChannelConfiguration config = WriteChannelConfiguration.newBuilder(tableId)
                .setFormatOptions(FormatOptions.json())
                .setWriteDisposition(JobInfo.WriteDisposition.WRITE_APPEND)
                .build();
        byte[] payload = encoder.encode(rows);

        try {
            TableDataWriteChannel writer = bigQuery.writer(config);
            try (OutputStream stream = Channels.newOutputStream(writer)) {
                stream.write(payload);
            }
            Job job = writer.getJob();
            job = job == null ? null : job.waitFor();
            if (job == null) {
                throw new QueryExecutionException("Load job into " + dataset + "." + table + " no longer exists",
                        true, null);
            }
            BigQueryError error = job.getStatus().getError();
            if (error != null) {
                throw new QueryExecutionException("Load job into " + dataset + "." + table + " failed: "
                        + error.getMessage(), TRANSIENT_REASONS.contains(error.getReason()), null);
            }
            LOG.info("Loaded {} row(s) into {}.{}", rows.size(), dataset, table);
        } catch (BigQueryException e) {
            throw translate(e, null);
        } catch (IOException e) {
            throw new QueryExecutionException("Failed to upload rows to " + dataset + "." + table, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while loading " + dataset + "." + table, true, e);
        }
    }

    @Override
    public TableMetadata getTableMetadata(String dataset, String table) {
        try {
            Table found = bigQuery.getTable(TableId.of(dataset, table));
            if (found == null) {
                throw new TableNotFoundException(dataset + "." + table, null);
            }
            StandardTableDefinition definition = found.getDefinition();
            TimePartitioning partitioning = definition.getTimePartitioning();
            Clustering clustering = definition.getClustering();
            return new TableMetadata(
                    partitioning == null ? null : partitioning.getField(),
                    clustering == null ? List.of() : clustering.getFields(),
                    fromBigQuery(definition.getSchema()));
        } catch (BigQueryException e) {
            throw translate(e, null);
        }
    }

    // ---------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------

    private void ensureDataset(String dataset) {
        if (bigQuery.getDataset(dataset) != null) {
            return;
        }
        try {
            bigQuery.create(DatasetInfo.newBuilder(dataset).build());
            LOG.info("Created dataset {}", dataset);
        } catch (BigQueryException e) {
            if (e.getCode() != 409) {
                throw e;
            }
            LOG.debug("Dataset {} was created concurrently", dataset);
        }
    }

    private void createTable(TableId tableId, TableSchema schema, String partitionField, List<String> clustering) {
        StandardTableDefinition.Builder definition = StandardTableDefinition.newBuilder()
                .setSchema(toBigQuery(schema.getFields()));
        if (partitionField != null) {
            definition.setTimePartitioning(TimePartitioning.newBuilder(TimePartitioning.Type.DAY)
                    .setField(partitionField)
                    .build());
        }
        if (!clustering.isEmpty()) {
            definition.setClustering(Clustering.newBuilder().setFields(clustering).build());
        }
        try {
            bigQuery.create(TableInfo.of(tableId, definition.build()));
            LOG.info("Created table {}.{} (partition: {}, cluster: {})",
                    tableId.getDataset(), tableId.getTable(), partitionField, clustering);
        } catch (BigQueryException e) {
            if (e.getCode() != 409) {
                throw e;
            }
            LOG.debug("Table {}.{} was created concurrently", tableId.getDataset(), tableId.getTable());
            Table created = bigQuery.getTable(tableId);
            if (created != null) {
                addMissingColumns(created, schema);
            }
        }
    }

    private void addMissingColumns(Table existing, TableSchema desired) {
        StandardTableDefinition definition = existing.getDefinition();
        Schema current = definition.getSchema();
        List<TableSchema.Field> missing = fromBigQuery(current).missingFrom(desired);
        if (missing.isEmpty()) {
            return;
        }
        List<Field> fields = new ArrayList<>(current == null ? List.of() : current.getFields());
        missing.forEach(field -> fields.add(toBigQuery(field)));
        existing.toBuilder()
                .setDefinition(definition.toBuilder().setSchema(Schema.of(fields)).build())
                .build()
                .update();
        LOG.info("Added column(s) {} to {}.{}",
                missing.stream().map(TableSchema.Field::name).collect(Collectors.toList()),
                existing.getTableId().getDataset(), existing.getTableId().getTable());
    }

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    static QueryParameterValue toParameter(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must not be null");
        }
        if (value instanceof List<?> list) {
            return toArrayParameter(list);
        }
        if (value instanceof LocalDate) {
            return QueryParameterValue.date(value.toString());
        }
        if (value instanceof Instant instant) {
            return QueryParameterValue.timestamp(ChronoUnit.MICROS.between(Instant.EPOCH, instant));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return QueryParameterValue.int64(((Number) value).longValue());
        }
        if (value instanceof BigDecimal decimal) {
            return QueryParameterValue.numeric(decimal);
        }
        if (value instanceof Number number) {
            return QueryParameterValue.float64(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return QueryParameterValue.bool(bool);
        }
        return QueryParameterValue.string(value.toString());
    }

    private static QueryParameterValue toArrayParameter(List<?> values) {
        boolean integral = !values.isEmpty() && values.stream()
                .allMatch(v -> v instanceof Integer || v instanceof Long || v instanceof Short);
        if (integral) {
            Long[] longs = values.stream().map(v -> ((Number) v).longValue()).toArray(Long[]::new);
            return QueryParameterValue.array(longs, Long.class);
        }
        boolean numeric = !values.isEmpty() && values.stream().allMatch(v -> v instanceof Number);
        if (numeric) {
            Double[] doubles = values.stream().map(v -> ((Number) v).doubleValue()).toArray(Double[]::new);
            return QueryParameterValue.array(doubles, Double.class);
        }
        String[] strings = values.stream().map(String::valueOf).toArray(String[]::new);
        return QueryParameterValue.array(strings, String.class);
    }

    private static List<Map<String, Object>> toRows(TableResult result) {
        Schema schema = result.getSchema();
        if (schema == null) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (FieldValueList values : result.iterateAll()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Field field : schema.getFields()) {
                row.put(field.getName(), toValue(field, values.get(field.getName())));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object toValue(Field field, FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.REPEATED) {
            return value.getRepeatedValue().stream()
                    .map(element -> toScalar(field.getType().getStandardType(), element))
                    .collect(Collectors.toList());
        }
        if (value.getAttribute() == FieldValue.Attribute.RECORD) {
            return value.getRecordValue().toString();
        }
        return toScalar(field.getType().getStandardType(), value);
    }

    private static Object toScalar(StandardSQLTypeName type, FieldValue value) {
        if (value.isNull()) {
            return null;
        }
        return switch (type) {
            case INT64 -> value.getLongValue();
            case FLOAT64 -> value.getDoubleValue();
            case NUMERIC, BIGNUMERIC -> value.getNumericValue();
            case BOOL -> value.getBooleanValue();
            case DATE -> LocalDate.parse(value.getStringValue());
            case TIMESTAMP -> Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS);
            default -> value.getStringValue();
        };
    }

    private static Schema toBigQuery(List<TableSchema.Field> fields) {
        return Schema.of(fields.stream().map(BigQueryWarehouseGateway::toBigQuery).collect(Collectors.toList()));
    }

    private static Field toBigQuery(TableSchema.Field field) {
        return Field.newBuilder(field.name(), StandardSQLTypeName.valueOf(field.type()))
                .setMode(Field.Mode.NULLABLE)
                .build();
    }

    private static TableSchema fromBigQuery(Schema schema) {
        if (schema == null) {
            return TableSchema.empty();
        }
        return TableSchema.of(schema.getFields().stream()
                .map(field -> new TableSchema.Field(field.getName(), field.getType().getStandardType().name()))
                .collect(Collectors.toList()));
    }

    // ---------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------

    static QueryExecutionException translate(BigQueryException e, String sql) {
        if (e.getCode() == 404) {
            return new TableNotFoundException(missingTable(e.getMessage()), e);
        }
        boolean transientFailure = e.isRetryable()
                || TRANSIENT_CODES.contains(e.getCode())
                || (e.getReason() != null && TRANSIENT_REASONS.contains(e.getReason()));
        return new QueryExecutionException(String.valueOf(e.getMessage()), transientFailure, sql, e);
    }

    static String missingTable(String message) {
        if (message == null) {
            return "<unknown>";
        }
        Matcher matcher = NOT_FOUND.matcher(message);
        return matcher.find() ? matcher.group(1) : message;
    }

    private static boolean isTransient(List<BigQueryError> errors) {
        return errors != null && errors.stream()
                .anyMatch(error -> error.getReason() != null && TRANSIENT_REASONS.contains(error.getReason()));
    }
}
