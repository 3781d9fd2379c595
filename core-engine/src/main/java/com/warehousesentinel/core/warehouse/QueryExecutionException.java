package com.warehousesentinel.core.warehouse;

/**
 * A warehouse call failed.
 *
 * <p>
 * {@link #isTransient()} separates failures worth retrying (network, timeout,
 * rate limit, backend errors) from semantic ones (bad SQL, permission
 * denied), which never are. When the failing call ran generated SQL, the text
 * is kept in {@link #getSql()} and appended to the message.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;
    private final String sql;

    public QueryExecutionException(String message, boolean transientFailure, String sql, Throwable cause) {
        super(sql == null ? message : message + "\n--- SQL ---\n" + sql, cause);
        this.transientFailure = transientFailure;
        this.sql = sql;
    }

    public QueryExecutionException(String message, boolean transientFailure, Throwable cause) {
        this(message, transientFailure, null, cause);
    }

    /**
     * Attach the SQL that was being run to a failure raised without it.
     *
     * @param failure original failure
     * @param sql     generated SQL
     * @return a failure carrying {@code sql}; {@code failure} itself when it
     *         already carries SQL or is a {@link TableNotFoundException}
     */
    public static QueryExecutionException withSql(QueryExecutionException failure, String sql) {
        if (failure.getSql() != null || failure instanceof TableNotFoundException) {
            return failure;
        }
        return new QueryExecutionException(failure.getMessage(), failure.isTransient(), sql, failure);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public String getSql() {
        return sql;
    }
}
