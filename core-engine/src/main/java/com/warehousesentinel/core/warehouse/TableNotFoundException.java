package com.warehousesentinel.core.warehouse;

/**
 * A referenced table does not exist yet. Read paths treat this as an empty
 * result.
 *
 * @since 1.0.0
 */
public class TableNotFoundException extends QueryExecutionException {

    private static final long serialVersionUID = 1L;

    private final String table;

    public TableNotFoundException(String table, Throwable cause) {
        super("Not found: Table " + table, false, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
