package com.warehousesentinel.core.model;

/**
 * Whether an {@link AggregateReport} is a plain report or a signal. Both are
 * compiled the same way; they differ only in the dataset their snapshots are
 * appended to.
 *
 * @since 1.0.0
 */
public enum ReportKind {

    REPORT("reports"),
    SIGNAL("signals");

    private final String defaultDataset;

    ReportKind(String defaultDataset) {
        this.defaultDataset = defaultDataset;
    }

    public String defaultDataset() {
        return defaultDataset;
    }
}
