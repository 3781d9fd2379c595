package com.warehousesentinel.core.sql;

import java.util.Locale;
import java.util.Objects;

/**
 * Time resolution of an aggregate report run.
 *
 * @since 1.0.0
 */
public enum TimeGrain {

    /** One row per grain key over the whole window. */
    TOTAL,

    /** One row per grain key and day; the date dimension joins the grain. */
    DAILY;

    public static TimeGrain fromString(String value) {
        Objects.requireNonNull(value, "Time grain must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
