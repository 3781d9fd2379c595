package com.warehousesentinel.core.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SQL text together with the named parameters it binds.
 *
 * @param sql    BigQuery Standard SQL with {@code @name} placeholders
 * @param params parameter name (without {@code @}) to value; list values bind
 *               as arrays
 * @since 1.0.0
 */
public record ParameterizedQuery(String sql, Map<String, Object> params) {

    public ParameterizedQuery {
        Objects.requireNonNull(sql, "SQL must not be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
