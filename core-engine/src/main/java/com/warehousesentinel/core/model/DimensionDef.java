package com.warehousesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dimension (attribute) of an {@link Entity}.
 *
 * @param type              logical type
 * @param mapping           default mapping for every source, or {@code null}
 *                          to fall back to a same-name column
 * @param perSourceOverride source id to mapping, taking precedence over the
 *                          default
 * @since 1.0.0
 */
public record DimensionDef(FieldType type,
                           FieldMapping mapping,
                           Map<String, FieldMapping> perSourceOverride) {

    public DimensionDef {
        Objects.requireNonNull(type, "Dimension type must not be null");
        perSourceOverride = perSourceOverride == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(perSourceOverride));
    }

    public static DimensionDef of(FieldType type) {
        return new DimensionDef(type, null, null);
    }

    public static DimensionDef of(FieldType type, FieldMapping mapping) {
        return new DimensionDef(type, mapping, null);
    }
}
