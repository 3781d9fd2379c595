package com.warehousesentinel.core.warehouse;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a {@link TableSchema} from the rows about to be loaded.
 *
 * <h3>Type rules</h3>
 * <ul>
 * <li>{@code detected_at} is always {@code TIMESTAMP}; {@code date} is always
 * {@code DATE}</li>
 * <li>integral numbers map to {@code INT64}, other numbers to
 * {@code FLOAT64}; a column seen with both is {@code FLOAT64}</li>
 * <li>{@link Boolean} maps to {@code BOOL}, {@link LocalDate} to {@code DATE},
 * instants and date-times to {@code TIMESTAMP}</li>
 * <li>everything else, and columns that are {@code null} in every row, map to
 * {@code STRING}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SchemaInference {

    private static final String STRING = "STRING";
    private static final String INT64 = "INT64";
    private static final String FLOAT64 = "FLOAT64";

    private SchemaInference() {
        // utility class, not instantiable
    }

    /**
     * @param rows rows as loaded; column order follows first appearance
     * @return inferred schema
     */
    public static TableSchema infer(List<Map<String, Object>> rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        Map<String, String> types = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> column : row.entrySet()) {
                String name = column.getKey();
                String type = typeOf(name, column.getValue());
                if (!types.containsKey(name)) {
                    types.put(name, type);
                } else if (type != null) {
                    String seen = types.get(name);
                    types.put(name, seen == null ? type : widen(seen, type));
                }
            }
        }
        List<TableSchema.Field> fields = new ArrayList<>();
        types.forEach((name, type) -> fields.add(new TableSchema.Field(name, type == null ? STRING : type)));
        return TableSchema.of(fields);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String typeOf(String name, Object value) {
        if ("detected_at".equals(name)) {
            return "TIMESTAMP";
        }
        if ("date".equals(name)) {
            return "DATE";
        }
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INT64;
        }
        if (value instanceof Number) {
            return value instanceof BigDecimal && ((BigDecimal) value).scale() <= 0 ? INT64 : FLOAT64;
        }
        if (value instanceof Boolean) {
            return "BOOL";
        }
        if (value instanceof LocalDate) {
            return "DATE";
        }
        if (value instanceof Instant || value instanceof LocalDateTime
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
            return "TIMESTAMP";
        }
        return STRING;
    }

    private static String widen(String seen, String type) {
        if (seen.equals(type)) {
            return seen;
        }
        if (isNumeric(seen) && isNumeric(type)) {
            return FLOAT64;
        }
        return STRING;
    }

    private static boolean isNumeric(String type) {
        return INT64.equals(type) || FLOAT64.equals(type);
    }
}
