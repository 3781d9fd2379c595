package com.warehousesentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warehousesentinel.core.warehouse.QueryExecutionException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Encodes rows as newline-delimited JSON for a load job.
 *
 * <p>
 * Dates and instants are written as ISO-8601 text, which BigQuery accepts for
 * {@code DATE} and {@code TIMESTAMP} columns.
 * </p>
 */
final class NdjsonEncoder {

    private final ObjectMapper mapper;

    NdjsonEncoder() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param rows rows to encode
     * @return one JSON object per line, UTF-8
     * @throws QueryExecutionException if a row cannot be serialized
     */
    byte[] encode(List<Map<String, Object>> rows) {
        StringBuilder payload = new StringBuilder();
        for (Map<String, Object> row : rows) {
            try {
                payload.append(mapper.writeValueAsString(row)).append('\n');
            } catch (JsonProcessingException e) {
                throw new QueryExecutionException("Failed to serialize row for load: " + e.getOriginalMessage(),
                        false, e);
            }
        }
        return payload.toString().getBytes(StandardCharsets.UTF_8);
    }
}
