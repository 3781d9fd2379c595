package com.warehousesentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NdjsonEncoder}.
 */
class NdjsonEncoderTest {

    private final NdjsonEncoder encoder = new NdjsonEncoder();

    @Test
    @DisplayName("Should write one JSON object per line with ISO dates")
    void shouldEncodeRows() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("detected_at", Instant.parse("2024-02-01T06:00:00Z"));
        first.put("date", LocalDate.of(2024, 1, 31));
        first.put("spend", 12.5);
        first.put("campaign_id", "c1");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("campaign_id", "c2");
        second.put("financial_impact", null);

        String payload = new String(encoder.encode(List.of(first, second)), StandardCharsets.UTF_8);

        assertThat(payload).isEqualTo(
                "{\"detected_at\":\"2024-02-01T06:00:00Z\",\"date\":\"2024-01-31\",\"spend\":12.5,\"campaign_id\":\"c1\"}\n"
                        + "{\"campaign_id\":\"c2\",\"financial_impact\":null}\n");
    }

    @Test
    @DisplayName("Should keep non-ASCII text intact")
    void shouldEncodeUtf8() {
        String payload = new String(encoder.encode(List.of(Map.of("campaign_name", "Été"))), StandardCharsets.UTF_8);

        assertThat(payload).isEqualTo("{\"campaign_name\":\"Été\"}\n");
    }

    @Test
    @DisplayName("Should produce an empty payload for no rows")
    void shouldEncodeNothing() {
        assertThat(encoder.encode(List.of())).isEmpty();
    }
}
