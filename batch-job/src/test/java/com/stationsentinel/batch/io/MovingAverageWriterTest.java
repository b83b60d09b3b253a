package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stationsentinel.core.model.MovingAverageRecord;
import com.stationsentinel.core.model.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MovingAverageWriter}.
 */
class MovingAverageWriterTest {

    @Test
    @DisplayName("Should write one JSON object per line in list order")
    void shouldWriteJsonLines() throws IOException {
        StringWriter out = new StringWriter();

        new MovingAverageWriter().write(List.of(
                record("STA-1", "Norte", 1.0),
                record("STA-2", "Sul", 2.5)), out);

        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("{\"timestamp\":\"2025-07-01 00:00:00\",\"stationId\":\"STA-1\"");

        JsonNode second = new ObjectMapper().readTree(lines[1]);
        assertThat(second.get("region").asText()).isEqualTo("Sul");
        assertThat(second.get("temperature").asDouble()).isEqualTo(2.5);
        assertThat(second.get("humidity").asDouble()).isEqualTo(50.0);
        assertThat(second.get("pressure").asDouble()).isEqualTo(1013.0);
    }

    @Test
    @DisplayName("Should create the target file, empty when there is nothing to write")
    void shouldWriteEmptyFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out/moving.jsonl");

        new MovingAverageWriter().write(List.of(), out);

        assertThat(Files.readString(out, StandardCharsets.UTF_8)).isEmpty();
    }

    private static MovingAverageRecord record(String stationId, String region, double temperature) {
        Row row = Row.builder()
                .timestamp(1_751_328_000_000L, "2025-07-01 00:00:00")
                .stationId(stationId)
                .region(region)
                .temperature(temperature)
                .humidity(50.0)
                .pressure(1013.0)
                .build();
        return new MovingAverageRecord(row, new double[] { temperature, 50.0, 1013.0 });
    }
}
