package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.RunSummary;
import com.stationsentinel.core.model.StationMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SummaryWriter}.
 */
class SummaryWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write stations sorted with every metric present")
    void shouldWriteSummary(@TempDir Path dir) throws IOException {
        Map<String, StationMetrics> stations = new TreeMap<>();
        stations.put("STA-002", StationMetrics.zero());
        stations.put("STA-001", metrics(1.5, 0.0, 3.0, 2));
        Path out = dir.resolve("nested/summary.json");

        new SummaryWriter().write(new RunSummary(12.5, stations), out);

        JsonNode root = mapper.readTree(out.toFile());
        assertThat(root.get("elapsedMillis").asDouble()).isEqualTo(12.5);
        assertThat(root.get("stations").fieldNames()).toIterable().containsExactly("STA-001", "STA-002");

        JsonNode first = root.get("stations").get("STA-001");
        assertThat(first.get("anomalyPercentages").get("temperature").asDouble()).isEqualTo(1.5);
        assertThat(first.get("anomalyPercentages").get("humidity").asDouble()).isEqualTo(0.0);
        assertThat(first.get("anomalyPercentages").get("pressure").asDouble()).isEqualTo(3.0);
        assertThat(first.get("concurrentAnomalyPeriods").asLong()).isEqualTo(2);
        assertThat(root.get("stations").get("STA-002").get("anomalyPercentages").size()).isEqualTo(3);
    }

    @Test
    @DisplayName("An empty summary should still be a valid document")
    void shouldWriteEmptySummary() throws IOException {
        String json = new SummaryWriter().toJson(new RunSummary(0.0, Map.of()));

        JsonNode root = mapper.readTree(json);
        assertThat(root.get("stations").isObject()).isTrue();
        assertThat(root.get("stations").size()).isZero();
    }

    private static StationMetrics metrics(double temperature, double humidity, double pressure, long periods) {
        Map<Metric, Double> map = new EnumMap<>(Metric.class);
        map.put(Metric.TEMPERATURE, temperature);
        map.put(Metric.HUMIDITY, humidity);
        map.put(Metric.PRESSURE, pressure);
        return StationMetrics.of(map, periods);
    }
}
