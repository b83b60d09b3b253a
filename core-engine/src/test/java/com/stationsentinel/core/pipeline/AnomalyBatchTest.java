package com.stationsentinel.core.pipeline;

import com.stationsentinel.core.concurrent.BatchProcessingException;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.model.StationMetrics;
import com.stationsentinel.core.store.RecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.stationsentinel.core.TestRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link AnomalyBatch}.
 */
class AnomalyBatchTest {

    private static final String[] REGIONS = { "Sudeste", "Nordeste", "Sul" };

    @Test
    @DisplayName("One outlier in 100 rows should give exactly 1% for that metric")
    void shouldReportSingleOutlier() {
        List<Row> rows = new ArrayList<>();
        for (int s = 0; s < 3; s++) {
            for (int i = 0; i < 100; i++) {
                double temperature = (s == 0 && i == 50) ? 100.0 : 20.0 + Math.sin(i * 0.3);
                rows.add(row("STA-" + s, REGIONS[s], i * 60_000L,
                        temperature, 60.0 + 5 * Math.sin(i * 0.2), 1013.0 + Math.cos(i * 0.1)));
            }
        }

        BatchResult result = new AnomalyBatch(DetectionSettings.defaults(), 2).run(RecordStore.of(rows));

        StationMetrics first = result.getSummary().getStations().get("STA-0");
        assertThat(first.getAnomalyPercentage(Metric.TEMPERATURE)).isCloseTo(1.0, within(1e-9));
        assertThat(first.getAnomalyPercentage(Metric.HUMIDITY)).isZero();
        assertThat(first.getAnomalyPercentage(Metric.PRESSURE)).isZero();
        assertThat(first.getConcurrentAnomalyPeriods()).isZero();
        assertThat(result.getSummary().getStations().get("STA-1")).isEqualTo(StationMetrics.zero());
        assertThat(result.getSummary().getStations().get("STA-2")).isEqualTo(StationMetrics.zero());

        assertThat(result.getMovingAverages()).hasSize(299);
        assertThat(result.getSummary().getElapsedMillis()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Results should not depend on the number of workers")
    void shouldBeDeterministicAcrossWorkerCounts() {
        BatchResult reference = new AnomalyBatch(DetectionSettings.defaults(), 1).run(randomStore());

        for (int workers : new int[] { 2, 4, 16 }) {
            BatchResult result = new AnomalyBatch(DetectionSettings.defaults(), workers).run(randomStore());

            assertThat(result.getSummary().getStations())
                    .as("summary with %d workers", workers)
                    .containsExactlyEntriesOf(reference.getSummary().getStations());
            assertThat(result.getMovingAverages())
                    .as("moving averages with %d workers", workers)
                    .containsExactlyElementsOf(reference.getMovingAverages());
        }
    }

    @Test
    @DisplayName("An empty input should produce an empty result")
    void shouldHandleEmptyInput() {
        BatchResult result = new AnomalyBatch(DetectionSettings.defaults(), 4).run(RecordStore.of(List.of()));

        assertThat(result.getSummary().getStations()).isEmpty();
        assertThat(result.getMovingAverages()).isEmpty();
    }

    @Test
    @DisplayName("Should reject fewer than one worker")
    void shouldRejectInvalidWorkerCount() {
        assertThatThrownBy(() -> new AnomalyBatch(DetectionSettings.defaults(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A failing station should fail the whole batch and name the station")
    void shouldFailBatchWhenPartitionFails() {
        RecordStore store = randomStore();
        AnomalyBatch batch = new AnomalyBatch(DetectionSettings.defaults(), 4, (s, partition) -> {
            if (partition.getStationId().equals("STA-3")) {
                throw new IllegalStateException("sensor table corrupted");
            }
            return StationMetrics.zero();
        });

        assertThatThrownBy(() -> batch.run(store))
                .isInstanceOf(BatchProcessingException.class)
                .hasMessageContaining("STA-3")
                .hasRootCauseMessage("sensor table corrupted")
                .satisfies(e -> assertThat(((BatchProcessingException) e).getStationId()).contains("STA-3"));
    }

    private static RecordStore randomStore() {
        Random random = new Random(7);
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            int station = random.nextInt(25);
            double spike = random.nextDouble() < 0.02 ? 40.0 : 0.0;
            rows.add(row("STA-" + station, REGIONS[station % REGIONS.length],
                    (i / 3) * 45_000L,
                    25.0 + random.nextGaussian() * 2 + spike,
                    60.0 + random.nextGaussian() * 8 - spike,
                    1013.0 + random.nextGaussian() * 3 + (random.nextDouble() < 0.01 ? 30.0 : 0.0)));
        }
        return RecordStore.of(rows);
    }
}
