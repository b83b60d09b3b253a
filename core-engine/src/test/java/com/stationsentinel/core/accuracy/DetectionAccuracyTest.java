package com.stationsentinel.core.accuracy;

import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.store.RecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stationsentinel.core.TestRows.baseline;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionAccuracy}.
 */
class DetectionAccuracyTest {

    @Test
    @DisplayName("Should classify detections against injected anomalies")
    void shouldCountPositivesAndNegatives() {
        Row hit = baseline("A", "Sul", 1_000);
        Row falseAlarm = baseline("A", "Sul", 2_000);
        Row missed = baseline("B", "Sul", 1_000);
        hit.markAnomalous(Metric.TEMPERATURE);
        falseAlarm.markAnomalous(Metric.PRESSURE);
        RecordStore store = RecordStore.of(List.of(hit, falseAlarm, missed));

        AccuracyReport report = DetectionAccuracy.evaluate(store, List.of(
                new GroundTruthEntry(1_000, "t1000", "A", Metric.TEMPERATURE, 80.0),
                new GroundTruthEntry(1_000, "t1000", "B", Metric.HUMIDITY, 5.0)));

        assertThat(report.getTruePositives()).isEqualTo(1);
        assertThat(report.getFalsePositives()).isEqualTo(1);
        assertThat(report.getFalseNegatives()).isEqualTo(1);
        assertThat(report.precision()).isEqualTo(0.5);
        assertThat(report.recall()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("A flag on the wrong metric should not count as a hit")
    void shouldMatchOnMetric() {
        Row row = baseline("A", "Sul", 1_000);
        row.markAnomalous(Metric.HUMIDITY);

        AccuracyReport report = DetectionAccuracy.evaluate(RecordStore.of(List.of(row)),
                List.of(new GroundTruthEntry(1_000, "t1000", "A", Metric.TEMPERATURE, 80.0)));

        assertThat(report.getTruePositives()).isZero();
        assertThat(report.getFalsePositives()).isEqualTo(1);
        assertThat(report.getFalseNegatives()).isEqualTo(1);
    }

    @Test
    @DisplayName("Precision and recall should be 1 when nothing was injected or detected")
    void shouldDefaultToPerfectScores() {
        AccuracyReport report = DetectionAccuracy.evaluate(
                RecordStore.of(List.of(baseline("A", "Sul", 0))), List.of());

        assertThat(report.precision()).isEqualTo(1.0);
        assertThat(report.recall()).isEqualTo(1.0);
    }
}
