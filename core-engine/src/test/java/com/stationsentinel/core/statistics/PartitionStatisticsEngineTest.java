package com.stationsentinel.core.statistics;

import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Partition;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.model.StationMetrics;
import com.stationsentinel.core.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.stationsentinel.core.TestRows.BOUNDARY;
import static com.stationsentinel.core.TestRows.baseline;
import static com.stationsentinel.core.TestRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PartitionStatisticsEngine}.
 */
class PartitionStatisticsEngineTest {

    private static final String STATION = "STA-001";

    private PartitionStatisticsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PartitionStatisticsEngine(DetectionSettings.defaults());
    }

    @Test
    @DisplayName("Two metrics anomalous in the same bucket should form one concurrent period")
    void shouldCountConcurrentPeriodInSameBucket() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", BOUNDARY + 90_000, 80.0, 50.0, 1013.0));
        rows.add(row(STATION, "Sul", BOUNDARY + 95_000, 20.0, 99.0, 1013.0));
        RecordStore store = RecordStore.of(rows);

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics.getAnomalyPercentage(Metric.TEMPERATURE)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getAnomalyPercentage(Metric.HUMIDITY)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getAnomalyPercentage(Metric.PRESSURE)).isZero();
        assertThat(metrics.getConcurrentAnomalyPeriods()).isEqualTo(1);

        assertThat(store.row(48).isAnomalous(Metric.TEMPERATURE)).isTrue();
        assertThat(store.row(48).isAnomalous(Metric.HUMIDITY)).isFalse();
        assertThat(store.row(49).isAnomalous(Metric.HUMIDITY)).isTrue();
        assertThat(store.row(0).isClean()).isTrue();
    }

    @Test
    @DisplayName("Anomalies in adjacent buckets should not form a concurrent period")
    void shouldNotCountAdjacentBuckets() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", BOUNDARY - 5_000, 80.0, 50.0, 1013.0));
        rows.add(row(STATION, "Sul", BOUNDARY + 5_000, 20.0, 99.0, 1013.0));
        RecordStore store = RecordStore.of(rows);

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics.getAnomalyPercentage(Metric.TEMPERATURE)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getAnomalyPercentage(Metric.HUMIDITY)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getConcurrentAnomalyPeriods()).isZero();
    }

    @Test
    @DisplayName("Buckets before the epoch should be as wide as any other")
    void shouldBucketNegativeTimestampsByFloor() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", -300_000, 80.0, 50.0, 1013.0));
        rows.add(row(STATION, "Sul", 300_000, 20.0, 99.0, 1013.0));
        RecordStore store = RecordStore.of(rows);

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics.getAnomalyPercentage(Metric.TEMPERATURE)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getAnomalyPercentage(Metric.HUMIDITY)).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getConcurrentAnomalyPeriods()).isZero();
    }

    @Test
    @DisplayName("Two metrics in the same bucket before the epoch should form one concurrent period")
    void shouldCountConcurrentPeriodBeforeEpoch() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", -300_000, 80.0, 50.0, 1013.0));
        rows.add(row(STATION, "Sul", -295_000, 20.0, 99.0, 1013.0));
        RecordStore store = RecordStore.of(rows);

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics.getConcurrentAnomalyPeriods()).isEqualTo(1);
    }

    @Test
    @DisplayName("The same metric twice in one bucket should not form a concurrent period")
    void shouldNotCountSingleMetricTwice() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", BOUNDARY + 10_000, 80.0, 50.0, 1013.0));
        rows.add(row(STATION, "Sul", BOUNDARY + 20_000, 80.0, 50.0, 1013.0));
        RecordStore store = RecordStore.of(rows);

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics.getAnomalyPercentage(Metric.TEMPERATURE)).isCloseTo(4.0, within(1e-9));
        assertThat(metrics.getConcurrentAnomalyPeriods()).isZero();
    }

    @Test
    @DisplayName("A constant metric should never be flagged")
    void shouldNotFlagConstantMetric() {
        RecordStore store = RecordStore.of(baselineRows(30));

        StationMetrics metrics = engine.process(store, store.partition(STATION));

        assertThat(metrics).isEqualTo(StationMetrics.zero());
        assertThat(store.rows()).allMatch(Row::isClean);
    }

    @Test
    @DisplayName("An empty partition should yield zero metrics")
    void shouldReturnZeroForEmptyPartition() {
        RecordStore store = RecordStore.of(List.of());

        StationMetrics metrics = engine.process(store, new Partition("EMPTY", new int[0]));

        assertThat(metrics).isEqualTo(StationMetrics.zero());
    }

    @Test
    @DisplayName("Only rows of the given partition should be flagged")
    void shouldOnlyTouchOwnPartition() {
        List<Row> rows = baselineRows(48);
        rows.add(row(STATION, "Sul", BOUNDARY, 80.0, 50.0, 1013.0));
        for (int i = 0; i < 10; i++) {
            rows.add(row("OTHER", "Sul", BOUNDARY + i, i == 0 ? 500.0 : 20.0, 50.0, 1013.0));
        }
        RecordStore store = RecordStore.of(rows);

        engine.process(store, store.partition(STATION));

        assertThat(store.row(48).isAnomalous(Metric.TEMPERATURE)).isTrue();
        assertThat(store.row(49).isClean()).isTrue();
    }

    private static List<Row> baselineRows(int count) {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(baseline(STATION, "Sul", BOUNDARY - 3_600_000L + i * 60_000L));
        }
        return rows;
    }
}
