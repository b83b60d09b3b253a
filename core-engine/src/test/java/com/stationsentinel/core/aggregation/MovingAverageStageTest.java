package com.stationsentinel.core.aggregation;

import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.MovingAverageRecord;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.store.RecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.stationsentinel.core.TestRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MovingAverageStage}.
 */
class MovingAverageStageTest {

    private final MovingAverageStage stage = new MovingAverageStage(10);

    @Test
    @DisplayName("Should average the trailing ten rows, fewer at the start")
    void shouldAverageTrailingWindow() {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            rows.add(row("STA-1", "Sul", i * 60_000L, i, 2.0 * i, 1000 + i));
        }

        List<MovingAverageRecord> records = stage.run(RecordStore.of(rows));

        assertThat(records).hasSize(12);
        assertThat(records.get(0).getTemperature()).isEqualTo(0.0);
        assertThat(records.get(1).getTemperature()).isCloseTo(0.5, within(1e-12));
        assertThat(records.get(9).getTemperature()).isCloseTo(4.5, within(1e-12));
        // rows 2..11
        assertThat(records.get(11).getTemperature()).isCloseTo(6.5, within(1e-12));
        assertThat(records.get(11).getHumidity()).isCloseTo(13.0, within(1e-12));
        assertThat(records.get(11).getPressure()).isCloseTo(1006.5, within(1e-9));
    }

    @Test
    @DisplayName("Rows with any anomaly flag should be left out of the windows")
    void shouldSkipAnomalousRows() {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            rows.add(row("STA-1", "Sul", i * 60_000L, 10.0 * (i + 1), 50.0, 1013.0));
        }
        rows.get(1).markAnomalous(Metric.PRESSURE);

        List<MovingAverageRecord> records = stage.run(RecordStore.of(rows));

        assertThat(records).extracting(MovingAverageRecord::getTimestamp)
                .containsExactly(rows.get(0).getTimestampText(), rows.get(2).getTimestampText());
        assertThat(records.get(1).getTemperature()).isCloseTo(20.0, within(1e-12));
    }

    @Test
    @DisplayName("Regions should be averaged separately and emitted in key order")
    void shouldSeparateRegions() {
        List<Row> rows = List.of(
                row("STA-1", "Sul", 0, 10, 0, 0),
                row("STA-2", "Norte", 1_000, 100, 0, 0),
                row("STA-1", "Sul", 2_000, 20, 0, 0),
                row("STA-2", "Norte", 3_000, 200, 0, 0));

        List<MovingAverageRecord> records = stage.run(RecordStore.of(rows));

        assertThat(records).extracting(MovingAverageRecord::getRegion)
                .containsExactly("Norte", "Norte", "Sul", "Sul");
        assertThat(records).extracting(MovingAverageRecord::getTemperature)
                .containsExactly(100.0, 150.0, 10.0, 15.0);
    }

    @Test
    @DisplayName("Stations of one region should share a window in global time order")
    void shouldMergeStationsByTimestamp() {
        List<Row> rows = List.of(
                row("STA-1", "Sul", 0, 1, 0, 0),
                row("STA-1", "Sul", 2_000, 3, 0, 0),
                row("STA-2", "Sul", 1_000, 2, 0, 0),
                row("STA-2", "Sul", 3_000, 4, 0, 0));

        List<MovingAverageRecord> records = new MovingAverageStage(2).run(RecordStore.of(rows));

        assertThat(records).extracting(MovingAverageRecord::getStationId)
                .containsExactly("STA-1", "STA-2", "STA-1", "STA-2");
        assertThat(records).extracting(MovingAverageRecord::getTemperature)
                .containsExactly(1.0, 1.5, 2.5, 3.5);
    }

    @Test
    @DisplayName("Equal timestamps should keep input order")
    void shouldBreakTiesByInputOrder() {
        List<Row> rows = List.of(
                row("STA-9", "Sul", 5_000, 1, 0, 0),
                row("STA-1", "Sul", 5_000, 2, 0, 0),
                row("STA-5", "Sul", 5_000, 3, 0, 0));

        List<MovingAverageRecord> records = stage.run(RecordStore.of(rows));

        assertThat(records).extracting(MovingAverageRecord::getStationId)
                .containsExactly("STA-9", "STA-1", "STA-5");
    }

    @Test
    @DisplayName("Should produce nothing when every row is anomalous")
    void shouldHandleNoCleanRows() {
        Row only = row("STA-1", "Sul", 0, 1, 0, 0);
        only.markAnomalous(Metric.TEMPERATURE);

        assertThat(stage.run(RecordStore.of(List.of(only)))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a window smaller than one")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new MovingAverageStage(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
