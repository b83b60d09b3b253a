package com.stationsentinel.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder should apply defaults")
    void builderShouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getWorkerCount()).isEqualTo(1);
        assertThat(config.getInputPath()).isEqualTo(Path.of("data/observations.csv"));
        assertThat(config.getSummaryOutput()).isEqualTo(Path.of("data/summary.json"));
        assertThat(config.getMovingAverageOutput()).isEqualTo(Path.of("data/moving_averages.jsonl"));
        assertThat(config.getDetectionConfigPath()).isNull();
    }

    @Test
    @DisplayName("toBuilder should keep values not overridden")
    void toBuilderShouldCopyValues() {
        JobConfig base = new JobConfig.Builder()
                .workerCount(8)
                .inputPath(Path.of("in.csv"))
                .detectionConfigPath(Path.of("detection.yml"))
                .build();

        JobConfig overridden = base.toBuilder().summaryOutput(Path.of("out.json")).build();

        assertThat(overridden.getWorkerCount()).isEqualTo(8);
        assertThat(overridden.getInputPath()).isEqualTo(Path.of("in.csv"));
        assertThat(overridden.getSummaryOutput()).isEqualTo(Path.of("out.json"));
        assertThat(overridden.getDetectionConfigPath()).isEqualTo(Path.of("detection.yml"));
    }

    @Test
    @DisplayName("Should reject fewer than one worker")
    void shouldRejectInvalidWorkerCount() {
        assertThatThrownBy(() -> new JobConfig.Builder().workerCount(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerCount");
    }

    @Test
    @DisplayName("Should reject a missing input path")
    void shouldRejectMissingInput() {
        assertThatThrownBy(() -> new JobConfig.Builder().inputPath(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
