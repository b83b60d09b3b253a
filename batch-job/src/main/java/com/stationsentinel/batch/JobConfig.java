package com.stationsentinel.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed, immutable configuration of a Station Sentinel batch run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the job can be driven from a container or a shell without arguments.
 * Command-line options override them through {@link #toBuilder()}.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code SENTINEL_WORKERS}: worker count (default: available
 * processors)</li>
 * <li>{@code SENTINEL_INPUT}: input CSV</li>
 * <li>{@code SENTINEL_SUMMARY_OUTPUT}: summary JSON</li>
 * <li>{@code SENTINEL_MOVING_AVERAGE_OUTPUT}: moving averages JSON
 * Lines</li>
 * <li>{@code DETECTION_CONFIG_PATH}: detection settings YAML (optional)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    private final int workerCount;
    private final Path inputPath;
    private final Path summaryOutput;
    private final Path movingAverageOutput;

    /** Detection settings file; {@code null} means classpath defaults. */
    private final Path detectionConfigPath;

    private JobConfig(Builder b) {
        this.workerCount = b.workerCount;
        this.inputPath = b.inputPath;
        this.summaryOutput = b.summaryOutput;
        this.movingAverageOutput = b.movingAverageOutput;
        this.detectionConfigPath = b.detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration resolved from environment variables
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            String configPath = env("DETECTION_CONFIG_PATH", "");
            return new Builder()
                    .workerCount(Integer.parseInt(env("SENTINEL_WORKERS",
                            String.valueOf(Runtime.getRuntime().availableProcessors()))))
                    .inputPath(Path.of(env("SENTINEL_INPUT", Builder.DEFAULT_INPUT)))
                    .summaryOutput(Path.of(env("SENTINEL_SUMMARY_OUTPUT", Builder.DEFAULT_SUMMARY)))
                    .movingAverageOutput(Path.of(env("SENTINEL_MOVING_AVERAGE_OUTPUT",
                            Builder.DEFAULT_MOVING_AVERAGES)))
                    .detectionConfigPath(configPath.isBlank() ? null : Path.of(configPath))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return a builder pre-filled with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .workerCount(workerCount)
                .inputPath(inputPath)
                .summaryOutput(summaryOutput)
                .movingAverageOutput(movingAverageOutput)
                .detectionConfigPath(detectionConfigPath);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkerCount() {
        return workerCount;
    }

    public Path getInputPath() {
        return inputPath;
    }

    public Path getSummaryOutput() {
        return summaryOutput;
    }

    public Path getMovingAverageOutput() {
        return movingAverageOutput;
    }

    public Path getDetectionConfigPath() {
        return detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}. {@link #build()} rejects a worker
     * count below one and missing paths.
     */
    public static class Builder {
        static final String DEFAULT_INPUT = "data/observations.csv";
        static final String DEFAULT_SUMMARY = "data/summary.json";
        static final String DEFAULT_MOVING_AVERAGES = "data/moving_averages.jsonl";

        private int workerCount = 1;
        private Path inputPath = Path.of(DEFAULT_INPUT);
        private Path summaryOutput = Path.of(DEFAULT_SUMMARY);
        private Path movingAverageOutput = Path.of(DEFAULT_MOVING_AVERAGES);
        private Path detectionConfigPath;

        public Builder workerCount(int v) {
            this.workerCount = v;
            return this;
        }

        public Builder inputPath(Path v) {
            this.inputPath = v;
            return this;
        }

        public Builder summaryOutput(Path v) {
            this.summaryOutput = v;
            return this;
        }

        public Builder movingAverageOutput(Path v) {
            this.movingAverageOutput = v;
            return this;
        }

        public Builder detectionConfigPath(Path v) {
            this.detectionConfigPath = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if the worker count is below one
         * @throws NullPointerException     if a required path is missing
         */
        public JobConfig build() {
            Objects.requireNonNull(inputPath, "inputPath required");
            Objects.requireNonNull(summaryOutput, "summaryOutput required");
            Objects.requireNonNull(movingAverageOutput, "movingAverageOutput required");

            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "workerCount=" + workerCount +
                ", inputPath=" + inputPath +
                ", summaryOutput=" + summaryOutput +
                ", movingAverageOutput=" + movingAverageOutput +
                ", detectionConfigPath=" + detectionConfigPath +
                '}';
    }
}
