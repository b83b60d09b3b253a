package com.stationsentinel.core.model;

import java.util.Objects;

/**
 * One observation of a station.
 *
 * <p>
 * Every field is immutable except the per-metric anomaly flags, which start
 * {@code false} and are raised by the statistics engine.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The flags are plain fields without synchronization. They may only be
 * written by the worker that owns the row's station partition; since
 * partitions are disjoint no two threads ever write the same row. Other
 * threads may read the flags only after the worker pool has joined.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code stationId}, {@code region} and
 * {@code timestampText} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Row {

    private final long timestampMillis;

    /** Timestamp exactly as it appeared in the input, echoed back in outputs. */
    private final String timestampText;

    private final String stationId;
    private final String region;

    /** Metric values indexed by {@link Metric#ordinal()}. */
    private final double[] values;

    private final boolean[] anomalous = new boolean[Metric.COUNT];

    private Row(Builder builder) {
        this.timestampMillis = builder.timestampMillis;
        this.timestampText = Objects.requireNonNull(builder.timestampText, "timestampText must not be null");
        this.stationId = Objects.requireNonNull(builder.stationId, "stationId must not be null");
        this.region = Objects.requireNonNull(builder.region, "region must not be null");
        this.values = builder.values.clone();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Row} instances.
     */
    public static class Builder {
        private long timestampMillis;
        private String timestampText;
        private String stationId;
        private String region;
        private final double[] values = new double[Metric.COUNT];

        public Builder timestamp(long timestampMillis, String timestampText) {
            this.timestampMillis = timestampMillis;
            this.timestampText = timestampText;
            return this;
        }

        public Builder stationId(String stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder value(Metric metric, double value) {
            values[metric.ordinal()] = value;
            return this;
        }

        public Builder temperature(double value) {
            return value(Metric.TEMPERATURE, value);
        }

        public Builder humidity(double value) {
            return value(Metric.HUMIDITY, value);
        }

        public Builder pressure(double value) {
            return value(Metric.PRESSURE, value);
        }

        /**
         * @return a new {@link Row} with all anomaly flags cleared
         * @throws NullPointerException if a required field is missing
         */
        public Row build() {
            return new Row(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public String getTimestampText() {
        return timestampText;
    }

    public String getStationId() {
        return stationId;
    }

    public String getRegion() {
        return region;
    }

    public double getValue(Metric metric) {
        return values[metric.ordinal()];
    }

    // ---------------------------------------------------------------
    // Anomaly flags
    // ---------------------------------------------------------------

    public boolean isAnomalous(Metric metric) {
        return anomalous[metric.ordinal()];
    }

    /**
     * @return {@code true} if any metric of this row is flagged
     */
    public boolean hasAnomaly() {
        for (boolean flag : anomalous) {
            if (flag) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if no metric of this row is flagged
     */
    public boolean isClean() {
        return !hasAnomaly();
    }

    /**
     * Raise the anomaly flag of one metric. Only the owner of this row's
     * partition may call this.
     *
     * @param metric the anomalous metric
     */
    public void markAnomalous(Metric metric) {
        anomalous[metric.ordinal()] = true;
    }

    @Override
    public String toString() {
        return "Row{" +
                "timestamp='" + timestampText + '\'' +
                ", stationId='" + stationId + '\'' +
                ", region='" + region + '\'' +
                ", temperature=" + values[Metric.TEMPERATURE.ordinal()] +
                ", humidity=" + values[Metric.HUMIDITY.ordinal()] +
                ", pressure=" + values[Metric.PRESSURE.ordinal()] +
                '}';
    }
}
