package com.stationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Trailing window average of a region, emitted for one clean row.
 *
 * <p>
 * The timestamp, station and region are those of the row that closed the
 * window; the metric values are the means over the window contents.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "stationId", "region", "temperature", "humidity", "pressure" })
public final class MovingAverageRecord {

    private final String timestamp;
    private final String stationId;
    private final String region;

    /** Window means indexed by {@link Metric#ordinal()}. */
    private final double[] averages;

    /**
     * @param row      the row that closed the window; must not be {@code null}
     * @param averages window mean per metric, indexed by ordinal (copied)
     */
    public MovingAverageRecord(Row row, double[] averages) {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(averages, "averages must not be null");
        if (averages.length != Metric.COUNT) {
            throw new IllegalArgumentException(
                    "Expected " + Metric.COUNT + " averages, got: " + averages.length);
        }
        this.timestamp = row.getTimestampText();
        this.stationId = row.getStationId();
        this.region = row.getRegion();
        this.averages = averages.clone();
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getStationId() {
        return stationId;
    }

    public String getRegion() {
        return region;
    }

    public double getAverage(Metric metric) {
        return averages[metric.ordinal()];
    }

    public double getTemperature() {
        return getAverage(Metric.TEMPERATURE);
    }

    public double getHumidity() {
        return getAverage(Metric.HUMIDITY);
    }

    public double getPressure() {
        return getAverage(Metric.PRESSURE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MovingAverageRecord that))
            return false;
        return timestamp.equals(that.timestamp)
                && stationId.equals(that.stationId)
                && region.equals(that.region)
                && Arrays.equals(averages, that.averages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, stationId, region, Arrays.hashCode(averages));
    }

    @Override
    public String toString() {
        return "MovingAverageRecord{" +
                "timestamp='" + timestamp + '\'' +
                ", stationId='" + stationId + '\'' +
                ", region='" + region + '\'' +
                ", averages=" + Arrays.toString(averages) +
                '}';
    }
}
