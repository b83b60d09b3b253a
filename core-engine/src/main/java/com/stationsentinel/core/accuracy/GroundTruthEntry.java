package com.stationsentinel.core.accuracy;

import com.stationsentinel.core.model.Metric;

import java.util.Objects;

/**
 * A deliberately injected anomaly, as recorded by the dataset generator.
 *
 * @since 1.0.0
 */
public final class GroundTruthEntry {

    private final long timestampMillis;
    private final String timestampText;
    private final String stationId;
    private final Metric metric;
    private final double value;

    public GroundTruthEntry(long timestampMillis, String timestampText, String stationId, Metric metric, double value) {
        this.timestampMillis = timestampMillis;
        this.timestampText = Objects.requireNonNull(timestampText, "timestampText must not be null");
        this.stationId = Objects.requireNonNull(stationId, "stationId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.value = value;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public String getTimestampText() {
        return timestampText;
    }

    public String getStationId() {
        return stationId;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GroundTruthEntry that))
            return false;
        return timestampMillis == that.timestampMillis
                && stationId.equals(that.stationId)
                && metric == that.metric
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampMillis, stationId, metric, value);
    }

    @Override
    public String toString() {
        return "GroundTruthEntry{" +
                "timestamp='" + timestampText + '\'' +
                ", stationId='" + stationId + '\'' +
                ", metric=" + metric.getFieldName() +
                ", value=" + value +
                '}';
    }
}
