package com.stationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Anomaly metrics of one station.
 *
 * <p>
 * Holds the percentage of anomalous rows per {@link Metric} (always in
 * {@code [0, 100]}) and the number of concurrent anomaly periods: 10-minute
 * buckets in which at least two distinct metrics were anomalous.
 * </p>
 *
 * <p>
 * Instances are immutable and are published to other threads as a whole.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "anomalyPercentages", "concurrentAnomalyPeriods" })
public final class StationMetrics {

    private static final StationMetrics ZERO = new StationMetrics(new double[Metric.COUNT], 0);

    /** Percentages indexed by {@link Metric#ordinal()}. */
    private final double[] percentages;

    private final long concurrentAnomalyPeriods;

    private StationMetrics(double[] percentages, long concurrentAnomalyPeriods) {
        this.percentages = percentages;
        this.concurrentAnomalyPeriods = concurrentAnomalyPeriods;
    }

    /**
     * @param percentages              anomaly percentage per metric; every metric
     *                                 must be present
     * @param concurrentAnomalyPeriods number of concurrent anomaly periods
     * @return a new instance
     * @throws IllegalArgumentException if a metric is missing, a percentage
     *                                  lies outside {@code [0, 100]} or the
     *                                  period count is negative
     */
    public static StationMetrics of(Map<Metric, Double> percentages, long concurrentAnomalyPeriods) {
        Objects.requireNonNull(percentages, "percentages must not be null");
        double[] values = new double[Metric.COUNT];
        for (Metric metric : Metric.values()) {
            Double pct = percentages.get(metric);
            if (pct == null) {
                throw new IllegalArgumentException("Missing percentage for metric " + metric.getFieldName());
            }
            if (!(pct >= 0.0 && pct <= 100.0)) {
                throw new IllegalArgumentException("Percentage for " + metric.getFieldName()
                        + " must be in [0, 100], got: " + pct);
            }
            values[metric.ordinal()] = pct;
        }
        if (concurrentAnomalyPeriods < 0) {
            throw new IllegalArgumentException(
                    "concurrentAnomalyPeriods must be >= 0, got: " + concurrentAnomalyPeriods);
        }
        return new StationMetrics(values, concurrentAnomalyPeriods);
    }

    /**
     * @return metrics with every percentage and the period count at zero
     */
    public static StationMetrics zero() {
        return ZERO;
    }

    public double getAnomalyPercentage(Metric metric) {
        return percentages[metric.ordinal()];
    }

    /**
     * @return unmodifiable map from metric field name to percentage, in
     *         {@link Metric} declaration order
     */
    public Map<String, Double> getAnomalyPercentages() {
        Map<String, Double> byName = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            byName.put(metric.getFieldName(), percentages[metric.ordinal()]);
        }
        return Collections.unmodifiableMap(byName);
    }

    public long getConcurrentAnomalyPeriods() {
        return concurrentAnomalyPeriods;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StationMetrics that))
            return false;
        return concurrentAnomalyPeriods == that.concurrentAnomalyPeriods
                && Arrays.equals(percentages, that.percentages);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(percentages) + Long.hashCode(concurrentAnomalyPeriods);
    }

    @Override
    public String toString() {
        return "StationMetrics{" +
                "anomalyPercentages=" + getAnomalyPercentages() +
                ", concurrentAnomalyPeriods=" + concurrentAnomalyPeriods +
                '}';
    }
}
