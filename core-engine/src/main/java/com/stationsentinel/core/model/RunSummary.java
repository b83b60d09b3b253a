package com.stationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-run summary: elapsed time and the metrics of every station, ordered by
 * station key so that serialization does not depend on worker scheduling.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "elapsedMillis", "stations" })
public final class RunSummary {

    /** Field name of the elapsed time, excluded from result comparisons. */
    public static final String ELAPSED_FIELD = "elapsedMillis";

    private final double elapsedMillis;
    private final SortedMap<String, StationMetrics> stations;

    /**
     * @param elapsedMillis wall-clock duration of the computation
     * @param stations      metrics per station (copied into a sorted map)
     */
    public RunSummary(double elapsedMillis, Map<String, StationMetrics> stations) {
        Objects.requireNonNull(stations, "stations must not be null");
        this.elapsedMillis = elapsedMillis;
        this.stations = Collections.unmodifiableSortedMap(new TreeMap<>(stations));
    }

    public double getElapsedMillis() {
        return elapsedMillis;
    }

    public SortedMap<String, StationMetrics> getStations() {
        return stations;
    }

    @Override
    public String toString() {
        return "RunSummary{elapsedMillis=" + elapsedMillis + ", stations=" + stations.size() + '}';
    }
}
