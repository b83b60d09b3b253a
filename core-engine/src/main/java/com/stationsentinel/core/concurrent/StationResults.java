package com.stationsentinel.core.concurrent;

import com.stationsentinel.core.model.StationMetrics;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Thread-safe map from station key to its {@link StationMetrics}.
 *
 * <p>
 * Each key is written exactly once, as one whole immutable value. Readers
 * therefore never see a half-built entry.
 * </p>
 *
 * @since 1.0.0
 */
public final class StationResults {

    private final Map<String, StationMetrics> results = new HashMap<>();

    /**
     * Publish the metrics of a station.
     *
     * @param stationId the station key; must not be {@code null}
     * @param metrics   the station's metrics; must not be {@code null}
     * @throws IllegalStateException if metrics for {@code stationId} were
     *                               already published
     */
    public void put(String stationId, StationMetrics metrics) {
        Objects.requireNonNull(stationId, "stationId must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        synchronized (results) {
            StationMetrics previous = results.putIfAbsent(stationId, metrics);
            if (previous != null) {
                throw new IllegalStateException("Metrics for station '" + stationId + "' published twice");
            }
        }
    }

    public Optional<StationMetrics> get(String stationId) {
        synchronized (results) {
            return Optional.ofNullable(results.get(stationId));
        }
    }

    public int size() {
        synchronized (results) {
            return results.size();
        }
    }

    /**
     * @return unmodifiable copy of the current entries, ordered by station key
     */
    public SortedMap<String, StationMetrics> snapshot() {
        synchronized (results) {
            return Collections.unmodifiableSortedMap(new TreeMap<>(results));
        }
    }
}
