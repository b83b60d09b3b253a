package com.stationsentinel.core.accuracy;

import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compares the anomaly flags of a processed store with a ground-truth log.
 *
 * <p>
 * Detections and injections are matched on
 * {@code (station, timestamp, metric)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionAccuracy {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionAccuracy.class);

    private DetectionAccuracy() {
        // utility class
    }

    /**
     * @param store       the store after the batch has run
     * @param groundTruth injected anomalies
     * @return true/false positives and false negatives
     */
    public static AccuracyReport evaluate(RecordStore store, List<GroundTruthEntry> groundTruth) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        Objects.requireNonNull(groundTruth, "Ground truth must not be null");

        Set<Key> injected = new HashSet<>();
        for (GroundTruthEntry entry : groundTruth) {
            injected.add(new Key(entry.getStationId(), entry.getTimestampMillis(), entry.getMetric()));
        }

        Set<Key> detected = new HashSet<>();
        for (Row row : store.rows()) {
            for (Metric metric : Metric.values()) {
                if (row.isAnomalous(metric)) {
                    detected.add(new Key(row.getStationId(), row.getTimestampMillis(), metric));
                }
            }
        }

        long truePositives = detected.stream().filter(injected::contains).count();
        AccuracyReport report = new AccuracyReport(
                truePositives,
                detected.size() - truePositives,
                injected.size() - truePositives);
        LOG.info("Detection accuracy: {}", report);
        return report;
    }

    private static final class Key {
        private final String stationId;
        private final long timestampMillis;
        private final Metric metric;

        Key(String stationId, long timestampMillis, Metric metric) {
            this.stationId = stationId;
            this.timestampMillis = timestampMillis;
            this.metric = metric;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Key that))
                return false;
            return timestampMillis == that.timestampMillis
                    && stationId.equals(that.stationId)
                    && metric == that.metric;
        }

        @Override
        public int hashCode() {
            return Objects.hash(stationId, timestampMillis, metric);
        }
    }
}
