package com.stationsentinel.core.statistics;

import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Partition;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.model.StationMetrics;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sigma-rule anomaly detector for one station partition.
 *
 * <p>
 * For each {@link Metric} the engine computes the population mean and
 * standard deviation of the partition and flags every row whose value lies
 * outside {@code mean ± sigmaFactor·stddev}. Statistics are partition-local:
 * no station sees another station's distribution.
 * </p>
 *
 * <h3>Concurrent anomaly periods</h3>
 * <p>
 * Row timestamps are bucketed into non-overlapping buckets of
 * {@link DetectionSettings#bucketWidthMillis()} ({@code bucket = ts / width}).
 * A bucket counts once if at least two distinct metrics were anomalous
 * anywhere inside it.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Stateless apart from its configuration; one instance is shared by all
 * workers.
 * </p>
 *
 * @since 1.0.0
 */
public final class PartitionStatisticsEngine implements PartitionProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionStatisticsEngine.class);

    private final double sigmaFactor;
    private final long bucketWidthMillis;

    /**
     * @param settings validated detection settings; must not be {@code null}
     */
    public PartitionStatisticsEngine(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.sigmaFactor = settings.getSigmaFactor();
        this.bucketWidthMillis = settings.bucketWidthMillis();
    }

    @Override
    public StationMetrics process(RecordStore store, Partition partition) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        Objects.requireNonNull(partition, "Partition must not be null");

        if (partition.isEmpty()) {
            LOG.debug("Station [{}] has no rows, returning zero metrics", partition.getStationId());
            return StationMetrics.zero();
        }

        Map<Metric, MetricStatistics> statistics = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            statistics.put(metric, MetricStatistics.of(values(store, partition, metric)));
        }

        long[] anomalyCounts = new long[Metric.COUNT];
        Map<Long, Set<Metric>> anomalousMetricsByBucket = new HashMap<>();

        for (int i = 0; i < partition.size(); i++) {
            Row row = store.row(partition.rowIndex(i));
            for (Metric metric : Metric.values()) {
                if (statistics.get(metric).isOutlier(row.getValue(metric), sigmaFactor)) {
                    row.markAnomalous(metric);
                    anomalyCounts[metric.ordinal()]++;
                    long bucket = Math.floorDiv(row.getTimestampMillis(), bucketWidthMillis);
                    anomalousMetricsByBucket
                            .computeIfAbsent(bucket, b -> EnumSet.noneOf(Metric.class))
                            .add(metric);
                }
            }
        }

        long concurrentPeriods = anomalousMetricsByBucket.values().stream()
                .filter(metrics -> metrics.size() >= 2)
                .count();

        double n = partition.size();
        Map<Metric, Double> percentages = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            percentages.put(metric, (anomalyCounts[metric.ordinal()] / n) * 100.0);
        }

        LOG.debug("Station [{}] processed: rows={} stats={} anomalies={} concurrentPeriods={}",
                partition.getStationId(), partition.size(), statistics,
                Arrays.toString(anomalyCounts), concurrentPeriods);
        return StationMetrics.of(percentages, concurrentPeriods);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] values(RecordStore store, Partition partition, Metric metric) {
        double[] values = new double[partition.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = store.row(partition.rowIndex(i)).getValue(metric);
        }
        return values;
    }
}
