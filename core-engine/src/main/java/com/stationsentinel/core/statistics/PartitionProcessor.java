package com.stationsentinel.core.statistics;

import com.stationsentinel.core.model.Partition;
import com.stationsentinel.core.model.StationMetrics;
import com.stationsentinel.core.store.RecordStore;

/**
 * Computes the metrics of a single station partition.
 *
 * <p>
 * Implementations may raise anomaly flags on the partition's rows and on no
 * other rows. They are called concurrently for different partitions and so
 * must not keep mutable state across calls.
 * </p>
 */
@FunctionalInterface
public interface PartitionProcessor {

    /**
     * @param store     the store owning the rows
     * @param partition the partition to process
     * @return the station's metrics, never {@code null}
     */
    StationMetrics process(RecordStore store, Partition partition);
}
