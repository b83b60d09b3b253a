/**
 * Per-station anomaly statistics.
 *
 * <p>
 * {@link com.stationsentinel.core.statistics.PartitionStatisticsEngine} is the
 * built-in {@link com.stationsentinel.core.statistics.PartitionProcessor}. It
 * flags each metric value lying outside {@code mean ± sigmaFactor × σ} of its
 * station, then counts the time buckets in which two or more metrics were
 * flagged.
 * </p>
 *
 * @since 1.0.0
 */
package com.stationsentinel.core.statistics;
