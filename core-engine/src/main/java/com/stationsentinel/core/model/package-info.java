/**
 * Domain model of Station Sentinel.
 *
 * <ul>
 * <li>{@link com.stationsentinel.core.model.Row}: one observation with its
 * anomaly flags</li>
 * <li>{@link com.stationsentinel.core.model.Partition}: row indices of one
 * station</li>
 * <li>{@link com.stationsentinel.core.model.StationMetrics}: anomaly
 * percentages and concurrent periods of a station</li>
 * <li>{@link com.stationsentinel.core.model.MovingAverageRecord}: regional
 * window average emitted per clean row</li>
 * <li>{@link com.stationsentinel.core.model.RunSummary}: per-run output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.stationsentinel.core.model;
