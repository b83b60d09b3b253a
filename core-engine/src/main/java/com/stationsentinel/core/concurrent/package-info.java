/**
 * Worker pool and the two structures its workers share.
 *
 * <p>
 * Workers cooperate only through
 * {@link com.stationsentinel.core.concurrent.StationWorkQueue} and
 * {@link com.stationsentinel.core.concurrent.StationResults}, both guarded by
 * a lock around every compound operation, and through the anomaly flags of
 * their own partition's rows, which need no lock because partitions are
 * disjoint.
 * </p>
 *
 * @since 1.0.0
 */
package com.stationsentinel.core.concurrent;
