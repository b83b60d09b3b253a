/**
 * File formats of the batch job: observation and ground-truth CSV (Jackson
 * CSV), summary JSON and moving-average JSON Lines (Jackson databind).
 *
 * @since 1.0.0
 */
package com.stationsentinel.batch.io;
