package com.stationsentinel.core.aggregation;

import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-capacity trailing window over the metric values of rows.
 *
 * <p>
 * Not thread-safe; one instance per region, used by a single thread.
 * </p>
 */
final class SlidingWindow {

    private final int capacity;

    /** Metric values of the rows in the window, oldest first. */
    private final Deque<double[]> entries = new ArrayDeque<>();

    SlidingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a row, evicting the oldest entry once capacity is exceeded.
     */
    void add(Row row) {
        double[] values = new double[Metric.COUNT];
        for (Metric metric : Metric.values()) {
            values[metric.ordinal()] = row.getValue(metric);
        }
        entries.addLast(values);
        if (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    int size() {
        return entries.size();
    }

    /**
     * @return arithmetic mean of each metric over the current contents,
     *         summed oldest first
     */
    double[] means() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Window is empty");
        }
        double[] sums = new double[Metric.COUNT];
        for (double[] values : entries) {
            for (int m = 0; m < Metric.COUNT; m++) {
                sums[m] += values[m];
            }
        }
        int n = entries.size();
        for (int m = 0; m < Metric.COUNT; m++) {
            sums[m] /= n;
        }
        return sums;
    }
}
