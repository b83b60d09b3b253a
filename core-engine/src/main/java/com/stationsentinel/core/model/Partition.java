package com.stationsentinel.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The row indices of one station, in input order.
 *
 * <p>
 * Indices refer to positions in the owning
 * {@link com.stationsentinel.core.store.RecordStore}. Instances are
 * immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Partition {

    private final String stationId;
    private final int[] rowIndices;

    /**
     * @param stationId  the station key; must not be {@code null}
     * @param rowIndices indices of the station's rows (copied)
     */
    public Partition(String stationId, int[] rowIndices) {
        this.stationId = Objects.requireNonNull(stationId, "stationId must not be null");
        this.rowIndices = Objects.requireNonNull(rowIndices, "rowIndices must not be null").clone();
    }

    public String getStationId() {
        return stationId;
    }

    public int size() {
        return rowIndices.length;
    }

    public boolean isEmpty() {
        return rowIndices.length == 0;
    }

    /**
     * @param position position within this partition, in {@code [0, size())}
     * @return the store index of the row at that position
     */
    public int rowIndex(int position) {
        return rowIndices[position];
    }

    /**
     * @return a copy of the row indices
     */
    public int[] rowIndices() {
        return rowIndices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Partition that))
            return false;
        return stationId.equals(that.stationId) && Arrays.equals(rowIndices, that.rowIndices);
    }

    @Override
    public int hashCode() {
        return 31 * stationId.hashCode() + Arrays.hashCode(rowIndices);
    }

    @Override
    public String toString() {
        return "Partition{stationId='" + stationId + "', size=" + rowIndices.length + '}';
    }
}
