package com.stationsentinel.core.store;

import com.stationsentinel.core.model.Partition;
import com.stationsentinel.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory, input-ordered collection of rows partitioned by station.
 *
 * <p>
 * The row list and the partitions are built once and never change. Rows are
 * shared read-only between workers; the only writes are anomaly flags, which
 * are safe because the partitions are a disjoint cover of the rows. That
 * cover is verified at construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(RecordStore.class);

    private final List<Row> rows;
    private final Map<String, Partition> partitions;

    private RecordStore(List<Row> rows, Map<String, Partition> partitions) {
        this.rows = rows;
        this.partitions = partitions;
    }

    /**
     * Build a store from rows in input order.
     *
     * @param rows the rows; must not be {@code null} nor contain {@code null}
     * @return a new store whose row indices follow the list order
     * @throws NullPointerException if {@code rows} or an element is {@code null}
     */
    public static RecordStore of(List<Row> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        List<Row> copy = new ArrayList<>(rows.size());
        Map<String, List<Integer>> indicesByStation = new TreeMap<>();
        for (int i = 0; i < rows.size(); i++) {
            Row row = Objects.requireNonNull(rows.get(i), "Row at index " + i + " is null");
            copy.add(row);
            indicesByStation.computeIfAbsent(row.getStationId(), k -> new ArrayList<>()).add(i);
        }

        Map<String, Partition> partitions = new TreeMap<>();
        indicesByStation.forEach((stationId, indices) -> partitions.put(stationId,
                new Partition(stationId, indices.stream().mapToInt(Integer::intValue).toArray())));

        verifyDisjointCover(copy.size(), partitions.values());
        LOG.info("Record store built: {} row(s) in {} station partition(s)", copy.size(), partitions.size());
        return new RecordStore(Collections.unmodifiableList(copy), Collections.unmodifiableMap(partitions));
    }

    // ---------------------------------------------------------------
    // Rows
    // ---------------------------------------------------------------

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Row row(int index) {
        return rows.get(index);
    }

    /**
     * @return unmodifiable list of all rows in input order
     */
    public List<Row> rows() {
        return rows;
    }

    // ---------------------------------------------------------------
    // Partitions
    // ---------------------------------------------------------------

    /**
     * @return station keys in ascending order
     */
    public SortedSet<String> stationIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(partitions.keySet()));
    }

    /**
     * @param stationId the station key
     * @return the station's partition
     * @throws IllegalArgumentException if the station is unknown
     */
    public Partition partition(String stationId) {
        Partition partition = partitions.get(stationId);
        if (partition == null) {
            throw new IllegalArgumentException("Unknown station: '" + stationId + "'");
        }
        return partition;
    }

    /**
     * @return partitions ordered by station key
     */
    public Collection<Partition> partitions() {
        return partitions.values();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void verifyDisjointCover(int rowCount, Collection<Partition> partitions) {
        boolean[] seen = new boolean[rowCount];
        int covered = 0;
        for (Partition partition : partitions) {
            for (int i = 0; i < partition.size(); i++) {
                int index = partition.rowIndex(i);
                if (seen[index]) {
                    throw new IllegalStateException("Row " + index + " belongs to more than one partition");
                }
                seen[index] = true;
                covered++;
            }
        }
        if (covered != rowCount) {
            throw new IllegalStateException(
                    "Partitions cover " + covered + " of " + rowCount + " row(s)");
        }
    }
}
