package com.stationsentinel.core.aggregation;

import com.stationsentinel.core.model.MovingAverageRecord;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Regional moving averages over clean rows.
 *
 * <p>
 * Must run after the worker pool has joined, on the fully flagged store.
 * Steps:
 * </p>
 * <ol>
 * <li>drop every row with any anomaly flag;</li>
 * <li>sort the remaining rows globally by timestamp, ties by input
 * order;</li>
 * <li>group by region, keeping that order;</li>
 * <li>slide a window of {@code windowSize} rows over each region and emit
 * one {@link MovingAverageRecord} per row.</li>
 * </ol>
 *
 * <p>
 * The sort is global rather than per station because a region collects rows
 * from several stations. Output lists regions in ascending key order.
 * </p>
 *
 * @since 1.0.0
 */
public final class MovingAverageStage {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageStage.class);

    private final int windowSize;

    /**
     * @param windowSize window capacity; must be {@code >= 1}
     */
    public MovingAverageStage(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * @param store the store, after anomaly flagging
     * @return one record per clean row, in region-then-time order
     */
    public List<MovingAverageRecord> run(RecordStore store) {
        Objects.requireNonNull(store, "RecordStore must not be null");

        List<Integer> clean = new ArrayList<>();
        for (int i = 0; i < store.size(); i++) {
            if (store.row(i).isClean()) {
                clean.add(i);
            }
        }

        clean.sort(Comparator.<Integer>comparingLong(i -> store.row(i).getTimestampMillis())
                .thenComparingInt(Integer::intValue));

        Map<String, List<Row>> rowsByRegion = new TreeMap<>();
        for (int index : clean) {
            Row row = store.row(index);
            rowsByRegion.computeIfAbsent(row.getRegion(), r -> new ArrayList<>()).add(row);
        }

        List<MovingAverageRecord> records = new ArrayList<>(clean.size());
        rowsByRegion.forEach((region, rows) -> {
            SlidingWindow window = new SlidingWindow(windowSize);
            for (Row row : rows) {
                window.add(row);
                records.add(new MovingAverageRecord(row, window.means()));
            }
        });

        LOG.info("Moving averages computed: {} clean row(s) of {} in {} region(s)",
                clean.size(), store.size(), rowsByRegion.size());
        return Collections.unmodifiableList(records);
    }
}
