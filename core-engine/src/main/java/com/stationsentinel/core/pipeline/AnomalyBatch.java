package com.stationsentinel.core.pipeline;

import com.stationsentinel.core.aggregation.MovingAverageStage;
import com.stationsentinel.core.concurrent.PartitionWorkerPool;
import com.stationsentinel.core.concurrent.StationResults;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.MovingAverageRecord;
import com.stationsentinel.core.model.RunSummary;
import com.stationsentinel.core.statistics.PartitionProcessor;
import com.stationsentinel.core.statistics.PartitionStatisticsEngine;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One batch pass over a {@link RecordStore}.
 *
 * <pre>
 *   RecordStore
 *     → PartitionWorkerPool (N workers, PartitionStatisticsEngine per station)
 *     → join barrier
 *     → MovingAverageStage (single thread)
 *     → BatchResult
 * </pre>
 *
 * <p>
 * The worker count changes throughput only; the station metrics and the
 * moving averages are identical for every value.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyBatch {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyBatch.class);

    private final DetectionSettings settings;
    private final PartitionWorkerPool workerPool;
    private final PartitionProcessor processor;

    /**
     * @param settings    validated detection settings
     * @param workerCount number of workers; must be {@code >= 1}
     * @throws IllegalArgumentException if {@code workerCount < 1}
     */
    public AnomalyBatch(DetectionSettings settings, int workerCount) {
        this(settings, workerCount, new PartitionStatisticsEngine(settings));
    }

    AnomalyBatch(DetectionSettings settings, int workerCount, PartitionProcessor processor) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.workerPool = new PartitionWorkerPool(workerCount);
        this.processor = Objects.requireNonNull(processor, "PartitionProcessor must not be null");
    }

    /**
     * Flag anomalies, compute station metrics and regional moving averages.
     *
     * <p>
     * The store's rows are annotated in place, so a store can be run once.
     * </p>
     *
     * @param store freshly built store
     * @return summary and moving averages
     * @throws com.stationsentinel.core.concurrent.BatchProcessingException if a
     *                                                                      partition fails
     */
    public BatchResult run(RecordStore store) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        LOG.info("Running batch over {} row(s) with {} worker(s)", store.size(), workerPool.getWorkerCount());

        long startNanos = System.nanoTime();
        StationResults results = workerPool.run(store, processor);
        List<MovingAverageRecord> movingAverages =
                new MovingAverageStage(settings.getMovingAverageWindow()).run(store);
        double elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000.0;

        LOG.info("Batch finished in {} ms", String.format("%.2f", elapsedMillis));
        return new BatchResult(new RunSummary(elapsedMillis, results.snapshot()), movingAverages);
    }
}
