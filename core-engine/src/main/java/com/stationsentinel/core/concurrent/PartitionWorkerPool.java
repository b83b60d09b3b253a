package com.stationsentinel.core.concurrent;

import com.stationsentinel.core.model.StationMetrics;
import com.stationsentinel.core.statistics.PartitionProcessor;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of workers that drain a {@link StationWorkQueue}.
 *
 * <p>
 * Each worker loops: claim a station key, run the {@link PartitionProcessor}
 * on that station's partition, publish the result into
 * {@link StationResults}. A worker exits as soon as the queue is empty.
 * </p>
 *
 * <h3>Barrier</h3>
 * <p>
 * {@link #run(RecordStore, PartitionProcessor)} returns only after every
 * worker has terminated. Waiting on each worker's {@link Future} also makes
 * all anomaly flags written by the workers visible to the calling thread.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A failing partition aborts the batch: remaining workers stop claiming new
 * keys, the pool still waits for all of them, then throws
 * {@link BatchProcessingException}. There are no retries.
 * </p>
 *
 * @since 1.0.0
 */
public final class PartitionWorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionWorkerPool.class);

    private final int workerCount;

    /**
     * @param workerCount number of concurrent workers; must be {@code >= 1}
     * @throws IllegalArgumentException if {@code workerCount < 1}
     */
    public PartitionWorkerPool(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Process every partition of {@code store} and wait for all workers.
     *
     * @param store     the annotated record store
     * @param processor per-partition computation
     * @return the metrics of every station
     * @throws BatchProcessingException if any partition fails or the caller
     *                                  is interrupted while waiting
     */
    public StationResults run(RecordStore store, PartitionProcessor processor) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        Objects.requireNonNull(processor, "PartitionProcessor must not be null");

        StationWorkQueue queue = new StationWorkQueue(store.stationIds());
        StationResults results = new StationResults();
        AtomicBoolean aborted = new AtomicBoolean(false);

        LOG.info("Starting {} worker(s) for {} station partition(s)", workerCount, queue.size());

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "partition-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<Integer>> workers = new ArrayList<>(workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.add(executor.submit(() -> drain(queue, store, processor, results, aborted)));
            }
            awaitAll(workers);
        } finally {
            executor.shutdownNow();
        }

        if (results.size() != store.partitions().size()) {
            throw new IllegalStateException("Expected metrics for " + store.partitions().size()
                    + " station(s), got " + results.size());
        }
        LOG.info("All workers finished: {} station(s) processed", results.size());
        return results;
    }

    // ---------------------------------------------------------------
    // Worker loop
    // ---------------------------------------------------------------

    private static int drain(StationWorkQueue queue,
            RecordStore store,
            PartitionProcessor processor,
            StationResults results,
            AtomicBoolean aborted) {
        int processed = 0;
        while (!aborted.get()) {
            Optional<String> next = queue.take();
            if (next.isEmpty()) {
                break;
            }
            String stationId = next.get();
            StationMetrics metrics;
            try {
                metrics = Objects.requireNonNull(processor.process(store, store.partition(stationId)),
                        "PartitionProcessor returned null");
            } catch (RuntimeException e) {
                aborted.set(true);
                throw new BatchProcessingException(stationId, e);
            }
            results.put(stationId, metrics);
            processed++;
        }
        LOG.debug("Worker {} exiting after {} partition(s)", Thread.currentThread().getName(), processed);
        return processed;
    }

    // ---------------------------------------------------------------
    // Barrier
    // ---------------------------------------------------------------

    private static void awaitAll(List<Future<Integer>> workers) {
        BatchProcessingException failure = null;
        for (Future<Integer> worker : workers) {
            try {
                worker.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof BatchProcessingException
                            ? (BatchProcessingException) e.getCause()
                            : new BatchProcessingException("Worker failed: " + e.getCause(), e.getCause());
                } else {
                    failure.addSuppressed(e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchProcessingException("Interrupted while waiting for workers", e);
            }
        }
        if (failure != null) {
            LOG.error("Batch aborted: {}", failure.getMessage(), failure);
            throw failure;
        }
    }
}
