package com.stationsentinel.core.concurrent;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared queue of station keys waiting to be processed.
 *
 * <p>
 * Keys are claimed last-in-first-out under a single lock. {@link #take()}
 * never blocks: it either hands out a key or reports that the queue is
 * drained. A key is handed out exactly once and never re-queued.
 * </p>
 *
 * @since 1.0.0
 */
public final class StationWorkQueue {

    private final Deque<String> pending;

    /**
     * @param stationIds keys to enqueue, in enqueue order; must not be
     *                   {@code null} nor contain duplicates
     * @throws IllegalArgumentException if a key appears twice
     */
    public StationWorkQueue(Collection<String> stationIds) {
        Objects.requireNonNull(stationIds, "stationIds must not be null");
        this.pending = new ArrayDeque<>(stationIds.size());
        Set<String> seen = new HashSet<>();
        for (String stationId : stationIds) {
            Objects.requireNonNull(stationId, "stationId must not be null");
            if (!seen.add(stationId)) {
                throw new IllegalArgumentException("Duplicate station key: '" + stationId + "'");
            }
            pending.addLast(stationId);
        }
    }

    /**
     * Claim the most recently enqueued key.
     *
     * @return the claimed key, or empty once the queue is drained
     */
    public Optional<String> take() {
        synchronized (pending) {
            return Optional.ofNullable(pending.pollLast());
        }
    }

    /**
     * @return number of keys not yet claimed
     */
    public int size() {
        synchronized (pending) {
            return pending.size();
        }
    }
}
