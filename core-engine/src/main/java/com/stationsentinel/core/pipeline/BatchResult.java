package com.stationsentinel.core.pipeline;

import com.stationsentinel.core.model.MovingAverageRecord;
import com.stationsentinel.core.model.RunSummary;

import java.util.List;
import java.util.Objects;

/**
 * Both outputs of a batch run.
 *
 * @since 1.0.0
 */
public final class BatchResult {

    private final RunSummary summary;
    private final List<MovingAverageRecord> movingAverages;

    public BatchResult(RunSummary summary, List<MovingAverageRecord> movingAverages) {
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.movingAverages = List.copyOf(Objects.requireNonNull(movingAverages, "movingAverages must not be null"));
    }

    public RunSummary getSummary() {
        return summary;
    }

    public List<MovingAverageRecord> getMovingAverages() {
        return movingAverages;
    }
}
