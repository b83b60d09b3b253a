package com.stationsentinel.batch.generator;

import com.stationsentinel.core.accuracy.GroundTruthEntry;
import com.stationsentinel.core.model.Row;

import java.util.List;

/**
 * Observations produced by {@link SyntheticDatasetGenerator} and the log of
 * anomalies injected into them.
 */
public final class GeneratedDataset {

    private final List<Row> rows;
    private final List<GroundTruthEntry> groundTruth;

    GeneratedDataset(List<Row> rows, List<GroundTruthEntry> groundTruth) {
        this.rows = List.copyOf(rows);
        this.groundTruth = List.copyOf(groundTruth);
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<GroundTruthEntry> getGroundTruth() {
        return groundTruth;
    }
}
