package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.stationsentinel.core.accuracy.GroundTruthEntry;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes observation rows and ground-truth entries as headed CSV files that
 * {@link StationCsvReader} and {@link GroundTruthReader} read back.
 *
 * @since 1.0.0
 */
public final class DatasetCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetCsvWriter.class);

    private final CsvMapper mapper = new CsvMapper();

    /**
     * @param rows observations, written in list order
     * @param path target file; parent directories are created
     * @throws UncheckedIOException if writing fails
     */
    public void writeObservations(List<Row> rows, Path path) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            SummaryWriter.createParentDirectories(path);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                    SequenceWriter csv = mapper.writer(CsvColumns.observationSchema()).writeValues(out)) {
                for (Row row : rows) {
                    Map<String, Object> record = new LinkedHashMap<>();
                    record.put(CsvColumns.TIMESTAMP, row.getTimestampText());
                    record.put(CsvColumns.STATION_ID, row.getStationId());
                    record.put(CsvColumns.REGION, row.getRegion());
                    for (Metric metric : Metric.values()) {
                        record.put(metric.getFieldName(), row.getValue(metric));
                    }
                    csv.write(record);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write observations to " + path, e);
        }
        LOG.info("{} observation(s) written to {}", rows.size(), path);
    }

    /**
     * @param entries injected anomalies
     * @param path    target file; parent directories are created
     * @throws UncheckedIOException if writing fails
     */
    public void writeGroundTruth(List<GroundTruthEntry> entries, Path path) {
        Objects.requireNonNull(entries, "entries must not be null");
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            SummaryWriter.createParentDirectories(path);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                    SequenceWriter csv = mapper.writer(CsvColumns.groundTruthSchema()).writeValues(out)) {
                for (GroundTruthEntry entry : entries) {
                    Map<String, Object> record = new LinkedHashMap<>();
                    record.put(CsvColumns.TIMESTAMP, entry.getTimestampText());
                    record.put(CsvColumns.STATION_ID, entry.getStationId());
                    record.put(CsvColumns.METRIC, entry.getMetric().getFieldName());
                    record.put(CsvColumns.VALUE, entry.getValue());
                    csv.write(record);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ground truth to " + path, e);
        }
        LOG.info("{} ground-truth entr(ies) written to {}", entries.size(), path);
    }
}
