package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvReadException;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.stationsentinel.core.accuracy.GroundTruthEntry;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the ground-truth CSV written by the dataset generator.
 *
 * @since 1.0.0
 */
public final class GroundTruthReader {

    private final CsvMapper mapper = new CsvMapper();
    private final TimestampCodec timestamps;

    public GroundTruthReader(DetectionSettings settings) {
        this.timestamps = new TimestampCodec(Objects.requireNonNull(settings, "DetectionSettings must not be null"));
    }

    /**
     * @param path ground-truth CSV
     * @return the entries in file order
     * @throws IngestionException   if a record is malformed
     * @throws UncheckedIOException if the file cannot be read
     */
    public List<GroundTruthEntry> read(Path path) {
        Objects.requireNonNull(path, "Ground truth path must not be null");
        List<GroundTruthEntry> entries = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> records = mapper.readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader())
                        .readValues(reader)) {
            long lineNumber = 1;
            while (true) {
                lineNumber++;
                Map<String, String> record;
                try {
                    if (!records.hasNextValue()) {
                        break;
                    }
                    record = records.nextValue();
                } catch (CsvReadException e) {
                    throw new IngestionException(lineNumber, e.getOriginalMessage(), e);
                }
                entries.add(toEntry(record, lineNumber));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ground truth: " + path, e);
        }
        return entries;
    }

    private GroundTruthEntry toEntry(Map<String, String> record, long lineNumber) {
        String timestampText = record.get(CsvColumns.TIMESTAMP);
        String stationId = record.get(CsvColumns.STATION_ID);
        String metric = record.get(CsvColumns.METRIC);
        String value = record.get(CsvColumns.VALUE);
        if (timestampText == null || stationId == null || metric == null || value == null) {
            throw new IngestionException(lineNumber, "ground-truth record is incomplete: " + record, null);
        }
        try {
            return new GroundTruthEntry(
                    timestamps.parse(timestampText),
                    timestampText.trim(),
                    stationId.trim(),
                    Metric.fromFieldName(metric),
                    Double.parseDouble(value.trim()));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IngestionException(lineNumber, e.getMessage(), e);
        }
    }
}
