package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvReadException;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Reads station observations from a headed CSV file into a
 * {@link RecordStore}.
 *
 * <p>
 * Required columns: {@code timestamp, station_id, region, temperature,
 * humidity, pressure}, in any order; extra columns are ignored. Any malformed
 * record rejects the whole file with an {@link IngestionException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StationCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(StationCsvReader.class);

    private final CsvMapper mapper = new CsvMapper();
    private final TimestampCodec timestamps;

    public StationCsvReader(DetectionSettings settings) {
        this.timestamps = new TimestampCodec(Objects.requireNonNull(settings, "DetectionSettings must not be null"));
    }

    /**
     * @param path CSV file; must not be {@code null}
     * @return a store holding the file's rows in file order
     * @throws IngestionException   if a record is malformed
     * @throws UncheckedIOException if the file cannot be read
     */
    public RecordStore read(Path path) {
        Objects.requireNonNull(path, "Input path must not be null");
        LOG.info("Reading observations from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input file: " + path, e);
        }
    }

    /**
     * @param reader CSV source, header first; not closed by this method
     * @return a store holding the rows in source order
     * @throws IngestionException if a record is malformed
     * @throws IOException        if reading fails
     */
    public RecordStore read(Reader reader) throws IOException {
        List<Row> rows = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> records = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            // line 1 is the header
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
                rows.add(toRow(record, lineNumber));
            }
        }
        return RecordStore.of(rows);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Row toRow(Map<String, String> record, long lineNumber) {
        String timestampText = required(record, CsvColumns.TIMESTAMP, lineNumber);
        long timestampMillis;
        try {
            timestampMillis = timestamps.parse(timestampText);
        } catch (DateTimeParseException e) {
            throw new IngestionException(lineNumber, "unparseable timestamp '" + timestampText + "'", e);
        }

        Row.Builder builder = Row.builder()
                .timestamp(timestampMillis, timestampText.trim())
                .stationId(required(record, CsvColumns.STATION_ID, lineNumber).trim())
                .region(required(record, CsvColumns.REGION, lineNumber).trim());

        for (Metric metric : Metric.values()) {
            String raw = required(record, metric.getFieldName(), lineNumber);
            double value;
            try {
                value = Double.parseDouble(raw.trim());
            } catch (NumberFormatException e) {
                throw new IngestionException(lineNumber,
                        "non-numeric " + metric.getFieldName() + " '" + raw + "'", e);
            }
            if (!Double.isFinite(value)) {
                throw new IngestionException(lineNumber,
                        "non-finite " + metric.getFieldName() + " '" + raw + "'", null);
            }
            builder.value(metric, value);
        }
        return builder.build();
    }

    private static String required(Map<String, String> record, String column, long lineNumber) {
        String value = record.get(column);
        if (value == null || value.isBlank()) {
            throw new IngestionException(lineNumber, "missing value for column '" + column + "'", null);
        }
        return value;
    }
}
