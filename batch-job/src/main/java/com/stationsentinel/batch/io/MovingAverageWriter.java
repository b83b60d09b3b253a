package com.stationsentinel.batch.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.stationsentinel.core.model.MovingAverageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes moving-average records as JSON Lines, one object per line, in the
 * order given.
 *
 * @since 1.0.0
 */
public final class MovingAverageWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageWriter.class);

    private final ObjectWriter writer = new ObjectMapper().writerFor(MovingAverageRecord.class);

    /**
     * @param records the records to write
     * @param path    target file; parent directories are created
     * @throws UncheckedIOException if writing fails
     */
    public void write(List<MovingAverageRecord> records, Path path) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            SummaryWriter.createParentDirectories(path);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(records, out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write moving averages to " + path, e);
        }
        LOG.info("{} moving-average record(s) written to {}", records.size(), path);
    }

    /**
     * @param records the records to write
     * @param out     destination; not closed by this method
     * @throws IOException if writing fails
     */
    public void write(List<MovingAverageRecord> records, Writer out) throws IOException {
        for (MovingAverageRecord record : records) {
            out.write(writer.writeValueAsString(record));
            out.write('\n');
        }
        out.flush();
    }
}
