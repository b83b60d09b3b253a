package com.stationsentinel.batch.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stationsentinel.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link RunSummary} as an indented JSON document.
 *
 * @since 1.0.0
 */
public final class SummaryWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryWriter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param summary the summary to write
     * @param path    target file; parent directories are created
     * @throws UncheckedIOException if writing fails
     */
    public void write(RunSummary summary, Path path) {
        Objects.requireNonNull(summary, "RunSummary must not be null");
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            createParentDirectories(path);
            mapper.writeValue(path.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write summary to " + path, e);
        }
        LOG.info("Summary of {} station(s) written to {}", summary.getStations().size(), path);
    }

    /**
     * @param summary the summary to render
     * @return the JSON document written by {@link #write(RunSummary, Path)}
     */
    public String toJson(RunSummary summary) {
        try {
            return mapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize summary", e);
        }
    }

    static void createParentDirectories(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
