package com.stationsentinel.batch.io;

import com.stationsentinel.core.config.DetectionSettings;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Converts between textual timestamps and epoch milliseconds using the
 * pattern and zone of the {@link DetectionSettings}.
 *
 * @since 1.0.0
 */
public final class TimestampCodec {

    private final DateTimeFormatter formatter;
    private final ZoneId zone;

    public TimestampCodec(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.formatter = settings.timestampFormatter();
        this.zone = settings.zoneId();
    }

    /**
     * @param text e.g. {@code 2025-07-01 00:10:00}
     * @return epoch milliseconds
     * @throws java.time.format.DateTimeParseException if {@code text} does not
     *                                                 match the pattern
     */
    public long parse(String text) {
        return LocalDateTime.parse(text.trim(), formatter).atZone(zone).toInstant().toEpochMilli();
    }

    public String format(LocalDateTime dateTime) {
        return formatter.format(dateTime);
    }

    public long toEpochMillis(LocalDateTime dateTime) {
        return dateTime.atZone(zone).toInstant().toEpochMilli();
    }

    public String format(long epochMillis) {
        return formatter.format(LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), zone));
    }
}
