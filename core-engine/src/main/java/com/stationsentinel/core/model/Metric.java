package com.stationsentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The three quantities measured by every station.
 *
 * <p>
 * The {@linkplain #getFieldName() field name} is the stable identifier used
 * in input columns, summary keys and moving-average records.
 * </p>
 *
 * @since 1.0.0
 */
public enum Metric {

    TEMPERATURE("temperature"),
    HUMIDITY("humidity"),
    PRESSURE("pressure");

    /** Number of metrics carried by each {@link Row}. */
    public static final int COUNT = values().length;

    private final String fieldName;

    Metric(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * Resolve a metric from its field name, ignoring case.
     *
     * @param fieldName the field name, e.g. {@code "humidity"}
     * @return the matching metric
     * @throws NullPointerException     if {@code fieldName} is {@code null}
     * @throws IllegalArgumentException if no metric has that name
     */
    public static Metric fromFieldName(String fieldName) {
        Objects.requireNonNull(fieldName, "Metric field name must not be null");
        String normalized = fieldName.trim().toLowerCase(Locale.ROOT);
        for (Metric metric : values()) {
            if (metric.fieldName.equals(normalized)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + fieldName
                + "'. Supported: temperature, humidity, pressure");
    }
}
