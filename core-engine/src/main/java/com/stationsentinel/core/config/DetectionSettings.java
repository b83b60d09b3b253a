package com.stationsentinel.core.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of the detection algorithm.
 *
 * <p>
 * Expected YAML structure (all keys optional, defaults shown):
 * </p>
 *
 * <pre>
 * sigmaFactor: 3.0
 * bucketWidthMinutes: 10
 * movingAverageWindow: 10
 * timestampPattern: "yyyy-MM-dd HH:mm:ss"
 * timeZone: UTC
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Other implementations of this
 * algorithm must use the same values for their results to be comparable.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    /** Values farther than this many standard deviations from the mean are anomalous. */
    private double sigmaFactor = 3.0;

    /** Width of the co-occurrence buckets. */
    private int bucketWidthMinutes = 10;

    /** Capacity of the regional moving-average window. */
    private int movingAverageWindow = 10;

    private String timestampPattern = "yyyy-MM-dd HH:mm:ss";

    /** Zone used to turn input timestamps into epoch milliseconds. */
    private String timeZone = "UTC";

    /**
     * @return a validated instance with default values
     */
    public static DetectionSettings defaults() {
        DetectionSettings settings = new DetectionSettings();
        settings.validate();
        return settings;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify every parameter, collecting all problems.
     *
     * @throws IllegalStateException if one or more parameters are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(sigmaFactor > 0) || Double.isInfinite(sigmaFactor)) {
            errors.add("'sigmaFactor' must be a finite value > 0, got: " + sigmaFactor);
        }
        if (bucketWidthMinutes < 1) {
            errors.add("'bucketWidthMinutes' must be >= 1, got: " + bucketWidthMinutes);
        }
        if (movingAverageWindow < 1) {
            errors.add("'movingAverageWindow' must be >= 1, got: " + movingAverageWindow);
        }
        if (timestampPattern == null || timestampPattern.isBlank()) {
            errors.add("'timestampPattern' is required");
        } else {
            try {
                DateTimeFormatter.ofPattern(timestampPattern);
            } catch (IllegalArgumentException e) {
                errors.add("'timestampPattern' is invalid: " + e.getMessage());
            }
        }
        if (timeZone == null || timeZone.isBlank()) {
            errors.add("'timeZone' is required");
        } else {
            try {
                ZoneId.of(timeZone);
            } catch (DateTimeException e) {
                errors.add("'timeZone' is invalid: " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public long bucketWidthMillis() {
        return bucketWidthMinutes * 60_000L;
    }

    public DateTimeFormatter timestampFormatter() {
        return DateTimeFormatter.ofPattern(timestampPattern);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public double getSigmaFactor() {
        return sigmaFactor;
    }

    public void setSigmaFactor(double sigmaFactor) {
        this.sigmaFactor = sigmaFactor;
    }

    public int getBucketWidthMinutes() {
        return bucketWidthMinutes;
    }

    public void setBucketWidthMinutes(int bucketWidthMinutes) {
        this.bucketWidthMinutes = bucketWidthMinutes;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public void setMovingAverageWindow(int movingAverageWindow) {
        this.movingAverageWindow = movingAverageWindow;
    }

    public String getTimestampPattern() {
        return timestampPattern;
    }

    public void setTimestampPattern(String timestampPattern) {
        this.timestampPattern = timestampPattern;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "sigmaFactor=" + sigmaFactor +
                ", bucketWidthMinutes=" + bucketWidthMinutes +
                ", movingAverageWindow=" + movingAverageWindow +
                ", timestampPattern='" + timestampPattern + '\'' +
                ", timeZone='" + timeZone + '\'' +
                '}';
    }
}
