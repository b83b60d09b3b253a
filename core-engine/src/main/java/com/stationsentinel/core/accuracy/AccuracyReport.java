package com.stationsentinel.core.accuracy;

/**
 * Outcome of matching detected anomalies against the ground truth.
 *
 * @since 1.0.0
 */
public final class AccuracyReport {

    private final long truePositives;
    private final long falsePositives;
    private final long falseNegatives;

    public AccuracyReport(long truePositives, long falsePositives, long falseNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
    }

    public long getTruePositives() {
        return truePositives;
    }

    public long getFalsePositives() {
        return falsePositives;
    }

    public long getFalseNegatives() {
        return falseNegatives;
    }

    /**
     * @return TP / (TP + FP), or {@code 1.0} when nothing was detected
     */
    public double precision() {
        long detected = truePositives + falsePositives;
        return detected == 0 ? 1.0 : (double) truePositives / detected;
    }

    /**
     * @return TP / (TP + FN), or {@code 1.0} when nothing was injected
     */
    public double recall() {
        long injected = truePositives + falseNegatives;
        return injected == 0 ? 1.0 : (double) truePositives / injected;
    }

    @Override
    public String toString() {
        return "AccuracyReport{" +
                "truePositives=" + truePositives +
                ", falsePositives=" + falsePositives +
                ", falseNegatives=" + falseNegatives +
                '}';
    }
}
