package com.stationsentinel.core.statistics;

/**
 * Population mean and standard deviation of one metric over one partition.
 *
 * @since 1.0.0
 */
public final class MetricStatistics {

    private final double mean;
    private final double stddev;

    public MetricStatistics(double mean, double stddev) {
        this.mean = mean;
        this.stddev = stddev;
    }

    /**
     * Two-pass population statistics: the sum, then the sum of squared
     * deviations from the mean.
     *
     * @param values the sample; must not be empty
     * @return the statistics of {@code values}
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static MetricStatistics of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot describe an empty sample");
        }
        double n = values.length;
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return new MetricStatistics(mean, Math.sqrt(sumSquaredDiff / n));
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    /**
     * Apply the sigma rule. A zero standard deviation never flags anything.
     *
     * @param value       the observation
     * @param sigmaFactor number of standard deviations tolerated
     * @return {@code true} if {@code value} lies outside
     *         {@code mean ± sigmaFactor·stddev}
     */
    public boolean isOutlier(double value, double sigmaFactor) {
        if (stddev == 0) {
            return false;
        }
        return value < mean - sigmaFactor * stddev || value > mean + sigmaFactor * stddev;
    }

    @Override
    public String toString() {
        return "MetricStatistics{mean=" + mean + ", stddev=" + stddev + '}';
    }
}
