package com.stationsentinel.batch.generator;

import com.stationsentinel.batch.io.TimestampCodec;
import com.stationsentinel.core.accuracy.GroundTruthEntry;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.model.Metric;
import com.stationsentinel.core.model.Row;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates synthetic weather observations with injected anomalies.
 *
 * <h3>Shape</h3>
 * <p>
 * Each station emits one row per minute from the start time. With
 * {@code t} running evenly over {@code [0, 2π]} and {@code i} the station
 * number (0-based):
 * </p>
 * <ul>
 * <li>temperature = 25 + 8·sin(t) + 0.5·i + N(0, 0.5)</li>
 * <li>humidity = clip(60 − 20·sin(t) + N(0, 2), 0, 100)</li>
 * <li>pressure = 1012 + 5·sin(t/2) + N(0, 1)</li>
 * </ul>
 * <p>
 * Stations are named {@code STA-001, STA-002, ...} and assigned to regions
 * round-robin.
 * </p>
 *
 * <h3>Anomalies</h3>
 * <p>
 * {@code floor(total × anomalyFraction)} distinct rows each get one random
 * metric replaced by {@code mean ± 5·stddev} of that metric over the whole
 * dataset (sample standard deviation). Every replacement is recorded as a
 * {@link GroundTruthEntry}.
 * </p>
 *
 * <p>
 * Output depends only on the parameters and the seed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SyntheticDatasetGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticDatasetGenerator.class);

    static final List<String> REGIONS = List.of("Sudeste", "Nordeste", "Sul", "Norte", "Centro-Oeste");

    /** Distance of an injected anomaly from the dataset mean, in standard deviations. */
    static final double ANOMALY_SIGMAS = 5.0;

    private final int stations;
    private final int eventsPerStation;
    private final double anomalyFraction;
    private final LocalDateTime start;
    private final long seed;
    private final TimestampCodec timestamps;

    /**
     * @param stations         number of stations; must be {@code >= 1}
     * @param eventsPerStation rows per station; must be {@code >= 1}
     * @param anomalyFraction  share of rows to corrupt, in {@code [0, 1]}
     * @param start            timestamp of every station's first row
     * @param seed             random seed
     * @param settings         supplies timestamp pattern and zone
     */
    public SyntheticDatasetGenerator(int stations,
            int eventsPerStation,
            double anomalyFraction,
            LocalDateTime start,
            long seed,
            DetectionSettings settings) {
        if (stations < 1) {
            throw new IllegalArgumentException("stations must be >= 1, got: " + stations);
        }
        if (eventsPerStation < 1) {
            throw new IllegalArgumentException("eventsPerStation must be >= 1, got: " + eventsPerStation);
        }
        if (!(anomalyFraction >= 0.0 && anomalyFraction <= 1.0)) {
            throw new IllegalArgumentException("anomalyFraction must be in [0, 1], got: " + anomalyFraction);
        }
        this.stations = stations;
        this.eventsPerStation = eventsPerStation;
        this.anomalyFraction = anomalyFraction;
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.seed = seed;
        this.timestamps = new TimestampCodec(Objects.requireNonNull(settings, "DetectionSettings must not be null"));
    }

    /**
     * @return the rows, station by station in time order, and the injected
     *         anomalies
     */
    public GeneratedDataset generate() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        NormalizedGaussianSampler normal = ZigguratSampler.NormalizedGaussian.of(rng);
        ContinuousSampler temperatureNoise = GaussianSampler.of(normal, 0, 0.5);
        ContinuousSampler humidityNoise = GaussianSampler.of(normal, 0, 2.0);
        ContinuousSampler pressureNoise = GaussianSampler.of(normal, 0, 1.0);

        int total = Math.multiplyExact(stations, eventsPerStation);
        LOG.info("Generating {} row(s): {} station(s) x {} event(s)", total, stations, eventsPerStation);

        String[] stationIds = new String[total];
        String[] regions = new String[total];
        long[] millis = new long[total];
        String[] texts = new String[total];
        double[][] values = new double[Metric.COUNT][total];

        for (int i = 0; i < stations; i++) {
            String stationId = String.format("STA-%03d", i + 1);
            String region = REGIONS.get(i % REGIONS.size());
            double regionOffset = i * 0.5;
            for (int j = 0; j < eventsPerStation; j++) {
                int row = i * eventsPerStation + j;
                LocalDateTime time = start.plusMinutes(j);
                double t = eventsPerStation == 1 ? 0.0 : 2 * Math.PI * j / (eventsPerStation - 1);

                stationIds[row] = stationId;
                regions[row] = region;
                millis[row] = timestamps.toEpochMillis(time);
                texts[row] = timestamps.format(time);
                values[Metric.TEMPERATURE.ordinal()][row] =
                        25 + 8 * Math.sin(t) + regionOffset + temperatureNoise.sample();
                values[Metric.HUMIDITY.ordinal()][row] =
                        clip(60 - 20 * Math.sin(t) + humidityNoise.sample(), 0, 100);
                values[Metric.PRESSURE.ordinal()][row] =
                        1012 + 5 * Math.sin(t / 2) + pressureNoise.sample();
            }
        }

        List<GroundTruthEntry> groundTruth = injectAnomalies(rng, values, stationIds, millis, texts);

        List<Row> rows = new ArrayList<>(total);
        for (int row = 0; row < total; row++) {
            Row.Builder builder = Row.builder()
                    .timestamp(millis[row], texts[row])
                    .stationId(stationIds[row])
                    .region(regions[row]);
            for (Metric metric : Metric.values()) {
                builder.value(metric, values[metric.ordinal()][row]);
            }
            rows.add(builder.build());
        }

        LOG.info("Generated {} row(s) with {} injected anomal(ies)", rows.size(), groundTruth.size());
        return new GeneratedDataset(rows, groundTruth);
    }

    // ---------------------------------------------------------------
    // Anomaly injection
    // ---------------------------------------------------------------

    private List<GroundTruthEntry> injectAnomalies(UniformRandomProvider rng,
            double[][] values,
            String[] stationIds,
            long[] millis,
            String[] texts) {
        int total = stationIds.length;
        int count = (int) Math.floor(total * anomalyFraction);
        if (count == 0) {
            return List.of();
        }

        int[] chosen = sampleDistinct(rng, total, count);
        Metric[] targets = new Metric[count];
        for (int k = 0; k < count; k++) {
            targets[k] = Metric.values()[rng.nextInt(Metric.COUNT)];
        }

        List<GroundTruthEntry> groundTruth = new ArrayList<>(count);
        for (Metric metric : Metric.values()) {
            double[] column = values[metric.ordinal()];
            double mean = mean(column);
            double stddev = sampleStddev(column, mean);
            for (int k = 0; k < count; k++) {
                if (targets[k] != metric) {
                    continue;
                }
                int row = chosen[k];
                double sign = rng.nextBoolean() ? 1.0 : -1.0;
                double anomalous = mean + sign * ANOMALY_SIGMAS * stddev;
                column[row] = anomalous;
                groundTruth.add(new GroundTruthEntry(millis[row], texts[row], stationIds[row], metric, anomalous));
            }
        }
        return groundTruth;
    }

    /** Partial Fisher-Yates shuffle: {@code count} distinct indices out of {@code [0, total)}. */
    private static int[] sampleDistinct(UniformRandomProvider rng, int total, int count) {
        int[] indices = new int[total];
        for (int i = 0; i < total; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < count; i++) {
            int j = i + rng.nextInt(total - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] chosen = new int[count];
        System.arraycopy(indices, 0, chosen, 0, count);
        return chosen;
    }

    private static double mean(double[] column) {
        double sum = 0;
        for (double v : column) {
            sum += v;
        }
        return sum / column.length;
    }

    private static double sampleStddev(double[] column, double mean) {
        if (column.length < 2) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : column) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (column.length - 1));
    }

    private static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
