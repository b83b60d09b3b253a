package com.stationsentinel.batch.cli;

import com.stationsentinel.batch.generator.GeneratedDataset;
import com.stationsentinel.batch.generator.SyntheticDatasetGenerator;
import com.stationsentinel.batch.io.DatasetCsvWriter;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.config.SettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

/**
 * Writes a synthetic observation CSV and its ground-truth anomaly CSV.
 */
@Command(name = "generate",
        description = "Generate synthetic station observations with injected anomalies.",
        exitCodeList = { "0: success", "2: error" })
public class GenerateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = { "-n", "--stations" }, description = "Number of stations", defaultValue = "12")
    private int stations;

    @Option(names = { "-e", "--events" }, description = "Events per station", defaultValue = "60")
    private int eventsPerStation;

    @Option(names = { "-a", "--anomalies" },
            description = "Fraction of rows with an injected anomaly, e.g. 0.02",
            defaultValue = "0.02")
    private double anomalyFraction;

    @Option(names = { "--start" }, description = "Start date (YYYY-MM-DD)", defaultValue = "2025-07-01")
    private LocalDate startDate;

    @Option(names = { "--seed" }, description = "Random seed", defaultValue = "42")
    private long seed;

    @Option(names = { "-o", "--output" }, description = "Observation CSV file",
            defaultValue = "data/observations.csv")
    private Path output;

    @Option(names = { "-g", "--ground-truth" }, description = "Ground-truth CSV file",
            defaultValue = "data/ground_truth.csv")
    private Path groundTruth;

    @Option(names = { "-c", "--config" }, description = "Detection settings YAML file")
    private Path config;

    @Override
    public Integer call() {
        try {
            DetectionSettings settings = config != null
                    ? SettingsLoader.fromFile(config.toString())
                    : SettingsLoader.load();
            GeneratedDataset dataset = new SyntheticDatasetGenerator(stations, eventsPerStation,
                    anomalyFraction, startDate.atStartOfDay(), seed, settings).generate();

            DatasetCsvWriter writer = new DatasetCsvWriter();
            writer.writeObservations(dataset.getRows(), output);
            writer.writeGroundTruth(dataset.getGroundTruth(), groundTruth);

            spec.commandLine().getOut().printf("%d row(s) written to %s, %d anomal(ies) to %s%n",
                    dataset.getRows().size(), output, dataset.getGroundTruth().size(), groundTruth);
            spec.commandLine().getOut().flush();
            return ExitCodes.SUCCESS;
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.error("Generation failed: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        }
    }
}
