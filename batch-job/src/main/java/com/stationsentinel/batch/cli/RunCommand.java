package com.stationsentinel.batch.cli;

import com.stationsentinel.batch.JobConfig;
import com.stationsentinel.batch.io.GroundTruthReader;
import com.stationsentinel.batch.io.IngestionException;
import com.stationsentinel.batch.io.MovingAverageWriter;
import com.stationsentinel.batch.io.StationCsvReader;
import com.stationsentinel.batch.io.SummaryWriter;
import com.stationsentinel.core.accuracy.AccuracyReport;
import com.stationsentinel.core.accuracy.DetectionAccuracy;
import com.stationsentinel.core.concurrent.BatchProcessingException;
import com.stationsentinel.core.config.DetectionSettings;
import com.stationsentinel.core.config.SettingsLoader;
import com.stationsentinel.core.pipeline.AnomalyBatch;
import com.stationsentinel.core.pipeline.BatchResult;
import com.stationsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs the batch: read observations, detect anomalies with N workers, write
 * the summary and the regional moving averages.
 *
 * <p>
 * Options left unset fall back to {@link JobConfig#fromEnvironment()}.
 * </p>
 */
@Command(name = "run",
        description = "Detect anomalies and compute regional moving averages.",
        exitCodeList = { "0: success", "2: error" })
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = { "-i", "--input" }, description = "Observation CSV file")
    private Path input;

    @Option(names = { "-s", "--summary" }, description = "Summary JSON output file")
    private Path summary;

    @Option(names = { "-m", "--moving-averages" }, description = "Moving averages JSON Lines output file")
    private Path movingAverages;

    @Option(names = { "-w", "--workers" }, description = "Number of concurrent workers")
    private Integer workers;

    @Option(names = { "-c", "--config" }, description = "Detection settings YAML file")
    private Path config;

    @Option(names = { "-g", "--ground-truth" },
            description = "Ground-truth CSV; when given, detection accuracy is reported")
    private Path groundTruth;

    @Override
    public Integer call() {
        JobConfig jobConfig;
        DetectionSettings settings;
        try {
            jobConfig = resolveConfig();
            settings = jobConfig.getDetectionConfigPath() != null
                    ? SettingsLoader.fromFile(jobConfig.getDetectionConfigPath().toString())
                    : SettingsLoader.load();
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return ExitCodes.ERROR;
        }
        LOG.info("Starting Station Sentinel with config: {}", jobConfig);

        try {
            RecordStore store = new StationCsvReader(settings).read(jobConfig.getInputPath());
            BatchResult result = runBatch(settings, jobConfig.getWorkerCount(), store);

            new SummaryWriter().write(result.getSummary(), jobConfig.getSummaryOutput());
            new MovingAverageWriter().write(result.getMovingAverages(), jobConfig.getMovingAverageOutput());

            PrintWriter out = spec.commandLine().getOut();
            out.printf("Processed %d row(s) of %d station(s) in %.2f ms%n",
                    store.size(), result.getSummary().getStations().size(),
                    result.getSummary().getElapsedMillis());
            out.printf("Summary: %s%nMoving averages: %s%n",
                    jobConfig.getSummaryOutput(), jobConfig.getMovingAverageOutput());

            if (groundTruth != null) {
                AccuracyReport report = DetectionAccuracy.evaluate(store,
                        new GroundTruthReader(settings).read(groundTruth));
                out.printf("Accuracy: TP=%d FP=%d FN=%d%n", report.getTruePositives(),
                        report.getFalsePositives(), report.getFalseNegatives());
            }
            out.flush();
            return ExitCodes.SUCCESS;
        } catch (IngestionException e) {
            LOG.error("Rejected input {}: {}", jobConfig.getInputPath(), e.getMessage());
            return ExitCodes.ERROR;
        } catch (BatchProcessingException e) {
            LOG.error("Batch failed, no output written: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        } catch (UncheckedIOException e) {
            LOG.error("I/O failure: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Batch aborted: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        }
    }

    BatchResult runBatch(DetectionSettings settings, int workerCount, RecordStore store) {
        return new AnomalyBatch(settings, workerCount).run(store);
    }

    private JobConfig resolveConfig() {
        JobConfig.Builder builder = JobConfig.fromEnvironment().toBuilder();
        if (input != null) {
            builder.inputPath(input);
        }
        if (summary != null) {
            builder.summaryOutput(summary);
        }
        if (movingAverages != null) {
            builder.movingAverageOutput(movingAverages);
        }
        if (workers != null) {
            builder.workerCount(workers);
        }
        if (config != null) {
            builder.detectionConfigPath(config);
        }
        return builder.build();
    }
}
