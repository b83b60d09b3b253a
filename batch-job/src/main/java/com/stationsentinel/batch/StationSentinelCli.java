package com.stationsentinel.batch;

import com.stationsentinel.batch.cli.CompareCommand;
import com.stationsentinel.batch.cli.GenerateCommand;
import com.stationsentinel.batch.cli.RunCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Main entry point of the Station Sentinel batch job.
 *
 * <pre>
 *   station-sentinel generate --stations 12 --events 60 --anomalies 0.02
 *   station-sentinel run --input data/observations.csv --workers 8
 *   station-sentinel compare data/reference.json data/summary.json
 * </pre>
 *
 * @since 1.0.0
 */
@Command(name = "station-sentinel",
        mixinStandardHelpOptions = true,
        version = "station-sentinel 1.0.0",
        description = "Partition-parallel anomaly detection over weather station observations.",
        subcommands = { RunCommand.class, GenerateCommand.class, CompareCommand.class })
public final class StationSentinelCli implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new StationSentinelCli()).execute(args);
        System.exit(exitCode);
    }
}
