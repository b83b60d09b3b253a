package com.stationsentinel.batch.cli;

import com.stationsentinel.batch.compare.SummaryComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Checks that two summaries agree, ignoring elapsed time.
 */
@Command(name = "compare",
        description = "Compare two summary files, ignoring elapsed time.",
        exitCodeList = { "0: consistent", "1: differences found", "2: error" })
public class CompareCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompareCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Reference summary JSON")
    private Path expected;

    @Parameters(index = "1", description = "Summary JSON to check")
    private Path actual;

    @Override
    public Integer call() {
        List<String> differences;
        try {
            differences = new SummaryComparator().compare(expected, actual);
        } catch (UncheckedIOException e) {
            LOG.error("Comparison failed: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (differences.isEmpty()) {
            out.println("Results are consistent.");
            out.flush();
            return ExitCodes.SUCCESS;
        }
        differences.forEach(d -> out.println("  - " + d));
        out.printf("%d difference(s) found.%n", differences.size());
        out.flush();
        return ExitCodes.MISMATCH;
    }
}
