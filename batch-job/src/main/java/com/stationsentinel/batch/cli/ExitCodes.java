package com.stationsentinel.batch.cli;

/**
 * Process exit codes shared by the subcommands.
 */
final class ExitCodes {

    static final int SUCCESS = 0;

    /** The command ran but found differences or problems in the data. */
    static final int MISMATCH = 1;

    static final int ERROR = 2;

    private ExitCodes() {
        // constants only
    }
}
