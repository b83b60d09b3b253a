/**
 * Subcommands of {@link com.stationsentinel.batch.StationSentinelCli}.
 */
package com.stationsentinel.batch.cli;
