package com.stationsentinel.core.concurrent;

import java.util.Optional;

/**
 * Fatal failure of a batch run. No partial output is produced once this is
 * thrown.
 *
 * @since 1.0.0
 */
public class BatchProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String stationId;

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.stationId = null;
    }

    /**
     * @param stationId the station whose processing failed
     * @param cause     the underlying failure
     */
    public BatchProcessingException(String stationId, RuntimeException cause) {
        super("Processing of station '" + stationId + "' failed: " + cause.getMessage(), cause);
        this.stationId = stationId;
    }

    /**
     * @return the failed station, if the failure is tied to one
     */
    public Optional<String> getStationId() {
        return Optional.ofNullable(stationId);
    }
}
