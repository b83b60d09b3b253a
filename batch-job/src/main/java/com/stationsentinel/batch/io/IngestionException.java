package com.stationsentinel.batch.io;

/**
 * An input row could not be turned into a
 * {@link com.stationsentinel.core.model.Row}.
 *
 * @since 1.0.0
 */
public class IngestionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long lineNumber;

    /**
     * @param lineNumber 1-based line of the offending record in the file
     * @param message    what is wrong with it
     * @param cause      underlying parse failure, may be {@code null}
     */
    public IngestionException(long lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
