package com.mossbauer.common.exception;

/**
 * Unsupported file type, or a table with too few rows/columns after missing values
 * were dropped.
 */
public class DataFormatException extends SpectrumAnalysisException {
    private final String reason;

    public DataFormatException(String reason) {
        super("Ingestion", reason);
        this.reason = reason;
    }

    public DataFormatException(String reason, Throwable cause) {
        super("Ingestion", reason, cause);
        this.reason = reason;
    }

    /** Human-readable reason without the stage prefix. */
    public String getReason() {
        return reason;
    }
}
