package com.mossbauer.common.exception;

/**
 * Root of the analysis pipeline's failures. Each subclass is surfaced to the caller
 * as-is; nothing in the pipeline retries on its behalf.
 */
public class SpectrumAnalysisException extends RuntimeException {
    private final String stage;

    public SpectrumAnalysisException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public SpectrumAnalysisException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
