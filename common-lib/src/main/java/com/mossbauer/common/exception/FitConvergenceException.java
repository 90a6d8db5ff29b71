package com.mossbauer.common.exception;

import com.mossbauer.common.lineshape.LineShape;

/**
 * The optimizer did not converge, or the problem was singular / under-determined.
 * Carries the configuration that was attempted so the caller can decide whether to
 * retry with a different site count or different starting values.
 */
public class FitConvergenceException extends SpectrumAnalysisException {
    private final LineShape lineShape;
    private final int siteCount;
    private final int variableCount;

    public FitConvergenceException(String message, LineShape lineShape,
                                   int siteCount, int variableCount) {
        super("Optimizer", describe(message, lineShape, siteCount, variableCount));
        this.lineShape = lineShape;
        this.siteCount = siteCount;
        this.variableCount = variableCount;
    }

    public FitConvergenceException(String message, LineShape lineShape,
                                   int siteCount, int variableCount, Throwable cause) {
        super("Optimizer", describe(message, lineShape, siteCount, variableCount), cause);
        this.lineShape = lineShape;
        this.siteCount = siteCount;
        this.variableCount = variableCount;
    }

    private static String describe(String message, LineShape lineShape, int siteCount, int variableCount) {
        return String.format("%s (lineShape=%s sites=%d variables=%d)",
            message, lineShape == null ? "?" : lineShape.wireName(), siteCount, variableCount);
    }

    public LineShape getLineShape() {
        return lineShape;
    }

    public int getSiteCount() {
        return siteCount;
    }

    public int getVariableCount() {
        return variableCount;
    }
}
