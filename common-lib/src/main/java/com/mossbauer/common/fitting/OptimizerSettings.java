package com.mossbauer.common.fitting;

/**
 * Convergence limits for {@link SpectrumOptimizer}.
 *
 * @param maxIterations             Levenberg–Marquardt iteration cap
 * @param evaluationsPerVariable    evaluation cap is this × (variables + 1)
 * @param costRelativeTolerance     stop when the relative cost reduction falls below this
 * @param parameterRelativeTolerance stop when the relative parameter step falls below this
 */
public record OptimizerSettings(
    int maxIterations,
    int evaluationsPerVariable,
    double costRelativeTolerance,
    double parameterRelativeTolerance
) {
    public static final double EPSILON = 0.001;

    public OptimizerSettings {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive");
        if (evaluationsPerVariable < 1) throw new IllegalArgumentException("evaluationsPerVariable must be positive");
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(2000, 2000, 1.0e-10, 1.0e-10);
    }
}
