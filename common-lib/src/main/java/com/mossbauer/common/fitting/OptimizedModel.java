package com.mossbauer.common.fitting;

import java.util.Map;

/**
 * Converged state of a {@link CompositeModel} together with its fit statistics and
 * curve evaluations. Lives only between optimization and extraction.
 *
 * @param initialValues starting point, full parameter layout
 * @param values        converged values, full parameter layout
 * @param stderr        standard errors, full layout; entries are null for fixed parameters
 *                      and all null when the covariance matrix was singular
 * @param bestFit       model evaluated at {@code values}
 * @param residuals     {@code data − bestFit}
 * @param components    positive component profiles keyed by prefix
 */
public record OptimizedModel(
    CompositeModel model,
    double[] initialValues,
    double[] values,
    Double[] stderr,
    double chiSquared,
    double reducedChiSquared,
    int nDataPoints,
    int nVariables,
    int iterations,
    int evaluations,
    double aic,
    double bic,
    double[] bestFit,
    double[] residuals,
    Map<String, double[]> components
) {
    public boolean uncertaintiesAvailable() {
        for (int i = 0; i < stderr.length; i++) {
            if (stderr[i] != null) return true;
        }
        return false;
    }
}
