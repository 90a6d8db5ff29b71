package com.mossbauer.common.fitting;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text fit report in the conventional sectioned layout:
 * model, fit statistics, then one line per parameter with its uncertainty.
 */
public final class FitReportFormatter {

    private FitReportFormatter() {}

    public static String format(OptimizedModel fit) {
        CompositeModel model = fit.model();
        StringBuilder sb = new StringBuilder();
        sb.append("[[Model]]\n");
        sb.append("    ").append(model.describe()).append('\n');

        sb.append("[[Fit Statistics]]\n");
        line(sb, "# fitting method", "leastsq (Levenberg-Marquardt)");
        line(sb, "# function evals", Integer.toString(fit.evaluations()));
        line(sb, "# iterations", Integer.toString(fit.iterations()));
        line(sb, "# data points", Integer.toString(fit.nDataPoints()));
        line(sb, "# variables", Integer.toString(fit.nVariables()));
        line(sb, "chi-square", number(fit.chiSquared()));
        line(sb, "reduced chi-square", number(fit.reducedChiSquared()));
        line(sb, "Akaike info crit", number(fit.aic()));
        line(sb, "Bayesian info crit", number(fit.bic()));
        if (!fit.uncertaintiesAvailable()) {
            sb.append("##  Warning: uncertainties could not be estimated\n");
        }

        sb.append("[[Variables]]\n");
        List<ModelParameter> parameters = model.parameters();
        double[] values = fit.values();
        for (int i = 0; i < parameters.size(); i++) {
            ModelParameter p = parameters.get(i);
            sb.append("    ").append(p.name()).append(": ").append(number(values[i]));
            if (!p.vary()) {
                sb.append(" (fixed)");
            } else {
                Double err = fit.stderr()[i];
                if (err != null) {
                    sb.append(" +/- ").append(number(err));
                    if (values[i] != 0.0) {
                        sb.append(String.format(Locale.ROOT, " (%.2f%%)", Math.abs(err / values[i]) * 100.0));
                    }
                }
                sb.append(" (init = ").append(number(fit.initialValues()[i])).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "    %-19s= %s%n", label, value));
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.7g", value);
    }
}
