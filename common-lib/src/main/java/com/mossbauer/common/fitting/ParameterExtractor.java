package com.mossbauer.common.fitting;

import com.mossbauer.common.classifier.SiteClassifier;
import com.mossbauer.common.model.Site;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Maps converged peak parameters onto Mössbauer site parameters.
 *
 * <p>For the doublet of components {@code (2k, 2k+1)}:
 * <pre>
 *   isomer shift          δ  = (c₁ + c₂) / 2
 *   quadrupole splitting  ΔE = |c₂ − c₁|
 *   line width            Γ  = (FWHM₁ + FWHM₂) / 2
 *   relative area            = (A₁ + A₂) / ΣA · 100
 * </pre>
 * {@code A} is the trapezoidal integral of a component's profile over the velocity
 * grid. When ΣA ≤ 0 every site gets a relative area of 0.
 */
public final class ParameterExtractor {

    private ParameterExtractor() {}

    public static List<Site> extract(OptimizedModel fit, double[] velocity) {
        CompositeModel model = fit.model();
        double[] values = fit.values();
        List<PeakComponent> components = model.components();

        double[] areas = new double[components.size()];
        double total = 0.0;
        for (int k = 0; k < components.size(); k++) {
            double[] profile = fit.components().get(components.get(k).prefix());
            areas[k] = integrate(velocity, profile);
            total += areas[k];
        }

        List<Site> sites = new ArrayList<>(model.siteCount());
        for (int s = 0; s < model.siteCount(); s++) {
            PeakComponent first = components.get(2 * s);
            PeakComponent second = components.get(2 * s + 1);

            double c1 = first.center(values);
            double c2 = second.center(values);
            double isomerShift = (c1 + c2) / 2.0;
            double quadrupoleSplitting = Math.abs(c2 - c1);
            double lineWidth = (first.fwhm(values) + second.fwhm(values)) / 2.0;
            double relativeArea = total > 0.0 ? (areas[2 * s] + areas[2 * s + 1]) / total * 100.0 : 0.0;

            sites.add(Site.doublet(isomerShift, quadrupoleSplitting, lineWidth, relativeArea,
                SiteClassifier.classify(isomerShift, quadrupoleSplitting)));
        }
        return sites;
    }

    /**
     * Trapezoidal rule over a possibly non-uniform grid. Samples are taken in order of
     * increasing {@code x}, so descending velocity scales integrate to the same value.
     */
    static double integrate(double[] x, double[] y) {
        int[] order = IntStream.range(0, x.length)
            .boxed()
            .sorted(Comparator.comparingDouble(i -> x[i]))
            .mapToInt(Integer::intValue)
            .toArray();
        double sum = 0.0;
        for (int j = 1; j < order.length; j++) {
            int a = order[j - 1];
            int b = order[j];
            sum += (x[b] - x[a]) * (y[a] + y[b]) / 2.0;
        }
        return sum;
    }
}
