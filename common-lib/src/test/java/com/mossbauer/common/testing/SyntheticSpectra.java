package com.mossbauer.common.testing;

import com.mossbauer.common.lineshape.LineShape;
import com.mossbauer.common.model.Spectrum;

import java.util.Arrays;

/** Deterministic Lorentzian doublet spectra for tests. */
public final class SyntheticSpectra {

    public static final double WIDTH = 0.15;

    private SyntheticSpectra() {}

    public static double[] grid(double from, double to, int points) {
        double[] v = new double[points];
        for (int i = 0; i < points; i++) {
            v[i] = from + (to - from) * i / (points - 1);
        }
        return v;
    }

    /**
     * Baseline 1.0 minus one Lorentzian pair per {@code (isomerShift, splitting, depth)} triple,
     * plus a small deterministic ripple of amplitude {@code ripple}.
     */
    public static Spectrum doublets(double[] velocity, double ripple, double[]... sites) {
        double[] absorption = new double[velocity.length];
        for (int i = 0; i < velocity.length; i++) {
            double y = 1.0;
            for (double[] site : sites) {
                double area = site[2] * Math.PI * WIDTH;
                y -= LineShape.LORENTZIAN.value(velocity[i], area, site[0] - site[1] / 2.0, WIDTH, 0.0);
                y -= LineShape.LORENTZIAN.value(velocity[i], area, site[0] + site[1] / 2.0, WIDTH, 0.0);
            }
            absorption[i] = y + ripple * Math.sin(1.7 * i);
        }
        return Spectrum.of(velocity, absorption);
    }

    /** Dips at ±1.2 (depth 0.20) and ±2.5 (depth 0.10) mm/s on 200 points over [-4, 4]. */
    public static Spectrum twoSite() {
        return doublets(grid(-4.0, 4.0, 200), 0.001,
            new double[] {0.0, 2.4, 0.20},
            new double[] {0.0, 5.0, 0.10});
    }

    public static Spectrum flat(int points) {
        double[] absorption = new double[points];
        Arrays.fill(absorption, 1.0);
        return Spectrum.of(grid(-4.0, 4.0, points), absorption);
    }

    /** Two-column comma-separated text of {@code spectrum}. */
    public static String toCsv(Spectrum spectrum) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < spectrum.size(); i++) {
            sb.append(spectrum.velocityAt(i)).append(',').append(spectrum.absorptionAt(i)).append('\n');
        }
        return sb.toString();
    }
}
