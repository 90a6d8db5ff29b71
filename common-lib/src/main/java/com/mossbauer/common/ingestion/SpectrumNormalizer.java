package com.mossbauer.common.ingestion;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Brings raw transmission values onto a unit scale.
 *
 * <ol>
 *   <li>max &gt; {@value #PERCENT_THRESHOLD} → values are percentages, divide by 100</li>
 *   <li>min &lt; {@value #BASELINE_THRESHOLD} → divide by the 95th percentile, which is
 *       dominated by the unabsorbed baseline</li>
 * </ol>
 *
 * <p>Pure function; the input array is never modified.
 */
public final class SpectrumNormalizer {

    static final double PERCENT_THRESHOLD = 10.0;
    static final double BASELINE_THRESHOLD = 0.9;
    static final double BASELINE_PERCENTILE = 95.0;

    private SpectrumNormalizer() {}

    public static double[] normalize(double[] absorption, boolean baselineCorrection) {
        double[] out = absorption.clone();
        if (out.length == 0) {
            return out;
        }
        if (Arrays.stream(out).max().getAsDouble() > PERCENT_THRESHOLD) {
            for (int i = 0; i < out.length; i++) out[i] /= 100.0;
        }
        if (baselineCorrection && Arrays.stream(out).min().getAsDouble() < BASELINE_THRESHOLD) {
            double baseline = baseline(out);
            if (baseline > 0.0) {
                for (int i = 0; i < out.length; i++) out[i] /= baseline;
            }
        }
        return out;
    }

    /** 95th percentile with linear interpolation between closest ranks. */
    static double baseline(double[] values) {
        return new Percentile()
            .withEstimationType(EstimationType.R_7)
            .evaluate(values, BASELINE_PERCENTILE);
    }
}
