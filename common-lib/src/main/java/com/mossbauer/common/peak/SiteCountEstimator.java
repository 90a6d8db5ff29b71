package com.mossbauer.common.peak;

import java.util.List;

/**
 * Guesses how many doublet sites a spectrum contains.
 *
 * <p>Dips are detected on the inverted signal with a height threshold of
 * {@value #HEIGHT_FACTOR}× its standard deviation and a separation of one twentieth of
 * the sample count. Each site contributes two lines, so the estimate is
 * {@code max(1, peaks / 2)} clamped to [{@value #MIN_SITES}, {@value #MAX_SITES}].
 */
public final class SiteCountEstimator {

    public static final int MIN_SITES = 1;
    public static final int MAX_SITES = 4;

    static final double HEIGHT_FACTOR = 0.5;
    static final int DISTANCE_DIVISOR = 20;

    private SiteCountEstimator() {}

    /** Never fails; a flat or empty signal yields {@value #MIN_SITES}. */
    public static int estimate(double[] absorption) {
        if (absorption == null || absorption.length < 3) {
            return MIN_SITES;
        }
        double[] depth = PeakDetector.invert(absorption);
        double threshold = HEIGHT_FACTOR * PeakDetector.std(depth);
        List<DetectedPeak> peaks = PeakDetector.findPeaks(depth, threshold, minDistance(absorption.length));
        int sites = Math.max(MIN_SITES, peaks.size() / 2);
        return Math.min(sites, MAX_SITES);
    }

    /** Minimum separation in samples between two distinct lines. */
    public static int minDistance(int sampleCount) {
        return Math.max(1, sampleCount / DISTANCE_DIVISOR);
    }
}
