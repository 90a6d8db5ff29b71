package com.mossbauer.common.peak;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Local-maximum detection over a sampled signal.
 *
 * <p>Rules (same semantics as the common scientific-Python peak finder):
 * <ol>
 *   <li>A peak is a sample strictly higher than its left neighbour and than the first
 *       differing sample to its right; flat tops resolve to their middle sample.
 *       The first and last samples are never peaks.</li>
 *   <li>Peaks lower than {@code minHeight} are discarded.</li>
 *   <li>Of two peaks closer than {@code minDistance} samples the higher one is kept.</li>
 * </ol>
 *
 * <p>No logging. No side effects.
 */
public final class PeakDetector {

    private PeakDetector() {}

    /**
     * Inverts a transmission spectrum so that absorption dips become non-negative peaks:
     * {@code depth[i] = max(absorption) − absorption[i]}.
     */
    public static double[] invert(double[] absorption) {
        double max = Arrays.stream(absorption).max().orElse(0.0);
        double[] depth = new double[absorption.length];
        for (int i = 0; i < absorption.length; i++) {
            depth[i] = max - absorption[i];
        }
        return depth;
    }

    /** Population standard deviation; 0 for an empty signal. */
    public static double std(double[] signal) {
        return signal.length == 0 ? 0.0 : new StandardDeviation(false).evaluate(signal);
    }

    /**
     * @param signal      sampled signal
     * @param minHeight   lowest accepted peak value
     * @param minDistance minimum index separation between kept peaks (values below 1 act as 1)
     * @return kept peaks ordered by index
     */
    public static List<DetectedPeak> findPeaks(double[] signal, double minHeight, int minDistance) {
        List<DetectedPeak> candidates = new ArrayList<>();
        for (int index : localMaxima(signal)) {
            if (signal[index] >= minHeight) {
                candidates.add(new DetectedPeak(index, signal[index]));
            }
        }
        return minDistance > 1 ? enforceDistance(candidates, minDistance) : candidates;
    }

    static List<Integer> localMaxima(double[] x) {
        List<Integer> maxima = new ArrayList<>();
        int last = x.length - 1;
        int i = 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    maxima.add((i + ahead - 1) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return maxima;
    }

    private static List<DetectedPeak> enforceDistance(List<DetectedPeak> peaks, int distance) {
        int n = peaks.size();
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);

        Integer[] byHeight = new Integer[n];
        for (int i = 0; i < n; i++) byHeight[i] = i;
        Arrays.sort(byHeight, Comparator.comparingDouble((Integer i) -> peaks.get(i).height()).reversed());

        for (int j : byHeight) {
            if (!keep[j]) continue;
            int centre = peaks.get(j).index();
            for (int k = j - 1; k >= 0 && centre - peaks.get(k).index() < distance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < n && peaks.get(k).index() - centre < distance; k++) {
                keep[k] = false;
            }
        }

        List<DetectedPeak> kept = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (keep[i]) kept.add(peaks.get(i));
        }
        return kept;
    }
}
