package com.mossbauer.common.fitting;

import com.mossbauer.common.lineshape.LineShape;
import com.mossbauer.common.model.ParameterOverride;
import com.mossbauer.common.model.Spectrum;
import com.mossbauer.common.peak.DetectedPeak;
import com.mossbauer.common.peak.PeakDetector;
import com.mossbauer.common.peak.SiteCountEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link CompositeModel} with physically reasonable starting values.
 *
 * <h3>Initial guesses</h3>
 * <ul>
 *   <li><b>center</b> — dips found with a looser {@value #GUESS_HEIGHT_FACTOR}× threshold.
 *       The {@code 2 × sites} deepest are paired by depth (deepest two → site 1, next two
 *       → site 2, ...), lower velocity first within a pair. When the depths do not step
 *       clearly between pairs, the lines are instead nested around a common centre
 *       (outermost two → site 1) if that gives the smaller isomer-shift spread.
 *       Components left without a detected dip are spread evenly across the velocity
 *       range. Bounded to the range.</li>
 *   <li><b>amplitude</b> — {@code ptp(absorption) / (2 × sites)}, bounded ≥ 0.</li>
 *   <li><b>sigma</b>, <b>gamma</b> — {@value #INITIAL_WIDTH}, bounded to
 *       [{@value #MIN_WIDTH}, {@value #MAX_WIDTH}].</li>
 *   <li><b>fraction</b> — 0.5, bounded to [0, 1].</li>
 *   <li><b>baseline</b> — max(absorption), bounded to ±50% of that.</li>
 * </ul>
 * Caller overrides are applied last and win over every default.
 */
public final class ModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    static final double GUESS_HEIGHT_FACTOR = 0.3;
    static final double INITIAL_WIDTH = 0.15;
    static final double MIN_WIDTH = 0.05;
    static final double MAX_WIDTH = 1.0;
    static final double INITIAL_FRACTION = 0.5;
    static final double DEPTH_SEPARATION = 0.1;

    private ModelBuilder() {}

    public static CompositeModel build(Spectrum spectrum, LineShape lineShape, int siteCount,
                                       Map<String, ParameterOverride> overrides) {
        if (siteCount < 1) {
            throw new IllegalArgumentException("siteCount must be at least 1, got " + siteCount);
        }
        CompositeModel model = CompositeModel.create(lineShape, siteCount);
        int componentCount = 2 * siteCount;

        double vMin = spectrum.minVelocity();
        double vMax = spectrum.maxVelocity();
        double[] centers = initialCenters(spectrum, componentCount);
        double amplitude = (spectrum.maxAbsorption() - spectrum.minAbsorption()) / componentCount;

        for (int k = 0; k < componentCount; k++) {
            String prefix = CompositeModel.prefix(k + 1);
            model.parameter(prefix + "center").set(centers[k], vMin, vMax);
            model.parameter(prefix + "amplitude").set(amplitude, 0.0, Double.POSITIVE_INFINITY);
            model.parameter(prefix + "sigma").set(INITIAL_WIDTH, MIN_WIDTH, MAX_WIDTH);
            if (lineShape == LineShape.VOIGT) {
                model.parameter(prefix + "gamma").set(INITIAL_WIDTH, MIN_WIDTH, MAX_WIDTH);
            } else if (lineShape == LineShape.PSEUDO_VOIGT) {
                model.parameter(prefix + "fraction").set(INITIAL_FRACTION, 0.0, 1.0);
            }
        }
        double baseline = spectrum.maxAbsorption();
        model.parameter(CompositeModel.BASELINE)
            .set(baseline, Math.min(0.5 * baseline, 1.5 * baseline), Math.max(0.5 * baseline, 1.5 * baseline));

        applyOverrides(model, overrides);
        log.debug("[ModelBuilder] Model assembled. lineShape={} sites={} parameters={} variables={}",
            lineShape.wireName(), siteCount, model.parameters().size(), model.variableCount());
        return model;
    }

    /**
     * One starting center per component, ordered so that consecutive pairs describe a
     * doublet.
     */
    static double[] initialCenters(Spectrum spectrum, int componentCount) {
        double[] velocity = spectrum.velocity();
        double[] depth = PeakDetector.invert(spectrum.absorption());
        double threshold = GUESS_HEIGHT_FACTOR * PeakDetector.std(depth);
        List<DetectedPeak> peaks = new ArrayList<>(
            PeakDetector.findPeaks(depth, threshold, SiteCountEstimator.minDistance(velocity.length)));

        peaks.sort(Comparator.comparingDouble(DetectedPeak::height).reversed());
        List<DetectedPeak> strongest = peaks.subList(0, Math.min(componentCount, peaks.size()));

        double[] centers = new double[componentCount];
        boolean[] assigned = new boolean[componentCount];
        for (int pair = 0; 2 * pair < strongest.size(); pair++) {
            int first = 2 * pair;
            if (first + 1 < strongest.size()) {
                double a = velocity[strongest.get(first).index()];
                double b = velocity[strongest.get(first + 1).index()];
                centers[first] = Math.min(a, b);
                centers[first + 1] = Math.max(a, b);
                assigned[first + 1] = true;
            } else {
                centers[first] = velocity[strongest.get(first).index()];
            }
            assigned[first] = true;
        }

        if (componentCount > 2 && strongest.size() == componentCount && !depthSeparatesPairs(strongest)) {
            double[] nested = nestedPairs(strongest, velocity);
            if (shiftSpread(nested) < shiftSpread(centers)) {
                log.debug("[ModelBuilder] Dip depths do not separate the doublets, pairing nested lines. centers={}",
                    Arrays.toString(nested));
                centers = nested;
            }
        }

        double vMin = Arrays.stream(velocity).min().orElse(0.0);
        double vMax = Arrays.stream(velocity).max().orElse(0.0);
        for (int i = 0; i < componentCount; i++) {
            if (!assigned[i]) {
                centers[i] = vMin + (i + 0.5) * (vMax - vMin) / componentCount;
            }
        }
        return centers;
    }

    /**
     * True when every doublet boundary in the depth ranking is a clear step: the
     * shallower line of pair k is at least {@value #DEPTH_SEPARATION} (relative) deeper
     * than the deeper line of pair k + 1.
     */
    static boolean depthSeparatesPairs(List<DetectedPeak> byDepth) {
        for (int boundary = 2; boundary < byDepth.size(); boundary += 2) {
            double above = byDepth.get(boundary - 1).height();
            double below = byDepth.get(boundary).height();
            if (above - below < DEPTH_SEPARATION * above) {
                return false;
            }
        }
        return true;
    }

    /** Lines sorted by velocity, outermost pair first: i is paired with 2m − 1 − i. */
    static double[] nestedPairs(List<DetectedPeak> lines, double[] velocity) {
        double[] sorted = lines.stream().mapToDouble(p -> velocity[p.index()]).sorted().toArray();
        int m = sorted.length;
        double[] centers = new double[m];
        for (int pair = 0; pair < m / 2; pair++) {
            centers[2 * pair] = sorted[pair];
            centers[2 * pair + 1] = sorted[m - 1 - pair];
        }
        return centers;
    }

    /** Population variance of the pair midpoints, i.e. of the implied isomer shifts. */
    static double shiftSpread(double[] centers) {
        int pairs = centers.length / 2;
        double[] shifts = new double[pairs];
        double mean = 0.0;
        for (int k = 0; k < pairs; k++) {
            shifts[k] = 0.5 * (centers[2 * k] + centers[2 * k + 1]);
            mean += shifts[k] / pairs;
        }
        double spread = 0.0;
        for (double shift : shifts) {
            spread += (shift - mean) * (shift - mean) / pairs;
        }
        return spread;
    }

    private static void applyOverrides(CompositeModel model, Map<String, ParameterOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return;
        }
        overrides.forEach((name, override) -> {
            if (override == null) {
                return;
            }
            model.find(name).ifPresentOrElse(
                parameter -> parameter.apply(override),
                () -> log.warn("[ModelBuilder] Ignoring override for unknown parameter. name={}", name));
        });
    }
}
