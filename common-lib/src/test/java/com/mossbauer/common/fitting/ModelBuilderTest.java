package com.mossbauer.common.fitting;

import com.mossbauer.common.lineshape.LineShape;
import com.mossbauer.common.model.ParameterOverride;
import com.mossbauer.common.model.Spectrum;
import com.mossbauer.common.peak.DetectedPeak;
import com.mossbauer.common.testing.SyntheticSpectra;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelBuilderTest {

    // ── layout ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("parameter layout")
    class LayoutTests {

        @Test
        @DisplayName("Lorentzian: 3 parameters per component plus baseline")
        void lorentzianLayout() {
            CompositeModel model = ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 2, Map.of());
            assertEquals(4, model.components().size());
            assertEquals(13, model.parameters().size());
            assertEquals("peak1_amplitude", model.parameters().get(0).name());
            assertEquals(CompositeModel.BASELINE, model.parameters().get(model.baselineIndex()).name());
        }

        @Test
        @DisplayName("Voigt adds gamma, pseudo-Voigt adds fraction")
        void shapeParameters() {
            Spectrum spectrum = SyntheticSpectra.twoSite();
            CompositeModel voigt = ModelBuilder.build(spectrum, LineShape.VOIGT, 1, Map.of());
            CompositeModel pseudo = ModelBuilder.build(spectrum, LineShape.PSEUDO_VOIGT, 1, Map.of());

            assertEquals(0.15, voigt.parameter("peak2_gamma").value(), 1e-12);
            assertEquals(0.5, pseudo.parameter("peak1_fraction").value(), 1e-12);
            assertEquals(1.0, pseudo.parameter("peak1_fraction").max(), 1e-12);
            assertTrue(voigt.find("peak1_fraction").isEmpty());
        }

        @Test
        @DisplayName("siteCount below 1 is rejected")
        void invalidSiteCount() {
            assertThrows(IllegalArgumentException.class,
                () -> ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 0, Map.of()));
        }
    }

    // ── initial guesses ───────────────────────────────────────────────────

    @Nested
    @DisplayName("initial guesses")
    class GuessTests {

        @Test
        @DisplayName("deepest dips are paired into the first doublet, lower velocity first")
        void pairedByDepth() {
            double[] centers = ModelBuilder.initialCenters(SyntheticSpectra.twoSite(), 4);
            assertEquals(-1.2, centers[0], 0.05);
            assertEquals(1.2, centers[1], 0.05);
            assertEquals(-2.5, centers[2], 0.05);
            assertEquals(2.5, centers[3], 0.05);
        }

        @Test
        @DisplayName("equal-depth doublets are nested around a common centre")
        void equalDepthsNest() {
            Spectrum equal = SyntheticSpectra.doublets(SyntheticSpectra.grid(-4, 4, 200), 0.001,
                new double[] {0.0, 2.4, 0.15},
                new double[] {0.0, 5.0, 0.15});
            double[] centers = ModelBuilder.initialCenters(equal, 4);
            assertEquals(0.0, 0.5 * (centers[0] + centers[1]), 0.05);
            assertEquals(0.0, 0.5 * (centers[2] + centers[3]), 0.05);
            double[] splittings = {centers[1] - centers[0], centers[3] - centers[2]};
            Arrays.sort(splittings);
            assertEquals(2.4, splittings[0], 0.1);
            assertEquals(5.0, splittings[1], 0.1);
        }

        @Test
        @DisplayName("depth ranking separates pairs only with a clear step between them")
        void depthSeparation() {
            List<DetectedPeak> stepped = List.of(new DetectedPeak(1, 0.20), new DetectedPeak(2, 0.19),
                new DetectedPeak(3, 0.10), new DetectedPeak(4, 0.09));
            List<DetectedPeak> flat = List.of(new DetectedPeak(1, 0.150), new DetectedPeak(2, 0.149),
                new DetectedPeak(3, 0.148), new DetectedPeak(4, 0.147));
            assertTrue(ModelBuilder.depthSeparatesPairs(stepped));
            assertFalse(ModelBuilder.depthSeparatesPairs(flat));
        }

        @Test
        @DisplayName("side-by-side doublets with distinct depths keep the depth pairing")
        void depthPairingWins() {
            // nesting these four lines would give both sites IS = 0
            Spectrum mixed = SyntheticSpectra.doublets(SyntheticSpectra.grid(-4, 4, 200), 0.0,
                new double[] {-1.5, 1.0, 0.20},
                new double[] {1.5, 1.0, 0.10});
            double[] centers = ModelBuilder.initialCenters(mixed, 4);
            assertEquals(-2.0, centers[0], 0.05);
            assertEquals(-1.0, centers[1], 0.05);
            assertEquals(1.0, centers[2], 0.05);
            assertEquals(2.0, centers[3], 0.05);
        }

        @Test
        @DisplayName("lines closer than the minimum separation seed a single center")
        void closeLinesMerge() {
            // QS 0.2 mm/s is about 5 samples on this grid, below the 10-sample separation
            Spectrum close = SyntheticSpectra.doublets(SyntheticSpectra.grid(-4, 4, 200), 0.0,
                new double[] {0.0, 0.2, 0.20});
            double[] centers = ModelBuilder.initialCenters(close, 2);
            assertEquals(0.0, centers[0], 0.15);
            assertEquals(-4.0 + 1.5 * 8.0 / 2, centers[1], 1e-9);
        }

        @Test
        @DisplayName("no detected dips → centers spread evenly across the range")
        void evenSpreadFallback() {
            double[] centers = ModelBuilder.initialCenters(SyntheticSpectra.flat(50), 4);
            assertArrayEquals(new double[] {-3.0, -1.0, 1.0, 3.0}, centers, 1e-12);
        }

        @Test
        @DisplayName("more components than dips → the remainder is spread, not stacked")
        void partialFallback() {
            Spectrum clean = SyntheticSpectra.doublets(SyntheticSpectra.grid(-4, 4, 200), 0.0,
                new double[] {0.0, 2.4, 0.20},
                new double[] {0.0, 5.0, 0.10});
            double[] centers = ModelBuilder.initialCenters(clean, 6);
            assertEquals(-1.2, centers[0], 0.05);
            assertEquals(2.5, centers[3], 0.05);
            assertEquals(-4.0 + 4.5 * 8.0 / 6, centers[4], 1e-9);
            assertEquals(-4.0 + 5.5 * 8.0 / 6, centers[5], 1e-9);
        }

        @Test
        @DisplayName("amplitude, width and baseline defaults with bounds")
        void defaultsAndBounds() {
            Spectrum spectrum = SyntheticSpectra.twoSite();
            CompositeModel model = ModelBuilder.build(spectrum, LineShape.LORENTZIAN, 2, Map.of());

            ModelParameter amplitude = model.parameter("peak3_amplitude");
            assertEquals((spectrum.maxAbsorption() - spectrum.minAbsorption()) / 4, amplitude.value(), 1e-12);
            assertEquals(0.0, amplitude.min(), 0.0);
            assertFalse(amplitude.hasMax());

            ModelParameter sigma = model.parameter("peak1_sigma");
            assertEquals(0.15, sigma.value(), 0.0);
            assertEquals(0.05, sigma.min(), 0.0);
            assertEquals(1.0, sigma.max(), 0.0);

            ModelParameter center = model.parameter("peak4_center");
            assertEquals(-4.0, center.min(), 1e-12);
            assertEquals(4.0, center.max(), 1e-12);

            ModelParameter baseline = model.parameter(CompositeModel.BASELINE);
            assertEquals(spectrum.maxAbsorption(), baseline.value(), 0.0);
            assertEquals(0.5 * spectrum.maxAbsorption(), baseline.min(), 1e-12);
            assertEquals(1.5 * spectrum.maxAbsorption(), baseline.max(), 1e-12);
        }
    }

    // ── overrides ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("overrides")
    class OverrideTests {

        @Test
        @DisplayName("override wins over the default, vary=false fixes the parameter")
        void fixedOverride() {
            CompositeModel model = ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 2,
                Map.of("peak1_sigma", ParameterOverride.fixed(0.2)));
            ModelParameter sigma = model.parameter("peak1_sigma");
            assertEquals(0.2, sigma.value(), 0.0);
            assertFalse(sigma.vary());
            assertEquals(12, model.variableCount());
        }

        @Test
        @DisplayName("bounds-only override keeps the default value")
        void boundsOverride() {
            CompositeModel model = ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 1,
                Map.of("peak2_center", ParameterOverride.bounds(0.0, 2.0)));
            ModelParameter center = model.parameter("peak2_center");
            assertEquals(0.0, center.min(), 0.0);
            assertEquals(2.0, center.max(), 0.0);
            assertEquals(1.2, center.value(), 0.05);
        }

        @Test
        @DisplayName("inverted bounds are rejected")
        void invertedBounds() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 1,
                    Map.of("peak1_sigma", ParameterOverride.bounds(0.5, 0.1))));
            assertTrue(ex.getMessage().contains("peak1_sigma"), ex.getMessage());
        }

        @Test
        @DisplayName("a max below the default min is rejected too")
        void maxBelowDefaultMin() {
            assertThrows(IllegalArgumentException.class,
                () -> ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 1,
                    Map.of("peak1_sigma", new ParameterOverride(null, null, 0.01, null))));
        }

        @Test
        @DisplayName("unknown parameter names are ignored")
        void unknownIgnored() {
            CompositeModel model = ModelBuilder.build(SyntheticSpectra.twoSite(), LineShape.LORENTZIAN, 1,
                Map.of("peak9_center", ParameterOverride.value(1.0)));
            assertEquals(7, model.parameters().size());
            assertEquals(7, model.variableCount());
        }
    }
}
