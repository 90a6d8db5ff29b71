package com.mossbauer.common.lineshape;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of symmetric line-shape families a peak component can take.
 *
 * <p>Every family is evaluated through the same signature:
 * {@code value(x, amplitude, center, sigma, shape)}. {@code amplitude} is the integrated
 * area of the line, {@code sigma} its primary width, and {@code shape} the family's
 * secondary parameter ({@code gamma} for Voigt, {@code fraction} for pseudo-Voigt,
 * ignored for Lorentzian).
 */
public enum LineShape {

    /** {@code A/π · σ / ((x−c)² + σ²)}; FWHM = 2σ. */
    LORENTZIAN("lorentzian", null) {
        @Override
        public double value(double x, double amplitude, double center, double sigma, double shape) {
            double dx = x - center;
            return amplitude / Math.PI * sigma / (dx * dx + sigma * sigma);
        }

        @Override
        public double fwhm(double sigma, double shape) {
            return 2.0 * sigma;
        }
    },

    /**
     * Gaussian (σ) convolved with Lorentzian (γ):
     * {@code A · Re[w(z)] / (σ√(2π))}, {@code z = (x − c + iγ) / (σ√2)}.
     */
    VOIGT("voigt", "gamma") {
        @Override
        public double value(double x, double amplitude, double center, double sigma, double shape) {
            double scale = sigma * SQRT2;
            double re = Faddeeva.real((x - center) / scale, shape / scale);
            return amplitude * re / (sigma * SQRT2PI);
        }

        /** Olivero–Longbothum approximation, accurate to about 0.02%. */
        @Override
        public double fwhm(double sigma, double shape) {
            double fl = 2.0 * shape;
            double fg = 2.0 * sigma * Math.sqrt(2.0 * LN2);
            return 0.5346 * fl + Math.sqrt(0.2166 * fl * fl + fg * fg);
        }
    },

    /**
     * Weighted sum of a Gaussian and a Lorentzian sharing the same FWHM (2σ);
     * {@code fraction} is the Lorentzian weight.
     */
    PSEUDO_VOIGT("pseudo_voigt", "fraction") {
        @Override
        public double value(double x, double amplitude, double center, double sigma, double shape) {
            double dx = x - center;
            double sigmaG = sigma / Math.sqrt(2.0 * LN2);
            double gauss = Math.exp(-dx * dx / (2.0 * sigmaG * sigmaG)) / (sigmaG * SQRT2PI);
            double lorentz = sigma / (Math.PI * (dx * dx + sigma * sigma));
            return amplitude * ((1.0 - shape) * gauss + shape * lorentz);
        }

        @Override
        public double fwhm(double sigma, double shape) {
            return 2.0 * sigma;
        }
    };

    private static final double SQRT2 = Math.sqrt(2.0);
    private static final double SQRT2PI = Math.sqrt(2.0 * Math.PI);
    private static final double LN2 = Math.log(2.0);

    private final String wireName;
    private final String shapeParameter;

    LineShape(String wireName, String shapeParameter) {
        this.wireName = wireName;
        this.shapeParameter = shapeParameter;
    }

    public abstract double value(double x, double amplitude, double center, double sigma, double shape);

    /** Full width at half maximum for the given width parameters. */
    public abstract double fwhm(double sigma, double shape);

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Name of the secondary parameter, or {@code null} when the family has none. */
    public String shapeParameter() {
        return shapeParameter;
    }

    public boolean hasShapeParameter() {
        return shapeParameter != null;
    }

    /** Parameter suffixes in evaluation order, e.g. {@code [amplitude, center, sigma, gamma]}. */
    List<String> parameterNames() {
        return hasShapeParameter()
            ? List.of("amplitude", "center", "sigma", shapeParameter)
            : List.of("amplitude", "center", "sigma");
    }

    @JsonCreator
    public static LineShape fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return LORENTZIAN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (LineShape shape : values()) {
            if (shape.wireName.equals(normalized) || shape.name().equalsIgnoreCase(normalized)) {
                return shape;
            }
        }
        throw new IllegalArgumentException("Unknown line shape: " + name
            + " (expected lorentzian, voigt or pseudo_voigt)");
    }
}
