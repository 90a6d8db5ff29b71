package com.mossbauer.common.interpretation;

/**
 * Qualitative label for a fit, derived from reduced χ².
 * <pre>
 *   redchi &lt; 1.5 → excellent
 *   redchi &lt; 3.0 → good
 *   otherwise    → moderate
 * </pre>
 */
public enum FitQuality {
    EXCELLENT("excellent"),
    GOOD("good"),
    MODERATE("moderate");

    private static final double EXCELLENT_BELOW = 1.5;
    private static final double GOOD_BELOW = 3.0;

    private final String label;

    FitQuality(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FitQuality of(double reducedChiSquared) {
        if (reducedChiSquared < EXCELLENT_BELOW) return EXCELLENT;
        if (reducedChiSquared < GOOD_BELOW) return GOOD;
        return MODERATE;
    }
}
